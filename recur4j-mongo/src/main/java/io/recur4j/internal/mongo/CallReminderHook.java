package io.recur4j.internal.mongo;

import io.recur4j.InstanceCreatedHook;
import io.recur4j.core.CallReminderSettings;
import io.recur4j.core.Occurrence;
import io.recur4j.utils.CallReminderDates;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.data.mongodb.core.MongoTemplate;

import java.time.Instant;
import java.time.LocalDate;
import java.util.Objects;

/**
 * Writes a call reminder for every new instance that has one scheduled.
 */
public class CallReminderHook implements InstanceCreatedHook {
    private static final Logger log = LoggerFactory.getLogger(CallReminderHook.class);

    public static final String NAME = "call-reminder";

    private final MongoTemplate mongoTemplate;

    public CallReminderHook(MongoTemplate mongoTemplate) {
        this.mongoTemplate = Objects.requireNonNull(mongoTemplate, "mongoTemplate must not be null");
    }

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public void onInstanceCreated(Occurrence instance) {
        CallReminderSettings reminder = instance.callReminder();
        if (!reminder.isScheduled()) {
            return;
        }
        LocalDate date = CallReminderDates.reminderSunday(instance.start().toLocalDate(), reminder.weeksPrior());

        CallReminderDocument doc = new CallReminderDocument();
        doc.setOccurrenceId(instance.id());
        doc.setCalendarId(instance.calendarId());
        doc.setReminderDate(date.toString());
        doc.setNotes(instance.snapshot().displayName());
        doc.setCompleted(false);
        doc.setCreatedAt(Instant.now());
        mongoTemplate.insert(doc);

        log.debug("call reminder created occurrenceId={} reminderDate={} weeksPrior={}",
                instance.id(), date, reminder.weeksPrior());
    }
}
