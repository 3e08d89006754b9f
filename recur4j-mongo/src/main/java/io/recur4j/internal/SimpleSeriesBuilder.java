package io.recur4j.internal;

import io.recur4j.SeriesBuilder;
import io.recur4j.core.CallReminderSettings;
import io.recur4j.core.JobSnapshot;
import io.recur4j.core.Occurrence;
import io.recur4j.core.RecurrenceRule;
import io.recur4j.core.SeriesCreated;

import java.time.LocalDateTime;
import java.time.ZoneId;
import java.util.Objects;
import java.util.function.Function;

/**
 * Default {@link SeriesBuilder} implementation used by the Mongo-backed series store.
 */
public class SimpleSeriesBuilder implements SeriesBuilder {

    private final String calendarId;
    private final JobSnapshot snapshot;
    private final Function<Occurrence, SeriesCreated> persister;

    private LocalDateTime start;
    private LocalDateTime end;
    private ZoneId zone;
    private boolean allDay;
    private CallReminderSettings callReminder = CallReminderSettings.none();
    private RecurrenceRule rule;

    public SimpleSeriesBuilder(String calendarId,
                               JobSnapshot snapshot,
                               ZoneId defaultZone,
                               Function<Occurrence, SeriesCreated> persister) {
        this.calendarId = Objects.requireNonNull(calendarId, "calendarId must not be null");
        if (calendarId.isBlank()) throw new IllegalArgumentException("calendarId must not be blank");

        this.snapshot = snapshot == null ? JobSnapshot.empty() : snapshot;
        this.zone = Objects.requireNonNull(defaultZone, "defaultZone must not be null");
        this.persister = Objects.requireNonNull(persister, "persister must not be null");
    }

    @Override
    public SeriesBuilder between(LocalDateTime start, LocalDateTime end) {
        Objects.requireNonNull(start, "start must not be null");
        Objects.requireNonNull(end, "end must not be null");
        if (end.isBefore(start)) {
            throw new IllegalArgumentException("end must not be before start");
        }
        this.start = start;
        this.end = end;
        return this;
    }

    @Override
    public SeriesBuilder zone(ZoneId zone) {
        this.zone = Objects.requireNonNull(zone, "zone must not be null");
        return this;
    }

    @Override
    public SeriesBuilder allDay(boolean allDay) {
        this.allDay = allDay;
        return this;
    }

    @Override
    public SeriesBuilder callReminder(CallReminderSettings callReminder) {
        this.callReminder = Objects.requireNonNull(callReminder, "callReminder must not be null");
        return this;
    }

    @Override
    public SeriesBuilder repeat(RecurrenceRule rule) {
        this.rule = Objects.requireNonNull(rule, "rule must not be null");
        return this;
    }

    @Override
    public Occurrence build() {
        if (start == null || end == null) {
            throw new IllegalStateException("between(start, end) must be called before build()");
        }
        Occurrence parent = Occurrence.newParent(calendarId, start, end, zone, allDay, snapshot, callReminder);
        return rule == null ? parent : parent.withRule(rule.toRecord());
    }

    @Override
    public SeriesCreated save() {
        return persister.apply(this.build());
    }
}
