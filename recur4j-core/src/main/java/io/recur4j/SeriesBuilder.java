package io.recur4j;

import io.recur4j.core.CallReminderSettings;
import io.recur4j.core.Occurrence;
import io.recur4j.core.RecurrenceRule;
import io.recur4j.core.SeriesCreated;

import java.time.LocalDateTime;
import java.time.ZoneId;

/**
 * Fluent builder for a job, optionally the parent of a recurring series.
 *
 * <p>Note:
 * <ul>
 *   <li>build(): returns the in-memory parent occurrence</li>
 *   <li>save(): build() + persist the parent and, for finite rules, its instances</li>
 * </ul>
 */
public interface SeriesBuilder {

    /**
     * Wall-clock start and end in the series zone.
     */
    SeriesBuilder between(LocalDateTime start, LocalDateTime end);

    /**
     * Timezone of the appointment. Defaults to the configured calendar timezone.
     */
    SeriesBuilder zone(ZoneId zone);

    SeriesBuilder allDay(boolean allDay);

    SeriesBuilder callReminder(CallReminderSettings callReminder);

    /**
     * Make this job the parent of a recurring series.
     */
    SeriesBuilder repeat(RecurrenceRule rule);

    Occurrence build();

    SeriesCreated save();
}
