package io.recur4j.utils;

import java.time.DayOfWeek;
import java.time.LocalDate;
import java.time.temporal.TemporalAdjusters;
import java.util.Objects;

/**
 * Reminder dates for call reminders, which always land on a Sunday.
 */
public final class CallReminderDates {
    private CallReminderDates() {
    }

    /**
     * Sunday on which to call ahead of a job on {@code jobDate}.
     * <p>
     * Weeks start on Sunday. {@code weeksPrior = 2} is the Sunday of the previous week,
     * {@code weeksPrior = 3} the Sunday two weeks before.
     */
    public static LocalDate reminderSunday(LocalDate jobDate, int weeksPrior) {
        Objects.requireNonNull(jobDate, "jobDate must not be null");
        if (weeksPrior < 1) {
            throw new IllegalArgumentException("weeksPrior must be a positive number");
        }
        LocalDate weekSunday = jobDate.with(TemporalAdjusters.previousOrSame(DayOfWeek.SUNDAY));
        return weekSunday.minusWeeks(weeksPrior - 1L);
    }
}
