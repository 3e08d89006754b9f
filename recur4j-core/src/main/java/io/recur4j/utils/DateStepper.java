package io.recur4j.utils;

import io.recur4j.core.RecurrenceType;

import java.time.DayOfWeek;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.YearMonth;
import java.time.temporal.ChronoField;
import java.time.temporal.IsoFields;
import java.time.temporal.TemporalAdjusters;
import java.util.Objects;

/**
 * Calendar-aware stepping between series anchors.
 * <p>
 * All arithmetic happens on local date-times (the appointment's own wall-clock time). Callers
 * convert to and from the storage representation, so stepping never drifts across DST changes.
 * <p>
 * Supported alignments:
 * <ul>
 *   <li>daily / weekly: plain day and week arithmetic</li>
 *   <li>monthly: same "Nth weekday of the month" (e.g. 3rd Tuesday), falling back to the last
 *       such weekday when the target month has fewer</li>
 *   <li>yearly: same ISO week and weekday, falling back to an earlier week when the target ISO
 *       year is shorter</li>
 * </ul>
 */
public final class DateStepper {

    // Only ISO week 53 can be missing, so two earlier weeks are always enough.
    private static final int ISO_WEEK_RETRIES = 2;

    private DateStepper() {
    }

    /**
     * Compute the anchor following {@code anchor} for the given recurrence kind.
     *
     * @param anchor   current anchor (local date-time)
     * @param type     recurrence kind
     * @param interval positive step multiplier
     * @return next anchor; time of day is preserved
     */
    public static LocalDateTime next(LocalDateTime anchor, RecurrenceType type, int interval) {
        Objects.requireNonNull(anchor, "anchor must not be null");
        Objects.requireNonNull(type, "type must not be null");
        if (interval <= 0) {
            throw new IllegalArgumentException("interval must be a positive number");
        }
        return type.next(anchor, interval);
    }

    public static LocalDateTime plusDays(LocalDateTime anchor, int interval) {
        return anchor.plusDays(interval);
    }

    public static LocalDateTime plusWeeks(LocalDateTime anchor, int interval) {
        return anchor.plusWeeks(interval);
    }

    /**
     * Monthly step that keeps the anchor's weekday and its ordinal within the month.
     */
    public static LocalDateTime sameWeekdayOfMonth(LocalDateTime anchor, int interval) {
        LocalDate date = anchor.toLocalDate();
        DayOfWeek weekday = date.getDayOfWeek();
        int ordinal = weekdayOrdinal(date);

        YearMonth target = YearMonth.from(date).plusMonths(interval);
        LocalDate found = nthWeekdayOfMonth(target, weekday, ordinal);
        if (found == null) {
            return anchor.plusMonths(interval);
        }
        return LocalDateTime.of(found, anchor.toLocalTime());
    }

    /**
     * Yearly step that keeps the anchor's ISO week and ISO weekday.
     */
    public static LocalDateTime sameIsoWeekday(LocalDateTime anchor, int interval) {
        LocalDate date = anchor.toLocalDate();
        int isoYear = date.get(IsoFields.WEEK_BASED_YEAR);
        int isoWeek = date.get(IsoFields.WEEK_OF_WEEK_BASED_YEAR);
        int isoWeekday = date.get(ChronoField.DAY_OF_WEEK);

        int targetYear = isoYear + interval;
        for (int retry = 0; retry <= ISO_WEEK_RETRIES; retry++) {
            LocalDate found = fromIsoWeek(targetYear, isoWeek - retry, isoWeekday);
            if (found != null) {
                return LocalDateTime.of(found, anchor.toLocalTime());
            }
        }
        return anchor.plusYears(interval);
    }

    /**
     * 1-based ordinal of the date's weekday within its month (the 15th is always the 3rd).
     */
    public static int weekdayOrdinal(LocalDate date) {
        return (date.getDayOfMonth() - 1) / 7 + 1;
    }

    /**
     * Nth occurrence of {@code weekday} in {@code month}; the month's last such weekday when there
     * are fewer than {@code ordinal}; {@code null} when neither lands inside the month.
     */
    public static LocalDate nthWeekdayOfMonth(YearMonth month, DayOfWeek weekday, int ordinal) {
        LocalDate first = month.atDay(1).with(TemporalAdjusters.firstInMonth(weekday));
        LocalDate candidate = first.plusWeeks(ordinal - 1L);
        if (YearMonth.from(candidate).equals(month)) {
            return candidate;
        }
        candidate = candidate.minusWeeks(1);
        if (YearMonth.from(candidate).equals(month)) {
            return candidate;
        }
        return null;
    }

    /**
     * Date for an ISO (week-based-year, week, weekday) triple, or {@code null} when that week does
     * not exist in the given ISO year.
     */
    public static LocalDate fromIsoWeek(int isoYear, int isoWeek, int isoWeekday) {
        if (isoWeek < 1) {
            return null;
        }
        // January 4th always falls in ISO week 1 of its own year.
        LocalDate reference = LocalDate.of(isoYear, 1, 4);
        long weeksInYear = reference.range(IsoFields.WEEK_OF_WEEK_BASED_YEAR).getMaximum();
        if (isoWeek > weeksInYear) {
            return null;
        }
        return reference
                .with(IsoFields.WEEK_OF_WEEK_BASED_YEAR, isoWeek)
                .with(ChronoField.DAY_OF_WEEK, isoWeekday);
    }
}
