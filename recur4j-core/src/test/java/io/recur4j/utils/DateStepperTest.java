package io.recur4j.utils;

import io.recur4j.core.RecurrenceType;
import org.junit.jupiter.api.Test;

import java.time.DayOfWeek;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.YearMonth;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;

class DateStepperTest {

    @Test
    void dailyAndWeeklyShouldKeepTimeOfDay() {
        LocalDateTime anchor = LocalDateTime.parse("2026-01-30T09:15");

        assertEquals(LocalDateTime.parse("2026-02-02T09:15"), DateStepper.next(anchor, RecurrenceType.DAILY, 3));
        assertEquals(LocalDateTime.parse("2026-02-13T09:15"), DateStepper.next(anchor, RecurrenceType.WEEKLY, 2));
    }

    @Test
    void monthlyShouldKeepNthWeekday() {
        // 2026-01-20 is the 3rd Tuesday of January
        LocalDateTime anchor = LocalDateTime.parse("2026-01-20T09:00");

        assertEquals(LocalDateTime.parse("2026-02-17T09:00"), DateStepper.next(anchor, RecurrenceType.MONTHLY, 1));
        assertEquals(LocalDateTime.parse("2026-03-17T09:00"), DateStepper.next(anchor, RecurrenceType.MONTHLY, 2));
    }

    @Test
    void monthlyShouldFallBackToLastWeekdayWhenTargetMonthIsShort() {
        // 5th Thursday of January; February 2026 only has four Thursdays
        LocalDateTime anchor = LocalDateTime.parse("2026-01-29T14:30");

        LocalDateTime next = DateStepper.next(anchor, RecurrenceType.MONTHLY, 1);

        assertEquals(LocalDateTime.parse("2026-02-26T14:30"), next);
        assertEquals(DayOfWeek.THURSDAY, next.getDayOfWeek());
    }

    @Test
    void yearlyShouldKeepIsoWeekAndWeekday() {
        // ISO week 10, Wednesday
        LocalDateTime anchor = LocalDateTime.parse("2026-03-04T08:00");

        assertEquals(LocalDateTime.parse("2027-03-10T08:00"), DateStepper.next(anchor, RecurrenceType.YEARLY, 1));
    }

    @Test
    void yearlyShouldFallBackWhenWeek53IsMissing() {
        // 2020-12-31 is Thursday of ISO week 53; 2021 only has 52 weeks
        LocalDateTime anchor = LocalDateTime.parse("2020-12-31T10:00");

        assertEquals(LocalDateTime.parse("2021-12-30T10:00"), DateStepper.next(anchor, RecurrenceType.YEARLY, 1));
    }

    @Test
    void nthWeekdayOfMonthShouldReturnNullOnlyForImpossibleOrdinals() {
        assertEquals(LocalDate.of(2026, 2, 26), DateStepper.nthWeekdayOfMonth(YearMonth.of(2026, 2), DayOfWeek.THURSDAY, 5));
        assertNull(DateStepper.nthWeekdayOfMonth(YearMonth.of(2026, 2), DayOfWeek.THURSDAY, 7));
    }

    @Test
    void fromIsoWeekShouldRejectMissingWeeks() {
        assertNull(DateStepper.fromIsoWeek(2021, 53, 4));
        assertEquals(LocalDate.of(2020, 12, 31), DateStepper.fromIsoWeek(2020, 53, 4));
    }

    @Test
    void nextShouldRejectNonPositiveInterval() {
        LocalDateTime anchor = LocalDateTime.parse("2026-01-01T00:00");
        assertThrows(IllegalArgumentException.class, () -> DateStepper.next(anchor, RecurrenceType.DAILY, 0));
    }
}
