package io.recur4j.utils;

import org.junit.jupiter.api.Test;

import java.time.LocalDate;

import static org.junit.jupiter.api.Assertions.assertEquals;

class CallReminderDatesTest {

    @Test
    void twoWeeksPriorShouldBeSundayOfThePreviousWeek() {
        // Wednesday; its week starts on Sunday 2026-01-18
        assertEquals(LocalDate.of(2026, 1, 11), CallReminderDates.reminderSunday(LocalDate.of(2026, 1, 21), 2));
    }

    @Test
    void threeWeeksPriorShouldGoOneMoreWeekBack() {
        assertEquals(LocalDate.of(2026, 1, 4), CallReminderDates.reminderSunday(LocalDate.of(2026, 1, 21), 3));
    }

    @Test
    void jobOnSundayShouldCountItsOwnWeek() {
        assertEquals(LocalDate.of(2026, 1, 11), CallReminderDates.reminderSunday(LocalDate.of(2026, 1, 18), 2));
    }
}
