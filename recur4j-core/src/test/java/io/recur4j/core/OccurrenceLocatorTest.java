package io.recur4j.core;

import org.junit.jupiter.api.Test;

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.ZoneId;
import java.util.List;
import java.util.OptionalInt;

import static org.assertj.core.api.Assertions.assertThat;

class OccurrenceLocatorTest {

    private static Occurrence parent(RecurrenceRule rule) {
        return Occurrence.newParent("main-shop",
                        LocalDateTime.parse("2026-01-20T09:00"),
                        LocalDateTime.parse("2026-01-20T10:00"),
                        ZoneId.of("Europe/Berlin"), false, JobSnapshot.empty(), CallReminderSettings.none())
                .withRule(rule.toRecord())
                .withId("parent-1");
    }

    @Test
    void parentShouldBeFirst() {
        RecurrenceRule rule = RecurrenceRule.times(RecurrenceType.MONTHLY, 1, 6);

        assertThat(OccurrenceLocator.ordinal(parent(rule), rule, LocalDateTime.parse("2026-01-20T09:00")))
                .isEqualTo(OptionalInt.of(1));
    }

    @Test
    void ordinalsShouldFollowGenerationOrder() {
        RecurrenceRule rule = RecurrenceRule.times(RecurrenceType.MONTHLY, 1, 12);
        Occurrence p = parent(rule);

        List<Occurrence> instances = SeriesGenerator.generate(p, null, null);

        for (int i = 0; i < instances.size(); i++) {
            assertThat(OccurrenceLocator.ordinal(p, rule, instances.get(i).originalAnchor()))
                    .isEqualTo(OptionalInt.of(i + 2));
        }
    }

    @Test
    void ordinalsShouldAgreeWithWindowExpansion() {
        RecurrenceRule rule = RecurrenceRule.forever(RecurrenceType.WEEKLY, 2);
        Occurrence p = parent(rule);

        for (VirtualOccurrence v : WindowExpander.expand(p, rule, LocalDate.of(2026, 1, 1), LocalDate.of(2026, 6, 30))) {
            assertThat(OccurrenceLocator.ordinal(p, rule, v.originalAnchor()))
                    .isEqualTo(OptionalInt.of(v.ordinal() + 1));
        }
    }

    @Test
    void anchorOffTheSeriesShouldNotBeLocated() {
        RecurrenceRule rule = RecurrenceRule.forever(RecurrenceType.WEEKLY, 1);
        Occurrence p = parent(rule);

        assertThat(OccurrenceLocator.ordinal(p, rule, LocalDateTime.parse("2026-01-28T09:00"))).isEmpty();
        assertThat(OccurrenceLocator.ordinal(p, rule, LocalDateTime.parse("2025-12-01T09:00"))).isEmpty();
    }

    @Test
    void anchorBeyondSafetyCapShouldNotBeLocated() {
        RecurrenceRule rule = RecurrenceRule.forever(RecurrenceType.DAILY, 1);
        Occurrence p = parent(rule);

        // ten days after the parent is the 11th occurrence
        assertThat(OccurrenceLocator.ordinal(p, rule, LocalDateTime.parse("2026-01-30T09:00"), 10)).isEmpty();
        assertThat(OccurrenceLocator.ordinal(p, rule, LocalDateTime.parse("2026-01-30T09:00"), 11))
                .isEqualTo(OptionalInt.of(11));
    }
}
