package io.recur4j.core;

import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.ZoneId;
import java.util.List;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;

class SeriesGeneratorTest {

    private static final ZoneId ZONE = ZoneId.of("America/Chicago");

    // Monday 2026-01-05, two hours long
    private static Occurrence parent(RecurrenceRule rule) {
        JobSnapshot snapshot = JobSnapshot.builder()
                .businessName("Prairie Hauling")
                .contactName("Dana")
                .trailerSerial("TR-4411")
                .repairNotes("check brakes")
                .build();
        return Occurrence.newParent("main-shop",
                        LocalDateTime.parse("2026-01-05T09:00"),
                        LocalDateTime.parse("2026-01-05T11:00"),
                        ZONE, false, snapshot, new CallReminderSettings(true, 2, true))
                .withRule(rule.toRecord())
                .withId("parent-1");
    }

    @Test
    void countShouldLimitInstances() {
        List<Occurrence> instances = SeriesGenerator.generate(
                parent(RecurrenceRule.times(RecurrenceType.WEEKLY, 1, 5)), null, null);

        assertThat(instances).extracting(Occurrence::start).containsExactly(
                LocalDateTime.parse("2026-01-12T09:00"),
                LocalDateTime.parse("2026-01-19T09:00"),
                LocalDateTime.parse("2026-01-26T09:00"),
                LocalDateTime.parse("2026-02-02T09:00"),
                LocalDateTime.parse("2026-02-09T09:00"));
    }

    @Test
    void untilDateShouldBeInclusive() {
        List<Occurrence> instances = SeriesGenerator.generate(
                parent(RecurrenceRule.until(RecurrenceType.DAILY, 1, LocalDate.of(2026, 1, 8))), null, null);

        assertThat(instances).extracting(Occurrence::anchorDate).containsExactly(
                LocalDate.of(2026, 1, 6), LocalDate.of(2026, 1, 7), LocalDate.of(2026, 1, 8));
    }

    @Test
    void cutoffShouldBeTheEarliestOfRuleArgumentAndOverride() {
        Occurrence p = parent(RecurrenceRule.times(RecurrenceType.WEEKLY, 1, 10));

        assertThat(SeriesGenerator.generate(p, null, LocalDate.of(2026, 1, 20))).hasSize(2);
        assertThat(SeriesGenerator.generate(p.withSeriesEndOverride(LocalDate.of(2026, 1, 26)), null, LocalDate.of(2026, 3, 1)))
                .hasSize(3);
    }

    @Test
    void maxCountShouldOverrideRuleCount() {
        Occurrence p = parent(RecurrenceRule.times(RecurrenceType.DAILY, 1, 10));

        assertThat(SeriesGenerator.generate(p, 4, null)).hasSize(4);
    }

    @Test
    void foreverRuleShouldFallBackToDefaultCount() {
        Occurrence p = parent(RecurrenceRule.forever(RecurrenceType.DAILY, 1));

        assertThat(SeriesGenerator.generate(p, null, null)).hasSize(SeriesGenerator.DEFAULT_MAX_COUNT);
    }

    @Test
    void instancesShouldCopyParentFieldsAndResetState() {
        Occurrence p = parent(RecurrenceRule.times(RecurrenceType.WEEKLY, 1, 1)).withStatus(OccurrenceStatus.COMPLETED);

        Occurrence instance = SeriesGenerator.generate(p, null, null).get(0);

        assertThat(instance.id()).isNull();
        assertThat(instance.parentId()).isEqualTo("parent-1");
        assertThat(instance.calendarId()).isEqualTo("main-shop");
        assertThat(instance.zone()).isEqualTo(ZONE);
        assertThat(instance.status()).isEqualTo(OccurrenceStatus.UNCOMPLETED);
        assertThat(instance.rule()).isNull();
        assertThat(instance.originalAnchor()).isEqualTo(instance.start());
        assertThat(instance.duration()).isEqualTo(Duration.ofHours(2));
        assertThat(instance.snapshot()).isEqualTo(p.snapshot());
        assertThat(instance.callReminder()).isEqualTo(new CallReminderSettings(true, 2, false));
    }

    @Test
    void existingAnchorsShouldBeSkippedButCounted() {
        Occurrence p = parent(RecurrenceRule.times(RecurrenceType.WEEKLY, 1, 3));
        RecurrenceRule rule = p.recurrenceRule().orElseThrow();

        List<Occurrence> instances = SeriesGenerator.generate(p, rule, null, null,
                Set.of(LocalDateTime.parse("2026-01-19T09:00")));

        assertThat(instances).extracting(Occurrence::anchorDate)
                .containsExactly(LocalDate.of(2026, 1, 12), LocalDate.of(2026, 1, 26));
    }

    @Test
    void unreadableRuleShouldProduceNothing() {
        Occurrence p = parent(RecurrenceRule.times(RecurrenceType.WEEKLY, 1, 3))
                .withRule(new RecurrenceRuleRecord("fortnightly", 1, null, null, null));

        assertThat(SeriesGenerator.generate(p, null, null)).isEmpty();
    }

    @Test
    void nonRecurringParentShouldProduceNothing() {
        Occurrence p = parent(RecurrenceRule.times(RecurrenceType.WEEKLY, 1, 3)).withRule(null);

        assertThat(SeriesGenerator.generate(p, null, null)).isEmpty();
    }
}
