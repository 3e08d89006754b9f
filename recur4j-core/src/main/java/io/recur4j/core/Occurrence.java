package io.recur4j.core;

import java.time.Duration;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.ZoneId;
import java.util.Objects;
import java.util.Optional;

/**
 * A scheduled job: either a series parent (no {@code parentId}) or an instance of a series.
 *
 * <p>Start, end and original anchor are wall-clock times in {@code zone}. The store converts them
 * to instants.
 */
public record Occurrence(

        // identity
        String id,
        String calendarId,

        // timing
        LocalDateTime start,
        LocalDateTime end,
        ZoneId zone,
        boolean allDay,

        // state
        OccurrenceStatus status,
        JobSnapshot snapshot,
        CallReminderSettings callReminder,

        // series linkage
        String parentId,
        LocalDateTime originalAnchor,
        LocalDate seriesEndOverride,
        RecurrenceRuleRecord rule,

        boolean deleted
) {
    public Occurrence {
        Objects.requireNonNull(start, "start must not be null");
        Objects.requireNonNull(end, "end must not be null");
        Objects.requireNonNull(zone, "zone must not be null");
        status = status == null ? OccurrenceStatus.UNCOMPLETED : status;
        snapshot = snapshot == null ? JobSnapshot.empty() : snapshot;
        callReminder = callReminder == null ? CallReminderSettings.none() : callReminder;
        if (parentId != null && rule != null && !rule.isNone()) {
            throw new IllegalArgumentException("only a series parent may carry a recurrence rule");
        }
    }

    public static Occurrence newParent(String calendarId,
                                       LocalDateTime start,
                                       LocalDateTime end,
                                       ZoneId zone,
                                       boolean allDay,
                                       JobSnapshot snapshot,
                                       CallReminderSettings callReminder) {
        return new Occurrence(null, calendarId, start, end, zone, allDay, OccurrenceStatus.UNCOMPLETED,
                snapshot, callReminder, null, null, null, null, false);
    }

    /**
     * Build a new (unsaved) instance of {@code parent} anchored at {@code anchor}.
     *
     * <p>Everything business-related is copied from the parent, except: status starts uncompleted,
     * the rule is not copied (instances never recur), and the call-reminder completion flag is
     * reset while its schedule is kept.
     */
    public static Occurrence instanceOf(Occurrence parent, LocalDateTime anchor) {
        Objects.requireNonNull(parent, "parent must not be null");
        Objects.requireNonNull(anchor, "anchor must not be null");
        if (parent.id() == null) {
            throw new IllegalArgumentException("parent must be persisted before creating instances");
        }
        return new Occurrence(
                null,
                parent.calendarId(),
                anchor,
                anchor.plus(parent.duration()),
                parent.zone(),
                parent.allDay(),
                OccurrenceStatus.UNCOMPLETED,
                parent.snapshot().copyForInstance(),
                parent.callReminder().forNewInstance(),
                parent.id(),
                anchor,
                null,
                null,
                false
        );
    }

    public boolean isParent() {
        return parentId == null;
    }

    public boolean isInstance() {
        return parentId != null;
    }

    public boolean isRecurringParent() {
        return parentId == null && rule != null && !rule.isNone();
    }

    public Duration duration() {
        return Duration.between(start, end);
    }

    /**
     * Series alignment key: the original anchor for instances, the start for parents.
     */
    public LocalDateTime anchor() {
        return originalAnchor != null ? originalAnchor : start;
    }

    public LocalDate anchorDate() {
        return anchor().toLocalDate();
    }

    /**
     * @throws InvalidRecurrenceRuleException if the stored rule cannot be interpreted
     */
    public Optional<RecurrenceRule> recurrenceRule() {
        return RecurrenceRule.from(rule);
    }

    public Occurrence withId(String id) {
        return new Occurrence(id, calendarId, start, end, zone, allDay, status, snapshot, callReminder,
                parentId, originalAnchor, seriesEndOverride, rule, deleted);
    }

    public Occurrence withStatus(OccurrenceStatus status) {
        return new Occurrence(id, calendarId, start, end, zone, allDay, status, snapshot, callReminder,
                parentId, originalAnchor, seriesEndOverride, rule, deleted);
    }

    public Occurrence withSnapshot(JobSnapshot snapshot) {
        return new Occurrence(id, calendarId, start, end, zone, allDay, status, snapshot, callReminder,
                parentId, originalAnchor, seriesEndOverride, rule, deleted);
    }

    public Occurrence withTiming(LocalDateTime start, LocalDateTime end) {
        return new Occurrence(id, calendarId, start, end, zone, allDay, status, snapshot, callReminder,
                parentId, originalAnchor, seriesEndOverride, rule, deleted);
    }

    public Occurrence withRule(RecurrenceRuleRecord rule) {
        return new Occurrence(id, calendarId, start, end, zone, allDay, status, snapshot, callReminder,
                parentId, originalAnchor, seriesEndOverride, rule, deleted);
    }

    public Occurrence withSeriesEndOverride(LocalDate seriesEndOverride) {
        return new Occurrence(id, calendarId, start, end, zone, allDay, status, snapshot, callReminder,
                parentId, originalAnchor, seriesEndOverride, rule, deleted);
    }

    public Occurrence withDeleted(boolean deleted) {
        return new Occurrence(id, calendarId, start, end, zone, allDay, status, snapshot, callReminder,
                parentId, originalAnchor, seriesEndOverride, rule, deleted);
    }
}
