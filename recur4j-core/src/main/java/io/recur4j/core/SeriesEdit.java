package io.recur4j.core;

/**
 * Changes propagated by a scoped edit. Null components are left untouched.
 */
public record SeriesEdit(
        JobSnapshot snapshot,
        OccurrenceStatus status,
        CallReminderSettings callReminder
) {
    public static SeriesEdit snapshot(JobSnapshot snapshot) {
        return new SeriesEdit(snapshot, null, null);
    }

    public static SeriesEdit status(OccurrenceStatus status) {
        return new SeriesEdit(null, status, null);
    }

    public boolean isEmpty() {
        return snapshot == null && status == null && callReminder == null;
    }

    /**
     * The same edit without a status change; a parent's status is never changed by a series-wide
     * edit.
     */
    public SeriesEdit withoutStatus() {
        return new SeriesEdit(snapshot, null, callReminder);
    }
}
