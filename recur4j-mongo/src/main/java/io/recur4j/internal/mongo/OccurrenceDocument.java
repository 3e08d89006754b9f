package io.recur4j.internal.mongo;

import io.recur4j.core.OccurrenceStatus;
import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.mapping.Document;
import org.springframework.data.mongodb.core.mapping.Field;

import java.time.Instant;
import java.util.Map;

/**
 * Mongo document model for persisted jobs (series parents and instances).
 */
@Document(collection = "occurrences")
public class OccurrenceDocument {

    @Id
    private String id;

    private String calendarId;

    private Instant startAt;
    private Instant endAt;
    private String timezone;
    private boolean allDay;

    private OccurrenceStatus status;

    private int snapshotVersion;
    private Map<String, Object> snapshot;

    private boolean hasCallReminder;
    private Integer callReminderWeeksPrior;
    private boolean callReminderCompleted;

    // series linkage; absent on parents
    private String parentId;
    private Instant originalAnchor;
    // wall-clock anchor in the series zone (ISO local date-time); identity key, survives DST gaps
    private String originalAnchorLocal;

    // parent only
    private Map<String, Object> recurrenceRule;
    @Field(write = Field.Write.ALWAYS)
    private String seriesEndOverride;

    private boolean deleted;
    private Instant createdAt;
    private Instant updatedAt;

    public OccurrenceDocument() {
    }

    public String getId() {
        return id;
    }

    public void setId(String id) {
        this.id = id;
    }

    public String getCalendarId() {
        return calendarId;
    }

    public void setCalendarId(String calendarId) {
        this.calendarId = calendarId;
    }

    public Instant getStartAt() {
        return startAt;
    }

    public void setStartAt(Instant startAt) {
        this.startAt = startAt;
    }

    public Instant getEndAt() {
        return endAt;
    }

    public void setEndAt(Instant endAt) {
        this.endAt = endAt;
    }

    public String getTimezone() {
        return timezone;
    }

    public void setTimezone(String timezone) {
        this.timezone = timezone;
    }

    public boolean isAllDay() {
        return allDay;
    }

    public void setAllDay(boolean allDay) {
        this.allDay = allDay;
    }

    public OccurrenceStatus getStatus() {
        return status;
    }

    public void setStatus(OccurrenceStatus status) {
        this.status = status;
    }

    public int getSnapshotVersion() {
        return snapshotVersion;
    }

    public void setSnapshotVersion(int snapshotVersion) {
        this.snapshotVersion = snapshotVersion;
    }

    public Map<String, Object> getSnapshot() {
        return snapshot;
    }

    public void setSnapshot(Map<String, Object> snapshot) {
        this.snapshot = snapshot;
    }

    public boolean isHasCallReminder() {
        return hasCallReminder;
    }

    public void setHasCallReminder(boolean hasCallReminder) {
        this.hasCallReminder = hasCallReminder;
    }

    public Integer getCallReminderWeeksPrior() {
        return callReminderWeeksPrior;
    }

    public void setCallReminderWeeksPrior(Integer callReminderWeeksPrior) {
        this.callReminderWeeksPrior = callReminderWeeksPrior;
    }

    public boolean isCallReminderCompleted() {
        return callReminderCompleted;
    }

    public void setCallReminderCompleted(boolean callReminderCompleted) {
        this.callReminderCompleted = callReminderCompleted;
    }

    public String getParentId() {
        return parentId;
    }

    public void setParentId(String parentId) {
        this.parentId = parentId;
    }

    public Instant getOriginalAnchor() {
        return originalAnchor;
    }

    public void setOriginalAnchor(Instant originalAnchor) {
        this.originalAnchor = originalAnchor;
    }

    public String getOriginalAnchorLocal() {
        return originalAnchorLocal;
    }

    public void setOriginalAnchorLocal(String originalAnchorLocal) {
        this.originalAnchorLocal = originalAnchorLocal;
    }

    public Map<String, Object> getRecurrenceRule() {
        return recurrenceRule;
    }

    public void setRecurrenceRule(Map<String, Object> recurrenceRule) {
        this.recurrenceRule = recurrenceRule;
    }

    public String getSeriesEndOverride() {
        return seriesEndOverride;
    }

    public void setSeriesEndOverride(String seriesEndOverride) {
        this.seriesEndOverride = seriesEndOverride;
    }

    public boolean isDeleted() {
        return deleted;
    }

    public void setDeleted(boolean deleted) {
        this.deleted = deleted;
    }

    public Instant getCreatedAt() {
        return createdAt;
    }

    public void setCreatedAt(Instant createdAt) {
        this.createdAt = createdAt;
    }

    public Instant getUpdatedAt() {
        return updatedAt;
    }

    public void setUpdatedAt(Instant updatedAt) {
        this.updatedAt = updatedAt;
    }
}
