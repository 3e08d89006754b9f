package io.recur4j.internal.mongo;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.mongodb.client.result.UpdateResult;
import io.recur4j.core.CallReminderSettings;
import io.recur4j.core.InstanceQuery;
import io.recur4j.core.JobSnapshot;
import io.recur4j.core.Occurrence;
import io.recur4j.core.OccurrenceStatus;
import io.recur4j.core.RecurrenceRuleRecord;
import io.recur4j.core.SeriesEdit;
import org.springframework.data.domain.Sort;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.data.mongodb.core.query.Criteria;
import org.springframework.data.mongodb.core.query.Query;
import org.springframework.data.mongodb.core.query.Update;

import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.ZoneId;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * MongoDB persistence layer for occurrences.
 *
 * <p>Local times are stored as UTC instants next to the zone id they were computed in; reads turn
 * them back into wall-clock times with that zone.
 *
 * <p>Every method joins the surrounding Mongo transaction when there is one.
 */
public class MongoOccurrenceStore {

    private final MongoTemplate mongoTemplate;
    private final ObjectMapper objectMapper;

    public MongoOccurrenceStore(MongoTemplate mongoTemplate, ObjectMapper objectMapper) {
        this.mongoTemplate = Objects.requireNonNull(mongoTemplate, "mongoTemplate must not be null");
        this.objectMapper = Objects.requireNonNull(objectMapper, "objectMapper must not be null");
    }

    /**
     * Insert a new occurrence.
     *
     * @return the occurrence with its generated id
     */
    public Occurrence insert(Occurrence occurrence) {
        Objects.requireNonNull(occurrence, "occurrence must not be null");
        if (occurrence.id() != null) {
            throw new IllegalArgumentException("occurrence is already persisted: " + occurrence.id());
        }
        OccurrenceDocument saved = mongoTemplate.insert(toDocument(occurrence));
        return occurrence.withId(saved.getId());
    }

    /**
     * Insert a batch of new occurrences, keeping their order.
     */
    public List<Occurrence> insertAll(List<Occurrence> occurrences) {
        Objects.requireNonNull(occurrences, "occurrences must not be null");
        if (occurrences.isEmpty()) {
            return List.of();
        }
        List<OccurrenceDocument> docs = new ArrayList<>(occurrences.size());
        for (Occurrence o : occurrences) {
            docs.add(toDocument(o));
        }
        List<OccurrenceDocument> inserted = new ArrayList<>(mongoTemplate.insertAll(docs));

        List<Occurrence> saved = new ArrayList<>(occurrences.size());
        for (int i = 0; i < occurrences.size(); i++) {
            saved.add(occurrences.get(i).withId(inserted.get(i).getId()));
        }
        return saved;
    }

    /**
     * Find by id, soft-deleted rows included.
     */
    public Optional<Occurrence> findById(String id) {
        Objects.requireNonNull(id, "id must not be null");
        OccurrenceDocument doc = mongoTemplate.findById(id, OccurrenceDocument.class);
        return Optional.ofNullable(doc).map(this::toOccurrence);
    }

    /**
     * Find the instance of a series for one original anchor, soft-deleted rows included.
     */
    public Optional<Occurrence> findInstance(String parentId, LocalDateTime originalAnchor) {
        Objects.requireNonNull(parentId, "parentId must not be null");
        Objects.requireNonNull(originalAnchor, "originalAnchor must not be null");
        Query q = new Query(Criteria.where("parentId").is(parentId)
                .and("originalAnchorLocal").is(originalAnchor.toString()));
        return Optional.ofNullable(mongoTemplate.findOne(q, OccurrenceDocument.class)).map(this::toOccurrence);
    }

    /**
     * Instances matching {@code query}, earliest anchor first.
     */
    public List<Occurrence> findInstances(InstanceQuery query) {
        Query q = new Query(buildCriteria(query));
        q.with(Sort.by(Sort.Order.asc("originalAnchor")));
        List<OccurrenceDocument> docs = mongoTemplate.find(q, OccurrenceDocument.class);
        List<Occurrence> out = new ArrayList<>(docs.size());
        for (OccurrenceDocument d : docs) {
            out.add(toOccurrence(d));
        }
        return out;
    }

    public long countInstances(InstanceQuery query) {
        return mongoTemplate.count(new Query(buildCriteria(query)), OccurrenceDocument.class);
    }

    /**
     * Original anchors that already have a row in the series, tombstones included.
     */
    public Set<LocalDateTime> anchorsOf(String parentId) {
        Objects.requireNonNull(parentId, "parentId must not be null");
        Query q = new Query(Criteria.where("parentId").is(parentId));
        q.fields().include("originalAnchor").include("originalAnchorLocal").include("timezone");

        Set<LocalDateTime> anchors = new HashSet<>();
        for (OccurrenceDocument d : mongoTemplate.find(q, OccurrenceDocument.class)) {
            LocalDateTime anchor = localAnchorOf(d);
            if (anchor != null) {
                anchors.add(anchor);
            }
        }
        return anchors;
    }

    /**
     * Parents of a calendar that may own a forever series: live, not canceled, carrying a rule,
     * starting before {@code startBefore}. Forever classification is left to the caller.
     */
    public List<Occurrence> findRecurringParents(String calendarId, Instant startBefore) {
        Objects.requireNonNull(calendarId, "calendarId must not be null");
        Objects.requireNonNull(startBefore, "startBefore must not be null");
        Criteria c = recurringParentCriteria()
                .and("calendarId").is(calendarId)
                .and("status").ne(OccurrenceStatus.CANCELED)
                .and("startAt").lt(startBefore);
        return findParents(c);
    }

    /**
     * Every live parent carrying a rule, across calendars.
     */
    public List<Occurrence> findRecurringParents() {
        return findParents(recurringParentCriteria());
    }

    private List<Occurrence> findParents(Criteria c) {
        Query q = new Query(c).with(Sort.by(Sort.Order.asc("startAt")));
        List<Occurrence> out = new ArrayList<>();
        for (OccurrenceDocument d : mongoTemplate.find(q, OccurrenceDocument.class)) {
            out.add(toOccurrence(d));
        }
        return out;
    }

    private static Criteria recurringParentCriteria() {
        return Criteria.where("parentId").exists(false)
                .and("deleted").is(false)
                .and("recurrenceRule").exists(true)
                .and("recurrenceRule.type").nin(null, RecurrenceRuleRecord.NONE);
    }

    /**
     * Soft-delete one occurrence.
     *
     * @return 1 when a live row was deleted, else 0
     */
    public long softDelete(String id) {
        Objects.requireNonNull(id, "id must not be null");
        Query q = new Query(Criteria.where("_id").is(id).and("deleted").is(false));
        return mongoTemplate.updateFirst(q, softDeleteUpdate(), OccurrenceDocument.class).getModifiedCount();
    }

    public long softDelete(InstanceQuery query) {
        Query q = new Query(buildCriteria(query));
        return mongoTemplate.updateMulti(q, softDeleteUpdate(), OccurrenceDocument.class).getModifiedCount();
    }

    /**
     * Hard delete instances; only regeneration and trimming remove rows.
     */
    public long hardDelete(InstanceQuery query) {
        return mongoTemplate.remove(new Query(buildCriteria(query)), OccurrenceDocument.class).getDeletedCount();
    }

    public long updateStatus(InstanceQuery query, OccurrenceStatus status) {
        Objects.requireNonNull(status, "status must not be null");
        Update u = new Update()
                .set("status", status)
                .set("updatedAt", Instant.now());
        UpdateResult r = mongoTemplate.updateMulti(new Query(buildCriteria(query)), u, OccurrenceDocument.class);
        return r.getModifiedCount();
    }

    /**
     * Set or clear (null) a parent's series end override.
     */
    public void setSeriesEndOverride(String parentId, LocalDate override) {
        Objects.requireNonNull(parentId, "parentId must not be null");
        Update u = new Update()
                .set("seriesEndOverride", override == null ? null : override.toString())
                .set("updatedAt", Instant.now());
        mongoTemplate.updateFirst(parentQuery(parentId), u, OccurrenceDocument.class);
    }

    /**
     * Replace a parent's rule and series end override together.
     */
    public void updateRule(String parentId, RecurrenceRuleRecord rule, LocalDate override) {
        Objects.requireNonNull(parentId, "parentId must not be null");
        Update u = new Update()
                .set("seriesEndOverride", override == null ? null : override.toString())
                .set("updatedAt", Instant.now());
        Map<String, Object> ruleMap = toMap(rule);
        if (ruleMap != null) {
            u.set("recurrenceRule", ruleMap);
        } else {
            u.unset("recurrenceRule");
        }
        mongoTemplate.updateFirst(parentQuery(parentId), u, OccurrenceDocument.class);
    }

    /**
     * Apply an edit to one occurrence, status and reminder completion included.
     */
    public long applyEdit(String id, SeriesEdit edit) {
        Objects.requireNonNull(id, "id must not be null");
        Query q = new Query(Criteria.where("_id").is(id));
        return mongoTemplate.updateFirst(q, editUpdate(edit, true), OccurrenceDocument.class).getModifiedCount();
    }

    /**
     * Apply an edit to many instances. Reminder completion stays per occurrence.
     */
    public long applyEdit(InstanceQuery query, SeriesEdit edit) {
        Query q = new Query(buildCriteria(query));
        return mongoTemplate.updateMulti(q, editUpdate(edit, false), OccurrenceDocument.class).getModifiedCount();
    }

    private Update editUpdate(SeriesEdit edit, boolean single) {
        Objects.requireNonNull(edit, "edit must not be null");
        Update u = new Update().set("updatedAt", Instant.now());
        if (edit.snapshot() != null) {
            u.set("snapshot", toMap(edit.snapshot()));
            u.set("snapshotVersion", JobSnapshot.VERSION);
        }
        if (edit.status() != null) {
            u.set("status", edit.status());
        }
        CallReminderSettings reminder = edit.callReminder();
        if (reminder != null) {
            u.set("hasCallReminder", reminder.enabled());
            u.set("callReminderWeeksPrior", reminder.weeksPrior());
            if (single) {
                u.set("callReminderCompleted", reminder.completed());
            }
        }
        return u;
    }

    private static Update softDeleteUpdate() {
        return new Update()
                .set("deleted", true)
                .set("updatedAt", Instant.now());
    }

    private static Query parentQuery(String parentId) {
        return new Query(Criteria.where("_id").is(parentId).and("parentId").exists(false));
    }

    static Criteria buildCriteria(InstanceQuery query) {
        Objects.requireNonNull(query, "query must not be null");
        List<Criteria> parts = new ArrayList<>(4);

        parts.add(Criteria.where("parentId").is(query.parentId()));

        if (query.anchorFrom() != null) {
            parts.add(Criteria.where("originalAnchor").gte(query.anchorFrom()));
        }

        if (!query.excludeStatuses().isEmpty()) {
            parts.add(Criteria.where("status").nin(query.excludeStatuses()));
        }

        if (!query.includeDeleted()) {
            parts.add(Criteria.where("deleted").is(false));
        }

        if (parts.size() == 1) {
            return parts.get(0);
        }
        return new Criteria().andOperator(parts.toArray(new Criteria[0]));
    }

    OccurrenceDocument toDocument(Occurrence o) {
        ZoneId zone = o.zone();
        Instant now = Instant.now();

        OccurrenceDocument doc = new OccurrenceDocument();
        doc.setCalendarId(o.calendarId());
        doc.setStartAt(o.start().atZone(zone).toInstant());
        doc.setEndAt(o.end().atZone(zone).toInstant());
        doc.setTimezone(zone.getId());
        doc.setAllDay(o.allDay());
        doc.setStatus(o.status());

        doc.setSnapshotVersion(JobSnapshot.VERSION);
        doc.setSnapshot(toMap(o.snapshot()));

        doc.setHasCallReminder(o.callReminder().enabled());
        doc.setCallReminderWeeksPrior(o.callReminder().weeksPrior());
        doc.setCallReminderCompleted(o.callReminder().completed());

        doc.setParentId(o.parentId());
        if (o.originalAnchor() != null) {
            doc.setOriginalAnchor(o.originalAnchor().atZone(zone).toInstant());
            doc.setOriginalAnchorLocal(o.originalAnchor().toString());
        }
        if (o.seriesEndOverride() != null) {
            doc.setSeriesEndOverride(o.seriesEndOverride().toString());
        }
        doc.setRecurrenceRule(toMap(o.rule()));

        doc.setDeleted(o.deleted());
        doc.setCreatedAt(now);
        doc.setUpdatedAt(now);
        return doc;
    }

    /**
     * Reverse of {@link #toDocument(Occurrence)}.
     *
     * <p>The stored rule is returned raw; it is only interpreted where it is used.
     */
    Occurrence toOccurrence(OccurrenceDocument doc) {
        Objects.requireNonNull(doc, "doc must not be null");
        ZoneId zone = ZoneId.of(doc.getTimezone());

        JobSnapshot snapshot = doc.getSnapshot() == null ? null
                : objectMapper.convertValue(doc.getSnapshot(), JobSnapshot.class);
        RecurrenceRuleRecord rule = doc.getRecurrenceRule() == null ? null
                : objectMapper.convertValue(doc.getRecurrenceRule(), RecurrenceRuleRecord.class);
        CallReminderSettings reminder = new CallReminderSettings(
                doc.isHasCallReminder(),
                doc.getCallReminderWeeksPrior(),
                doc.isCallReminderCompleted());

        return new Occurrence(
                doc.getId(),
                doc.getCalendarId(),
                LocalDateTime.ofInstant(doc.getStartAt(), zone),
                LocalDateTime.ofInstant(doc.getEndAt(), zone),
                zone,
                doc.isAllDay(),
                doc.getStatus(),
                snapshot,
                reminder,
                doc.getParentId(),
                localAnchorOf(doc),
                doc.getSeriesEndOverride() == null ? null : LocalDate.parse(doc.getSeriesEndOverride()),
                rule,
                doc.isDeleted()
        );
    }

    /**
     * The stored wall-clock anchor. The instant is only a fallback for rows written without it: an
     * anchor inside a DST gap does not survive the instant round trip.
     */
    private static LocalDateTime localAnchorOf(OccurrenceDocument doc) {
        if (doc.getOriginalAnchorLocal() != null) {
            return LocalDateTime.parse(doc.getOriginalAnchorLocal());
        }
        if (doc.getOriginalAnchor() == null || doc.getTimezone() == null) {
            return null;
        }
        return LocalDateTime.ofInstant(doc.getOriginalAnchor(), ZoneId.of(doc.getTimezone()));
    }

    private Map<String, Object> toMap(Object value) {
        if (value == null) {
            return null;
        }
        return objectMapper.convertValue(value, new TypeReference<>() {
        });
    }
}
