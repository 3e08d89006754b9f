package io.recur4j.config;

import io.recur4j.internal.mongo.CallReminderDocument;
import io.recur4j.internal.mongo.OccurrenceDocument;
import org.bson.Document;
import org.springframework.data.domain.Sort;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.data.mongodb.core.index.Index;
import org.springframework.data.mongodb.core.index.PartialIndexFilter;

import java.util.Objects;

/**
 * MongoDB index definitions for the recurrence engine.
 *
 * <p><b>Important:</b> indexes are <b>NOT</b> created at application startup unless
 * {@code recur4j.ensure-indexes-on-startup=true}. In production they are usually managed by DB
 * migrations / ops scripts.
 *
 * <p>{@link #UX_PARENT_ANCHOR} is required for correctness: materialization relies on it to keep
 * one row per {@code (parentId, originalAnchor)} under concurrent requests.
 *
 * <h3>Required indexes (collection: {@code occurrences})</h3>
 * <ul>
 *   <li><b>ux_parent_anchor</b> (unique + partial): { parentId: 1, originalAnchorLocal: 1 } with
 *       partialFilterExpression { parentId: { $exists: true } }
 *       <br/>One instance per series anchor; parents are not indexed. Keyed on the wall-clock
 *       anchor, since two anchors around a DST gap can map to the same instant.</li>
 *   <li><b>idx_parent_anchor_status</b>: { parentId: 1, originalAnchor: 1, status: 1, deleted: 1 }
 *       <br/>Used by scoped delete / edit / cancel and regeneration.</li>
 *   <li><b>idx_calendar_parent</b>: { calendarId: 1, parentId: 1, startAt: 1 }
 *       <br/>Used by the virtual feed to find forever parents of a calendar.</li>
 * </ul>
 *
 * <h3>Example mongosh script</h3>
 * <pre>
 * db.occurrences.createIndex(
 *   { parentId: 1, originalAnchorLocal: 1 },
 *   { name: "ux_parent_anchor", unique: true, partialFilterExpression: { parentId: { $exists: true } } }
 * );
 * db.occurrences.createIndex({ parentId: 1, originalAnchor: 1, status: 1, deleted: 1 }, { name: "idx_parent_anchor_status" });
 * db.occurrences.createIndex({ calendarId: 1, parentId: 1, startAt: 1 }, { name: "idx_calendar_parent" });
 * db.call_reminders.createIndex({ occurrenceId: 1 }, { name: "idx_reminder_occurrence" });
 * </pre>
 */
public class SeriesMongoIndexConfig {

    public static final String UX_PARENT_ANCHOR = "ux_parent_anchor";
    public static final String IDX_PARENT_ANCHOR_STATUS = "idx_parent_anchor_status";
    public static final String IDX_CALENDAR_PARENT = "idx_calendar_parent";
    public static final String IDX_REMINDER_OCCURRENCE = "idx_reminder_occurrence";

    private final MongoTemplate mongoTemplate;

    public SeriesMongoIndexConfig(MongoTemplate mongoTemplate) {
        this.mongoTemplate = Objects.requireNonNull(mongoTemplate, "mongoTemplate must not be null");
    }

    /**
     * Create every index listed above. Safe to run repeatedly.
     */
    public void ensureIndexes() {
        mongoTemplate.indexOps(OccurrenceDocument.class).createIndex(parentAnchorUniqueIndex());
        mongoTemplate.indexOps(OccurrenceDocument.class).createIndex(parentAnchorStatusIndex());
        mongoTemplate.indexOps(OccurrenceDocument.class).createIndex(calendarParentIndex());
        mongoTemplate.indexOps(CallReminderDocument.class).createIndex(reminderOccurrenceIndex());
    }

    /**
     * Unique index for series instances.
     * Keys: parentId ASC, originalAnchorLocal ASC
     * Options: unique + partialFilterExpression { parentId: { $exists: true } }
     */
    public static Index parentAnchorUniqueIndex() {
        return new Index()
                .on("parentId", Sort.Direction.ASC)
                .on("originalAnchorLocal", Sort.Direction.ASC)
                .unique()
                .partial(PartialIndexFilter.of(new Document("parentId", new Document("$exists", true))))
                .named(UX_PARENT_ANCHOR);
    }

    /**
     * Index for scoped instance queries.
     * Keys: parentId ASC, originalAnchor ASC, status ASC, deleted ASC
     */
    public static Index parentAnchorStatusIndex() {
        return new Index()
                .on("parentId", Sort.Direction.ASC)
                .on("originalAnchor", Sort.Direction.ASC)
                .on("status", Sort.Direction.ASC)
                .on("deleted", Sort.Direction.ASC)
                .named(IDX_PARENT_ANCHOR_STATUS);
    }

    /**
     * Index for calendar feeds.
     * Keys: calendarId ASC, parentId ASC, startAt ASC
     */
    public static Index calendarParentIndex() {
        return new Index()
                .on("calendarId", Sort.Direction.ASC)
                .on("parentId", Sort.Direction.ASC)
                .on("startAt", Sort.Direction.ASC)
                .named(IDX_CALENDAR_PARENT);
    }

    public static Index reminderOccurrenceIndex() {
        return new Index()
                .on("occurrenceId", Sort.Direction.ASC)
                .named(IDX_REMINDER_OCCURRENCE);
    }
}
