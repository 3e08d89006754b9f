package io.recur4j;

import io.recur4j.core.DeleteResult;
import io.recur4j.core.JobSnapshot;
import io.recur4j.core.MaterializeResult;
import io.recur4j.core.Occurrence;
import io.recur4j.core.RecurrenceRule;
import io.recur4j.core.SeriesEdit;
import io.recur4j.core.SeriesScope;
import io.recur4j.core.TrimResult;
import io.recur4j.core.VirtualOccurrence;

import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.ZonedDateTime;
import java.util.List;
import java.util.Optional;
import java.util.OptionalInt;

/**
 * Main recurrence API.
 *
 * <p>Supports two kinds of series:
 * <ul>
 *   <li>Finite series (count or until-date): instances are persisted eagerly</li>
 *   <li>Forever series: occurrences are computed per display window and persisted only when a
 *       user interacts with one ({@link #materialize})</li>
 * </ul>
 *
 * <p>Every call that writes runs in a single transaction.
 */
public interface JobSeries {

    /**
     * Start building a new job on a calendar. Nothing is persisted until {@code save()}.
     */
    SeriesBuilder create(String calendarId, JobSnapshot snapshot);

    Optional<Occurrence> find(String occurrenceId);

    /**
     * Persist instances for a finite series parent.
     *
     * @param maxCount  max instances; null means the rule's count (or the configured default)
     * @param untilDate optional extra inclusive cutoff
     * @return the persisted instances; empty for forever series or an unreadable rule
     */
    List<Occurrence> generate(String parentId, Integer maxCount, LocalDate untilDate);

    /**
     * Virtual occurrences of a series in the inclusive window {@code [windowStart, windowEnd]}.
     */
    List<VirtualOccurrence> expand(String parentId, LocalDate windowStart, LocalDate windowEnd);

    /**
     * Find-or-create the instance of {@code parentId} for a virtual occurrence. Idempotent.
     */
    MaterializeResult materialize(String parentId, ZonedDateTime originalAnchor);

    MaterializeResult materialize(String parentId, Instant originalAnchor);

    /**
     * Same as {@link #materialize(String, ZonedDateTime)} with an anchor already in the series zone.
     */
    MaterializeResult materialize(String parentId, LocalDateTime originalAnchor);

    /**
     * 1-based position of an occurrence in its series; empty when it cannot be located.
     */
    OptionalInt ordinal(String occurrenceId);

    DeleteResult delete(String occurrenceId, SeriesScope scope);

    /**
     * Apply an edit to an occurrence and, depending on scope, to the rest of its series.
     *
     * <ul>
     *   <li>{@code THIS_ONLY}: the occurrence alone</li>
     *   <li>{@code THIS_AND_FUTURE}: the occurrence plus non-completed, non-canceled instances
     *       anchored after it. On a parent this edits the parent alone.</li>
     *   <li>{@code ALL}: the parent (its status is never changed) plus every non-completed,
     *       non-canceled instance</li>
     * </ul>
     *
     * @return number of occurrences updated
     */
    long edit(String occurrenceId, SeriesScope scope, SeriesEdit edit);

    /**
     * Replace the parent's rule and regenerate its non-terminal instances.
     */
    List<Occurrence> updateRule(String parentId, RecurrenceRule rule);

    /**
     * Drop non-terminal instances and generate them again from the current rule.
     */
    List<Occurrence> regenerate(String parentId);

    /**
     * End the series at {@code fromDate} and cancel its non-completed instances from that date on.
     *
     * @param occurrenceId the parent or any of its instances
     * @return number of instances canceled
     */
    long cancelFutureRecurrences(String occurrenceId, LocalDate fromDate);

    /**
     * Virtual occurrences of every forever series on a calendar, minus the ones already persisted.
     */
    List<VirtualOccurrence> virtualFeed(String calendarId, LocalDate windowStart, LocalDate windowEnd);

    /**
     * Next occurrences of a forever series after now that have not been persisted yet.
     */
    List<VirtualOccurrence> upcoming(String parentId, int count);

    TrimResult trim(TrimOptions options);

    /**
     * Options for trimming series generated too far ahead.
     * <ul>
     *   <li>horizon: instances anchored after this date are removed</li>
     *   <li>minInstances: only series with at least this many live instances are considered</li>
     *   <li>convertToForever: switch trimmed series to a forever rule</li>
     *   <li>dryRun: report without writing</li>
     * </ul>
     */
    record TrimOptions(LocalDate horizon, int minInstances, boolean convertToForever, boolean dryRun) {
        public static TrimOptions ofYears(LocalDate today, int years) {
            return new TrimOptions(today.plusDays(years * 365L), 24, false, false);
        }
    }
}
