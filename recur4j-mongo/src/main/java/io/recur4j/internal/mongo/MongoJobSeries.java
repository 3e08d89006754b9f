package io.recur4j.internal.mongo;

import io.recur4j.JobSeries;
import io.recur4j.SeriesBuilder;
import io.recur4j.config.SeriesProperties;
import io.recur4j.core.DeleteResult;
import io.recur4j.core.InstanceHookRegistry;
import io.recur4j.core.JobSnapshot;
import io.recur4j.core.MaterializeResult;
import io.recur4j.core.Occurrence;
import io.recur4j.core.OccurrenceLocator;
import io.recur4j.core.OccurrenceNotFoundException;
import io.recur4j.core.RecurrenceRule;
import io.recur4j.core.RuleEvaluator;
import io.recur4j.core.ScopeViolationException;
import io.recur4j.core.SeriesCreated;
import io.recur4j.core.SeriesEdit;
import io.recur4j.core.SeriesGenerator;
import io.recur4j.core.SeriesScope;
import io.recur4j.core.TrimResult;
import io.recur4j.core.VirtualOccurrence;
import io.recur4j.core.WindowExpander;
import io.recur4j.internal.SimpleSeriesBuilder;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.transaction.support.TransactionOperations;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.ZonedDateTime;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.OptionalInt;
import java.util.Set;

/**
 * JobSeries is the Mongo-backed recurrence engine.
 *
 * <p>Core capabilities:
 * <ul>
 *   <li>Finite series (count / until-date): instances persisted eagerly on save</li>
 *   <li>Forever series: occurrences computed per window, persisted on first interaction</li>
 *   <li>Scoped delete / edit / cancel without touching completed history</li>
 * </ul>
 *
 * <p>Typical usage:
 * <pre>{@code
 * SeriesCreated created = jobSeries.create("main-shop", snapshot)
 *       .between(LocalDateTime.parse("2026-03-02T09:00"), LocalDateTime.parse("2026-03-02T11:00"))
 *       .repeat(RecurrenceRule.forever(RecurrenceType.WEEKLY, 2))
 *       .save();
 *
 * List<VirtualOccurrence> feed = jobSeries.virtualFeed("main-shop", from, to);
 * jobSeries.materialize(created.parent().id(), feed.get(0).originalAnchor());
 * }</pre>
 */
public class MongoJobSeries implements JobSeries {
    private static final Logger log = LoggerFactory.getLogger(MongoJobSeries.class);

    private final SeriesProperties props;
    private final MongoOccurrenceStore store;
    private final TransactionOperations tx;
    private final Clock clock;

    private final Materializer materializer;
    private final SeriesLifecycle lifecycle;

    public MongoJobSeries(SeriesProperties props,
                          MongoOccurrenceStore store,
                          TransactionOperations tx,
                          InstanceHookRegistry hooks,
                          Clock clock) {
        this.props = Objects.requireNonNull(props, "props must not be null");
        this.store = Objects.requireNonNull(store, "store must not be null");
        this.tx = Objects.requireNonNull(tx, "tx must not be null");
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
        Objects.requireNonNull(hooks, "hooks must not be null");

        this.materializer = new Materializer(store, tx, hooks);
        this.lifecycle = new SeriesLifecycle(store, tx, hooks, props);
    }

    /**
     * Create a series builder. This does not persist until save() is called.
     */
    @Override
    public SeriesBuilder create(String calendarId, JobSnapshot snapshot) {
        return new SimpleSeriesBuilder(calendarId, snapshot, props.resolveZone(), this::persistSeries);
    }

    private SeriesCreated persistSeries(Occurrence parent) {
        validateParent(parent);

        SeriesCreated created = tx.execute(status -> {
            Occurrence saved = store.insert(parent);
            Optional<RecurrenceRule> rule = saved.recurrenceRule();
            if (rule.isEmpty() || new RuleEvaluator(rule.get()).isForever()) {
                return new SeriesCreated(saved, List.of());
            }
            int limit = lifecycle.resolveLimit(rule.get(), null);
            List<Occurrence> instances = SeriesGenerator.generate(saved, limit, null);
            return new SeriesCreated(saved, lifecycle.insertInstances(instances));
        });

        log.info("series created parentId={} calendarId={} rule={} instances={}",
                created.parent().id(), parent.calendarId(), parent.rule(), created.instances().size());
        return created;
    }

    @Override
    public Optional<Occurrence> find(String occurrenceId) {
        Objects.requireNonNull(occurrenceId, "occurrenceId must not be null");
        return store.findById(occurrenceId).filter(o -> !o.deleted());
    }

    @Override
    public List<Occurrence> generate(String parentId, Integer maxCount, LocalDate untilDate) {
        Objects.requireNonNull(parentId, "parentId must not be null");
        if (maxCount != null && maxCount <= 0) {
            throw new IllegalArgumentException("maxCount must be a positive number");
        }

        List<Occurrence> created = tx.execute(status -> {
            Occurrence parent = lifecycle.requireParent(parentId);
            Optional<RecurrenceRule> rule = lifecycle.readRule(parent);
            if (rule.isEmpty() || new RuleEvaluator(rule.get()).isForever()) {
                return List.<Occurrence>of();
            }
            Set<LocalDateTime> existing = store.anchorsOf(parentId);
            List<Occurrence> instances = SeriesGenerator.generate(
                    parent, rule.get(), lifecycle.resolveLimit(rule.get(), maxCount), untilDate, existing);
            return lifecycle.insertInstances(instances);
        });

        log.info("series generated parentId={} maxCount={} untilDate={} instances={}",
                parentId, maxCount, untilDate, created.size());
        return created;
    }

    @Override
    public List<VirtualOccurrence> expand(String parentId, LocalDate windowStart, LocalDate windowEnd) {
        Objects.requireNonNull(parentId, "parentId must not be null");
        validateRange(windowStart, windowEnd);

        Occurrence parent = lifecycle.requireParent(parentId);
        RecurrenceRule rule = parent.recurrenceRule()
                .orElseThrow(() -> new ScopeViolationException("Occurrence does not recur: " + parentId));
        return WindowExpander.expand(parent, rule, windowStart, windowEnd, props.getWindowSafetyCap());
    }

    @Override
    public MaterializeResult materialize(String parentId, ZonedDateTime originalAnchor) {
        Objects.requireNonNull(originalAnchor, "originalAnchor must not be null");
        Occurrence parent = lifecycle.requireParent(parentId);
        return materialize(parent, originalAnchor.withZoneSameInstant(parent.zone()).toLocalDateTime());
    }

    @Override
    public MaterializeResult materialize(String parentId, Instant originalAnchor) {
        Objects.requireNonNull(originalAnchor, "originalAnchor must not be null");
        Occurrence parent = lifecycle.requireParent(parentId);
        return materialize(parent, LocalDateTime.ofInstant(originalAnchor, parent.zone()));
    }

    @Override
    public MaterializeResult materialize(String parentId, LocalDateTime originalAnchor) {
        Objects.requireNonNull(parentId, "parentId must not be null");
        Objects.requireNonNull(originalAnchor, "originalAnchor must not be null");
        return materialize(lifecycle.requireParent(parentId), originalAnchor);
    }

    private MaterializeResult materialize(Occurrence parent, LocalDateTime originalAnchor) {
        validateYear(originalAnchor.toLocalDate(), "originalAnchor");
        return materializer.materialize(parent, originalAnchor);
    }

    @Override
    public OptionalInt ordinal(String occurrenceId) {
        Occurrence occurrence = find(occurrenceId)
                .orElseThrow(() -> new OccurrenceNotFoundException(occurrenceId));
        if (occurrence.isParent()) {
            return occurrence.isRecurringParent() ? OptionalInt.of(1) : OptionalInt.empty();
        }

        Optional<Occurrence> parent = store.findById(occurrence.parentId());
        if (parent.isEmpty()) {
            log.warn("ordinal lookup found no parent id={} parentId={}", occurrenceId, occurrence.parentId());
            return OptionalInt.empty();
        }
        return lifecycle.readRule(parent.get())
                .map(rule -> OccurrenceLocator.ordinal(
                        parent.get(), rule, occurrence.anchor(), props.getOrdinalSafetyCap()))
                .orElse(OptionalInt.empty());
    }

    @Override
    public DeleteResult delete(String occurrenceId, SeriesScope scope) {
        return lifecycle.delete(occurrenceId, scope);
    }

    @Override
    public long edit(String occurrenceId, SeriesScope scope, SeriesEdit edit) {
        return lifecycle.edit(occurrenceId, scope, edit);
    }

    @Override
    public List<Occurrence> updateRule(String parentId, RecurrenceRule rule) {
        return lifecycle.updateRule(parentId, rule);
    }

    @Override
    public List<Occurrence> regenerate(String parentId) {
        return lifecycle.regenerate(parentId);
    }

    @Override
    public long cancelFutureRecurrences(String occurrenceId, LocalDate fromDate) {
        return lifecycle.cancelFutureRecurrences(occurrenceId, fromDate);
    }

    @Override
    public List<VirtualOccurrence> virtualFeed(String calendarId, LocalDate windowStart, LocalDate windowEnd) {
        Objects.requireNonNull(calendarId, "calendarId must not be null");
        validateRange(windowStart, windowEnd);

        // zones differ per parent; over-fetch by a day and filter on the local date
        Instant startBefore = windowEnd.plusDays(2).atStartOfDay(props.resolveZone()).toInstant();
        List<Occurrence> parents = store.findRecurringParents(calendarId, startBefore);

        List<VirtualOccurrence> out = new ArrayList<>();
        for (Occurrence parent : parents) {
            if (parent.start().toLocalDate().isAfter(windowEnd)) {
                continue;
            }
            try {
                Optional<RecurrenceRule> rule = lifecycle.readRule(parent);
                if (rule.isEmpty() || !new RuleEvaluator(rule.get()).isForever()) {
                    continue;
                }
                Set<LocalDateTime> materialized = store.anchorsOf(parent.id());
                List<VirtualOccurrence> expanded = WindowExpander.expand(
                        parent, rule.get(), windowStart, windowEnd, props.getFeedSafetyCap());
                for (VirtualOccurrence v : expanded) {
                    if (!v.isParent() && !materialized.contains(v.originalAnchor())) {
                        out.add(v);
                    }
                }
            } catch (RuntimeException e) {
                log.error("virtual feed skipped parent parentId={} msg={}", parent.id(), e.getMessage(), e);
            }
        }

        out.sort(Comparator.comparing(VirtualOccurrence::start).thenComparing(VirtualOccurrence::parentId));
        log.debug("virtual feed calendarId={} window=[{}, {}] parents={} occurrences={}",
                calendarId, windowStart, windowEnd, parents.size(), out.size());
        return out;
    }

    @Override
    public List<VirtualOccurrence> upcoming(String parentId, int count) {
        if (count <= 0) {
            throw new IllegalArgumentException("count must be a positive number");
        }
        int limit = Math.min(count, props.getPreviewMaxCount());

        Occurrence parent = lifecycle.requireParent(parentId);
        RecurrenceRule rule = parent.recurrenceRule()
                .orElseThrow(() -> new ScopeViolationException("Occurrence does not recur: " + parentId));
        RuleEvaluator evaluator = new RuleEvaluator(rule);
        if (!evaluator.isForever()) {
            throw new ScopeViolationException("Preview is only available for forever series: " + parentId);
        }

        LocalDateTime now = LocalDateTime.ofInstant(clock.instant(), parent.zone());
        LocalDate cutoff = evaluator.effectiveCutoff(parent.seriesEndOverride()).orElse(null);
        Set<LocalDateTime> materialized = store.anchorsOf(parentId);
        Duration duration = parent.duration();

        List<VirtualOccurrence> out = new ArrayList<>(limit);
        LocalDateTime anchor = parent.start();
        int ordinal = 0;
        while (out.size() < limit) {
            anchor = evaluator.next(anchor);
            ordinal++;
            if (cutoff != null && anchor.toLocalDate().isAfter(cutoff)) {
                break;
            }
            if (!anchor.isAfter(now) || materialized.contains(anchor)) {
                continue;
            }
            out.add(new VirtualOccurrence(parentId, anchor, anchor, anchor.plus(duration), ordinal, false));
        }
        return out;
    }

    @Override
    public TrimResult trim(TrimOptions options) {
        return lifecycle.trim(options);
    }

    private void validateParent(Occurrence parent) {
        if (parent.calendarId() == null || parent.calendarId().isBlank()) {
            throw new IllegalArgumentException("calendarId must not be blank");
        }
        validateYear(parent.start().toLocalDate(), "start");
        validateYear(parent.end().toLocalDate(), "end");
        if (parent.end().isBefore(parent.start())) {
            throw new IllegalArgumentException("end must not be before start");
        }
        if (Duration.between(parent.start(), parent.end()).toDays() > props.getMaxSpanDays()) {
            throw new IllegalArgumentException("job must not span more than " + props.getMaxSpanDays() + " days");
        }
    }

    private void validateRange(LocalDate start, LocalDate end) {
        Objects.requireNonNull(start, "windowStart must not be null");
        Objects.requireNonNull(end, "windowEnd must not be null");
        validateYear(start, "windowStart");
        validateYear(end, "windowEnd");
        if (end.isBefore(start)) {
            throw new IllegalArgumentException("windowEnd must not be before windowStart");
        }
        if (Duration.between(start.atStartOfDay(), end.atStartOfDay()).toDays() > props.getMaxSpanDays()) {
            throw new IllegalArgumentException("window must not span more than " + props.getMaxSpanDays() + " days");
        }
    }

    private void validateYear(LocalDate date, String field) {
        int year = date.getYear();
        if (year < props.getMinValidYear() || year > props.getMaxValidYear()) {
            throw new IllegalArgumentException(field + " year must be between "
                    + props.getMinValidYear() + " and " + props.getMaxValidYear() + ", got: " + year);
        }
    }
}
