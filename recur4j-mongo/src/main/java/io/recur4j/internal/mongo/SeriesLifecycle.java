package io.recur4j.internal.mongo;

import io.recur4j.JobSeries.TrimOptions;
import io.recur4j.config.SeriesProperties;
import io.recur4j.core.DeleteResult;
import io.recur4j.core.InstanceHookRegistry;
import io.recur4j.core.InstanceQuery;
import io.recur4j.core.InvalidRecurrenceRuleException;
import io.recur4j.core.Occurrence;
import io.recur4j.core.OccurrenceNotFoundException;
import io.recur4j.core.OccurrenceStatus;
import io.recur4j.core.RecurrenceRule;
import io.recur4j.core.RuleEvaluator;
import io.recur4j.core.ScopeViolationException;
import io.recur4j.core.SeriesEdit;
import io.recur4j.core.SeriesGenerator;
import io.recur4j.core.SeriesScope;
import io.recur4j.core.TrimResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.transaction.support.TransactionOperations;

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * Scoped mutations of a series: delete, edit, cancel-future, regeneration, rule changes and
 * trimming.
 *
 * <p>Each public call runs in one transaction and reads the parent (rule and series end) once at
 * its start.
 */
public class SeriesLifecycle {
    private static final Logger log = LoggerFactory.getLogger(SeriesLifecycle.class);

    private final MongoOccurrenceStore store;
    private final TransactionOperations tx;
    private final InstanceHookRegistry hooks;
    private final SeriesProperties props;

    public SeriesLifecycle(MongoOccurrenceStore store,
                           TransactionOperations tx,
                           InstanceHookRegistry hooks,
                           SeriesProperties props) {
        this.store = Objects.requireNonNull(store, "store must not be null");
        this.tx = Objects.requireNonNull(tx, "tx must not be null");
        this.hooks = Objects.requireNonNull(hooks, "hooks must not be null");
        this.props = Objects.requireNonNull(props, "props must not be null");
    }

    public DeleteResult delete(String occurrenceId, SeriesScope scope) {
        Objects.requireNonNull(occurrenceId, "occurrenceId must not be null");
        Objects.requireNonNull(scope, "scope must not be null");

        DeleteResult result = tx.execute(status -> {
            Occurrence target = requireLive(occurrenceId);
            return switch (scope) {
                case THIS_ONLY -> deleteThisOnly(target);
                case THIS_AND_FUTURE -> deleteThisAndFuture(target);
                case ALL -> deleteAll(target);
            };
        });
        log.info("series delete id={} scope={} deleted={} seriesEndOverride={}",
                occurrenceId, scope, result.deleted(), result.seriesEndOverride());
        return result;
    }

    private DeleteResult deleteThisOnly(Occurrence target) {
        if (target.isParent()) {
            long live = store.countInstances(InstanceQuery.forParent(target.id()).build());
            if (live > 0) {
                throw new ScopeViolationException(
                        "Cannot delete only the parent of a series with " + live + " live instances: " + target.id());
            }
        }
        return new DeleteResult(SeriesScope.THIS_ONLY, store.softDelete(target.id()), null);
    }

    private DeleteResult deleteThisAndFuture(Occurrence target) {
        if (target.isParent()) {
            // the parent stays; the series simply ends on its own date
            LocalDate parentDate = target.start().toLocalDate();
            long deleted = store.softDelete(InstanceQuery.forParent(target.id())
                    .anchorAfter(parentDate, target.zone())
                    .excludeStatus(OccurrenceStatus.COMPLETED)
                    .build());
            LocalDate override = truncate(target, parentDate);
            return new DeleteResult(SeriesScope.THIS_AND_FUTURE, deleted, override);
        }

        LocalDate anchorDate = target.anchorDate();
        long deleted = store.softDelete(target.id());
        deleted += store.softDelete(InstanceQuery.forParent(target.parentId())
                .anchorOnOrAfter(anchorDate, target.zone())
                .excludeStatus(OccurrenceStatus.COMPLETED)
                .build());

        Occurrence parent = store.findById(target.parentId())
                .orElseThrow(() -> new OccurrenceNotFoundException(target.parentId()));
        LocalDate override = truncate(parent, anchorDate.minusDays(1));
        return new DeleteResult(SeriesScope.THIS_AND_FUTURE, deleted, override);
    }

    /**
     * End the series no later than {@code seriesEnd}. An earlier existing end is kept.
     *
     * @return the parent's resulting series end
     */
    private LocalDate truncate(Occurrence parent, LocalDate seriesEnd) {
        LocalDate override = RuleEvaluator.earliest(parent.seriesEndOverride(), seriesEnd);
        if (!override.equals(parent.seriesEndOverride())) {
            store.setSeriesEndOverride(parent.id(), override);
        }
        return override;
    }

    private DeleteResult deleteAll(Occurrence target) {
        String parentId = target.isParent() ? target.id() : target.parentId();
        long deleted = store.softDelete(InstanceQuery.forParent(parentId).build());
        deleted += store.softDelete(parentId);
        return new DeleteResult(SeriesScope.ALL, deleted, null);
    }

    public long edit(String occurrenceId, SeriesScope scope, SeriesEdit edit) {
        Objects.requireNonNull(occurrenceId, "occurrenceId must not be null");
        Objects.requireNonNull(scope, "scope must not be null");
        Objects.requireNonNull(edit, "edit must not be null");
        if (edit.isEmpty()) {
            return 0;
        }

        Long updated = tx.execute(status -> {
            Occurrence target = requireLive(occurrenceId);
            return switch (scope) {
                case THIS_ONLY -> store.applyEdit(target.id(), edit);
                case THIS_AND_FUTURE -> {
                    long n = store.applyEdit(target.id(), edit);
                    if (target.isParent()) {
                        // the series itself is edited with ALL
                        yield n;
                    }
                    yield n + store.applyEdit(InstanceQuery.forParent(target.parentId())
                            .anchorAfter(target.anchorDate(), target.zone())
                            .excludeTerminal()
                            .build(), edit);
                }
                case ALL -> {
                    String parentId = target.isParent() ? target.id() : target.parentId();
                    SeriesEdit parentEdit = edit.withoutStatus();
                    long n = parentEdit.isEmpty() ? 0 : store.applyEdit(parentId, parentEdit);
                    yield n + store.applyEdit(InstanceQuery.forParent(parentId).excludeTerminal().build(), edit);
                }
            };
        });
        log.info("series edit id={} scope={} updated={}", occurrenceId, scope, updated);
        return updated;
    }

    public long cancelFutureRecurrences(String occurrenceId, LocalDate fromDate) {
        Objects.requireNonNull(occurrenceId, "occurrenceId must not be null");
        Objects.requireNonNull(fromDate, "fromDate must not be null");

        Long canceled = tx.execute(status -> {
            Occurrence target = requireLive(occurrenceId);
            Occurrence parent = target.isParent() ? target : requireLive(target.parentId());
            if (!parent.isRecurringParent()) {
                throw new ScopeViolationException("Occurrence is not part of a recurring series: " + occurrenceId);
            }
            truncate(parent, fromDate);
            return store.updateStatus(InstanceQuery.forParent(parent.id())
                            .anchorOnOrAfter(fromDate, parent.zone())
                            .excludeTerminal()
                            .build(),
                    OccurrenceStatus.CANCELED);
        });
        log.info("series canceled from date id={} fromDate={} canceled={}", occurrenceId, fromDate, canceled);
        return canceled;
    }

    public List<Occurrence> regenerate(String parentId) {
        Objects.requireNonNull(parentId, "parentId must not be null");
        List<Occurrence> created = tx.execute(status -> doRegenerate(requireParent(parentId)));
        log.info("series regenerated parentId={} instances={}", parentId, created.size());
        return created;
    }

    /**
     * Replace the parent's rule, then regenerate. Converting to forever also clears the series end.
     */
    public List<Occurrence> updateRule(String parentId, RecurrenceRule rule) {
        Objects.requireNonNull(parentId, "parentId must not be null");
        Objects.requireNonNull(rule, "rule must not be null");

        List<Occurrence> created = tx.execute(status -> {
            Occurrence parent = requireParent(parentId);
            boolean forever = new RuleEvaluator(rule).isForever();
            LocalDate override = forever ? null : parent.seriesEndOverride();
            store.updateRule(parent.id(), rule.toRecord(), override);
            return doRegenerate(parent.withRule(rule.toRecord()).withSeriesEndOverride(override));
        });
        log.info("series rule updated parentId={} type={} interval={} count={} untilDate={} instances={}",
                parentId, rule.type(), rule.interval(), rule.count(), rule.untilDate(), created.size());
        return created;
    }

    private List<Occurrence> doRegenerate(Occurrence parent) {
        Optional<RecurrenceRule> rule = readRule(parent);
        if (rule.isEmpty()) {
            return List.of();
        }
        store.hardDelete(InstanceQuery.forParent(parent.id()).excludeTerminal().build());
        if (new RuleEvaluator(rule.get()).isForever()) {
            return List.of();
        }
        Set<LocalDateTime> existing = store.anchorsOf(parent.id());
        List<Occurrence> instances = SeriesGenerator.generate(
                parent, rule.get(), resolveLimit(rule.get(), null), null, existing);
        return insertInstances(instances);
    }

    /**
     * Persist generated instances and run the creation hooks for each. Callers provide the
     * transaction.
     */
    List<Occurrence> insertInstances(List<Occurrence> instances) {
        List<Occurrence> saved = store.insertAll(instances);
        for (Occurrence o : saved) {
            hooks.fire(o);
        }
        return saved;
    }

    /**
     * Instance limit: the requested count, else the rule's, else the configured default; never
     * above the configured maximum.
     */
    int resolveLimit(RecurrenceRule rule, Integer maxCount) {
        int limit = maxCount != null ? maxCount
                : rule.count() != null ? rule.count()
                : props.getDefaultMaxCount();
        return Math.min(limit, props.getMaxCount());
    }

    public TrimResult trim(TrimOptions options) {
        Objects.requireNonNull(options, "options must not be null");
        Objects.requireNonNull(options.horizon(), "horizon must not be null");
        if (options.minInstances() < 0) {
            throw new IllegalArgumentException("minInstances must not be negative");
        }

        long affected = 0;
        long trimmed = 0;
        long converted = 0;
        for (Occurrence parent : store.findRecurringParents()) {
            RecurrenceRule rule = readRule(parent).orElse(null);
            if (rule == null || new RuleEvaluator(rule).isForever()) {
                continue;
            }
            long live = store.countInstances(InstanceQuery.forParent(parent.id()).build());
            if (live < options.minInstances()) {
                continue;
            }
            InstanceQuery beyond = InstanceQuery.forParent(parent.id())
                    .anchorAfter(options.horizon(), parent.zone())
                    .excludeTerminal()
                    .build();
            long count = store.countInstances(beyond);
            if (count == 0) {
                continue;
            }
            affected++;
            log.info("series trim candidate parentId={} live={} beyondHorizon={} dryRun={}",
                    parent.id(), live, count, options.dryRun());
            if (options.dryRun()) {
                continue;
            }

            Long removed = tx.execute(status -> {
                long n = store.hardDelete(beyond);
                if (options.convertToForever()) {
                    store.updateRule(parent.id(), RecurrenceRule.forever(rule.type(), rule.interval()).toRecord(), null);
                }
                return n;
            });
            trimmed += removed;
            if (options.convertToForever()) {
                converted++;
            }
        }

        log.info("series trim done horizon={} seriesAffected={} trimmed={} converted={} dryRun={}",
                options.horizon(), affected, trimmed, converted, options.dryRun());
        return new TrimResult(affected, trimmed, converted, options.dryRun());
    }

    /**
     * The parent's rule; empty when it has none, or (logged) when it cannot be interpreted.
     */
    Optional<RecurrenceRule> readRule(Occurrence parent) {
        try {
            return parent.recurrenceRule();
        } catch (InvalidRecurrenceRuleException e) {
            log.warn("unreadable recurrence rule skipped parentId={} msg={}", parent.id(), e.getMessage());
            return Optional.empty();
        }
    }

    Occurrence requireLive(String id) {
        return store.findById(id)
                .filter(o -> !o.deleted())
                .orElseThrow(() -> new OccurrenceNotFoundException(id));
    }

    Occurrence requireParent(String id) {
        Occurrence o = requireLive(id);
        if (!o.isParent()) {
            throw new ScopeViolationException("Occurrence is an instance, not a series parent: " + id);
        }
        return o;
    }
}
