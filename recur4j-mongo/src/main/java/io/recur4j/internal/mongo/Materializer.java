package io.recur4j.internal.mongo;

import com.mongodb.MongoException;
import io.recur4j.core.InstanceHookRegistry;
import io.recur4j.core.MaterializeResult;
import io.recur4j.core.Occurrence;
import io.recur4j.core.RecurrenceRule;
import io.recur4j.core.RuleEvaluator;
import io.recur4j.core.ScopeViolationException;
import io.recur4j.core.SeriesStoreException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.dao.TransientDataAccessException;
import org.springframework.transaction.support.TransactionOperations;

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.Objects;
import java.util.Optional;

/**
 * Turns a virtual occurrence into a persisted instance, at most once per
 * {@code (parentId, originalAnchor)}.
 *
 * <p>The lookup and the insert run in one transaction. Two racing callers are separated by the
 * unique index on {@code (parentId, originalAnchor)}: the loser's insert fails, and it reads the
 * winner's row instead.
 */
public class Materializer {
    private static final Logger log = LoggerFactory.getLogger(Materializer.class);

    private final MongoOccurrenceStore store;
    private final TransactionOperations tx;
    private final InstanceHookRegistry hooks;

    public Materializer(MongoOccurrenceStore store, TransactionOperations tx, InstanceHookRegistry hooks) {
        this.store = Objects.requireNonNull(store, "store must not be null");
        this.tx = Objects.requireNonNull(tx, "tx must not be null");
        this.hooks = Objects.requireNonNull(hooks, "hooks must not be null");
    }

    /**
     * Find or create the instance of {@code parent} anchored at {@code originalAnchor}.
     *
     * @param originalAnchor anchor in the parent's zone
     * @throws ScopeViolationException if the parent does not own a live recurring series, or the
     *                                 anchor is not a later occurrence of it within the series end
     */
    public MaterializeResult materialize(Occurrence parent, LocalDateTime originalAnchor) {
        Objects.requireNonNull(parent, "parent must not be null");
        Objects.requireNonNull(originalAnchor, "originalAnchor must not be null");
        if (!parent.isRecurringParent() || parent.deleted()) {
            throw new ScopeViolationException("Occurrence is not a live recurring series parent: " + parent.id());
        }
        if (originalAnchor.equals(parent.start())) {
            throw new ScopeViolationException("Anchor is the parent's own occurrence: " + originalAnchor);
        }

        RecurrenceRule rule = parent.recurrenceRule().orElseThrow();
        RuleEvaluator evaluator = new RuleEvaluator(rule);
        Optional<LocalDate> cutoff = evaluator.effectiveCutoff(parent.seriesEndOverride());
        if (cutoff.isPresent() && originalAnchor.toLocalDate().isAfter(cutoff.get())) {
            throw new ScopeViolationException(
                    "Anchor " + originalAnchor + " is after the series end " + cutoff.get());
        }
        if (!evaluator.isAnchor(parent.start(), originalAnchor)) {
            throw new ScopeViolationException(
                    "Anchor " + originalAnchor + " is not an occurrence of series " + parent.id());
        }

        try {
            return tx.execute(status -> findOrCreate(parent, originalAnchor));
        } catch (RuntimeException e) {
            if (!isWriteConflict(e)) {
                throw e;
            }
            log.warn("materialize conflict, re-reading parentId={} anchor={} msg={}",
                    parent.id(), originalAnchor, e.getMessage());
            return store.findInstance(parent.id(), originalAnchor)
                    .map(MaterializeResult::existingResult)
                    .orElseThrow(() -> new SeriesStoreException(
                            "Materialization conflict but no instance found for parentId=" + parent.id()
                                    + " anchor=" + originalAnchor, e));
        }
    }

    private MaterializeResult findOrCreate(Occurrence parent, LocalDateTime originalAnchor) {
        Optional<Occurrence> existing = store.findInstance(parent.id(), originalAnchor);
        if (existing.isPresent()) {
            return MaterializeResult.existingResult(existing.get());
        }

        Occurrence created = store.insert(Occurrence.instanceOf(parent, originalAnchor));
        hooks.fire(created);
        log.debug("instance materialized parentId={} id={} anchor={}", parent.id(), created.id(), originalAnchor);
        return MaterializeResult.createdResult(created);
    }

    /**
     * Duplicate key on the unique anchor index, or a transient transaction error (write conflict)
     * anywhere in the cause chain.
     */
    static boolean isWriteConflict(Throwable e) {
        if (e instanceof DuplicateKeyException || e instanceof TransientDataAccessException) {
            return true;
        }
        for (Throwable t = e; t != null; t = t.getCause()) {
            if (t instanceof MongoException me
                    && me.hasErrorLabel(MongoException.TRANSIENT_TRANSACTION_ERROR_LABEL)) {
                return true;
            }
            if (t.getCause() == t) {
                break;
            }
        }
        return false;
    }
}
