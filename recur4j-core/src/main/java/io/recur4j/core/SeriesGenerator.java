package io.recur4j.core;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * Produces the concrete instances of a bounded series (unsaved).
 *
 * <p>Persisting the batch, and firing hooks for it, is the store's job and must happen in one
 * transaction.
 */
public final class SeriesGenerator {
    private static final Logger log = LoggerFactory.getLogger(SeriesGenerator.class);

    public static final int DEFAULT_MAX_COUNT = 50;

    private SeriesGenerator() {
    }

    /**
     * Generate instances from the parent's own stored rule.
     *
     * <p>A rule that cannot be interpreted is a configuration error for this parent only: it is
     * logged and no instance is produced.
     */
    public static List<Occurrence> generate(Occurrence parent, Integer maxCount, LocalDate untilDate) {
        Objects.requireNonNull(parent, "parent must not be null");
        RecurrenceRule rule;
        try {
            rule = parent.recurrenceRule().orElse(null);
        } catch (InvalidRecurrenceRuleException e) {
            log.warn("series generation skipped parentId={} msg={}", parent.id(), e.getMessage());
            return List.of();
        }
        if (rule == null) {
            return List.of();
        }
        return generate(parent, rule, maxCount, untilDate, Set.of());
    }

    /**
     * Step forward from the parent and build one instance per anchor.
     *
     * @param parent       persisted series parent
     * @param rule         rule snapshot to step with
     * @param maxCount     max instances; null means the rule's count, else {@link #DEFAULT_MAX_COUNT}
     * @param untilDate    optional extra inclusive cutoff
     * @param skipAnchors  anchors that already have a row; they are counted as produced but not
     *                     rebuilt
     */
    public static List<Occurrence> generate(Occurrence parent,
                                            RecurrenceRule rule,
                                            Integer maxCount,
                                            LocalDate untilDate,
                                            Set<LocalDateTime> skipAnchors) {
        Objects.requireNonNull(parent, "parent must not be null");
        Objects.requireNonNull(rule, "rule must not be null");
        Objects.requireNonNull(skipAnchors, "skipAnchors must not be null");

        int limit = maxCount != null ? maxCount
                : rule.count() != null ? rule.count()
                : DEFAULT_MAX_COUNT;
        if (limit <= 0) {
            return List.of();
        }

        RuleEvaluator evaluator = new RuleEvaluator(rule);
        LocalDate cutoff = RuleEvaluator.earliest(
                evaluator.effectiveCutoff(parent.seriesEndOverride()).orElse(null),
                untilDate);

        List<Occurrence> instances = new ArrayList<>(Math.min(limit, 64));
        LocalDateTime anchor = parent.start();
        for (int produced = 0; produced < limit; produced++) {
            anchor = evaluator.next(anchor);
            if (cutoff != null && anchor.toLocalDate().isAfter(cutoff)) {
                break;
            }
            if (skipAnchors.contains(anchor)) {
                continue;
            }
            instances.add(Occurrence.instanceOf(parent, anchor));
        }

        log.debug("series generated parentId={} type={} interval={} instances={} cutoff={}",
                parent.id(), rule.type(), rule.interval(), instances.size(), cutoff);
        return instances;
    }
}
