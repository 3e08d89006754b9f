package io.recur4j.core;

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.Objects;
import java.util.OptionalInt;

/**
 * Recomputes the 1-based position of an occurrence in its series (the parent is 1).
 *
 * <p>Uses the exact stepping of {@link SeriesGenerator} and {@link WindowExpander}, so displayed
 * numbers match generation order.
 */
public final class OccurrenceLocator {

    public static final int DEFAULT_SAFETY_CAP = 502;

    private OccurrenceLocator() {
    }

    public static OptionalInt ordinal(Occurrence parent, RecurrenceRule rule, LocalDateTime instanceAnchor) {
        return ordinal(parent, rule, instanceAnchor, DEFAULT_SAFETY_CAP);
    }

    /**
     * @return the ordinal, or empty when the anchor is not on the series (e.g. it was hand-edited)
     *         or lies beyond {@code safetyCap} steps
     */
    public static OptionalInt ordinal(Occurrence parent,
                                      RecurrenceRule rule,
                                      LocalDateTime instanceAnchor,
                                      int safetyCap) {
        Objects.requireNonNull(parent, "parent must not be null");
        Objects.requireNonNull(rule, "rule must not be null");
        Objects.requireNonNull(instanceAnchor, "instanceAnchor must not be null");

        LocalDate target = instanceAnchor.toLocalDate();
        LocalDateTime anchor = parent.start();
        if (anchor.toLocalDate().equals(target)) {
            return OptionalInt.of(1);
        }

        RuleEvaluator evaluator = new RuleEvaluator(rule);
        for (int ordinal = 2; ordinal <= safetyCap; ordinal++) {
            anchor = evaluator.next(anchor);
            LocalDate date = anchor.toLocalDate();
            if (date.equals(target)) {
                return OptionalInt.of(ordinal);
            }
            if (date.isAfter(target)) {
                return OptionalInt.empty();
            }
        }
        return OptionalInt.empty();
    }
}
