package io.recur4j.core;

import io.recur4j.utils.DateStepper;

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.Objects;
import java.util.Optional;

/**
 * Read-only questions about one {@link RecurrenceRule}.
 *
 * <p>Built once per call from the parent's rule, so a whole generation or expansion steps under a
 * single rule even if the parent is edited concurrently.
 */
public final class RuleEvaluator {

    private static final String SEPARATOR = " • ";

    private final RecurrenceRule rule;

    public RuleEvaluator(RecurrenceRule rule) {
        this.rule = Objects.requireNonNull(rule, "rule must not be null");
    }

    public RecurrenceRule rule() {
        return rule;
    }

    /**
     * An explicit "never" marker and a rule with neither count nor until-date both read as forever.
     */
    public boolean isForever() {
        return rule.never() || (rule.count() == null && rule.untilDate() == null);
    }

    /**
     * Null-safe variant for raw persisted records; unreadable rules are not forever.
     */
    public static boolean isForever(RecurrenceRuleRecord record) {
        try {
            return RecurrenceRule.from(record).map(r -> new RuleEvaluator(r).isForever()).orElse(false);
        } catch (InvalidRecurrenceRuleException e) {
            return false;
        }
    }

    /**
     * Last date an occurrence may fall on: the earlier of the rule's until-date and the parent's
     * series end override.
     */
    public Optional<LocalDate> effectiveCutoff(LocalDate seriesEndOverride) {
        return Optional.ofNullable(earliest(rule.untilDate(), seriesEndOverride));
    }

    /**
     * Anchor of the {@code n}-th occurrence; {@code n = 0} is the parent itself.
     */
    public LocalDateTime anchorOf(LocalDateTime parentAnchor, int n) {
        Objects.requireNonNull(parentAnchor, "parentAnchor must not be null");
        if (n < 0) {
            throw new IllegalArgumentException("n must not be negative");
        }
        LocalDateTime anchor = parentAnchor;
        for (int i = 0; i < n; i++) {
            anchor = next(anchor);
        }
        return anchor;
    }

    /**
     * Whether stepping from {@code parentAnchor} reaches {@code candidate} exactly (the parent's own
     * anchor included). Ignores count and cutoff.
     */
    public boolean isAnchor(LocalDateTime parentAnchor, LocalDateTime candidate) {
        Objects.requireNonNull(parentAnchor, "parentAnchor must not be null");
        Objects.requireNonNull(candidate, "candidate must not be null");
        LocalDateTime anchor = parentAnchor;
        while (anchor.isBefore(candidate)) {
            anchor = next(anchor);
        }
        return anchor.equals(candidate);
    }

    public LocalDateTime next(LocalDateTime anchor) {
        return DateStepper.next(anchor, rule.type(), rule.interval());
    }

    /**
     * Human-readable description, e.g. "Repeats every 2 weeks • 6 occurrences".
     * Count-based rules report the parent too, so the stored count plus one.
     */
    public String summary() {
        StringBuilder sb = new StringBuilder("Repeats ");
        if (rule.interval() == 1) {
            sb.append(adverb(rule.type()));
        } else {
            sb.append("every ").append(rule.interval()).append(' ').append(rule.type().unit()).append('s');
        }
        sb.append(SEPARATOR);

        if (rule.count() != null) {
            sb.append(rule.count() + 1).append(" occurrences");
        } else if (rule.untilDate() != null && !rule.never()) {
            sb.append("Until ").append(rule.untilDate());
        } else {
            sb.append("Forever");
        }
        return sb.toString();
    }

    private static String adverb(RecurrenceType type) {
        return switch (type) {
            case DAILY -> "daily";
            case WEEKLY -> "weekly";
            case MONTHLY -> "monthly";
            case YEARLY -> "yearly";
        };
    }

    /**
     * The earlier of two optional dates; null only when both are null.
     */
    public static LocalDate earliest(LocalDate a, LocalDate b) {
        if (a == null) return b;
        if (b == null) return a;
        return a.isBefore(b) ? a : b;
    }
}
