package io.recur4j.core;

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Computes virtual occurrences of a series inside a display window without touching storage.
 *
 * <p>Same inputs always give the same output, so it is safe to call from concurrent requests.
 */
public final class WindowExpander {

    public static final int DEFAULT_SAFETY_CAP = 200;

    private WindowExpander() {
    }

    public static List<VirtualOccurrence> expand(Occurrence parent,
                                                 RecurrenceRule rule,
                                                 LocalDate windowStart,
                                                 LocalDate windowEnd) {
        return expand(parent, rule, windowStart, windowEnd, DEFAULT_SAFETY_CAP);
    }

    /**
     * Expand the series over the inclusive window {@code [windowStart, windowEnd]}.
     *
     * <p>The parent's own slot is emitted first (ordinal 0) when it falls inside the window. At most
     * {@code safetyCap} occurrences are returned; hitting the cap truncates silently.
     */
    public static List<VirtualOccurrence> expand(Occurrence parent,
                                                 RecurrenceRule rule,
                                                 LocalDate windowStart,
                                                 LocalDate windowEnd,
                                                 int safetyCap) {
        Objects.requireNonNull(parent, "parent must not be null");
        Objects.requireNonNull(rule, "rule must not be null");
        Objects.requireNonNull(windowStart, "windowStart must not be null");
        Objects.requireNonNull(windowEnd, "windowEnd must not be null");
        if (safetyCap <= 0) {
            return List.of();
        }

        RuleEvaluator evaluator = new RuleEvaluator(rule);
        Optional<LocalDate> cutoff = evaluator.effectiveCutoff(parent.seriesEndOverride());

        LocalDate end = windowEnd;
        if (cutoff.isPresent()) {
            if (cutoff.get().isBefore(windowStart)) {
                return List.of();
            }
            if (cutoff.get().isBefore(end)) {
                end = cutoff.get();
            }
        }
        if (end.isBefore(windowStart)) {
            return List.of();
        }

        List<VirtualOccurrence> out = new ArrayList<>();
        LocalDateTime anchor = parent.start();
        if (inWindow(anchor.toLocalDate(), windowStart, end)) {
            out.add(toVirtual(parent, anchor, 0, true));
        }

        int ordinal = 0;
        while (out.size() < safetyCap) {
            anchor = evaluator.next(anchor);
            ordinal++;
            if (anchor.toLocalDate().isAfter(end)) {
                break;
            }
            if (!anchor.toLocalDate().isBefore(windowStart)) {
                out.add(toVirtual(parent, anchor, ordinal, false));
            }
        }
        return out;
    }

    private static boolean inWindow(LocalDate date, LocalDate start, LocalDate end) {
        return !date.isBefore(start) && !date.isAfter(end);
    }

    private static VirtualOccurrence toVirtual(Occurrence parent, LocalDateTime anchor, int ordinal, boolean isParent) {
        return new VirtualOccurrence(
                parent.id(),
                anchor,
                anchor,
                anchor.plus(parent.duration()),
                ordinal,
                isParent
        );
    }
}
