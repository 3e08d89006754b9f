package io.recur4j.core;

import java.time.LocalDateTime;

/**
 * Computed, never persisted, occurrence of a forever series.
 *
 * ordinal  : steps from the parent anchor (the parent itself is 0)
 * isParent : true only for the parent's own slot
 */
public record VirtualOccurrence(
        String parentId,
        LocalDateTime originalAnchor,
        LocalDateTime start,
        LocalDateTime end,
        int ordinal,
        boolean isParent
) {
}
