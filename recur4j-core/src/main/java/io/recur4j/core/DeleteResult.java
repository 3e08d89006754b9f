package io.recur4j.core;

import java.time.LocalDate;

/**
 * Result of a scoped delete.
 *
 * scope             : scope that was applied
 * deleted           : number of occurrences soft-deleted (parent included when it was deleted)
 * seriesEndOverride : the parent's new series end, or null when it was not changed
 */
public record DeleteResult(
        SeriesScope scope,
        long deleted,
        LocalDate seriesEndOverride
) {
    public boolean hasEffect() {
        return deleted > 0 || seriesEndOverride != null;
    }
}
