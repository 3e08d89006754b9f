package io.recur4j.core;

/**
 * Result of trimming over-generated series.
 *
 * seriesAffected : series that had uncompleted instances beyond the horizon
 * trimmed        : instances deleted (0 on a dry run)
 * converted      : series switched to forever
 */
public record TrimResult(
        long seriesAffected,
        long trimmed,
        long converted,
        boolean dryRun
) {
}
