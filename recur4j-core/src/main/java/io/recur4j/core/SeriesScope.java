package io.recur4j.core;

/**
 * Which occurrences of a series a delete or edit applies to.
 */
public enum SeriesScope {
    THIS_ONLY,
    THIS_AND_FUTURE,
    ALL
}
