package io.recur4j.core;

/**
 * A series operation was rejected because of the target's place in its series. Nothing was
 * modified.
 */
public class ScopeViolationException extends SeriesException {

    public ScopeViolationException(String message) {
        super(message);
    }
}
