package io.recur4j.core;

/**
 * Base type for errors raised by the recurrence engine.
 */
public class SeriesException extends RuntimeException {

    public SeriesException(String message) {
        super(message);
    }

    public SeriesException(String message, Throwable cause) {
        super(message, cause);
    }
}
