package io.recur4j.core;

/**
 * The store ended up in a state the engine cannot reconcile, e.g. a materialization conflict whose
 * winning row cannot be found.
 */
public class SeriesStoreException extends SeriesException {

    public SeriesStoreException(String message, Throwable cause) {
        super(message, cause);
    }
}
