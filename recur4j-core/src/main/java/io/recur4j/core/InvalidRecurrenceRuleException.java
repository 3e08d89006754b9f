package io.recur4j.core;

/**
 * A stored or requested recurrence rule cannot be interpreted (unknown type, malformed until-date,
 * out-of-range values).
 */
public class InvalidRecurrenceRuleException extends SeriesException {

    public InvalidRecurrenceRuleException(String message) {
        super(message);
    }

    public InvalidRecurrenceRuleException(String message, Throwable cause) {
        super(message, cause);
    }
}
