package io.recur4j.core;

public class OccurrenceNotFoundException extends SeriesException {

    private final String occurrenceId;

    public OccurrenceNotFoundException(String occurrenceId) {
        super("Occurrence not found: " + occurrenceId);
        this.occurrenceId = occurrenceId;
    }

    public String occurrenceId() {
        return occurrenceId;
    }
}
