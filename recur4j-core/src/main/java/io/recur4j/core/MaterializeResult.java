package io.recur4j.core;

public record MaterializeResult(
        Occurrence occurrence,
        boolean created
) {
    public static MaterializeResult createdResult(Occurrence occurrence) {
        return new MaterializeResult(occurrence, true);
    }

    public static MaterializeResult existingResult(Occurrence occurrence) {
        return new MaterializeResult(occurrence, false);
    }
}
