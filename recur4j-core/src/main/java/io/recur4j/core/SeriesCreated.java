package io.recur4j.core;

import java.util.List;

/**
 * A persisted series parent and the instances created eagerly with it (none for forever series).
 */
public record SeriesCreated(
        Occurrence parent,
        List<Occurrence> instances
) {
    public SeriesCreated {
        instances = List.copyOf(instances);
    }
}
