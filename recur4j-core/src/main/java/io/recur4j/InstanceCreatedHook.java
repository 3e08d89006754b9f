package io.recur4j;

import io.recur4j.core.Occurrence;

/**
 * Side effect run for every newly created series instance, inside the creating transaction.
 * Throwing aborts the whole transaction.
 */
public interface InstanceCreatedHook {
    String name();

    void onInstanceCreated(Occurrence instance);
}
