package io.recur4j.core;

import io.recur4j.InstanceCreatedHook;

import java.util.List;
import java.util.Map;
import java.util.function.Function;
import java.util.stream.Collectors;

public class InstanceHookRegistry {

    private final Map<String, InstanceCreatedHook> hooksByName;
    private final List<InstanceCreatedHook> hooks;

    public InstanceHookRegistry(List<InstanceCreatedHook> hooks) {
        this.hooksByName = hooks.stream()
                .collect(Collectors.toUnmodifiableMap(
                        InstanceCreatedHook::name,
                        Function.identity(),
                        (a, b) -> {
                            throw new IllegalStateException("Duplicate InstanceCreatedHook name: " + a.name());
                        }
                ));
        this.hooks = List.copyOf(hooks);
    }

    public static InstanceHookRegistry empty() {
        return new InstanceHookRegistry(List.of());
    }

    public boolean contains(String name) {
        return hooksByName.containsKey(name);
    }

    /**
     * Run every hook, in registration order, for a freshly persisted instance.
     */
    public void fire(Occurrence instance) {
        for (InstanceCreatedHook hook : hooks) {
            hook.onInstanceCreated(instance);
        }
    }
}
