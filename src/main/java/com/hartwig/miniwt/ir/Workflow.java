package com.hartwig.miniwt.ir;

import java.util.List;
import java.util.Map;
import java.util.Optional;

import org.immutables.value.Value;

@Value.Immutable
@Value.Style(jdkOnly = true)
public interface Workflow {
    String name();

    List<Declaration> inputs();

    List<Declaration> outputs();

    /**
     * Tasks by name, in declaration order.
     */
    Map<String, Task> tasks();

    /**
     * Calls in workflow body order.
     */
    List<Call> calls();

    Optional<String> description();

    default Optional<Declaration> input(String name) {
        return inputs().stream().filter(input -> input.name().equals(name)).findFirst();
    }

    static ImmutableWorkflow.Builder builder() {
        return ImmutableWorkflow.builder();
    }
}
