package com.hartwig.miniwt.ir;

import java.util.List;
import java.util.Optional;

import com.hartwig.miniwt.expression.Interpolation;

import org.immutables.value.Value;

@Value.Immutable
@Value.Style(jdkOnly = true)
public interface Task {
    String name();

    /**
     * Shell command template. Placeholders reference the task inputs.
     */
    Interpolation command();

    List<Declaration> inputs();

    List<Declaration> outputs();

    Optional<Runtime> runtime();

    Optional<String> description();

    default Optional<Declaration> input(String name) {
        return inputs().stream().filter(input -> input.name().equals(name)).findFirst();
    }

    default Optional<Declaration> output(String name) {
        return outputs().stream().filter(output -> output.name().equals(name)).findFirst();
    }

    static ImmutableTask.Builder builder() {
        return ImmutableTask.builder();
    }
}
