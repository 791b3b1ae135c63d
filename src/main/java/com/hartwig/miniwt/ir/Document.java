package com.hartwig.miniwt.ir;

import java.util.List;
import java.util.Optional;

import org.immutables.value.Value;

/**
 * The result of parsing one source text: a workflow or a single task.
 */
@Value.Immutable
@Value.Style(jdkOnly = true)
public interface Document {
    /**
     * Version declared in the source, e.g. {@code 1.0} or {@code v1.2}.
     */
    Optional<String> version();

    List<Import> imports();

    Optional<Workflow> workflow();

    Optional<Task> task();

    @Value.Check
    default void check() {
        if (workflow().isPresent() == task().isPresent()) {
            throw new IllegalStateException("Document should hold exactly one of a workflow or a task");
        }
    }

    /**
     * The document's workflow or task name.
     */
    default String name() {
        return workflow().map(Workflow::name).orElseGet(() -> task().orElseThrow().name());
    }

    static Document of(Workflow workflow) {
        return builder().workflow(workflow).build();
    }

    static Document of(Task task) {
        return builder().task(task).build();
    }

    static ImmutableDocument.Builder builder() {
        return ImmutableDocument.builder();
    }
}
