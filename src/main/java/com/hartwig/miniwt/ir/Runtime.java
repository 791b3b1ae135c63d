package com.hartwig.miniwt.ir;

import java.util.Map;
import java.util.Optional;

import com.hartwig.miniwt.expression.Expression;

import org.immutables.value.Value;

/**
 * Resource requirements of a task. Absent fields are unconstrained.
 */
@Value.Immutable
@Value.Style(jdkOnly = true)
public interface Runtime {
    /**
     * Prefix of custom attributes holding a CWL requirement the model does not cover, keyed by requirement class.
     */
    String REQUIREMENT_PREFIX = "requirement:";

    Optional<Quantity> memory();

    Optional<Integer> cpu();

    Optional<Quantity> disk();

    /**
     * Container image, e.g. {@code ubuntu:22.04}.
     */
    Optional<String> container();

    Optional<Integer> maxRetries();

    /**
     * Number of preemptible attempts, 0 means not preemptible.
     */
    Optional<Integer> preemptible();

    /**
     * Runtime attributes the model has no dedicated field for, in declaration order.
     */
    Map<String, Expression> customAttributes();

    default boolean isEmpty() {
        return memory().isEmpty() && cpu().isEmpty() && disk().isEmpty() && container().isEmpty() && maxRetries().isEmpty()
                && preemptible().isEmpty() && customAttributes().isEmpty();
    }

    static boolean isRequirement(String attribute) {
        return attribute.startsWith(REQUIREMENT_PREFIX);
    }

    static ImmutableRuntime.Builder builder() {
        return ImmutableRuntime.builder();
    }
}
