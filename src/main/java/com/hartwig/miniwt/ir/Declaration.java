package com.hartwig.miniwt.ir;

import java.util.Optional;

import com.hartwig.miniwt.expression.Expression;

import org.immutables.value.Value;

/**
 * A typed, named input or output.
 */
@Value.Immutable
@Value.Style(jdkOnly = true)
public interface Declaration {
    String name();

    DataType type();

    /**
     * Default value for inputs, computed value for outputs.
     */
    Optional<Expression> expression();

    Optional<String> description();

    /**
     * Whether a caller has to supply a value for this input.
     */
    default boolean isRequired() {
        return !type().optional() && expression().isEmpty();
    }

    static Declaration of(String name, DataType type) {
        return builder().name(name).type(type).build();
    }

    static Declaration of(String name, DataType type, Expression expression) {
        return builder().name(name).type(type).expression(expression).build();
    }

    static ImmutableDeclaration.Builder builder() {
        return ImmutableDeclaration.builder();
    }
}
