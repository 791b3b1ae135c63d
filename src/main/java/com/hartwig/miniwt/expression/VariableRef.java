package com.hartwig.miniwt.expression;

import org.immutables.value.Value;

/**
 * Reference to a workflow input, a task input or a scatter variable.
 */
@Value.Immutable
@Value.Style(jdkOnly = true)
public interface VariableRef extends Expression {
    @Value.Parameter
    String name();

    @Override
    default <T> T accept(ExpressionVisitor<T> visitor) {
        return visitor.visitVariableRef(this);
    }

    static VariableRef of(String name) {
        return ImmutableVariableRef.of(name);
    }
}
