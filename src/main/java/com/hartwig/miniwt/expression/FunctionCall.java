package com.hartwig.miniwt.expression;

import java.util.Arrays;
import java.util.List;

import org.immutables.value.Value;

@Value.Immutable
@Value.Style(jdkOnly = true)
public interface FunctionCall extends Expression {
    /**
     * Conditional value, {@code if_then_else(condition, whenTrue, whenFalse)}.
     */
    String IF_THEN_ELSE = "if_then_else";

    /**
     * Opaque JavaScript taken over from CWL. The first argument is the raw expression text, the remaining arguments are
     * the values the script reads as {@code self}.
     */
    String JAVASCRIPT = "js";

    @Value.Parameter
    String name();

    @Value.Parameter
    List<Expression> args();

    @Override
    default <T> T accept(ExpressionVisitor<T> visitor) {
        return visitor.visitFunctionCall(this);
    }

    default boolean isNamed(String functionName) {
        return name().equals(functionName);
    }

    static FunctionCall of(String name, Expression... args) {
        return ImmutableFunctionCall.of(name, Arrays.asList(args));
    }

    static FunctionCall of(String name, List<Expression> args) {
        return ImmutableFunctionCall.of(name, args);
    }
}
