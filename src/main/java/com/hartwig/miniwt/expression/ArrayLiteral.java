package com.hartwig.miniwt.expression;

import java.util.Arrays;
import java.util.List;

import org.immutables.value.Value;

@Value.Immutable
@Value.Style(jdkOnly = true)
public interface ArrayLiteral extends Expression {
    @Value.Parameter
    List<Expression> items();

    @Override
    default <T> T accept(ExpressionVisitor<T> visitor) {
        return visitor.visitArrayLiteral(this);
    }

    static ArrayLiteral of(Expression... items) {
        return ImmutableArrayLiteral.of(Arrays.asList(items));
    }

    static ArrayLiteral of(List<Expression> items) {
        return ImmutableArrayLiteral.of(items);
    }
}
