package com.hartwig.miniwt.expression;

import java.util.List;

import org.immutables.value.Value;

@Value.Immutable
@Value.Style(jdkOnly = true)
public interface Operation extends Expression {
    @Value.Parameter
    Operator operator();

    @Value.Parameter
    List<Expression> operands();

    @Override
    default <T> T accept(ExpressionVisitor<T> visitor) {
        return visitor.visitOperation(this);
    }

    @Value.Check
    default void check() {
        int expected = operator().isUnary() ? 1 : 2;
        if (operands().size() != expected) {
            throw new IllegalStateException(String.format("Operator '%s' takes %d operand(s), got %d",
                    operator().symbol(),
                    expected,
                    operands().size()));
        }
    }

    static Operation unary(Operator operator, Expression operand) {
        return ImmutableOperation.of(operator, List.of(operand));
    }

    static Operation binary(Operator operator, Expression left, Expression right) {
        return ImmutableOperation.of(operator, List.of(left, right));
    }
}
