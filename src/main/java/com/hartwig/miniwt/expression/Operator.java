package com.hartwig.miniwt.expression;

import java.util.Arrays;
import java.util.Optional;

public enum Operator {
    OR("||", 1, false),
    AND("&&", 2, false),
    EQUAL("==", 3, false),
    NOT_EQUAL("!=", 3, false),
    LESS("<", 4, false),
    LESS_EQUAL("<=", 4, false),
    GREATER(">", 4, false),
    GREATER_EQUAL(">=", 4, false),
    ADD("+", 5, false),
    SUBTRACT("-", 5, false),
    MULTIPLY("*", 6, false),
    DIVIDE("/", 6, false),
    REMAINDER("%", 6, false),
    NOT("!", 7, true),
    NEGATE("-", 7, true);

    private final String symbol;
    private final int precedence;
    private final boolean unary;

    Operator(final String symbol, final int precedence, final boolean unary) {
        this.symbol = symbol;
        this.precedence = precedence;
        this.unary = unary;
    }

    public String symbol() {
        return symbol;
    }

    /**
     * Binding strength, higher binds tighter. Writers use it to decide where parentheses are needed.
     */
    public int precedence() {
        return precedence;
    }

    public boolean isUnary() {
        return unary;
    }

    public static Optional<Operator> binary(String symbol) {
        return Arrays.stream(values()).filter(operator -> !operator.unary && operator.symbol.equals(symbol)).findFirst();
    }
}
