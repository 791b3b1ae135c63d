package com.hartwig.miniwt.expression;

import org.immutables.value.Value;

@Value.Immutable
@Value.Style(jdkOnly = true)
public interface Literal extends Expression {
    enum Type {
        STRING,
        INT,
        FLOAT,
        BOOLEAN,
        NULL
    }

    @Value.Parameter
    Type type();

    /**
     * Textual value. Strings are stored unescaped, numbers and booleans in their canonical source form.
     */
    @Value.Parameter
    String value();

    @Override
    default <T> T accept(ExpressionVisitor<T> visitor) {
        return visitor.visitLiteral(this);
    }

    default boolean isString() {
        return type() == Type.STRING;
    }

    static Literal ofString(String value) {
        return ImmutableLiteral.of(Type.STRING, value);
    }

    static Literal ofInt(long value) {
        return ImmutableLiteral.of(Type.INT, Long.toString(value));
    }

    static Literal ofFloat(String value) {
        return ImmutableLiteral.of(Type.FLOAT, value);
    }

    static Literal ofBoolean(boolean value) {
        return ImmutableLiteral.of(Type.BOOLEAN, Boolean.toString(value));
    }

    static Literal nullValue() {
        return ImmutableLiteral.of(Type.NULL, "null");
    }
}
