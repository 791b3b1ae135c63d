package com.hartwig.miniwt.expression;

import java.util.Optional;

import org.immutables.value.Value;

/**
 * One part of an {@link Interpolation}: either literal text or an embedded expression.
 */
@Value.Immutable
@Value.Style(jdkOnly = true)
public interface TemplatePart {
    Optional<String> text();

    Optional<Expression> expression();

    @Value.Check
    default void check() {
        if (text().isPresent() == expression().isPresent()) {
            throw new IllegalStateException("Template part should hold either text or an expression");
        }
    }

    default boolean isText() {
        return text().isPresent();
    }

    static TemplatePart text(String text) {
        return ImmutableTemplatePart.builder().text(text).build();
    }

    static TemplatePart placeholder(Expression expression) {
        return ImmutableTemplatePart.builder().expression(expression).build();
    }
}
