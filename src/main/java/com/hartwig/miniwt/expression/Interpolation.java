package com.hartwig.miniwt.expression;

import java.util.List;
import java.util.stream.Collectors;

import org.immutables.value.Value;

/**
 * A string assembled from literal text and placeholders. Task command templates are interpolations.
 */
@Value.Immutable
@Value.Style(jdkOnly = true)
public interface Interpolation extends Expression {
    @Value.Parameter
    List<TemplatePart> parts();

    @Override
    default <T> T accept(ExpressionVisitor<T> visitor) {
        return visitor.visitInterpolation(this);
    }

    default boolean isLiteralText() {
        return parts().stream().allMatch(TemplatePart::isText);
    }

    /**
     * Concatenated text parts, placeholders left out.
     */
    default String literalText() {
        return parts().stream().filter(TemplatePart::isText).map(part -> part.text().orElseThrow()).collect(Collectors.joining());
    }

    default boolean isBlank() {
        return isLiteralText() && literalText().isBlank();
    }

    static Interpolation of(List<TemplatePart> parts) {
        return ImmutableInterpolation.of(parts);
    }

    static Interpolation ofText(String text) {
        return ImmutableInterpolation.of(text.isEmpty() ? List.of() : List.of(TemplatePart.text(text)));
    }

    static Interpolation empty() {
        return ImmutableInterpolation.of(List.of());
    }
}
