package com.hartwig.miniwt.ir;

import java.util.Optional;

import com.hartwig.miniwt.expression.Expression;

import org.immutables.value.Value;

/**
 * One enclosing scatter or conditional block of a call. All calls inside the same lexical block share its block id.
 */
@Value.Immutable
@Value.Style(jdkOnly = true)
public interface Frame {
    enum Kind {
        SCATTER,
        CONDITIONAL
    }

    Kind kind();

    String blockId();

    /**
     * Name bound to each element, scatter frames only.
     */
    Optional<String> variable();

    /**
     * The collection for scatter frames, the guard for conditional frames.
     */
    Expression expression();

    @Value.Check
    default void check() {
        if ((kind() == Kind.SCATTER) != variable().isPresent()) {
            throw new IllegalStateException(String.format("Frame '%s': a variable should be present for scatter frames only",
                    blockId()));
        }
    }

    static Frame scatter(String blockId, String variable, Expression collection) {
        return ImmutableFrame.builder().kind(Kind.SCATTER).blockId(blockId).variable(variable).expression(collection).build();
    }

    static Frame conditional(String blockId, Expression guard) {
        return ImmutableFrame.builder().kind(Kind.CONDITIONAL).blockId(blockId).expression(guard).build();
    }
}
