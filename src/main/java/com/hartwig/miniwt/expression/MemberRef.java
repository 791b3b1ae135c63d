package com.hartwig.miniwt.expression;

import org.immutables.value.Value;

/**
 * Reference to an output of another call, {@code call.output}. The call is resolved by name, never held.
 */
@Value.Immutable
@Value.Style(jdkOnly = true)
public interface MemberRef extends Expression {
    @Value.Parameter
    String callName();

    @Value.Parameter
    String outputName();

    @Override
    default <T> T accept(ExpressionVisitor<T> visitor) {
        return visitor.visitMemberRef(this);
    }

    static MemberRef of(String callName, String outputName) {
        return ImmutableMemberRef.of(callName, outputName);
    }
}
