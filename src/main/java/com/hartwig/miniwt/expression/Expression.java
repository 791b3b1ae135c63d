package com.hartwig.miniwt.expression;

/**
 * A pure, side-effect free expression shared by all parsers and writers.
 * <p>
 * The set of expression kinds is closed: every consumer implements {@link ExpressionVisitor}, so adding a kind
 * breaks compilation of every place that renders or inspects expressions.
 */
public interface Expression {
    <T> T accept(ExpressionVisitor<T> visitor);
}
