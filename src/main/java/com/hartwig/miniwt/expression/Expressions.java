package com.hartwig.miniwt.expression;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.function.Consumer;
import java.util.stream.Collectors;

public final class Expressions {
    private Expressions() {
    }

    /**
     * Variable references in left-to-right source order, duplicates included.
     */
    public static List<VariableRef> references(Expression expression) {
        var result = new ArrayList<VariableRef>();
        walk(expression, e -> {
            if (e instanceof VariableRef) {
                result.add((VariableRef) e);
            }
        });
        return result;
    }

    /**
     * Member references in left-to-right source order, duplicates included.
     */
    public static List<MemberRef> memberRefs(Expression expression) {
        var result = new ArrayList<MemberRef>();
        walk(expression, e -> {
            if (e instanceof MemberRef) {
                result.add((MemberRef) e);
            }
        });
        return result;
    }

    public static List<FunctionCall> functionCalls(Expression expression) {
        var result = new ArrayList<FunctionCall>();
        walk(expression, e -> {
            if (e instanceof FunctionCall) {
                result.add((FunctionCall) e);
            }
        });
        return result;
    }

    public static boolean containsJavascript(Expression expression) {
        return functionCalls(expression).stream().anyMatch(call -> call.isNamed(FunctionCall.JAVASCRIPT));
    }

    /**
     * Visits the expression and all its sub-expressions, parents before children.
     */
    public static void walk(Expression expression, Consumer<Expression> consumer) {
        expression.accept(new ExpressionVisitor<Void>() {
            @Override
            public Void visitLiteral(final Literal literal) {
                consumer.accept(literal);
                return null;
            }

            @Override
            public Void visitVariableRef(final VariableRef variableRef) {
                consumer.accept(variableRef);
                return null;
            }

            @Override
            public Void visitMemberRef(final MemberRef memberRef) {
                consumer.accept(memberRef);
                return null;
            }

            @Override
            public Void visitFunctionCall(final FunctionCall functionCall) {
                consumer.accept(functionCall);
                functionCall.args().forEach(arg -> arg.accept(this));
                return null;
            }

            @Override
            public Void visitInterpolation(final Interpolation interpolation) {
                consumer.accept(interpolation);
                interpolation.parts().forEach(part -> part.expression().ifPresent(e -> e.accept(this)));
                return null;
            }

            @Override
            public Void visitArrayLiteral(final ArrayLiteral arrayLiteral) {
                consumer.accept(arrayLiteral);
                arrayLiteral.items().forEach(item -> item.accept(this));
                return null;
            }

            @Override
            public Void visitOperation(final Operation operation) {
                consumer.accept(operation);
                operation.operands().forEach(operand -> operand.accept(this));
                return null;
            }
        });
    }

    /**
     * Rebuilds the expression with every variable reference found in the replacement map swapped for its replacement.
     */
    public static Expression substitute(Expression expression, Map<String, Expression> replacements) {
        return expression.accept(new ExpressionVisitor<Expression>() {
            @Override
            public Expression visitLiteral(final Literal literal) {
                return literal;
            }

            @Override
            public Expression visitVariableRef(final VariableRef variableRef) {
                return replacements.getOrDefault(variableRef.name(), variableRef);
            }

            @Override
            public Expression visitMemberRef(final MemberRef memberRef) {
                return memberRef;
            }

            @Override
            public Expression visitFunctionCall(final FunctionCall functionCall) {
                return FunctionCall.of(functionCall.name(), rebuild(functionCall.args()));
            }

            @Override
            public Expression visitInterpolation(final Interpolation interpolation) {
                return Interpolation.of(interpolation.parts()
                        .stream()
                        .map(part -> part.isText() ? part : TemplatePart.placeholder(part.expression().orElseThrow().accept(this)))
                        .collect(Collectors.toList()));
            }

            @Override
            public Expression visitArrayLiteral(final ArrayLiteral arrayLiteral) {
                return ArrayLiteral.of(rebuild(arrayLiteral.items()));
            }

            @Override
            public Expression visitOperation(final Operation operation) {
                return ImmutableOperation.of(operation.operator(), rebuild(operation.operands()));
            }

            private List<Expression> rebuild(List<Expression> expressions) {
                return expressions.stream().map(e -> e.accept(this)).collect(Collectors.toList());
            }
        });
    }
}
