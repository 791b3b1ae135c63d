package com.hartwig.miniwt.wdl;

import java.util.function.UnaryOperator;
import java.util.stream.Collectors;

import com.hartwig.miniwt.expression.ArrayLiteral;
import com.hartwig.miniwt.expression.Expression;
import com.hartwig.miniwt.expression.ExpressionVisitor;
import com.hartwig.miniwt.expression.FunctionCall;
import com.hartwig.miniwt.expression.Interpolation;
import com.hartwig.miniwt.expression.Literal;
import com.hartwig.miniwt.expression.MemberRef;
import com.hartwig.miniwt.expression.Operation;
import com.hartwig.miniwt.expression.Operator;
import com.hartwig.miniwt.expression.TemplatePart;
import com.hartwig.miniwt.expression.VariableRef;

/**
 * Renders expressions as WDL source text.
 */
class WdlExpressionRenderer implements ExpressionVisitor<String> {
    private static final int IF_THEN_ELSE_PRECEDENCE = 0;
    private static final int ATOM_PRECEDENCE = 10;

    private final UnaryOperator<String> names;

    /**
     * @param names maps source names to valid WDL identifiers
     */
    WdlExpressionRenderer(final UnaryOperator<String> names) {
        this.names = names;
    }

    String render(Expression expression) {
        return expression.accept(this);
    }

    /**
     * Renders the body of a {@code ~{}} placeholder, turning the lowered placeholder options back into option syntax.
     */
    String renderPlaceholder(Expression expression) {
        if (expression instanceof FunctionCall) {
            var call = (FunctionCall) expression;
            if (call.isNamed("sep") && call.args().size() == 2 && isStringLiteral(call.args().get(0))) {
                return String.format("sep=%s %s", render(call.args().get(0)), renderPlaceholder(call.args().get(1)));
            }
            if (call.isNamed(FunctionCall.IF_THEN_ELSE) && isStringLiteral(call.args().get(1)) && isStringLiteral(call.args().get(2))) {
                return String.format("true=%s false=%s %s",
                        render(call.args().get(1)),
                        render(call.args().get(2)),
                        renderPlaceholder(call.args().get(0)));
            }
            if (call.isNamed("select_first") && call.args().size() == 1 && call.args().get(0) instanceof ArrayLiteral) {
                var items = ((ArrayLiteral) call.args().get(0)).items();
                if (items.size() == 2 && isStringLiteral(items.get(1))) {
                    return String.format("default=%s %s", render(items.get(1)), renderPlaceholder(items.get(0)));
                }
            }
        }
        return render(expression);
    }

    @Override
    public String visitLiteral(final Literal literal) {
        switch (literal.type()) {
            case STRING:
                return "\"" + escape(literal.value()) + "\"";
            case NULL:
                return "None";
            default:
                return literal.value();
        }
    }

    @Override
    public String visitVariableRef(final VariableRef variableRef) {
        return names.apply(variableRef.name());
    }

    @Override
    public String visitMemberRef(final MemberRef memberRef) {
        return names.apply(memberRef.callName()) + "." + names.apply(memberRef.outputName());
    }

    @Override
    public String visitFunctionCall(final FunctionCall functionCall) {
        if (functionCall.isNamed(FunctionCall.JAVASCRIPT)) {
            throw new UnrenderableExpressionException("JavaScript expressions have no WDL equivalent");
        }
        if (functionCall.isNamed(FunctionCall.IF_THEN_ELSE) && functionCall.args().size() == 3) {
            return String.format("if %s then %s else %s",
                    render(functionCall.args().get(0)),
                    render(functionCall.args().get(1)),
                    render(functionCall.args().get(2)));
        }
        return functionCall.name() + "(" + functionCall.args().stream().map(this::render).collect(Collectors.joining(", ")) + ")";
    }

    @Override
    public String visitInterpolation(final Interpolation interpolation) {
        var result = new StringBuilder("\"");
        for (TemplatePart part : interpolation.parts()) {
            if (part.isText()) {
                result.append(escape(part.text().orElseThrow()));
            } else {
                result.append("~{").append(renderPlaceholder(part.expression().orElseThrow())).append("}");
            }
        }
        return result.append("\"").toString();
    }

    @Override
    public String visitArrayLiteral(final ArrayLiteral arrayLiteral) {
        return "[" + arrayLiteral.items().stream().map(this::render).collect(Collectors.joining(", ")) + "]";
    }

    @Override
    public String visitOperation(final Operation operation) {
        var operator = operation.operator();
        if (operator.isUnary()) {
            return operator.symbol() + operand(operation.operands().get(0), operator.precedence());
        }
        // left associative: the right operand needs parentheses at equal precedence
        return operand(operation.operands().get(0), operator.precedence()) + " " + operator.symbol() + " " + operand(operation.operands()
                .get(1), operator.precedence() + 1);
    }

    private String operand(Expression operand, int minPrecedence) {
        var rendered = render(operand);
        return precedence(operand) < minPrecedence ? "(" + rendered + ")" : rendered;
    }

    private static int precedence(Expression expression) {
        if (expression instanceof Operation) {
            return ((Operation) expression).operator().precedence();
        }
        if (expression instanceof FunctionCall && ((FunctionCall) expression).isNamed(FunctionCall.IF_THEN_ELSE)) {
            return IF_THEN_ELSE_PRECEDENCE;
        }
        if (expression instanceof Literal && !((Literal) expression).isString() && ((Literal) expression).value().startsWith("-")) {
            return Operator.NEGATE.precedence();
        }
        return ATOM_PRECEDENCE;
    }

    private static boolean isStringLiteral(Expression expression) {
        return expression instanceof Literal && ((Literal) expression).isString();
    }

    static String escape(String text) {
        return text.replace("\\", "\\\\")
                .replace("\"", "\\\"")
                .replace("\n", "\\n")
                .replace("\t", "\\t")
                .replace("~{", "\\~{")
                .replace("${", "\\${");
    }
}
