package com.hartwig.miniwt.cwl;

import java.util.Optional;
import java.util.function.Function;
import java.util.stream.Collectors;

import com.hartwig.miniwt.expression.ArrayLiteral;
import com.hartwig.miniwt.expression.Expression;
import com.hartwig.miniwt.expression.ExpressionVisitor;
import com.hartwig.miniwt.expression.FunctionCall;
import com.hartwig.miniwt.expression.Interpolation;
import com.hartwig.miniwt.expression.Literal;
import com.hartwig.miniwt.expression.MemberRef;
import com.hartwig.miniwt.expression.Operation;
import com.hartwig.miniwt.expression.TemplatePart;
import com.hartwig.miniwt.expression.VariableRef;
import com.hartwig.miniwt.ir.DataType;

/**
 * Renders expressions as CWL parameter references where possible and as inline JavaScript otherwise.
 */
class CwlExpressionRenderer {
    private final Function<VariableRef, String> variables;
    private final Function<MemberRef, String> members;
    private final Function<String, Optional<DataType>> types;
    private boolean javascriptUsed;

    /**
     * @param variables JavaScript accessor of a variable, e.g. {@code inputs.reads}
     * @param members JavaScript accessor of a call output, throws {@link UnrenderableExpressionException} when there is
     *         none
     * @param types declared type of a variable, used to pick file paths
     */
    CwlExpressionRenderer(final Function<VariableRef, String> variables, final Function<MemberRef, String> members,
            final Function<String, Optional<DataType>> types) {
        this.variables = variables;
        this.members = members;
        this.types = types;
    }

    /**
     * Whether any rendered expression needs InlineJavascriptRequirement.
     */
    boolean javascriptUsed() {
        return javascriptUsed;
    }

    /**
     * Renders a string value: text with escaped {@code $} and each placeholder as {@code $(...)}.
     */
    String renderTemplate(Interpolation template) {
        var result = new StringBuilder();
        for (TemplatePart part : template.parts()) {
            if (part.isText()) {
                result.append(escape(part.text().orElseThrow()));
            } else {
                result.append(renderValue(part.expression().orElseThrow()));
            }
        }
        return result.toString();
    }

    /**
     * Renders a single value as {@code $(...)}, a plain parameter reference when the expression is one.
     */
    String renderValue(Expression expression) {
        if (expression instanceof VariableRef) {
            var variable = (VariableRef) expression;
            var optionalFile = types.apply(variable.name()).map(type -> type.isFileLike() && type.optional()).orElse(false);
            if (!optionalFile) {
                return "$(" + variables.apply(variable) + pathSuffix(variable) + ")";
            }
        }
        if (expression instanceof FunctionCall && ((FunctionCall) expression).isNamed(FunctionCall.JAVASCRIPT)) {
            javascriptUsed = true;
            return rawJavascript((FunctionCall) expression);
        }
        if (expression instanceof FunctionCall && ((FunctionCall) expression).isNamed("basename")
                && ((FunctionCall) expression).args().size() == 1 && ((FunctionCall) expression).args().get(0) instanceof VariableRef) {
            return "$(" + variables.apply((VariableRef) ((FunctionCall) expression).args().get(0)) + ".basename)";
        }
        var script = renderJavascript(expression);
        javascriptUsed = true;
        return "$(" + script + ")";
    }

    String renderJavascript(Expression expression) {
        return expression.accept(new JavascriptVisitor());
    }

    private String pathSuffix(VariableRef variable) {
        return types.apply(variable.name()).filter(DataType::isFileLike).isPresent() ? ".path" : "";
    }

    private static String rawJavascript(FunctionCall call) {
        var raw = call.args().get(0);
        if (!(raw instanceof Literal)) {
            throw new UnrenderableExpressionException("Malformed JavaScript expression");
        }
        return ((Literal) raw).value();
    }

    static String escape(String text) {
        return text.replace("\\", "\\\\").replace("$(", "\\$(").replace("${", "\\${");
    }

    static String quote(String text) {
        return "\"" + text.replace("\\", "\\\\").replace("\"", "\\\"").replace("\n", "\\n").replace("\t", "\\t") + "\"";
    }

    private class JavascriptVisitor implements ExpressionVisitor<String> {
        @Override
        public String visitLiteral(final Literal literal) {
            switch (literal.type()) {
                case STRING:
                    return quote(literal.value());
                case NULL:
                    return "null";
                default:
                    return literal.value();
            }
        }

        @Override
        public String visitVariableRef(final VariableRef variableRef) {
            var accessor = variables.apply(variableRef);
            var type = types.apply(variableRef.name());
            if (type.filter(DataType::isFileLike).isPresent()) {
                return type.get().optional() ? "(" + accessor + " === null ? null : " + accessor + ".path)" : accessor + ".path";
            }
            if (type.filter(t -> t.kind() == DataType.Kind.ARRAY && t.itemType().orElseThrow().isFileLike()).isPresent()) {
                return accessor + ".map(function (f) { return f.path; })";
            }
            return accessor;
        }

        @Override
        public String visitMemberRef(final MemberRef memberRef) {
            return members.apply(memberRef);
        }

        @Override
        public String visitFunctionCall(final FunctionCall functionCall) {
            var args = functionCall.args();
            switch (functionCall.name()) {
                case FunctionCall.JAVASCRIPT:
                    var raw = rawJavascript(functionCall);
                    return raw.startsWith("${") ? "(function () " + raw.substring(1) + ")()" : "(" + raw.substring(2, raw.length() - 1) + ")";
                case FunctionCall.IF_THEN_ELSE:
                    return "(" + render(args.get(0)) + " ? " + render(args.get(1)) + " : " + render(args.get(2)) + ")";
                case "select_first":
                    return render(args.get(0)) + ".filter(function (v) { return v !== null && v !== undefined; })[0]";
                case "defined":
                    return "(" + render(args.get(0)) + " !== null)";
                case "length":
                    return render(args.get(0)) + ".length";
                case "sep":
                    return render(args.get(1)) + ".join(" + render(args.get(0)) + ")";
                case "basename":
                    var name = args.get(0) instanceof VariableRef && types.apply(((VariableRef) args.get(0)).name())
                            .filter(DataType::isFileLike)
                            .isPresent()
                            ? variables.apply((VariableRef) args.get(0)) + ".basename"
                            : render(args.get(0)) + ".split('/').pop()";
                    if (args.size() == 2) {
                        return "(function (b, s) { return b.endsWith(s) ? b.slice(0, b.length - s.length) : b; })(" + name + ", "
                                + render(args.get(1)) + ")";
                    }
                    return name;
                default:
                    throw new UnrenderableExpressionException(String.format("Function '%s' has no CWL equivalent", functionCall.name()));
            }
        }

        @Override
        public String visitInterpolation(final Interpolation interpolation) {
            if (interpolation.parts().isEmpty()) {
                return "\"\"";
            }
            return "(" + interpolation.parts()
                    .stream()
                    .map(part -> part.isText() ? quote(part.text().orElseThrow()) : "String(" + render(part.expression().orElseThrow()) + ")")
                    .collect(Collectors.joining(" + ")) + ")";
        }

        @Override
        public String visitArrayLiteral(final ArrayLiteral arrayLiteral) {
            return "[" + arrayLiteral.items().stream().map(this::render).collect(Collectors.joining(", ")) + "]";
        }

        @Override
        public String visitOperation(final Operation operation) {
            var operator = operation.operator();
            if (operator.isUnary()) {
                return operator.symbol() + render(operation.operands().get(0));
            }
            return "(" + render(operation.operands().get(0)) + " " + operator.symbol() + " " + render(operation.operands().get(1)) + ")";
        }

        private String render(Expression expression) {
            return expression.accept(this);
        }
    }
}
