package com.hartwig.miniwt.cwl;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

import com.hartwig.miniwt.expression.Expression;
import com.hartwig.miniwt.expression.FunctionCall;
import com.hartwig.miniwt.expression.Interpolation;
import com.hartwig.miniwt.expression.Literal;
import com.hartwig.miniwt.expression.Operation;
import com.hartwig.miniwt.expression.Operator;
import com.hartwig.miniwt.expression.TemplatePart;
import com.hartwig.miniwt.expression.VariableRef;

/**
 * Lowers CWL strings with {@code $(...)} parameter references and {@code ${...}} bodies. Plain references to inputs
 * become variable references, everything else is kept as opaque JavaScript.
 */
final class CwlExpressionParser {
    private static final Pattern INPUT_REFERENCE = Pattern.compile("^inputs\\.([A-Za-z_][A-Za-z0-9_]*)(?:\\.(path|location|basename))?$");
    private static final Pattern NEGATED_REFERENCE = Pattern.compile("^!\\s*inputs\\.([A-Za-z_][A-Za-z0-9_]*)$");
    private static final Pattern INPUT_USE = Pattern.compile("inputs\\.([A-Za-z_][A-Za-z0-9_]*)");

    private CwlExpressionParser() {
    }

    /**
     * Lowers a string to a literal, a single expression when the whole string is one reference, or an interpolation.
     */
    static Expression parse(String text) {
        var template = parseTemplate(text);
        if (template.isLiteralText()) {
            return Literal.ofString(template.literalText());
        }
        if (template.parts().size() == 1) {
            return template.parts().get(0).expression().orElseThrow();
        }
        return template;
    }

    static Interpolation parseTemplate(String text) {
        var parts = new ArrayList<TemplatePart>();
        var literal = new StringBuilder();
        var i = 0;
        while (i < text.length()) {
            var c = text.charAt(i);
            if (c == '\\' && i + 1 < text.length() && (text.charAt(i + 1) == '$' || text.charAt(i + 1) == '\\')) {
                literal.append(text.charAt(i + 1));
                i += 2;
                continue;
            }
            if (c == '$' && i + 1 < text.length() && (text.charAt(i + 1) == '(' || text.charAt(i + 1) == '{')) {
                var end = closing(text, i + 1);
                if (end > 0) {
                    if (literal.length() > 0) {
                        parts.add(TemplatePart.text(literal.toString()));
                        literal.setLength(0);
                    }
                    parts.add(TemplatePart.placeholder(lowerExpression(text.substring(i, end + 1))));
                    i = end + 1;
                    continue;
                }
            }
            literal.append(c);
            i++;
        }
        if (literal.length() > 0) {
            parts.add(TemplatePart.text(literal.toString()));
        }
        return Interpolation.of(parts);
    }

    /**
     * Lowers one complete {@code $(...)} or {@code ${...}} expression.
     */
    static Expression lowerExpression(String raw) {
        var body = raw.substring(2, raw.length() - 1).trim();
        if (raw.startsWith("$(")) {
            var reference = INPUT_REFERENCE.matcher(body);
            if (reference.matches()) {
                var variable = VariableRef.of(reference.group(1));
                return "basename".equals(reference.group(2)) ? FunctionCall.of("basename", variable) : variable;
            }
            var negated = NEGATED_REFERENCE.matcher(body);
            if (negated.matches()) {
                return Operation.unary(Operator.NOT, VariableRef.of(negated.group(1)));
            }
        }
        return javascript(raw);
    }

    /**
     * Opaque script: the raw text followed by the inputs it reads, so dependencies stay visible.
     */
    static FunctionCall javascript(String raw) {
        var args = new ArrayList<Expression>();
        args.add(Literal.ofString(raw));
        args.addAll(inputsUsed(raw).stream().map(VariableRef::of).collect(Collectors.toList()));
        return FunctionCall.of(FunctionCall.JAVASCRIPT, args);
    }

    static List<String> inputsUsed(String raw) {
        var names = new LinkedHashSet<String>();
        var matcher = INPUT_USE.matcher(raw);
        while (matcher.find()) {
            names.add(matcher.group(1));
        }
        return new ArrayList<>(names);
    }

    /**
     * Recognizes {@code $(parseInt(self[0].contents))} style output evaluations of loaded file contents.
     */
    static Optional<String> readFunction(String outputEval) {
        var body = outputEval.replaceAll("\\s+", "");
        if (body.equals("$(parseInt(self[0].contents))")) {
            return Optional.of("read_int");
        }
        if (body.equals("$(parseFloat(self[0].contents))")) {
            return Optional.of("read_float");
        }
        if (body.equals("$(self[0].contents)") || body.equals("$(self[0].contents.replace(/\\n$/,''))")) {
            return Optional.of("read_string");
        }
        if (body.equals("$(self[0].contents.trim()=='true')")) {
            return Optional.of("read_boolean");
        }
        return Optional.empty();
    }

    private static int closing(String text, int open) {
        var openChar = text.charAt(open);
        var closeChar = openChar == '(' ? ')' : '}';
        var depth = 0;
        var i = open;
        while (i < text.length()) {
            var c = text.charAt(i);
            if (c == '"' || c == '\'') {
                var end = text.indexOf(c, i + 1);
                if (end < 0) {
                    return -1;
                }
                i = end + 1;
                continue;
            }
            if (c == openChar) {
                depth++;
            } else if (c == closeChar && --depth == 0) {
                return i;
            }
            i++;
        }
        return -1;
    }
}
