package com.hartwig.miniwt.wdl;

import java.util.ArrayList;
import java.util.List;

import com.hartwig.miniwt.diagnostics.SyntaxException;
import com.hartwig.miniwt.expression.ArrayLiteral;
import com.hartwig.miniwt.expression.Expression;
import com.hartwig.miniwt.expression.FunctionCall;
import com.hartwig.miniwt.expression.Interpolation;
import com.hartwig.miniwt.expression.Literal;
import com.hartwig.miniwt.expression.TemplatePart;

/**
 * Splits string literals and command sections on {@code ~{...}} and {@code ${...}} placeholders.
 */
final class WdlTemplateParser {
    private WdlTemplateParser() {
    }

    /**
     * String literals accept both placeholder styles and have their escapes resolved.
     */
    static Interpolation parseString(String raw, int line, int column) throws SyntaxException {
        return parse(raw, line, column, true, true);
    }

    /**
     * Heredoc commands only treat {@code ~{}} as placeholder, {@code ${}} stays shell syntax.
     */
    static Interpolation parseCommand(String raw, int line, int column, boolean braces) throws SyntaxException {
        return parse(raw, line, column, braces, false);
    }

    private static Interpolation parse(String raw, int line, int column, boolean dollarPlaceholders, boolean unescape)
            throws SyntaxException {
        var parts = new ArrayList<TemplatePart>();
        var text = new StringBuilder();
        var i = 0;
        while (i < raw.length()) {
            var c = raw.charAt(i);
            if (unescape && c == '\\' && i + 1 < raw.length()) {
                text.append(unescape(raw.charAt(i + 1)));
                i += 2;
                continue;
            }
            var opens = i + 1 < raw.length() && raw.charAt(i + 1) == '{' && (c == '~' || (c == '$' && dollarPlaceholders));
            if (!opens) {
                text.append(c);
                i++;
                continue;
            }
            var end = closingBrace(raw, i + 2);
            var bodyLine = line + countLines(raw, i + 2);
            var bodyColumn = bodyLine == line ? column + i + 2 : i + 2 - raw.lastIndexOf('\n', i + 1);
            if (end < 0) {
                throw new SyntaxException("Placeholder is not closed with '}'", bodyLine, bodyColumn);
            }
            if (text.length() > 0) {
                parts.add(TemplatePart.text(text.toString()));
                text.setLength(0);
            }
            parts.add(TemplatePart.placeholder(parsePlaceholder(raw.substring(i + 2, end), bodyLine, bodyColumn)));
            i = end + 1;
        }
        if (text.length() > 0) {
            parts.add(TemplatePart.text(text.toString()));
        }
        return Interpolation.of(parts);
    }

    private static Expression parsePlaceholder(String body, int line, int column) throws SyntaxException {
        var cursor = new WdlTokenCursor(new WdlLexer(body, line, column).tokenize());
        var options = new ArrayList<Option>();
        while ((cursor.at(WdlTokenType.IDENTIFIER) || cursor.at(WdlTokenType.KEYWORD)) && cursor.peek(1).is(WdlTokenType.ASSIGN)) {
            var name = cursor.next();
            cursor.next();
            var value = cursor.expect(WdlTokenType.STRING, "option value");
            options.add(new Option(name, parseString(value.text(), value.line(), value.column()).literalText()));
        }
        var expression = new WdlExpressionParser(cursor).parseExpression();
        cursor.expect(WdlTokenType.EOF, "end of placeholder");
        return applyOptions(cursor, expression, options);
    }

    private static Expression applyOptions(WdlTokenCursor cursor, Expression expression, List<Option> options) throws SyntaxException {
        String trueValue = null;
        String falseValue = null;
        var result = expression;
        for (Option option : options) {
            switch (option.name.text()) {
                case "sep":
                    result = FunctionCall.of("sep", Literal.ofString(option.value), result);
                    break;
                case "default":
                    result = FunctionCall.of("select_first", ArrayLiteral.of(result, Literal.ofString(option.value)));
                    break;
                case "true":
                    trueValue = option.value;
                    break;
                case "false":
                    falseValue = option.value;
                    break;
                default:
                    throw cursor.error(option.name, String.format("Unknown placeholder option '%s'", option.name.text()));
            }
        }
        if ((trueValue == null) != (falseValue == null)) {
            throw cursor.error(options.get(0).name, "Placeholder options 'true' and 'false' should be given together");
        }
        if (trueValue != null) {
            result = FunctionCall.of(FunctionCall.IF_THEN_ELSE, result, Literal.ofString(trueValue), Literal.ofString(falseValue));
        }
        return result;
    }

    private static int closingBrace(String raw, int start) {
        var depth = 1;
        var i = start;
        while (i < raw.length()) {
            var c = raw.charAt(i);
            if (c == '"' || c == '\'') {
                var close = raw.indexOf(c, i + 1);
                if (close < 0) {
                    return -1;
                }
                i = close + 1;
                continue;
            }
            if (c == '{') {
                depth++;
            } else if (c == '}' && --depth == 0) {
                return i;
            }
            i++;
        }
        return -1;
    }

    private static int countLines(String raw, int end) {
        var count = 0;
        for (var i = 0; i < end; i++) {
            if (raw.charAt(i) == '\n') {
                count++;
            }
        }
        return count;
    }

    private static char unescape(char c) {
        switch (c) {
            case 'n':
                return '\n';
            case 't':
                return '\t';
            case 'r':
                return '\r';
            default:
                return c;
        }
    }

    private static final class Option {
        private final WdlToken name;
        private final String value;

        private Option(final WdlToken name, final String value) {
            this.name = name;
            this.value = value;
        }
    }
}
