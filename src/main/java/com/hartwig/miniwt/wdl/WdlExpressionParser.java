package com.hartwig.miniwt.wdl;

import java.util.ArrayList;

import com.hartwig.miniwt.diagnostics.SyntaxException;
import com.hartwig.miniwt.expression.ArrayLiteral;
import com.hartwig.miniwt.expression.Expression;
import com.hartwig.miniwt.expression.FunctionCall;
import com.hartwig.miniwt.expression.Literal;
import com.hartwig.miniwt.expression.MemberRef;
import com.hartwig.miniwt.expression.Operation;
import com.hartwig.miniwt.expression.Operator;
import com.hartwig.miniwt.expression.VariableRef;

/**
 * Precedence climbing parser for WDL expressions, from {@code ||} (loosest) to member access and calls (tightest).
 */
final class WdlExpressionParser {
    private final WdlTokenCursor cursor;

    WdlExpressionParser(final WdlTokenCursor cursor) {
        this.cursor = cursor;
    }

    Expression parseExpression() throws SyntaxException {
        return parseBinary(Operator.OR.precedence());
    }

    private Expression parseBinary(int minPrecedence) throws SyntaxException {
        var left = parseUnary();
        while (cursor.at(WdlTokenType.OPERATOR)) {
            var operator = Operator.binary(cursor.peek().text());
            if (operator.isEmpty() || operator.get().precedence() < minPrecedence) {
                break;
            }
            cursor.next();
            var right = parseBinary(operator.get().precedence() + 1);
            left = Operation.binary(operator.get(), left, right);
        }
        return left;
    }

    private Expression parseUnary() throws SyntaxException {
        if (cursor.atOperator("!")) {
            cursor.next();
            return Operation.unary(Operator.NOT, parseUnary());
        }
        if (cursor.atOperator("-")) {
            cursor.next();
            if (cursor.at(WdlTokenType.INTEGER)) {
                return integer(cursor.next(), "-");
            }
            if (cursor.at(WdlTokenType.FLOAT)) {
                return Literal.ofFloat("-" + cursor.next().text());
            }
            return Operation.unary(Operator.NEGATE, parseUnary());
        }
        return parsePostfix();
    }

    private Expression parsePostfix() throws SyntaxException {
        var expression = parsePrimary();
        if (cursor.at(WdlTokenType.DOT)) {
            var dot = cursor.next();
            var member = cursor.expectName("member name");
            if (!(expression instanceof VariableRef)) {
                throw cursor.error(dot, "Member access is only supported on call names");
            }
            if (cursor.at(WdlTokenType.DOT)) {
                throw cursor.error(cursor.peek(), "Nested member access is not supported");
            }
            return MemberRef.of(((VariableRef) expression).name(), member.text());
        }
        return expression;
    }

    private Expression parsePrimary() throws SyntaxException {
        var token = cursor.peek();
        switch (token.type()) {
            case INTEGER:
                return integer(cursor.next(), "");
            case FLOAT:
                return Literal.ofFloat(cursor.next().text());
            case STRING:
                cursor.next();
                var interpolation = WdlTemplateParser.parseString(token.text(), token.line(), token.column() + 1);
                return interpolation.isLiteralText() ? Literal.ofString(interpolation.literalText()) : interpolation;
            case LPAREN:
                cursor.next();
                var inner = parseExpression();
                cursor.expect(WdlTokenType.RPAREN, "')'");
                return inner;
            case LBRACKET:
                return parseArray();
            case IDENTIFIER:
                cursor.next();
                return cursor.at(WdlTokenType.LPAREN) ? parseFunctionCall(token) : VariableRef.of(token.text());
            case KEYWORD:
                return parseKeyword(token);
            default:
                throw cursor.unexpected("expression");
        }
    }

    private Expression parseKeyword(WdlToken token) throws SyntaxException {
        switch (token.text()) {
            case "true":
            case "false":
                cursor.next();
                return Literal.ofBoolean(Boolean.parseBoolean(token.text()));
            case "None":
                cursor.next();
                return Literal.nullValue();
            case "if":
                cursor.next();
                var condition = parseExpression();
                cursor.expectKeyword("then");
                var whenTrue = parseExpression();
                cursor.expectKeyword("else");
                var whenFalse = parseExpression();
                return FunctionCall.of(FunctionCall.IF_THEN_ELSE, condition, whenTrue, whenFalse);
            default:
                throw cursor.unexpected("expression");
        }
    }

    private Expression parseFunctionCall(WdlToken name) throws SyntaxException {
        cursor.expect(WdlTokenType.LPAREN, "'('");
        var args = new ArrayList<Expression>();
        if (!cursor.accept(WdlTokenType.RPAREN)) {
            do {
                args.add(parseExpression());
            } while (cursor.accept(WdlTokenType.COMMA));
            cursor.expect(WdlTokenType.RPAREN, "')' or ','");
        }
        return FunctionCall.of(name.text(), args);
    }

    private Expression parseArray() throws SyntaxException {
        cursor.expect(WdlTokenType.LBRACKET, "'['");
        var items = new ArrayList<Expression>();
        while (!cursor.at(WdlTokenType.RBRACKET)) {
            items.add(parseExpression());
            if (!cursor.accept(WdlTokenType.COMMA)) {
                break;
            }
        }
        cursor.expect(WdlTokenType.RBRACKET, "']' or ','");
        return ArrayLiteral.of(items);
    }

    private Expression integer(WdlToken token, String sign) throws SyntaxException {
        try {
            return Literal.ofInt(Long.parseLong(sign + token.text()));
        } catch (NumberFormatException e) {
            throw new SyntaxException(String.format("Integer literal %s is out of range", token.text()), token.line(), token.column(), e);
        }
    }
}
