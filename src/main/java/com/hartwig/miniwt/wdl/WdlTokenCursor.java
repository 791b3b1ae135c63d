package com.hartwig.miniwt.wdl;

import java.util.List;

import com.hartwig.miniwt.diagnostics.SyntaxException;

final class WdlTokenCursor {
    private final List<WdlToken> tokens;
    private int index;

    WdlTokenCursor(final List<WdlToken> tokens) {
        this.tokens = tokens;
    }

    WdlToken peek() {
        return tokens.get(index);
    }

    WdlToken peek(int offset) {
        return tokens.get(Math.min(index + offset, tokens.size() - 1));
    }

    WdlToken next() {
        var token = tokens.get(index);
        if (!token.is(WdlTokenType.EOF)) {
            index++;
        }
        return token;
    }

    boolean at(WdlTokenType type) {
        return peek().is(type);
    }

    boolean atKeyword(String keyword) {
        return peek().isKeyword(keyword);
    }

    boolean atOperator(String symbol) {
        return peek().is(WdlTokenType.OPERATOR, symbol);
    }

    boolean accept(WdlTokenType type) {
        if (at(type)) {
            next();
            return true;
        }
        return false;
    }

    boolean acceptKeyword(String keyword) {
        if (atKeyword(keyword)) {
            next();
            return true;
        }
        return false;
    }

    WdlToken expect(WdlTokenType type, String what) throws SyntaxException {
        if (!at(type)) {
            throw unexpected(what);
        }
        return next();
    }

    WdlToken expectKeyword(String keyword) throws SyntaxException {
        if (!atKeyword(keyword)) {
            throw unexpected("'" + keyword + "'");
        }
        return next();
    }

    /**
     * Identifiers, also accepting keywords where the grammar allows any name, e.g. call inputs named {@code input}.
     */
    WdlToken expectName(String what) throws SyntaxException {
        if (!at(WdlTokenType.IDENTIFIER) && !at(WdlTokenType.KEYWORD)) {
            throw unexpected(what);
        }
        return next();
    }

    SyntaxException unexpected(String expected) {
        var token = peek();
        return new SyntaxException(String.format("Expected %s but found %s", expected, token.describe()), token.line(), token.column());
    }

    SyntaxException error(WdlToken token, String message) {
        return new SyntaxException(message, token.line(), token.column());
    }
}
