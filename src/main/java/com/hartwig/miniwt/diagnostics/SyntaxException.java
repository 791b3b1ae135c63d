package com.hartwig.miniwt.diagnostics;

public class SyntaxException extends TranslationException {
    private final int line;
    private final int column;

    public SyntaxException(final String message, final int line, final int column) {
        super(String.format("line %d, column %d", line, column), message);
        this.line = line;
        this.column = column;
    }

    public SyntaxException(final String message, final int line, final int column, final Throwable cause) {
        super(String.format("line %d, column %d", line, column), message, cause);
        this.line = line;
        this.column = column;
    }

    public int line() {
        return line;
    }

    public int column() {
        return column;
    }

    @Override
    public DiagnosticKind kind() {
        return DiagnosticKind.SYNTAX_ERROR;
    }
}
