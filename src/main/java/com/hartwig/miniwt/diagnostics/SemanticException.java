package com.hartwig.miniwt.diagnostics;

/**
 * Well-formed input that does not make sense: unknown types, unresolvable imports, duplicate names.
 */
public class SemanticException extends TranslationException {
    public SemanticException(final String location, final String message) {
        super(location, message);
    }

    public SemanticException(final String location, final String message, final Throwable cause) {
        super(location, message, cause);
    }

    @Override
    public DiagnosticKind kind() {
        return DiagnosticKind.SEMANTIC_ERROR;
    }
}
