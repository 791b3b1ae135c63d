package com.hartwig.miniwt.diagnostics;

public class UnsupportedConstructException extends TranslationException {
    private final DiagnosticKind constructKind;

    public UnsupportedConstructException(final DiagnosticKind constructKind, final String location, final String message) {
        super(location, message);
        this.constructKind = constructKind;
    }

    /**
     * What kind of construct could not be written.
     */
    public DiagnosticKind constructKind() {
        return constructKind;
    }

    @Override
    public DiagnosticKind kind() {
        return DiagnosticKind.UNSUPPORTED_CONSTRUCT;
    }
}
