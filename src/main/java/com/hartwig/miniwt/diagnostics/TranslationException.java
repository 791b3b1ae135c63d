package com.hartwig.miniwt.diagnostics;

import java.util.Optional;

/**
 * Root of the checked exceptions raised while reading, checking or writing a workflow document.
 */
public abstract class TranslationException extends Exception {
    private final String location;

    protected TranslationException(final String location, final String message) {
        super(message);
        this.location = location;
    }

    protected TranslationException(final String location, final String message, final Throwable cause) {
        super(message, cause);
        this.location = location;
    }

    public Optional<String> location() {
        return Optional.ofNullable(location);
    }

    /**
     * Kind used when the exception is reported as a diagnostic.
     */
    public abstract DiagnosticKind kind();

    /**
     * The message without the location prefix.
     */
    public String reason() {
        return super.getMessage();
    }

    @Override
    public String getMessage() {
        return location == null ? super.getMessage() : location + ": " + super.getMessage();
    }
}
