package com.hartwig.miniwt.diagnostics;

import java.util.Optional;

import org.immutables.value.Value;

@Value.Immutable
@Value.Style(jdkOnly = true)
public interface Diagnostic {
    Severity severity();

    DiagnosticKind kind();

    String message();

    /**
     * Where in the document the problem is, e.g. {@code task 'align' runtime 'maxRetries'}.
     */
    Optional<String> location();

    default String render() {
        return String.format("%s %s: %s%s", severity(), kind(), location().map(l -> l + ": ").orElse(""), message());
    }

    static Diagnostic of(Severity severity, DiagnosticKind kind, String location, String message) {
        return ImmutableDiagnostic.builder().severity(severity).kind(kind).location(Optional.ofNullable(location)).message(message).build();
    }

    static Diagnostic warning(DiagnosticKind kind, String location, String message) {
        return of(Severity.WARNING, kind, location, message);
    }

    static Diagnostic info(DiagnosticKind kind, String location, String message) {
        return of(Severity.INFO, kind, location, message);
    }

    static Diagnostic error(DiagnosticKind kind, String location, String message) {
        return of(Severity.ERROR, kind, location, message);
    }
}
