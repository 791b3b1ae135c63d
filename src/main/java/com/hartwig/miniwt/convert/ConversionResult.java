package com.hartwig.miniwt.convert;

import java.io.IOException;
import java.util.List;
import java.util.Optional;

import com.hartwig.miniwt.diagnostics.Diagnostic;
import com.hartwig.miniwt.diagnostics.DiagnosticKind;
import com.hartwig.miniwt.diagnostics.TranslationException;
import com.hartwig.miniwt.graph.WorkflowStatistics;

import org.immutables.value.Value;

/**
 * Outcome of converting one document. A failed conversion has no text and a single ERROR diagnostic.
 */
@Value.Immutable
@Value.Style(jdkOnly = true)
public interface ConversionResult {
    Optional<String> text();

    List<Diagnostic> diagnostics();

    /**
     * Present for workflow documents that passed validation.
     */
    Optional<WorkflowStatistics> statistics();

    @Value.Auxiliary
    Optional<Exception> error();

    default boolean isSuccess() {
        return text().isPresent();
    }

    @Value.Check
    default void check() {
        if (text().isPresent() == error().isPresent()) {
            throw new IllegalStateException("Conversion result should hold either text or an error");
        }
    }

    static ConversionResult success(String text, List<Diagnostic> diagnostics, Optional<WorkflowStatistics> statistics) {
        return ImmutableConversionResult.builder().text(text).diagnostics(diagnostics).statistics(statistics).build();
    }

    static ConversionResult failure(TranslationException exception) {
        return ImmutableConversionResult.builder()
                .addDiagnostics(Diagnostic.error(exception.kind(), exception.location().orElse(null), exception.reason()))
                .error(exception)
                .build();
    }

    /**
     * A document whose text could not be read.
     */
    static ConversionResult readFailure(String documentId, IOException exception) {
        return ImmutableConversionResult.builder()
                .addDiagnostics(Diagnostic.error(DiagnosticKind.READ_ERROR,
                        documentId,
                        String.format("Could not read document: %s %s", exception.getClass().getSimpleName(), exception.getMessage())))
                .error(exception)
                .build();
    }

    /**
     * A bug or other unexpected failure while converting, kept so one document cannot take down a batch.
     */
    static ConversionResult internalError(String documentId, RuntimeException exception) {
        return ImmutableConversionResult.builder()
                .addDiagnostics(Diagnostic.error(DiagnosticKind.INTERNAL_ERROR,
                        documentId,
                        String.format("Unexpected %s: %s", exception.getClass().getSimpleName(), exception.getMessage())))
                .error(exception)
                .build();
    }
}
