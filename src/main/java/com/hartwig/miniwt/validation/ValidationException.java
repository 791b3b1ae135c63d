package com.hartwig.miniwt.validation;

import java.util.List;
import java.util.stream.Collectors;

import com.hartwig.miniwt.diagnostics.DiagnosticKind;
import com.hartwig.miniwt.diagnostics.TranslationException;

/**
 * All issues of the first check that failed. Later checks did not run.
 */
public class ValidationException extends TranslationException {
    private final ValidationKind validationKind;
    private final List<ValidationIssue> issues;

    public ValidationException(final ValidationKind validationKind, final List<ValidationIssue> issues) {
        super(issues.isEmpty() ? null : issues.get(0).location(), render(validationKind, issues));
        this.validationKind = validationKind;
        this.issues = List.copyOf(issues);
    }

    private static String render(ValidationKind kind, List<ValidationIssue> issues) {
        return kind + " " + issues.stream().map(ValidationIssue::render).collect(Collectors.joining("; "));
    }

    public ValidationKind validationKind() {
        return validationKind;
    }

    public List<ValidationIssue> issues() {
        return issues;
    }

    @Override
    public DiagnosticKind kind() {
        return DiagnosticKind.VALIDATION_ERROR;
    }

    /**
     * The full issue list; the location of the first issue is already part of it.
     */
    @Override
    public String getMessage() {
        return reason();
    }
}
