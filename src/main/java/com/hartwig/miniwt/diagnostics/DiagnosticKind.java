package com.hartwig.miniwt.diagnostics;

public enum DiagnosticKind {
    // writer: information lost or changed on the way to the target language
    DEGRADED_TYPE,
    UNSUPPORTED_RUNTIME_FIELD,
    UNSUPPORTED_EXPRESSION,
    UNSUPPORTED_OUTPUT,
    UNSUPPORTED_REQUIREMENT,
    GUARD_PER_ELEMENT,

    // validator warnings
    UNUSED_INPUT,
    UNKNOWN_PLACEHOLDER,

    // fatal errors reported by the converter
    READ_ERROR,
    SYNTAX_ERROR,
    SEMANTIC_ERROR,
    VALIDATION_ERROR,
    UNSUPPORTED_CONSTRUCT,
    INTERNAL_ERROR
}
