package com.hartwig.miniwt.validation;

/**
 * Structural checks, in the order the validator runs them.
 */
public enum ValidationKind {
    UNKNOWN_TASK,
    UNRESOLVED_REFERENCE,
    UNBOUND_INPUT,
    UNKNOWN_INPUT,
    CYCLE,
    MISSING_COMMAND
}
