package com.hartwig.miniwt.validation;

import org.immutables.value.Value;

@Value.Immutable
@Value.Style(jdkOnly = true)
public interface ValidationIssue {
    @Value.Parameter
    ValidationKind kind();

    /**
     * E.g. {@code call 'c2' input 'x'}.
     */
    @Value.Parameter
    String location();

    @Value.Parameter
    String message();

    default String render() {
        return location() + ": " + message();
    }

    static ValidationIssue of(ValidationKind kind, String location, String message) {
        return ImmutableValidationIssue.of(kind, location, message);
    }
}
