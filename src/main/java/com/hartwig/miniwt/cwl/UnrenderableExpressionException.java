package com.hartwig.miniwt.cwl;

/**
 * Thrown while rendering an expression CWL has no way to express.
 */
class UnrenderableExpressionException extends RuntimeException {
    UnrenderableExpressionException(final String message) {
        super(message);
    }
}
