package com.hartwig.miniwt.wdl;

/**
 * Thrown while rendering an expression the target language has no syntax for.
 */
class UnrenderableExpressionException extends RuntimeException {
    UnrenderableExpressionException(final String message) {
        super(message);
    }
}
