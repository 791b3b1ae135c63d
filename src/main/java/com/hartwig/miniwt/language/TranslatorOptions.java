package com.hartwig.miniwt.language;

import org.immutables.value.Value;

@Value.Immutable
@Value.Style(jdkOnly = true)
public interface TranslatorOptions {
    /**
     * Fail on the first construct the target cannot express instead of dropping it with a diagnostic.
     */
    @Value.Default
    default boolean strict() {
        return false;
    }

    @Value.Default
    default String cwlVersion() {
        return "v1.2";
    }

    @Value.Default
    default String wdlVersion() {
        return "1.0";
    }

    @Value.Default
    @Value.Auxiliary
    default ImportResolver importResolver() {
        return ImportResolver.NONE;
    }

    @Value.Default
    default int batchThreads() {
        return 4;
    }

    @Value.Check
    default void check() {
        if (batchThreads() < 1) {
            throw new IllegalStateException(String.format("Batch threads should be at least 1, was %d", batchThreads()));
        }
    }

    static TranslatorOptions defaults() {
        return builder().build();
    }

    static ImmutableTranslatorOptions.Builder builder() {
        return ImmutableTranslatorOptions.builder();
    }
}
