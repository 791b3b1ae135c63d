package com.hartwig.miniwt.convert;

import org.immutables.value.Value;

@Value.Immutable
@Value.Style(jdkOnly = true)
public interface BatchSummary {
    int total();

    int succeeded();

    int failed();

    /**
     * Diagnostics over all documents, errors of failed documents included.
     */
    int diagnostics();

    default String render() {
        return String.format("%d document(s): %d succeeded, %d failed, %d diagnostic(s)", total(), succeeded(), failed(), diagnostics());
    }

    static ImmutableBatchSummary.Builder builder() {
        return ImmutableBatchSummary.builder();
    }
}
