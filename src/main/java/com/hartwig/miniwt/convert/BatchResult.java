package com.hartwig.miniwt.convert;

import java.util.Map;

import org.immutables.value.Value;

@Value.Immutable
@Value.Style(jdkOnly = true)
public interface BatchResult {
    /**
     * Result per document id, in submission order. Failed documents are included.
     */
    @Value.Parameter
    Map<String, ConversionResult> results();

    @Value.Derived
    default BatchSummary summary() {
        var succeeded = (int) results().values().stream().filter(ConversionResult::isSuccess).count();
        return BatchSummary.builder()
                .total(results().size())
                .succeeded(succeeded)
                .failed(results().size() - succeeded)
                .diagnostics(results().values().stream().mapToInt(result -> result.diagnostics().size()).sum())
                .build();
    }

    default boolean allSucceeded() {
        return summary().failed() == 0;
    }

    static BatchResult of(Map<String, ? extends ConversionResult> results) {
        return ImmutableBatchResult.of(results);
    }
}
