package com.hartwig.miniwt.language;

import java.util.List;

import com.hartwig.miniwt.diagnostics.Diagnostic;

import org.immutables.value.Value;

@Value.Immutable
@Value.Style(jdkOnly = true)
public interface WriteResult {
    @Value.Parameter
    String text();

    @Value.Parameter
    List<Diagnostic> diagnostics();

    static WriteResult of(String text, List<Diagnostic> diagnostics) {
        return ImmutableWriteResult.of(text, diagnostics);
    }
}
