package com.hartwig.miniwt.convert;

import com.hartwig.miniwt.language.WorkflowLanguage;

import org.immutables.value.Value;

/**
 * One document of a batch: its id (usually the relative path), its text and the language it is written in.
 */
@Value.Immutable
@Value.Style(jdkOnly = true)
public interface SourceDocument {
    @Value.Parameter
    String id();

    @Value.Parameter
    String text();

    @Value.Parameter
    WorkflowLanguage language();

    static SourceDocument of(String id, String text, WorkflowLanguage language) {
        return ImmutableSourceDocument.of(id, text, language);
    }
}
