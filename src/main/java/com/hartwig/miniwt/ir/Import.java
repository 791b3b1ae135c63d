package com.hartwig.miniwt.ir;

import org.immutables.value.Value;

/**
 * An import that was resolved and inlined into the document, tasks registered as {@code alias.task}.
 */
@Value.Immutable
@Value.Style(jdkOnly = true)
public interface Import {
    @Value.Parameter
    String uri();

    @Value.Parameter
    String alias();

    static Import of(String uri, String alias) {
        return ImmutableImport.of(uri, alias);
    }
}
