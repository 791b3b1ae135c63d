package com.hartwig.miniwt.language;

import java.util.Optional;

/**
 * Supplies the text of imported documents. The translator does no I/O of its own.
 */
@FunctionalInterface
public interface ImportResolver {
    /**
     * Resolves nothing.
     */
    ImportResolver NONE = sourceName -> Optional.empty();

    /**
     * Text of the document with the given source name, empty when it cannot be found.
     */
    Optional<String> read(String sourceName);

    /**
     * Source name of an import as written in the importing document.
     */
    default String locate(String uri, String importingSourceName) {
        return uri;
    }
}
