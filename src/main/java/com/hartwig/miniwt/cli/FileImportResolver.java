package com.hartwig.miniwt.cli;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Optional;

import com.hartwig.miniwt.language.ImportResolver;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Resolves imports and {@code run} references against the file system, relative to the importing file.
 */
public class FileImportResolver implements ImportResolver {
    private static final Logger LOGGER = LoggerFactory.getLogger(FileImportResolver.class);

    @Override
    public Optional<String> read(String sourceName) {
        var path = Path.of(sourceName);
        if (!Files.isRegularFile(path)) {
            return Optional.empty();
        }
        try {
            return Optional.of(Files.readString(path));
        } catch (IOException e) {
            LOGGER.warn("Could not read imported file [{}]: {}", sourceName, e.getMessage());
            return Optional.empty();
        }
    }

    @Override
    public String locate(String uri, String importingSourceName) {
        if (uri.contains("://")) {
            return uri;
        }
        var path = Path.of(uri);
        if (path.isAbsolute()) {
            return path.normalize().toString();
        }
        var parent = Path.of(importingSourceName).toAbsolutePath().getParent();
        return (parent == null ? path : parent.resolve(path)).normalize().toString();
    }
}
