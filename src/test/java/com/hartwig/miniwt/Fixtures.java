package com.hartwig.miniwt;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.util.Optional;

import com.hartwig.miniwt.language.ImportResolver;

/**
 * Test documents under src/test/resources.
 */
public final class Fixtures {
    private Fixtures() {
    }

    public static String read(String resource) {
        return find(resource).orElseThrow(() -> new IllegalArgumentException("No test resource " + resource));
    }

    public static Optional<String> find(String resource) {
        try (var stream = Fixtures.class.getClassLoader().getResourceAsStream(resource)) {
            if (stream == null) {
                return Optional.empty();
            }
            return Optional.of(new String(stream.readAllBytes(), StandardCharsets.UTF_8));
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }

    /**
     * Resolves imports against a resource directory, e.g. {@code wdl}.
     */
    public static ImportResolver resolver(String directory) {
        return sourceName -> find(directory + "/" + sourceName);
    }
}
