package com.hartwig.miniwt.cli;

import static org.assertj.core.api.Assertions.assertThat;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class FileImportResolverTest {
    private final FileImportResolver resolver = new FileImportResolver();

    @Test
    void locatesRelativeToImportingFile(@TempDir Path directory) {
        var importing = directory.resolve("pipelines/main.wdl").toString();

        assertThat(resolver.locate("lib/tasks.wdl", importing)).isEqualTo(directory.resolve("pipelines/lib/tasks.wdl").toString());
        assertThat(resolver.locate("../shared.wdl", importing)).isEqualTo(directory.resolve("shared.wdl").toString());
    }

    @Test
    void keepsUrlsAndAbsolutePaths(@TempDir Path directory) {
        var absolute = directory.resolve("tasks.wdl").toString();

        assertThat(resolver.locate("https://example.org/tasks.wdl", "main.wdl")).isEqualTo("https://example.org/tasks.wdl");
        assertThat(resolver.locate(absolute, "elsewhere/main.wdl")).isEqualTo(absolute);
    }

    @Test
    void readsExistingFilesOnly(@TempDir Path directory) throws IOException {
        var file = Files.writeString(directory.resolve("tasks.wdl"), "version 1.0\n");

        assertThat(resolver.read(file.toString())).contains("version 1.0\n");
        assertThat(resolver.read(directory.resolve("missing.wdl").toString())).isEmpty();
        assertThat(resolver.read(directory.toString())).isEmpty();
    }
}
