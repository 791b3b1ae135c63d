package com.hartwig.miniwt.cli;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

import com.hartwig.miniwt.language.ImmutableTranslatorOptions;
import com.hartwig.miniwt.language.TranslatorOptions;
import com.hartwig.miniwt.language.WorkflowLanguage;

import picocli.CommandLine;

/**
 * Options shared by the commands that read a single document.
 */
abstract class DocumentCommand {
    @CommandLine.Spec
    CommandLine.Model.CommandSpec spec;

    @CommandLine.Parameters(paramLabel = "input",
                            index = "0",
                            description = "Path to the WDL or CWL document")
    Path input;

    @CommandLine.Option(names = { "--from" },
                        description = "Source language (wdl, cwl), detected from the file when absent")
    String from;

    /**
     * Language from {@code --from}, the file extension or the content, in that order.
     */
    WorkflowLanguage sourceLanguage(String text) {
        if (from != null) {
            return WorkflowLanguage.fromTag(from);
        }
        return WorkflowLanguage.fromFileName(input.getFileName().toString())
                .or(() -> WorkflowLanguage.detect(text))
                .orElseThrow(() -> new CommandLine.ParameterException(spec.commandLine(),
                        String.format("Cannot tell the language of '%s', use --from", input)));
    }

    String readInput() throws IOException {
        return Files.readString(input);
    }

    static ImmutableTranslatorOptions.Builder defaultOptions() {
        return TranslatorOptions.builder().importResolver(new FileImportResolver());
    }
}
