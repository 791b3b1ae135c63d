package com.hartwig.miniwt.cli;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.concurrent.Callable;

import com.hartwig.miniwt.convert.Converter;
import com.hartwig.miniwt.language.WorkflowLanguage;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import picocli.CommandLine;

@CommandLine.Command(name = "convert",
                     mixinStandardHelpOptions = true,
                     description = "Converts one document, to the output file or to standard out")
public class ConvertCommand extends DocumentCommand implements Callable<Integer> {
    private static final Logger LOGGER = LoggerFactory.getLogger(ConvertCommand.class);

    @CommandLine.Parameters(paramLabel = "output",
                            index = "1",
                            arity = "0..1",
                            description = "Path of the converted document")
    private Path output;

    @CommandLine.Option(names = { "--to" },
                        description = "Target language (wdl, cwl), the other language when absent")
    private String to;

    @CommandLine.Option(names = { "--strict" },
                        description = "Fail instead of dropping constructs the target language cannot express")
    private boolean strict;

    @Override
    public Integer call() {
        try {
            var text = readInput();
            var source = sourceLanguage(text);
            var target = targetLanguage(to, source);
            var converter = new Converter(defaultOptions().strict(strict).build());
            var result = converter.convert(text, source, target, input.toString());
            if (!result.isSuccess()) {
                return 1;
            }
            if (output == null) {
                spec.commandLine().getOut().print(result.text().orElseThrow());
                spec.commandLine().getOut().flush();
            } else {
                if (output.toAbsolutePath().getParent() != null) {
                    Files.createDirectories(output.toAbsolutePath().getParent());
                }
                Files.writeString(output, result.text().orElseThrow());
                LOGGER.info("Wrote {} document to [{}]", target.tag(), output);
            }
            return 0;
        } catch (IOException e) {
            LOGGER.error("Could not convert [{}]", input, e);
            return 1;
        }
    }

    static WorkflowLanguage targetLanguage(String to, WorkflowLanguage source) {
        if (to != null) {
            return WorkflowLanguage.fromTag(to);
        }
        return source == WorkflowLanguage.WDL ? WorkflowLanguage.CWL : WorkflowLanguage.WDL;
    }
}
