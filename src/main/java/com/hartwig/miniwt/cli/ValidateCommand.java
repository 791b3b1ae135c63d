package com.hartwig.miniwt.cli;

import java.io.IOException;
import java.util.concurrent.Callable;

import com.hartwig.miniwt.convert.Converter;
import com.hartwig.miniwt.diagnostics.TranslationException;
import com.hartwig.miniwt.validation.WorkflowValidator;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import picocli.CommandLine;

@CommandLine.Command(name = "validate",
                     mixinStandardHelpOptions = true,
                     description = "Parses and validates one document")
public class ValidateCommand extends DocumentCommand implements Callable<Integer> {
    private static final Logger LOGGER = LoggerFactory.getLogger(ValidateCommand.class);

    @Override
    public Integer call() {
        try {
            var text = readInput();
            var document = new Converter(defaultOptions().build()).read(text, sourceLanguage(text), input.toString());
            var warnings = document.workflow().isPresent() ? new WorkflowValidator().validate(document.workflow().get()).size() : 0;
            spec.commandLine().getOut().printf("%s is valid (%d warning(s))%n", input, warnings);
            return 0;
        } catch (TranslationException e) {
            LOGGER.error("[{}] {}", input, e.getMessage());
            return 1;
        } catch (IOException e) {
            LOGGER.error("Could not read [{}]", input, e);
            return 1;
        }
    }
}
