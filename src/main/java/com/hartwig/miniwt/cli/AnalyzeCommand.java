package com.hartwig.miniwt.cli;

import java.io.IOException;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.Callable;

import com.hartwig.miniwt.convert.Converter;
import com.hartwig.miniwt.diagnostics.TranslationException;
import com.hartwig.miniwt.graph.GraphAnalyzer;
import com.hartwig.miniwt.validation.WorkflowValidator;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import picocli.CommandLine;

@CommandLine.Command(name = "analyze",
                     mixinStandardHelpOptions = true,
                     description = "Prints call graph statistics of a workflow")
public class AnalyzeCommand extends DocumentCommand implements Callable<Integer> {
    private static final Logger LOGGER = LoggerFactory.getLogger(AnalyzeCommand.class);

    @CommandLine.Option(names = { "--dot" },
                        description = "Also print the call graph in DOT format")
    private boolean dot;

    @CommandLine.Option(names = { "--weights" },
                        split = ",",
                        paramLabel = "task=cost",
                        description = "Cost per task for the critical path, 1 for tasks not listed")
    private Map<String, Double> weights = new LinkedHashMap<>();

    @Override
    public Integer call() {
        try {
            var text = readInput();
            var document = new Converter(defaultOptions().build()).read(text, sourceLanguage(text), input.toString());
            if (document.workflow().isEmpty()) {
                LOGGER.error("[{}] Holds a single task, there is no call graph to analyze", input);
                return 1;
            }
            var workflow = document.workflow().get();
            new WorkflowValidator().validate(workflow);
            var analyzer = new GraphAnalyzer(workflow);
            var out = spec.commandLine().getOut();
            analyzer.statistics().toMap().forEach((key, value) -> out.printf("%s: %s%n", key, value));
            var criticalPath = analyzer.criticalPath(weights);
            out.printf("critical_path: %s (length %s)%n", criticalPath.calls(), criticalPath.length());
            out.printf("execution_order: %s%n", analyzer.executionOrder());
            if (dot) {
                out.println(analyzer.toDotFormat());
            }
            out.flush();
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
