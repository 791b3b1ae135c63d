package com.hartwig.miniwt.cli;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.Callable;
import java.util.stream.Collectors;

import com.hartwig.miniwt.convert.BatchConverter;
import com.hartwig.miniwt.convert.BatchResult;
import com.hartwig.miniwt.convert.ConversionResult;
import com.hartwig.miniwt.convert.SourceDocument;
import com.hartwig.miniwt.language.WorkflowLanguage;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import picocli.CommandLine;

@CommandLine.Command(name = "convert-dir",
                     mixinStandardHelpOptions = true,
                     description = "Converts every document in a directory on a worker pool")
public class ConvertDirCommand implements Callable<Integer> {
    private static final Logger LOGGER = LoggerFactory.getLogger(ConvertDirCommand.class);

    @CommandLine.Spec
    private CommandLine.Model.CommandSpec spec;

    @CommandLine.Parameters(paramLabel = "input_dir",
                            index = "0",
                            description = "Directory with the documents to convert")
    private Path inputDir;

    @CommandLine.Parameters(paramLabel = "output_dir",
                            index = "1",
                            description = "Directory to write the converted documents to")
    private Path outputDir;

    @CommandLine.Option(names = { "--from" },
                        description = "Only convert documents in this language (wdl, cwl)")
    private String from;

    @CommandLine.Option(names = { "--to" },
                        description = "Target language (wdl, cwl), the other language of --from when absent")
    private String to;

    @CommandLine.Option(names = { "--threads" },
                        defaultValue = "4",
                        description = "Number of documents converted concurrently")
    private int threads;

    @CommandLine.Option(names = { "--recursive" },
                        description = "Also convert documents in subdirectories")
    private boolean recursive;

    @CommandLine.Option(names = { "--strict" },
                        description = "Fail a document instead of dropping constructs the target language cannot express")
    private boolean strict;

    @Override
    public Integer call() {
        var source = Optional.ofNullable(from).map(WorkflowLanguage::fromTag);
        var target = Optional.ofNullable(to)
                .map(WorkflowLanguage::fromTag)
                .or(() -> source.map(language -> ConvertCommand.targetLanguage(null, language)))
                .orElseThrow(() -> new CommandLine.ParameterException(spec.commandLine(), "Either --to or --from is required"));
        List<Path> files;
        try {
            files = listFiles();
        } catch (IOException e) {
            LOGGER.error("Could not list directory [{}]", inputDir, e);
            return 1;
        }

        var documents = new ArrayList<SourceDocument>();
        var unreadable = new HashMap<String, ConversionResult>();
        var order = new ArrayList<String>();
        for (Path file : files) {
            var language = source.or(() -> WorkflowLanguage.fromFileName(file.getFileName().toString()));
            if (language.isEmpty() || language.get() == target) {
                continue;
            }
            order.add(file.toString());
            try {
                documents.add(SourceDocument.of(file.toString(), Files.readString(file), language.get()));
            } catch (IOException e) {
                LOGGER.error("[{}] Could not read document: {}", file, e.toString());
                unreadable.put(file.toString(), ConversionResult.readFailure(file.toString(), e));
            }
        }
        if (order.isEmpty()) {
            LOGGER.warn("No documents to convert in [{}]", inputDir);
            return 0;
        }

        var options = DocumentCommand.defaultOptions().strict(strict).batchThreads(threads).build();
        var converted = new BatchConverter(options, target).convertAll(documents).results();
        var results = new LinkedHashMap<String, ConversionResult>();
        order.forEach(id -> results.put(id, unreadable.containsKey(id) ? unreadable.get(id) : converted.get(id)));
        var batchResult = BatchResult.of(results);

        var writeFailed = false;
        for (var entry : batchResult.results().entrySet()) {
            try {
                write(Path.of(entry.getKey()), entry.getValue(), target);
            } catch (IOException e) {
                LOGGER.error("[{}] Could not write converted document", entry.getKey(), e);
                writeFailed = true;
            }
        }
        spec.commandLine().getOut().println(batchResult.summary().render());
        spec.commandLine().getOut().flush();
        return batchResult.allSucceeded() && !writeFailed ? 0 : 1;
    }

    private List<Path> listFiles() throws IOException {
        try (var files = Files.walk(inputDir, recursive ? Integer.MAX_VALUE : 1)) {
            return files.filter(Files::isRegularFile).sorted(Comparator.naturalOrder()).collect(Collectors.toList());
        }
    }

    /**
     * Failed documents get no output file.
     */
    private void write(Path sourceFile, ConversionResult result, WorkflowLanguage target) throws IOException {
        if (!result.isSuccess()) {
            return;
        }
        var relative = inputDir.relativize(sourceFile);
        var fileName = relative.getFileName().toString();
        var dot = fileName.lastIndexOf('.');
        var targetName = (dot > 0 ? fileName.substring(0, dot) : fileName) + target.extension();
        var targetFile = outputDir.resolve(relative).resolveSibling(targetName);
        Files.createDirectories(targetFile.getParent());
        Files.writeString(targetFile, result.text().orElseThrow());
        LOGGER.debug("Wrote [{}]", targetFile);
    }
}
