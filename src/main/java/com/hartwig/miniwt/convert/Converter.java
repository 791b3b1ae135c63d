package com.hartwig.miniwt.convert;

import java.util.ArrayList;
import java.util.Optional;

import com.hartwig.miniwt.diagnostics.Diagnostic;
import com.hartwig.miniwt.diagnostics.SemanticException;
import com.hartwig.miniwt.diagnostics.Severity;
import com.hartwig.miniwt.diagnostics.SyntaxException;
import com.hartwig.miniwt.diagnostics.TranslationException;
import com.hartwig.miniwt.graph.GraphAnalyzer;
import com.hartwig.miniwt.graph.WorkflowStatistics;
import com.hartwig.miniwt.ir.Document;
import com.hartwig.miniwt.language.TranslatorOptions;
import com.hartwig.miniwt.language.WorkflowLanguage;
import com.hartwig.miniwt.validation.WorkflowValidator;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Parses, validates and writes a single document. Safe to share between threads.
 */
public class Converter {
    private static final Logger LOGGER = LoggerFactory.getLogger(Converter.class);

    private final TranslatorOptions options;
    private final WorkflowValidator validator;

    public Converter() {
        this(TranslatorOptions.defaults());
    }

    public Converter(final TranslatorOptions options) {
        this(options, new WorkflowValidator());
    }

    Converter(final TranslatorOptions options, final WorkflowValidator validator) {
        this.options = options;
        this.validator = validator;
    }

    public TranslatorOptions options() {
        return options;
    }

    /**
     * Converts the document, reporting a fatal error as a failed result instead of throwing.
     */
    public ConversionResult convert(String sourceText, WorkflowLanguage from, WorkflowLanguage to, String sourceName) {
        try {
            return convertOrThrow(sourceText, from, to, sourceName);
        } catch (TranslationException e) {
            LOGGER.error("[{}] Conversion failed: {}", sourceName, e.getMessage());
            return ConversionResult.failure(e);
        }
    }

    public ConversionResult convertOrThrow(String sourceText, WorkflowLanguage from, WorkflowLanguage to, String sourceName)
            throws TranslationException {
        LOGGER.info("[{}] Converting {} to {}", sourceName, from.tag(), to.tag());
        var document = read(sourceText, from, sourceName);
        var diagnostics = new ArrayList<Diagnostic>();
        Optional<WorkflowStatistics> statistics = Optional.empty();
        if (document.workflow().isPresent()) {
            var workflow = document.workflow().get();
            diagnostics.addAll(validator.validate(workflow));
            statistics = Optional.of(new GraphAnalyzer(workflow).statistics());
        }
        var written = to.writer(options).write(document);
        for (Diagnostic diagnostic : written.diagnostics()) {
            if (diagnostic.severity() == Severity.INFO) {
                LOGGER.info("[{}] {}", sourceName, diagnostic.render());
            } else {
                LOGGER.warn("[{}] {}", sourceName, diagnostic.render());
            }
        }
        diagnostics.addAll(written.diagnostics());
        LOGGER.info("[{}] Converted with {} diagnostic(s)", sourceName, diagnostics.size());
        return ConversionResult.success(written.text(), diagnostics, statistics);
    }

    public Document read(String sourceText, WorkflowLanguage from, String sourceName) throws SyntaxException, SemanticException {
        return from.parser(options).parse(sourceText, sourceName);
    }
}
