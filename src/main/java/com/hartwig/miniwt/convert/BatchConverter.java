package com.hartwig.miniwt.convert;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Future;

import com.hartwig.miniwt.ThreadUtil;
import com.hartwig.miniwt.language.TranslatorOptions;
import com.hartwig.miniwt.language.WorkflowLanguage;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Converts many documents on a bounded worker pool. Each document is converted in isolation: a failure, expected or
 * not, only affects that document's result.
 */
public class BatchConverter {
    private static final Logger LOGGER = LoggerFactory.getLogger(BatchConverter.class);

    private final Converter converter;
    private final WorkflowLanguage target;
    private final int threads;

    public BatchConverter(final TranslatorOptions options, final WorkflowLanguage target) {
        this(new Converter(options), target, options.batchThreads());
    }

    public BatchConverter(final Converter converter, final WorkflowLanguage target, final int threads) {
        if (threads < 1) {
            throw new IllegalArgumentException(String.format("Batch threads should be at least 1, was %d", threads));
        }
        this.converter = converter;
        this.target = target;
        this.threads = threads;
    }

    public BatchResult convertAll(List<SourceDocument> documents) {
        var ids = new HashSet<String>();
        documents.forEach(document -> {
            if (!ids.add(document.id())) {
                throw new IllegalArgumentException(String.format("Duplicate document id '%s'", document.id()));
            }
        });

        LOGGER.info("Converting {} document(s) to {} on {} thread(s)", documents.size(), target.tag(), threads);
        var executorService = ThreadUtil.createExecutorService(threads, "convert-%d");
        var results = new LinkedHashMap<String, ConversionResult>();
        try {
            var futures = new ArrayList<Future<ConversionResult>>();
            for (SourceDocument document : documents) {
                futures.add(executorService.submit(() -> convertIsolated(document)));
            }
            for (var i = 0; i < documents.size(); i++) {
                var id = documents.get(i).id();
                results.put(id, await(id, futures.get(i)));
            }
        } finally {
            executorService.shutdownNow();
        }

        var batchResult = BatchResult.of(results);
        LOGGER.info("Batch done: {}", batchResult.summary().render());
        return batchResult;
    }

    private ConversionResult convertIsolated(SourceDocument document) {
        try {
            return converter.convert(document.text(), document.language(), target, document.id());
        } catch (RuntimeException e) {
            LOGGER.error("[{}] Unexpected failure during conversion", document.id(), e);
            return ConversionResult.internalError(document.id(), e);
        }
    }

    private static ConversionResult await(String id, Future<ConversionResult> future) {
        try {
            return future.get();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            LOGGER.warn("[{}] Interrupted while waiting for conversion", id);
            return ConversionResult.internalError(id, new IllegalStateException("Interrupted while waiting for conversion", e));
        } catch (ExecutionException e) {
            var cause = e.getCause() instanceof RuntimeException
                    ? (RuntimeException) e.getCause()
                    : new IllegalStateException(e.getCause());
            return ConversionResult.internalError(id, cause);
        }
    }
}
