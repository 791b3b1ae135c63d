package com.hartwig.miniwt.convert;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

import java.util.List;
import java.util.Optional;

import com.hartwig.miniwt.Fixtures;
import com.hartwig.miniwt.diagnostics.DiagnosticKind;
import com.hartwig.miniwt.language.TranslatorOptions;
import com.hartwig.miniwt.language.WorkflowLanguage;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.Timeout;

class BatchConverterTest {
    private static final List<SourceDocument> DOCUMENTS = List.of(
            SourceDocument.of("hello.wdl", Fixtures.read("wdl/hello.wdl"), WorkflowLanguage.WDL),
            SourceDocument.of("cycle.wdl", Fixtures.read("wdl/cycle.wdl"), WorkflowLanguage.WDL),
            SourceDocument.of("counting.cwl", Fixtures.read("cwl/counting.cwl"), WorkflowLanguage.CWL),
            SourceDocument.of("scatter.wdl", Fixtures.read("wdl/scatter.wdl"), WorkflowLanguage.WDL));

    @Test
    @Timeout(10)
    void failedDocumentsDoNotAffectOthers() {
        var batch = new BatchConverter(TranslatorOptions.builder().batchThreads(3).build(), WorkflowLanguage.CWL);

        var result = batch.convertAll(DOCUMENTS);

        assertThat(result.results()).containsOnlyKeys("hello.wdl", "cycle.wdl", "counting.cwl", "scatter.wdl");
        assertThat(result.results().keySet()).containsExactly("hello.wdl", "cycle.wdl", "counting.cwl", "scatter.wdl");
        assertThat(result.results().get("cycle.wdl").isSuccess()).isFalse();
        assertThat(result.results().get("hello.wdl").isSuccess()).isTrue();
        assertThat(result.results().get("counting.cwl").isSuccess()).isTrue();
        assertThat(result.summary().total()).isEqualTo(4);
        assertThat(result.summary().succeeded()).isEqualTo(3);
        assertThat(result.summary().failed()).isEqualTo(1);
        assertThat(result.allSucceeded()).isFalse();
    }

    @Test
    @Timeout(10)
    void unexpectedExceptionBecomesInternalError() {
        var converter = mock(Converter.class);
        var ok = ConversionResult.success("converted", List.of(), Optional.empty());
        when(converter.convert(anyString(), any(), eq(WorkflowLanguage.WDL), anyString())).thenReturn(ok);
        when(converter.convert(anyString(), any(), eq(WorkflowLanguage.WDL), eq("cycle.wdl"))).thenThrow(new IllegalStateException("boom"));

        var result = new BatchConverter(converter, WorkflowLanguage.WDL, 2).convertAll(DOCUMENTS);

        var failed = result.results().get("cycle.wdl");
        assertThat(failed.isSuccess()).isFalse();
        assertThat(failed.diagnostics()).hasSize(1);
        assertThat(failed.diagnostics().get(0).kind()).isEqualTo(DiagnosticKind.INTERNAL_ERROR);
        assertThat(failed.diagnostics().get(0).message()).isEqualTo("Unexpected IllegalStateException: boom");
        assertThat(result.results().get("hello.wdl").text()).contains("converted");
        assertThat(result.summary().succeeded()).isEqualTo(3);
    }

    @Test
    void singleThreadGivesTheSameResults() {
        var parallel = new BatchConverter(TranslatorOptions.builder().batchThreads(4).build(), WorkflowLanguage.WDL).convertAll(DOCUMENTS);
        var sequential = new BatchConverter(TranslatorOptions.builder().batchThreads(1).build(), WorkflowLanguage.WDL).convertAll(DOCUMENTS);

        assertThat(sequential.results()).isEqualTo(parallel.results());
    }

    @Test
    void duplicateIdsAreRejected() {
        var batch = new BatchConverter(TranslatorOptions.defaults(), WorkflowLanguage.CWL);
        var duplicate = SourceDocument.of("hello.wdl", "version 1.0", WorkflowLanguage.WDL);

        var e = assertThrows(IllegalArgumentException.class, () -> batch.convertAll(List.of(DOCUMENTS.get(0), duplicate)));
        assertThat(e.getMessage()).isEqualTo("Duplicate document id 'hello.wdl'");
    }

    @Test
    void threadCountMustBePositive() {
        assertThrows(IllegalArgumentException.class, () -> new BatchConverter(new Converter(), WorkflowLanguage.CWL, 0));
        assertThrows(IllegalStateException.class, () -> TranslatorOptions.builder().batchThreads(0).build());
    }

    @Test
    void emptyBatchHasEmptySummary() {
        var result = new BatchConverter(TranslatorOptions.defaults(), WorkflowLanguage.CWL).convertAll(List.of());

        assertThat(result.results()).isEmpty();
        assertThat(result.summary().render()).isEqualTo("0 document(s): 0 succeeded, 0 failed, 0 diagnostic(s)");
        assertThat(result.allSucceeded()).isTrue();
    }
}
