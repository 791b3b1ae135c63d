package com.hartwig.miniwt.wdl;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.util.List;

import com.hartwig.miniwt.Fixtures;
import com.hartwig.miniwt.diagnostics.Diagnostic;
import com.hartwig.miniwt.diagnostics.DiagnosticKind;
import com.hartwig.miniwt.diagnostics.Severity;
import com.hartwig.miniwt.diagnostics.TranslationException;
import com.hartwig.miniwt.diagnostics.UnsupportedConstructException;
import com.hartwig.miniwt.expression.FunctionCall;
import com.hartwig.miniwt.expression.Interpolation;
import com.hartwig.miniwt.expression.Literal;
import com.hartwig.miniwt.expression.TemplatePart;
import com.hartwig.miniwt.expression.VariableRef;
import com.hartwig.miniwt.ir.DataType;
import com.hartwig.miniwt.ir.Declaration;
import com.hartwig.miniwt.ir.Document;
import com.hartwig.miniwt.ir.Quantity;
import com.hartwig.miniwt.ir.Runtime;
import com.hartwig.miniwt.ir.Task;
import com.hartwig.miniwt.language.TranslatorOptions;

import org.junit.jupiter.api.Test;

class WdlWriterTest {
    private final WdlParser parser = new WdlParser();
    private final WdlWriter writer = new WdlWriter();

    @Test
    void writtenWorkflowParsesBackToTheSameCalls() throws TranslationException {
        var original = parser.parse(Fixtures.read("wdl/scatter.wdl"), "scatter.wdl");

        var result = writer.write(original);
        var reparsed = parser.parse(result.text(), "scatter.wdl");

        var before = original.workflow().orElseThrow();
        var after = reparsed.workflow().orElseThrow();
        assertThat(after.calls()).isEqualTo(before.calls());
        assertThat(after.inputs()).isEqualTo(before.inputs());
        assertThat(after.outputs()).isEqualTo(before.outputs());
        assertThat(after.tasks().keySet()).containsExactlyElementsOf(before.tasks().keySet());
        assertThat(after.tasks().get("qc").command()).isEqualTo(before.tasks().get("qc").command());
        assertThat(result.diagnostics()).isEmpty();
    }

    @Test
    void blocksAreRebuiltAroundTheirCalls() throws TranslationException {
        var text = writer.write(parser.parse(Fixtures.read("wdl/scatter.wdl"), "scatter.wdl")).text();

        assertThat(text).startsWith("version 1.0\n");
        assertThat(text).contains("    scatter (sample in samples) {\n        call align {\n");
        assertThat(text).contains("    if (run_summary) {\n        call summarize {\n");
        assertThat(text).contains("    command <<<\n        qc ~{sep=\" \" bams} > report.txt\n    >>>\n");
    }

    @Test
    void runtimeIsWrittenInFixedUnits() throws TranslationException {
        var text = writer.write(parser.parse(Fixtures.read("wdl/scatter.wdl"), "scatter.wdl")).text();

        assertThat(text).contains("        docker: \"aligner:1.2\"\n");
        assertThat(text).contains("        memory: \"8192 MiB\"\n");
        assertThat(text).contains("        disks: \"local-disk 50 HDD\"\n");
        assertThat(text).contains("        maxRetries: 2\n");
        assertThat(text).contains("        preemptible: 3\n");
    }

    @Test
    void diskSizeIsRoundedUpToWholeGibibytes() throws TranslationException {
        var task = task(Interpolation.ofText("true"),
                List.of(),
                Runtime.builder().disk(Quantity.of(1500, Quantity.Unit.MiB)).memory(Quantity.of(1, Quantity.Unit.GB)).build());

        var text = writer.write(Document.of(task)).text();
        assertThat(text).contains("disks: \"local-disk 2 HDD\"");
        assertThat(text).contains("memory: \"954 MiB\"");
    }

    @Test
    void directoryIsDegradedToFile() throws TranslationException {
        var task = task(Interpolation.ofText("ls ref"), List.of(Declaration.of("ref", DataType.of(DataType.Kind.DIRECTORY))), null);

        var result = writer.write(Document.of(task));
        assertThat(result.text()).contains("        File ref\n");
        assertThat(result.diagnostics()).containsExactly(Diagnostic.warning(DiagnosticKind.DEGRADED_TYPE,
                "task 't' input 'ref'",
                "WDL 1.0 has no Directory type, written as File"));
    }

    @Test
    void javascriptPlaceholderIsDroppedWithWarning() throws TranslationException {
        var command = Interpolation.of(List.of(TemplatePart.text("echo "),
                TemplatePart.placeholder(FunctionCall.of(FunctionCall.JAVASCRIPT, Literal.ofString("$(inputs.x.toUpperCase())")))));
        var document = Document.of(task(command, List.of(Declaration.of("x", DataType.of(DataType.Kind.STRING))), null));

        var result = writer.write(document);
        assertThat(result.text()).doesNotContain("toUpperCase");
        assertThat(result.diagnostics()).extracting(Diagnostic::kind).containsExactly(DiagnosticKind.UNSUPPORTED_EXPRESSION);
    }

    @Test
    void strictModeFailsOnTheFirstDroppedConstruct() {
        var strict = new WdlWriter(TranslatorOptions.builder().strict(true).build());
        var document = Document.of(task(Interpolation.ofText("true"), List.of(Declaration.of("ref", DataType.of(DataType.Kind.DIRECTORY))), null));

        var e = assertThrows(UnsupportedConstructException.class, () -> strict.write(document));
        assertThat(e.reason()).isEqualTo("WDL 1.0 has no Directory type, written as File");
    }

    @Test
    void unmodelledRequirementIsReportedAsInfo() throws TranslationException {
        var runtime = Runtime.builder()
                .container("ubuntu:22.04")
                .putCustomAttributes("requirement:NetworkAccess", Literal.ofString("{\"networkAccess\":true}"))
                .putCustomAttributes("zones", Literal.ofString("europe-west4-a"))
                .build();

        var result = writer.write(Document.of(task(Interpolation.ofText("true"), List.of(), runtime)));
        assertThat(result.text()).contains("        zones: \"europe-west4-a\"\n");
        assertThat(result.text()).doesNotContain("NetworkAccess");
        assertThat(result.diagnostics()).hasSize(1);
        assertThat(result.diagnostics().get(0).severity()).isEqualTo(Severity.INFO);
        assertThat(result.diagnostics().get(0).kind()).isEqualTo(DiagnosticKind.UNSUPPORTED_REQUIREMENT);
    }

    @Test
    void outputWithoutExpressionIsDropped() throws TranslationException {
        var task = Task.builder()
                .name("t")
                .command(Interpolation.ofText("date > now.txt"))
                .addOutputs(Declaration.of("now", DataType.of(DataType.Kind.FILE)))
                .build();

        var result = writer.write(Document.of(task));
        assertThat(result.text()).doesNotContain("output {");
        assertThat(result.diagnostics()).extracting(Diagnostic::kind).containsExactly(DiagnosticKind.UNSUPPORTED_OUTPUT);
    }

    @Test
    void callAliasIsWrittenWhenItDiffersFromTheTask() throws TranslationException {
        var text = writer.write(parser.parse(Fixtures.read("wdl/hello.wdl"), "hello.wdl")).text();

        assertThat(text).contains("    call t1 as c1 {\n        input:\n            x = 5\n    }\n");
        assertThat(text).contains("        Int result = c1.y\n");
    }

    @Test
    void namesAreMadeIntoValidIdentifiers() {
        assertThat(WdlWriter.identifier("count-lines")).isEqualTo("count_lines");
        assertThat(WdlWriter.identifier("1st")).isEqualTo("v1st");
        assertThat(WdlWriter.identifier("_hidden")).isEqualTo("v_hidden");
        assertThat(WdlWriter.identifier("input")).isEqualTo("input_");
        assertThat(WdlWriter.identifier("sample")).isEqualTo("sample");
    }

    @Test
    void placeholderInStringOutputIsKept() throws TranslationException {
        var task = Task.builder()
                .name("t")
                .command(Interpolation.ofText("touch out.txt"))
                .addInputs(Declaration.of("prefix", DataType.of(DataType.Kind.STRING)))
                .addOutputs(Declaration.of("out",
                        DataType.of(DataType.Kind.FILE),
                        Interpolation.of(List.of(TemplatePart.placeholder(VariableRef.of("prefix")), TemplatePart.text(".txt")))))
                .build();

        assertThat(writer.write(Document.of(task)).text()).contains("        File out = \"~{prefix}.txt\"\n");
    }

    private static Task task(Interpolation command, List<Declaration> inputs, Runtime runtime) {
        var builder = Task.builder().name("t").command(command).inputs(inputs);
        if (runtime != null) {
            builder.runtime(runtime);
        }
        return builder.build();
    }
}
