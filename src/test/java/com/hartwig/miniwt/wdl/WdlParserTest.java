package com.hartwig.miniwt.wdl;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.util.List;
import java.util.Map;
import java.util.Optional;

import com.hartwig.miniwt.Fixtures;
import com.hartwig.miniwt.diagnostics.SemanticException;
import com.hartwig.miniwt.diagnostics.SyntaxException;
import com.hartwig.miniwt.diagnostics.TranslationException;
import com.hartwig.miniwt.expression.ArrayLiteral;
import com.hartwig.miniwt.expression.FunctionCall;
import com.hartwig.miniwt.expression.Literal;
import com.hartwig.miniwt.expression.MemberRef;
import com.hartwig.miniwt.expression.Operation;
import com.hartwig.miniwt.expression.Operator;
import com.hartwig.miniwt.expression.TemplatePart;
import com.hartwig.miniwt.expression.VariableRef;
import com.hartwig.miniwt.ir.DataType;
import com.hartwig.miniwt.ir.Document;
import com.hartwig.miniwt.ir.Frame;
import com.hartwig.miniwt.ir.Import;
import com.hartwig.miniwt.ir.Quantity;
import com.hartwig.miniwt.ir.Workflow;
import com.hartwig.miniwt.language.ImportResolver;

import org.junit.jupiter.api.Test;

class WdlParserTest {
    private final WdlParser parser = new WdlParser();

    @Test
    void parsesSingleCallWorkflow() throws TranslationException {
        var document = parser.parse(Fixtures.read("wdl/hello.wdl"), "hello.wdl");

        assertThat(document.version()).contains("1.0");
        var workflow = document.workflow().orElseThrow();
        assertThat(workflow.name()).isEqualTo("W");
        assertThat(workflow.tasks()).containsOnlyKeys("t1");
        var call = workflow.calls().get(0);
        assertThat(call.name()).isEqualTo("c1");
        assertThat(call.taskName()).isEqualTo("t1");
        assertThat(call.inputs()).isEqualTo(Map.of("x", Literal.ofInt(5)));
        assertThat(call.frames()).isEmpty();
        assertThat(workflow.outputs().get(0).expression()).contains(MemberRef.of("c1", "y"));
    }

    @Test
    void commandIsDedentedAndSplitOnPlaceholders() throws TranslationException {
        var task = workflow("wdl/hello.wdl").tasks().get("t1");

        assertThat(task.command().parts()).containsExactly(TemplatePart.text("echo "), TemplatePart.placeholder(VariableRef.of("x")));
        assertThat(task.outputs().get(0).expression()).contains(FunctionCall.of("read_int", FunctionCall.of("stdout")));
    }

    @Test
    void tasksDeclaredAfterTheWorkflowBelongToIt() throws TranslationException {
        var workflow = workflow("wdl/chain.wdl");

        assertThat(workflow.tasks()).containsOnlyKeys("increment");
        assertThat(workflow.calls().get(1).inputs()).isEqualTo(Map.of("x", MemberRef.of("c1", "y")));
        assertThat(workflow.tasks().get("increment").command().literalText()).isEqualTo("echo $((  + 1 ))");
    }

    @Test
    void scatterAndConditionalBlocksBecomeFrames() throws TranslationException {
        var workflow = workflow("wdl/scatter.wdl");
        var align = workflow.calls().get(0);
        var qc = workflow.calls().get(1);
        var summarize = workflow.calls().get(2);

        assertThat(align.frames()).containsExactly(Frame.scatter("scatter0", "sample", VariableRef.of("samples")));
        assertThat(align.inputs()).isEqualTo(Map.of("reads", VariableRef.of("sample")));
        assertThat(qc.frames()).isEmpty();
        assertThat(summarize.frames()).containsExactly(Frame.conditional("if1", VariableRef.of("run_summary")));
        assertThat(summarize.isConditional()).isTrue();
        assertThat(summarize.isScattered()).isFalse();
    }

    @Test
    void nestedBlocksKeepOuterFramesFirst() throws TranslationException {
        var text = "version 1.0\n"
                + "task t { input { Int n } command <<< echo ~{n} >>> }\n"
                + "workflow w {\n"
                + "  input { Array[Int] ns\n Boolean go }\n"
                + "  if (go) {\n"
                + "    scatter (n in ns) {\n"
                + "      call t { input: n = n }\n"
                + "      call t as again { input: n = n + 1 }\n"
                + "    }\n"
                + "  }\n"
                + "}\n";
        var workflow = parser.parse(text, "nested.wdl").workflow().orElseThrow();

        var first = workflow.calls().get(0);
        var second = workflow.calls().get(1);
        assertThat(first.blockIds()).containsExactly("if0", "scatter1");
        assertThat(second.blockIds()).isEqualTo(first.blockIds());
        assertThat(second.inputs().get("n")).isEqualTo(Operation.binary(Operator.ADD, VariableRef.of("n"), Literal.ofInt(1)));
    }

    @Test
    void runtimeAttributesAreLowered() throws TranslationException {
        var align = workflow("wdl/scatter.wdl").tasks().get("align");
        var runtime = align.runtime().orElseThrow();

        assertThat(runtime.container()).contains("aligner:1.2");
        assertThat(runtime.cpu()).contains(4);
        assertThat(runtime.memory()).contains(Quantity.of(8, Quantity.Unit.GiB));
        assertThat(runtime.disk()).contains(Quantity.of(50, Quantity.Unit.GiB));
        assertThat(runtime.maxRetries()).contains(2);
        assertThat(runtime.preemptible()).contains(3);
        assertThat(runtime.customAttributes()).isEmpty();
        assertThat(align.description()).contains("Aligns one sample");
    }

    @Test
    void unknownRuntimeAttributesAreKept() throws SemanticException {
        var runtime = WdlParser.lowerRuntime("t", Map.of("zones", Literal.ofString("europe-west4-a"), "preemptible", Literal.ofBoolean(true)));

        assertThat(runtime.customAttributes()).isEqualTo(Map.of("zones", Literal.ofString("europe-west4-a")));
        assertThat(runtime.preemptible()).contains(1);
    }

    @Test
    void diskSizeWithoutUnitIsGibibytes() {
        assertThat(WdlParser.parseDisk("local-disk 100 SSD")).contains(Quantity.of(100, Quantity.Unit.GiB));
        assertThat(WdlParser.parseDisk("200")).contains(Quantity.of(200, Quantity.Unit.GiB));
        assertThat(WdlParser.parseDisk("local-disk")).isEmpty();
    }

    @Test
    void placeholderOptionsBecomeFunctionCalls() throws TranslationException {
        var task = workflow("wdl/scatter.wdl").tasks().get("qc");

        assertThat(task.command().parts()).contains(TemplatePart.placeholder(FunctionCall.of("sep",
                Literal.ofString(" "),
                VariableRef.of("bams"))));

        var text = "version 1.0\ntask t {\n input { String? name\n Boolean loud }\n"
                + " command <<< greet ~{default=\"world\" name} ~{true=\"-l\" false=\"\" loud} >>>\n}\n";
        var parts = parser.parse(text, "t.wdl").task().orElseThrow().command().parts();
        assertThat(parts).contains(TemplatePart.placeholder(FunctionCall.of("select_first",
                ArrayLiteral.of(VariableRef.of("name"), Literal.ofString("world")))));
        assertThat(parts).contains(TemplatePart.placeholder(FunctionCall.of(FunctionCall.IF_THEN_ELSE,
                VariableRef.of("loud"),
                Literal.ofString("-l"),
                Literal.ofString(""))));
    }

    @Test
    void taskOnlyDocumentHoldsTheTask() throws TranslationException {
        var document = parser.parse(Fixtures.read("wdl/lib/greetings.wdl"), "greetings.wdl");

        assertThat(document.workflow()).isEmpty();
        assertThat(document.name()).isEqualTo("greet");
    }

    @Test
    void typesIncludeOptionalsArraysAndMaps() throws TranslationException {
        var text = "version 1.0\ntask t {\n input {\n  Array[File]+ reads\n  Map[String, Int]? counts\n  Directory? ref\n }\n"
                + " command <<< true >>>\n}\n";
        var inputs = parser.parse(text, "t.wdl").task().orElseThrow().inputs();

        assertThat(inputs.get(0).type()).isEqualTo(DataType.arrayOf(DataType.of(DataType.Kind.FILE)));
        assertThat(inputs.get(1).type()).isEqualTo(DataType.mapOf(DataType.of(DataType.Kind.STRING), DataType.of(DataType.Kind.INT))
                .asOptional());
        assertThat(inputs.get(2).type()).isEqualTo(DataType.of(DataType.Kind.DIRECTORY).asOptional());
    }

    @Test
    void operatorPrecedenceIsRespected() throws TranslationException {
        var text = "version 1.0\ntask t {\n input { Int n = 1 + 2 * 3\n Boolean b = !false || 1 < 2 && true }\n command <<< true >>>\n}\n";
        var inputs = parser.parse(text, "t.wdl").task().orElseThrow().inputs();

        assertThat(inputs.get(0).expression()).contains(Operation.binary(Operator.ADD,
                Literal.ofInt(1),
                Operation.binary(Operator.MULTIPLY, Literal.ofInt(2), Literal.ofInt(3))));
        assertThat(inputs.get(1).expression()).contains(Operation.binary(Operator.OR,
                Operation.unary(Operator.NOT, Literal.ofBoolean(false)),
                Operation.binary(Operator.AND, Operation.binary(Operator.LESS, Literal.ofInt(1), Literal.ofInt(2)), Literal.ofBoolean(true))));
    }

    @Test
    void callWithoutInputKeywordIsAccepted() throws TranslationException {
        var text = "version 1.1\ntask t { input { Int n } command <<< echo ~{n} >>> }\nworkflow w { call t { n = 3 } }\n";

        var call = parser.parse(text, "w.wdl").workflow().orElseThrow().calls().get(0);
        assertThat(call.inputs()).isEqualTo(Map.of("n", Literal.ofInt(3)));
    }

    @Test
    void importedTasksAreNamespaced() throws TranslationException {
        var document = new WdlParser(Fixtures.resolver("wdl")).parse(Fixtures.read("wdl/imports.wdl"), "imports.wdl");
        var workflow = document.workflow().orElseThrow();

        assertThat(document.imports()).containsExactly(Import.of("lib/greetings.wdl", "lib"));
        assertThat(workflow.tasks()).containsOnlyKeys("lib.greet");
        assertThat(workflow.tasks().get("lib.greet").name()).isEqualTo("lib.greet");
        assertThat(workflow.calls().get(0).name()).isEqualTo("greet");
        assertThat(workflow.calls().get(0).taskName()).isEqualTo("lib.greet");
    }

    @Test
    void runtimeValueOutOfRangeNamesTheField() {
        var text = "version 1.0\ntask big {\n  command <<<\n    true\n  >>>\n  runtime {\n    cpu: 1e12\n  }\n}\n";

        var e = assertThrows(SemanticException.class, () -> parser.parse(text, "big.wdl"));
        assertThat(e.location()).contains("task 'big' runtime 'cpu'");
        assertThat(e.reason()).startsWith("Value out of range");
    }

    @Test
    void oversizedMemoryIsSemanticError() {
        var e = assertThrows(SemanticException.class,
                () -> WdlParser.lowerRuntime("big", Map.of("memory", Literal.ofString("100000000000000000000000 TiB"))));

        assertThat(e.location()).contains("task 'big' runtime 'memory'");
    }

    @Test
    void unresolvableImportIsSemanticError() {
        var e = assertThrows(SemanticException.class, () -> parser.parse(Fixtures.read("wdl/imports.wdl"), "imports.wdl"));

        assertThat(e.reason()).isEqualTo("Cannot resolve import 'lib/greetings.wdl'");
        assertThat(e.location()).contains("line 3, column 1");
    }

    @Test
    void importCycleIsSemanticError() {
        var sources = Map.of("a.wdl", "version 1.0\nimport \"b.wdl\"\n", "b.wdl", "version 1.0\nimport \"a.wdl\"\n");
        ImportResolver resolver = name -> Optional.ofNullable(sources.get(name));

        var e = assertThrows(SemanticException.class, () -> new WdlParser(resolver).parse(sources.get("a.wdl"), "a.wdl"));
        assertThat(e.reason()).isEqualTo("Import cycle: a.wdl -> b.wdl -> a.wdl");
    }

    @Test
    void unknownNamespaceIsSemanticError() {
        var text = "version 1.0\nworkflow w {\n  call other.task_name\n}\n";

        var e = assertThrows(SemanticException.class, () -> parser.parse(text, "w.wdl"));
        assertThat(e.reason()).isEqualTo("Unknown namespace 'other' in call to 'other.task_name'");
    }

    @Test
    void unknownTypeIsSemanticError() {
        var text = "version 1.0\ntask t {\n  input {\n    Matrix m\n  }\n  command <<< true >>>\n}\n";

        var e = assertThrows(SemanticException.class, () -> parser.parse(text, "t.wdl"));
        assertThat(e.getMessage()).isEqualTo("line 4, column 5: Unknown type 'Matrix'");
    }

    @Test
    void duplicateNamesAreSemanticErrors() {
        var duplicateTask = "version 1.0\ntask t { command <<< a >>> }\ntask t { command <<< b >>> }\n";
        var duplicateCall = "version 1.0\ntask t { command <<< a >>> }\nworkflow w { call t\n call t }\n";

        assertThat(assertThrows(SemanticException.class, () -> parser.parse(duplicateTask, "d.wdl")).reason()).isEqualTo(
                "Duplicate task 't'");
        assertThat(assertThrows(SemanticException.class, () -> parser.parse(duplicateCall, "d.wdl")).reason()).isEqualTo(
                "Duplicate call name 't'");
    }

    @Test
    void missingExpressionReportsPosition() {
        var text = "version 1.0\n\nworkflow w {\n    call t {\n        input: x = \n    }\n}\n";

        var e = assertThrows(SyntaxException.class, () -> parser.parse(text, "w.wdl"));
        assertThat(e.line()).isEqualTo(6);
        assertThat(e.column()).isEqualTo(5);
        assertThat(e.reason()).isEqualTo("Expected expression but found '}'");
    }

    @Test
    void workflowBodyDeclarationIsSyntaxError() {
        var text = "version 1.0\nworkflow w {\n  Int n = 3\n}\n";

        var e = assertThrows(SyntaxException.class, () -> parser.parse(text, "w.wdl"));
        assertThat(e.line()).isEqualTo(3);
        assertThat(e.reason()).startsWith("Declarations in the workflow body are not supported");
    }

    @Test
    void nestedMemberAccessIsSyntaxError() {
        var text = "version 1.0\ntask t { input { String s } command <<< echo >>> }\nworkflow w { call t { input: s = a.b.c } }\n";

        var e = assertThrows(SyntaxException.class, () -> parser.parse(text, "w.wdl"));
        assertThat(e.reason()).isEqualTo("Nested member access is not supported");
    }

    @Test
    void documentWithoutTasksOrWorkflowIsSemanticError() {
        assertThrows(SemanticException.class, () -> parser.parse("version 1.0\n", "empty.wdl"));
    }

    @Test
    void severalTasksWithoutWorkflowAreNamedAfterTheSource() throws TranslationException {
        var text = "version 1.0\ntask a { command <<< a >>> }\ntask b { command <<< b >>> }\n";

        Document document = parser.parse(text, "dir/tools.wdl");
        assertThat(document.workflow().map(Workflow::name)).contains("tools");
        assertThat(document.workflow().orElseThrow().tasks()).containsOnlyKeys("a", "b");
        assertThat(document.workflow().orElseThrow().calls()).isEqualTo(List.of());
    }

    private Workflow workflow(String resource) throws TranslationException {
        return parser.parse(Fixtures.read(resource), resource).workflow().orElseThrow();
    }
}
