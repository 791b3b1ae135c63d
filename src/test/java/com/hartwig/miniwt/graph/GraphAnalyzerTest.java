package com.hartwig.miniwt.graph;

import static com.hartwig.miniwt.graph.CallGraphTest.workflow;
import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.util.List;
import java.util.Map;

import com.hartwig.miniwt.diagnostics.TranslationException;
import com.hartwig.miniwt.expression.Interpolation;
import com.hartwig.miniwt.expression.Literal;
import com.hartwig.miniwt.expression.MemberRef;
import com.hartwig.miniwt.ir.Call;
import com.hartwig.miniwt.ir.DataType;
import com.hartwig.miniwt.ir.Declaration;
import com.hartwig.miniwt.ir.Task;
import com.hartwig.miniwt.ir.Workflow;

import org.junit.jupiter.api.Test;

class GraphAnalyzerTest {
    @Test
    void singleCallStatistics() throws TranslationException {
        var statistics = new GraphAnalyzer(workflow("wdl/hello.wdl")).statistics();

        assertThat(statistics.taskCount()).isEqualTo(1);
        assertThat(statistics.callCount()).isEqualTo(1);
        assertThat(statistics.dependencyCount()).isEqualTo(0);
        assertThat(statistics.criticalPathLength()).isEqualTo(1);
        assertThat(statistics.maxParallelism()).isEqualTo(1);
        assertThat(statistics.parallelGroups()).isEqualTo(1);
        assertThat(statistics.hasScatter()).isFalse();
        assertThat(statistics.hasConditional()).isFalse();
    }

    @Test
    void chainIsSequential() throws TranslationException {
        var analyzer = new GraphAnalyzer(workflow("wdl/chain.wdl"));

        assertThat(analyzer.executionOrder()).containsExactly("c1", "c2");
        assertThat(analyzer.criticalPath().calls()).containsExactly("c1", "c2");
        assertThat(analyzer.criticalPath().length()).isEqualTo(2.0);
        assertThat(analyzer.maxParallelism()).isEqualTo(1);
        assertThat(analyzer.parallelGroups()).containsExactly(List.of("c1"), List.of("c2"));
    }

    @Test
    void independentCallsRunInParallel() throws TranslationException {
        var analyzer = new GraphAnalyzer(workflow("wdl/independent.wdl"));

        assertThat(analyzer.maxParallelism()).isEqualTo(3);
        assertThat(analyzer.parallelGroups()).containsExactly(List.of("fetch", "count", "stamp"));
        assertThat(analyzer.criticalPath().calls()).containsExactly("fetch");
        assertThat(analyzer.statistics().criticalPathLength()).isEqualTo(1);
    }

    @Test
    void statisticsOfBlocks() throws TranslationException {
        var statistics = new GraphAnalyzer(workflow("wdl/scatter.wdl")).statistics();

        assertThat(statistics.toMap()).containsEntry("task_count", 3)
                .containsEntry("call_count", 3)
                .containsEntry("dependency_count", 2)
                .containsEntry("critical_path_length", 3)
                .containsEntry("max_parallelism", 1)
                .containsEntry("parallel_groups", 3)
                .containsEntry("has_scatter", true)
                .containsEntry("has_conditional", true);
    }

    @Test
    void transitiveNeighboursAreInBodyOrder() throws TranslationException {
        var analyzer = new GraphAnalyzer(workflow("wdl/scatter.wdl"));

        assertThat(analyzer.dependencies("summarize")).containsExactly("align", "qc");
        assertThat(analyzer.dependents("align")).containsExactly("qc", "summarize");
        assertThat(analyzer.dependencies("align")).isEmpty();
        assertThrows(IllegalArgumentException.class, () -> analyzer.dependencies("nope"));
    }

    @Test
    void weightsPickTheHeaviestBranch() {
        var analyzer = new GraphAnalyzer(diamond());

        assertThat(analyzer.criticalPath().calls()).containsExactly("start", "left", "end");
        var weighted = analyzer.criticalPath(Map.of("slow", 10.0));
        assertThat(weighted.calls()).containsExactly("start", "right", "end");
        assertThat(weighted.length()).isEqualTo(12.0);
    }

    @Test
    void executionOrderBreaksTiesByBodyPosition() {
        var analyzer = new GraphAnalyzer(diamond());

        assertThat(analyzer.executionOrder()).containsExactly("start", "left", "right", "end");
        assertThat(analyzer.levels()).containsExactly(Map.entry("start", 1), Map.entry("left", 2), Map.entry("right", 2), Map.entry("end", 3));
        assertThat(new GraphAnalyzer(diamond()).executionOrder()).isEqualTo(analyzer.executionOrder());
    }

    @Test
    void statisticsAreRepeatable() {
        var analyzer = new GraphAnalyzer(diamond());

        assertThat(analyzer.statistics()).isEqualTo(analyzer.statistics());
        assertThat(new GraphAnalyzer(diamond()).statistics()).isEqualTo(analyzer.statistics());
        assertThat(new GraphAnalyzer(diamond()).statistics().toMap()).isEqualTo(analyzer.statistics().toMap());
        assertThat(new GraphAnalyzer(diamond()).criticalPath()).isEqualTo(analyzer.criticalPath());
    }

    @Test
    void emptyWorkflowHasEmptyCriticalPath() {
        var analyzer = new GraphAnalyzer(Workflow.builder().name("empty").build());

        assertThat(analyzer.criticalPath()).isEqualTo(CriticalPath.empty());
        assertThat(analyzer.statistics().maxParallelism()).isEqualTo(0);
        assertThat(analyzer.executionOrder()).isEmpty();
    }

    @Test
    void cyclicWorkflowIsRejected() throws TranslationException {
        var cyclic = workflow("wdl/cycle.wdl");

        var e = assertThrows(IllegalArgumentException.class, () -> new GraphAnalyzer(cyclic));
        assertThat(e.getMessage()).contains("loop").contains("[b, a]");
    }

    /**
     * start feeds left and right, end reads both. Right runs the task named slow.
     */
    private static Workflow diamond() {
        var out = Declaration.of("out", DataType.of(DataType.Kind.FILE), Literal.ofString("out.txt"));
        var input = Declaration.of("in", DataType.of(DataType.Kind.FILE).asOptional());
        var fast = Task.builder().name("fast").command(Interpolation.ofText("run")).addInputs(input).addOutputs(out).build();
        var slow = Task.builder().name("slow").command(Interpolation.ofText("run")).addInputs(input).addOutputs(out).build();
        var merge = Task.builder()
                .name("merge")
                .command(Interpolation.ofText("merge"))
                .addInputs(input, Declaration.of("other", DataType.of(DataType.Kind.FILE).asOptional()))
                .addOutputs(out)
                .build();
        return Workflow.builder()
                .name("diamond")
                .putTasks("fast", fast)
                .putTasks("slow", slow)
                .putTasks("merge", merge)
                .addCalls(Call.builder().name("start").taskName("fast").build())
                .addCalls(Call.builder().name("left").taskName("fast").putInputs("in", MemberRef.of("start", "out")).build())
                .addCalls(Call.builder().name("right").taskName("slow").putInputs("in", MemberRef.of("start", "out")).build())
                .addCalls(Call.builder()
                        .name("end")
                        .taskName("merge")
                        .putInputs("in", MemberRef.of("left", "out"))
                        .putInputs("other", MemberRef.of("right", "out"))
                        .build())
                .build();
    }
}
