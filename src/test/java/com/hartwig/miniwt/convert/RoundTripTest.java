package com.hartwig.miniwt.convert;

import static org.assertj.core.api.Assertions.assertThat;

import java.util.stream.Collectors;

import com.hartwig.miniwt.Fixtures;
import com.hartwig.miniwt.expression.MemberRef;
import com.hartwig.miniwt.ir.Call;
import com.hartwig.miniwt.ir.Frame;
import com.hartwig.miniwt.ir.Workflow;
import com.hartwig.miniwt.language.WorkflowLanguage;

import org.junit.jupiter.api.Test;

class RoundTripTest {
    private final Converter converter = new Converter();

    @Test
    void wdlThroughCwlKeepsCallStructure() throws Exception {
        var cwl = converter.convertOrThrow(Fixtures.read("wdl/scatter.wdl"), WorkflowLanguage.WDL, WorkflowLanguage.CWL, "scatter.wdl");
        var fromCwl = converter.read(cwl.text().orElseThrow(), WorkflowLanguage.CWL, "scatter.cwl");
        var wdl = WorkflowLanguage.WDL.writer(converter.options()).write(fromCwl);
        var workflow = converter.read(wdl.text(), WorkflowLanguage.WDL, "scatter.wdl").workflow().orElseThrow();

        assertThat(workflow.calls().stream().map(Call::name).collect(Collectors.toList())).containsExactly("align", "qc", "summarize");
        assertThat(call(workflow, "align").frames()).extracting(Frame::kind).containsExactly(Frame.Kind.SCATTER);
        assertThat(call(workflow, "summarize").frames()).extracting(Frame::kind).containsExactly(Frame.Kind.CONDITIONAL);
        assertThat(call(workflow, "qc").frames()).isEmpty();
        assertThat(call(workflow, "qc").inputs()).containsEntry("bams", MemberRef.of("align", "bam"));
        assertThat(workflow.tasks()).containsOnlyKeys("align", "qc", "summarize");
    }

    @Test
    void cwlThroughWdlKeepsCallStructure() throws Exception {
        var wdl = converter.convertOrThrow(Fixtures.read("cwl/counting.cwl"), WorkflowLanguage.CWL, WorkflowLanguage.WDL, "counting.cwl");
        var workflow = converter.read(wdl.text().orElseThrow(), WorkflowLanguage.WDL, "counting.wdl").workflow().orElseThrow();

        assertThat(workflow.calls().stream().map(Call::name).collect(Collectors.toList())).containsExactly("count_lines", "sum");
        assertThat(call(workflow, "count_lines").isScattered()).isTrue();
        assertThat(call(workflow, "sum").isConditional()).isTrue();
        assertThat(call(workflow, "sum").inputs()).containsEntry("counts", MemberRef.of("count_lines", "lines"));
    }

    private static Call call(Workflow workflow, String name) {
        return workflow.calls().stream().filter(call -> call.name().equals(name)).findFirst().orElseThrow();
    }
}
