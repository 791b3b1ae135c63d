package com.hartwig.miniwt.graph;

import static org.assertj.core.api.Assertions.assertThat;

import com.hartwig.miniwt.Fixtures;
import com.hartwig.miniwt.diagnostics.TranslationException;
import com.hartwig.miniwt.ir.Workflow;
import com.hartwig.miniwt.wdl.WdlParser;

import org.junit.jupiter.api.Test;

class CallGraphTest {
    @Test
    void edgesRunFromDependentToDependency() throws TranslationException {
        var callGraph = CallGraph.of(workflow("wdl/chain.wdl"));

        assertThat(callGraph.graph().vertexSet()).containsExactlyInAnyOrder("c1", "c2");
        assertThat(callGraph.graph().containsEdge("c2", "c1")).isTrue();
        assertThat(callGraph.graph().containsEdge("c1", "c2")).isFalse();
        assertThat(callGraph.graph().getEdge("c2", "c1").name()).isEqualTo("y");
        assertThat(callGraph.dependencyCount()).isEqualTo(1);
    }

    @Test
    void directNeighboursAreInBodyOrder() throws TranslationException {
        var callGraph = CallGraph.of(workflow("wdl/scatter.wdl"));

        assertThat(callGraph.dependenciesOf("qc")).containsExactly("align");
        assertThat(callGraph.dependentsOf("qc")).containsExactly("summarize");
        assertThat(callGraph.dependenciesOf("align")).isEmpty();
        assertThat(callGraph.hasCycles()).isFalse();
    }

    @Test
    void independentCallsHaveNoEdges() throws TranslationException {
        var callGraph = CallGraph.of(workflow("wdl/independent.wdl"));

        assertThat(callGraph.graph().edgeSet()).isEmpty();
        assertThat(callGraph.cycles()).isEmpty();
    }

    @Test
    void cyclesAreReportedInBodyOrder() throws TranslationException {
        var callGraph = CallGraph.of(workflow("wdl/cycle.wdl"));

        assertThat(callGraph.cycles()).hasSize(1);
        assertThat(callGraph.cycles().get(0)).containsExactly("b", "a");
    }

    @Test
    void dotOutputMarksScattersAndConditionals() throws TranslationException {
        var dot = CallGraph.of(workflow("wdl/scatter.wdl")).toDotFormat();

        assertThat(dot).contains("digraph");
        assertThat(dot).contains("align").contains("qc").contains("summarize");
        assertThat(dot).contains("box3d").contains("dashed");
        assertThat(dot).contains("->");
    }

    static Workflow workflow(String resource) throws TranslationException {
        return new WdlParser().parse(Fixtures.read(resource), resource).workflow().orElseThrow();
    }
}
