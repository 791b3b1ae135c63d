package com.hartwig.miniwt.graph;

import java.io.StringWriter;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

import com.hartwig.miniwt.expression.Expression;
import com.hartwig.miniwt.expression.Expressions;
import com.hartwig.miniwt.expression.MemberRef;
import com.hartwig.miniwt.ir.Call;
import com.hartwig.miniwt.ir.Frame;
import com.hartwig.miniwt.ir.Workflow;
import com.hartwig.miniwt.ir.WorkflowIndex;

import org.jgrapht.Graph;
import org.jgrapht.alg.connectivity.KosarajuStrongConnectivityInspector;
import org.jgrapht.graph.AsUnmodifiableGraph;
import org.jgrapht.graph.DefaultDirectedGraph;
import org.jgrapht.nio.Attribute;
import org.jgrapht.nio.DefaultAttribute;
import org.jgrapht.nio.dot.DOTExporter;

/**
 * Call dependency graph of a workflow. Vertices are call names in body order, an edge runs from a call to each call
 * whose outputs its bindings or enclosing frames read.
 */
public class CallGraph {
    private final WorkflowIndex index;
    private final DefaultDirectedGraph<String, NamedEdge> graph;

    private CallGraph(final WorkflowIndex index) {
        this.index = index;
        this.graph = createGraph();
    }

    public static CallGraph of(Workflow workflow) {
        return of(WorkflowIndex.of(workflow));
    }

    public static CallGraph of(WorkflowIndex index) {
        return new CallGraph(index);
    }

    private DefaultDirectedGraph<String, NamedEdge> createGraph() {
        var g = new DefaultDirectedGraph<String, NamedEdge>(NamedEdge.class);
        for (Call call : index.calls()) {
            g.addVertex(call.name());
        }
        for (Call call : index.calls()) {
            var outputsByDependency = new LinkedHashMap<String, Set<String>>();
            for (MemberRef reference : references(call)) {
                if (index.hasCall(reference.callName())) {
                    outputsByDependency.computeIfAbsent(reference.callName(), name -> new LinkedHashSet<>()).add(reference.outputName());
                }
            }
            outputsByDependency.forEach((dependency, outputs) -> g.addEdge(call.name(),
                    dependency,
                    new NamedEdge(String.join(",", outputs))));
        }
        return g;
    }

    /**
     * Member references of a call's bindings followed by those of its frames, in source order.
     */
    static List<MemberRef> references(Call call) {
        var references = new ArrayList<MemberRef>();
        for (Expression binding : call.inputs().values()) {
            references.addAll(Expressions.memberRefs(binding));
        }
        for (Frame frame : call.frames()) {
            references.addAll(Expressions.memberRefs(frame.expression()));
        }
        return references;
    }

    public Graph<String, NamedEdge> graph() {
        return new AsUnmodifiableGraph<>(graph);
    }

    public WorkflowIndex index() {
        return index;
    }

    /**
     * Calls the given call reads from directly, in body order.
     */
    public List<String> dependenciesOf(String callName) {
        return inBodyOrder(graph.outgoingEdgesOf(callName).stream().map(NamedEdge::dependency).collect(Collectors.toSet()));
    }

    /**
     * Calls that read from the given call directly, in body order.
     */
    public List<String> dependentsOf(String callName) {
        return inBodyOrder(graph.incomingEdgesOf(callName).stream().map(NamedEdge::dependent).collect(Collectors.toSet()));
    }

    public int dependencyCount() {
        return graph.edgeSet().size();
    }

    /**
     * Strongly connected components that form a cycle, including single calls reading their own outputs. Call names
     * within a component and the components themselves are in body order.
     */
    public List<List<String>> cycles() {
        var inspector = new KosarajuStrongConnectivityInspector<>(graph);
        return inspector.stronglyConnectedSets()
                .stream()
                .filter(component -> component.size() > 1 || graph.containsEdge(component.iterator().next(),
                        component.iterator().next()))
                .map(this::inBodyOrder)
                .sorted(Comparator.comparingInt(component -> index.position(component.get(0))))
                .collect(Collectors.toList());
    }

    public boolean hasCycles() {
        return !cycles().isEmpty();
    }

    List<String> inBodyOrder(Set<String> callNames) {
        return callNames.stream().sorted(Comparator.comparingInt(index::position)).collect(Collectors.toList());
    }

    public String toDotFormat() {
        var exporter = new DOTExporter<String, NamedEdge>();
        exporter.setVertexAttributeProvider((v) -> {
            Map<String, Attribute> map = new LinkedHashMap<>();
            map.put("label", DefaultAttribute.createAttribute(v));
            index.call(v).filter(Call::isScattered).ifPresent(call -> map.put("shape", DefaultAttribute.createAttribute("box3d")));
            index.call(v)
                    .filter(Call::isConditional)
                    .ifPresent(call -> map.put("style", DefaultAttribute.createAttribute("dashed")));
            return map;
        });
        exporter.setEdgeAttributeProvider((e) -> {
            Map<String, Attribute> map = new LinkedHashMap<>();
            map.put("label", DefaultAttribute.createAttribute(e.name()));
            return map;
        });
        var writer = new StringWriter();
        exporter.exportGraph(graph, writer);
        return writer.toString();
    }
}
