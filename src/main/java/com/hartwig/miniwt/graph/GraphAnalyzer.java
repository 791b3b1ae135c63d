package com.hartwig.miniwt.graph;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.PriorityQueue;
import java.util.Set;

import com.hartwig.miniwt.ir.Call;
import com.hartwig.miniwt.ir.Workflow;
import com.hartwig.miniwt.ir.WorkflowIndex;

import org.jgrapht.graph.EdgeReversedGraph;
import org.jgrapht.traverse.DepthFirstIterator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Structural queries over a validated, acyclic workflow. All results are deterministic: ties are broken by the
 * position of calls in the workflow body.
 */
public class GraphAnalyzer {
    private static final Logger LOGGER = LoggerFactory.getLogger(GraphAnalyzer.class);

    private static final double DEFAULT_WEIGHT = 1.0;

    private final WorkflowIndex index;
    private final CallGraph callGraph;

    public GraphAnalyzer(final Workflow workflow) {
        this(CallGraph.of(workflow));
    }

    public GraphAnalyzer(final CallGraph callGraph) {
        if (callGraph.hasCycles()) {
            throw new IllegalArgumentException(String.format("Workflow '%s' has cyclic call dependencies %s",
                    callGraph.index().workflow().name(),
                    callGraph.cycles()));
        }
        this.index = callGraph.index();
        this.callGraph = callGraph;
    }

    public CallGraph callGraph() {
        return callGraph;
    }

    /**
     * Topological order, dependencies first. Among calls that are ready at the same time the earliest in the body goes
     * first.
     */
    public List<String> executionOrder() {
        var remaining = new HashMap<String, Integer>();
        var ready = new PriorityQueue<String>(Comparator.comparingInt(index::position));
        for (Call call : index.calls()) {
            var dependencies = callGraph.dependenciesOf(call.name()).size();
            remaining.put(call.name(), dependencies);
            if (dependencies == 0) {
                ready.add(call.name());
            }
        }
        var order = new ArrayList<String>();
        while (!ready.isEmpty()) {
            var next = ready.poll();
            order.add(next);
            for (String dependent : callGraph.dependentsOf(next)) {
                if (remaining.merge(dependent, -1, Integer::sum) == 0) {
                    ready.add(dependent);
                }
            }
        }
        return order;
    }

    /**
     * Level of each call: 1 without dependencies, otherwise one more than its deepest dependency.
     */
    public Map<String, Integer> levels() {
        var levels = new LinkedHashMap<String, Integer>();
        for (String callName : executionOrder()) {
            var level = callGraph.dependenciesOf(callName).stream().mapToInt(levels::get).max().orElse(0) + 1;
            levels.put(callName, level);
        }
        return levels;
    }

    /**
     * Calls per level, calls within a level in body order.
     */
    public List<List<String>> parallelGroups() {
        var groups = new ArrayList<List<String>>();
        var levels = levels();
        for (Call call : index.calls()) {
            var level = levels.get(call.name());
            while (groups.size() < level) {
                groups.add(new ArrayList<>());
            }
            groups.get(level - 1).add(call.name());
        }
        return groups;
    }

    public int maxParallelism() {
        return parallelGroups().stream().mapToInt(List::size).max().orElse(0);
    }

    public CriticalPath criticalPath() {
        return criticalPath(Map.of());
    }

    /**
     * Longest path where each call costs the weight of its task, 1 for tasks without a weight.
     */
    public CriticalPath criticalPath(Map<String, Double> taskWeights) {
        if (index.calls().isEmpty()) {
            return CriticalPath.empty();
        }
        var distance = new HashMap<String, Double>();
        var predecessor = new HashMap<String, String>();
        for (String callName : executionOrder()) {
            var best = 0.0;
            String via = null;
            for (String dependency : callGraph.dependenciesOf(callName)) {
                if (via == null || distance.get(dependency) > best) {
                    best = distance.get(dependency);
                    via = dependency;
                }
            }
            if (via != null) {
                predecessor.put(callName, via);
            }
            var weight = taskWeights.getOrDefault(index.call(callName).orElseThrow().taskName(), DEFAULT_WEIGHT);
            distance.put(callName, best + weight);
        }

        String end = null;
        for (Call call : index.calls()) {
            if (end == null || distance.get(call.name()) > distance.get(end)) {
                end = call.name();
            }
        }
        var path = new ArrayList<String>();
        for (var current = end; current != null; current = predecessor.get(current)) {
            path.add(current);
        }
        Collections.reverse(path);
        LOGGER.debug("Critical path of workflow [{}] is {} with length {}", index.workflow().name(), path, distance.get(end));
        return CriticalPath.of(path, distance.get(end));
    }

    /**
     * Every call the given call depends on, directly or transitively, in body order.
     */
    public List<String> dependencies(String callName) {
        return reachable(new DepthFirstIterator<>(callGraph.graph(), requireCall(callName)), callName);
    }

    /**
     * Every call depending on the given call, directly or transitively, in body order.
     */
    public List<String> dependents(String callName) {
        return reachable(new DepthFirstIterator<>(new EdgeReversedGraph<>(callGraph.graph()), requireCall(callName)), callName);
    }

    private List<String> reachable(DepthFirstIterator<String, NamedEdge> iterator, String start) {
        Set<String> reached = new HashSet<>();
        while (iterator.hasNext()) {
            reached.add(iterator.next());
        }
        reached.remove(start);
        return callGraph.inBodyOrder(reached);
    }

    private String requireCall(String callName) {
        if (!index.hasCall(callName)) {
            throw new IllegalArgumentException(String.format("Unknown call '%s'", callName));
        }
        return callName;
    }

    public WorkflowStatistics statistics() {
        var workflow = index.workflow();
        return WorkflowStatistics.builder()
                .taskCount(workflow.tasks().size())
                .callCount(workflow.calls().size())
                .dependencyCount(callGraph.dependencyCount())
                .criticalPathLength(criticalPath().calls().size())
                .maxParallelism(maxParallelism())
                .parallelGroups(parallelGroups().size())
                .hasScatter(workflow.calls().stream().anyMatch(Call::isScattered))
                .hasConditional(workflow.calls().stream().anyMatch(Call::isConditional))
                .build();
    }

    public String toDotFormat() {
        return callGraph.toDotFormat();
    }
}
