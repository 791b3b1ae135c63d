package com.hartwig.miniwt.graph;

import java.util.LinkedHashMap;
import java.util.Map;

import org.immutables.value.Value;

@Value.Immutable
@Value.Style(jdkOnly = true)
public interface WorkflowStatistics {
    int taskCount();

    int callCount();

    /**
     * Number of distinct (dependent, dependency) call pairs.
     */
    int dependencyCount();

    /**
     * Number of calls on the unweighted critical path.
     */
    int criticalPathLength();

    int maxParallelism();

    /**
     * Number of dependency levels.
     */
    int parallelGroups();

    boolean hasScatter();

    boolean hasConditional();

    default Map<String, Object> toMap() {
        var map = new LinkedHashMap<String, Object>();
        map.put("task_count", taskCount());
        map.put("call_count", callCount());
        map.put("dependency_count", dependencyCount());
        map.put("critical_path_length", criticalPathLength());
        map.put("max_parallelism", maxParallelism());
        map.put("parallel_groups", parallelGroups());
        map.put("has_scatter", hasScatter());
        map.put("has_conditional", hasConditional());
        return map;
    }

    static ImmutableWorkflowStatistics.Builder builder() {
        return ImmutableWorkflowStatistics.builder();
    }
}
