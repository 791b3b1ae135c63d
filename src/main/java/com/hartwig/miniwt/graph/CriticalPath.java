package com.hartwig.miniwt.graph;

import java.util.List;

import org.immutables.value.Value;

/**
 * Longest chain of dependent calls, in execution order. The length is the number of calls, or the summed task
 * weights when the path was computed with weights.
 */
@Value.Immutable
@Value.Style(jdkOnly = true)
public interface CriticalPath {
    @Value.Parameter
    List<String> calls();

    @Value.Parameter
    double length();

    static CriticalPath of(List<String> calls, double length) {
        return ImmutableCriticalPath.of(calls, length);
    }

    static CriticalPath empty() {
        return of(List.of(), 0);
    }
}
