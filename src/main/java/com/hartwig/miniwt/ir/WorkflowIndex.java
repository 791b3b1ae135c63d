package com.hartwig.miniwt.ir;

import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Lookup tables over a workflow, built once. Relations between calls and tasks are resolved through here.
 */
public class WorkflowIndex {
    private final Workflow workflow;
    private final Map<String, Call> callsByName = new LinkedHashMap<>();
    private final Map<String, Integer> positionsByName = new LinkedHashMap<>();

    private WorkflowIndex(final Workflow workflow) {
        this.workflow = workflow;
        var position = 0;
        for (Call call : workflow.calls()) {
            if (callsByName.putIfAbsent(call.name(), call) != null) {
                throw new IllegalArgumentException(String.format("Duplicate call name '%s' in workflow '%s'",
                        call.name(),
                        workflow.name()));
            }
            positionsByName.put(call.name(), position++);
        }
    }

    public static WorkflowIndex of(Workflow workflow) {
        return new WorkflowIndex(workflow);
    }

    public Workflow workflow() {
        return workflow;
    }

    public Optional<Call> call(String name) {
        return Optional.ofNullable(callsByName.get(name));
    }

    public Collection<Call> calls() {
        return callsByName.values();
    }

    public Optional<Task> task(String name) {
        return Optional.ofNullable(workflow.tasks().get(name));
    }

    /**
     * The task a call invokes, if it exists.
     */
    public Optional<Task> taskOf(Call call) {
        return task(call.taskName());
    }

    /**
     * Position of the call in the workflow body, used for deterministic ordering.
     */
    public int position(String callName) {
        var position = positionsByName.get(callName);
        if (position == null) {
            throw new IllegalArgumentException(String.format("Unknown call '%s'", callName));
        }
        return position;
    }

    public boolean hasCall(String name) {
        return callsByName.containsKey(name);
    }
}
