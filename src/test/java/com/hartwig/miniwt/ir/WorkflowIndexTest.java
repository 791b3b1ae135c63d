package com.hartwig.miniwt.ir;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertThrows;

import com.hartwig.miniwt.expression.Interpolation;

import org.junit.jupiter.api.Test;

class WorkflowIndexTest {
    private final Task task = Task.builder().name("t").command(Interpolation.ofText("true")).build();

    @Test
    void resolvesCallsAndTasksByName() {
        var workflow = Workflow.builder()
                .name("w")
                .putTasks("t", task)
                .addCalls(Call.builder().name("first").taskName("t").build())
                .addCalls(Call.builder().name("second").taskName("missing").build())
                .build();
        var index = WorkflowIndex.of(workflow);

        assertThat(index.position("second")).isEqualTo(1);
        assertThat(index.taskOf(index.call("first").orElseThrow())).contains(task);
        assertThat(index.taskOf(index.call("second").orElseThrow())).isEmpty();
        assertThat(index.hasCall("third")).isFalse();
    }

    @Test
    void duplicateCallNamesAreRejected() {
        var workflow = Workflow.builder()
                .name("w")
                .putTasks("t", task)
                .addCalls(Call.builder().name("same").taskName("t").build())
                .addCalls(Call.builder().name("same").taskName("t").build())
                .build();

        var e = assertThrows(IllegalArgumentException.class, () -> WorkflowIndex.of(workflow));
        assertThat(e.getMessage()).isEqualTo("Duplicate call name 'same' in workflow 'w'");
    }

    @Test
    void unknownCallHasNoPosition() {
        var index = WorkflowIndex.of(Workflow.builder().name("w").build());

        assertThrows(IllegalArgumentException.class, () -> index.position("nope"));
    }
}
