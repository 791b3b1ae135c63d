package com.hartwig.miniwt.ir;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.stream.Collectors;

import com.hartwig.miniwt.expression.Expression;

import org.immutables.value.Value;

@Value.Immutable
@Value.Style(jdkOnly = true)
public interface Call {
    /**
     * Unique within the workflow, the alias if one was given.
     */
    String name();

    /**
     * Name of the called task, looked up in the workflow's tasks.
     */
    String taskName();

    /**
     * Argument bindings by task input name, in source order.
     */
    Map<String, Expression> inputs();

    /**
     * Enclosing blocks, outermost first.
     */
    List<Frame> frames();

    default List<String> blockIds() {
        return frames().stream().map(Frame::blockId).collect(Collectors.toList());
    }

    default Optional<Frame> scatterFrameFor(String variable) {
        return frames().stream().filter(frame -> frame.variable().map(variable::equals).orElse(false)).findFirst();
    }

    default boolean isScattered() {
        return frames().stream().anyMatch(frame -> frame.kind() == Frame.Kind.SCATTER);
    }

    default boolean isConditional() {
        return frames().stream().anyMatch(frame -> frame.kind() == Frame.Kind.CONDITIONAL);
    }

    static ImmutableCall.Builder builder() {
        return ImmutableCall.builder();
    }
}
