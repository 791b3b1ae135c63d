package com.hartwig.miniwt.wdl;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

import com.hartwig.miniwt.diagnostics.DiagnosticKind;
import com.hartwig.miniwt.diagnostics.Diagnostics;
import com.hartwig.miniwt.diagnostics.UnsupportedConstructException;
import com.hartwig.miniwt.expression.Expression;
import com.hartwig.miniwt.ir.Call;
import com.hartwig.miniwt.ir.DataType;
import com.hartwig.miniwt.ir.Declaration;
import com.hartwig.miniwt.ir.Document;
import com.hartwig.miniwt.ir.Frame;
import com.hartwig.miniwt.ir.Runtime;
import com.hartwig.miniwt.ir.Task;
import com.hartwig.miniwt.ir.Workflow;
import com.hartwig.miniwt.language.TranslatorOptions;
import com.hartwig.miniwt.language.WorkflowWriter;
import com.hartwig.miniwt.language.WriteResult;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public class WdlWriter implements WorkflowWriter {
    private static final Logger LOGGER = LoggerFactory.getLogger(WdlWriter.class);

    private static final String INDENT = "    ";
    private static final Set<String> RESERVED = Set.of("version",
            "import",
            "as",
            "task",
            "workflow",
            "struct",
            "input",
            "output",
            "command",
            "runtime",
            "meta",
            "parameter_meta",
            "call",
            "scatter",
            "in",
            "if",
            "then",
            "else",
            "true",
            "false",
            "None",
            "object",
            "alias");

    private final TranslatorOptions options;

    public WdlWriter() {
        this(TranslatorOptions.defaults());
    }

    public WdlWriter(final TranslatorOptions options) {
        this.options = options;
    }

    @Override
    public WriteResult write(Document document) throws UnsupportedConstructException {
        var diagnostics = new Diagnostics(options.strict());
        var out = new StringBuilder("version ").append(options.wdlVersion()).append("\n");
        if (document.workflow().isPresent()) {
            var workflow = document.workflow().get();
            for (Task task : workflow.tasks().values()) {
                out.append("\n");
                writeTask(task, out, diagnostics);
            }
            out.append("\n");
            writeWorkflow(workflow, out, diagnostics);
        } else {
            out.append("\n");
            writeTask(document.task().orElseThrow(), out, diagnostics);
        }
        LOGGER.debug("Wrote WDL for [{}] with {} diagnostic(s)", document.name(), diagnostics.entries().size());
        return WriteResult.of(out.toString(), diagnostics.entries());
    }

    private void writeTask(Task task, StringBuilder out, Diagnostics diagnostics) throws UnsupportedConstructException {
        var location = String.format("task '%s'", task.name());
        var renderer = new WdlExpressionRenderer(WdlWriter::identifier);
        out.append("task ").append(identifier(task.name())).append(" {\n");

        if (!task.inputs().isEmpty()) {
            out.append(INDENT).append("input {\n");
            for (Declaration input : task.inputs()) {
                writeDeclaration(input, location + " input", false, renderer, out, diagnostics);
            }
            out.append(INDENT).append("}\n\n");
        }

        out.append(INDENT).append("command <<<\n");
        for (String line : renderCommand(task, renderer, diagnostics).split("\n", -1)) {
            out.append(line.isBlank() ? "" : INDENT + INDENT + line).append("\n");
        }
        out.append(INDENT).append(">>>\n");

        if (!task.outputs().isEmpty()) {
            out.append("\n").append(INDENT).append("output {\n");
            for (Declaration output : task.outputs()) {
                writeDeclaration(output, location + " output", true, renderer, out, diagnostics);
            }
            out.append(INDENT).append("}\n");
        }

        if (task.runtime().isPresent() && !task.runtime().get().isEmpty()) {
            out.append("\n").append(INDENT).append("runtime {\n");
            writeRuntime(task.runtime().get(), location, renderer, out, diagnostics);
            out.append(INDENT).append("}\n");
        }

        writeMeta(task.description(), task.inputs(), task.outputs(), out);
        out.append("}\n");
    }

    private String renderCommand(Task task, WdlExpressionRenderer renderer, Diagnostics diagnostics)
            throws UnsupportedConstructException {
        var command = new StringBuilder();
        for (var part : task.command().parts()) {
            if (part.isText()) {
                command.append(part.text().orElseThrow());
                continue;
            }
            var rendered = tryRender(() -> renderer.renderPlaceholder(part.expression().orElseThrow()));
            if (rendered.isPresent()) {
                command.append("~{").append(rendered.get()).append("}");
            } else {
                diagnostics.unsupported(DiagnosticKind.UNSUPPORTED_EXPRESSION,
                        String.format("task '%s' command", task.name()),
                        "JavaScript placeholder dropped from the command");
            }
        }
        return command.toString();
    }

    private void writeDeclaration(Declaration declaration, String kind, boolean output, WdlExpressionRenderer renderer,
            StringBuilder out, Diagnostics diagnostics) throws UnsupportedConstructException {
        var location = String.format("%s '%s'", kind, declaration.name());
        var expression = declaration.expression().map(e -> tryRender(() -> renderer.render(e)));
        if (output && (expression.isEmpty() || expression.get().isEmpty())) {
            diagnostics.unsupported(DiagnosticKind.UNSUPPORTED_OUTPUT, location, "Output has no WDL expression and was dropped");
            return;
        }
        var type = renderType(declaration.type(), location, diagnostics);
        out.append(INDENT).append(INDENT).append(type).append(" ").append(identifier(declaration.name()));
        if (expression.isPresent() && expression.get().isPresent()) {
            out.append(" = ").append(expression.get().get());
        } else if (expression.isPresent()) {
            diagnostics.unsupported(DiagnosticKind.UNSUPPORTED_EXPRESSION, location, "JavaScript default value dropped");
        }
        out.append("\n");
    }

    private void writeRuntime(Runtime runtime, String location, WdlExpressionRenderer renderer, StringBuilder out,
            Diagnostics diagnostics) throws UnsupportedConstructException {
        runtime.container().ifPresent(image -> attribute(out, "docker", "\"" + WdlExpressionRenderer.escape(image) + "\""));
        runtime.cpu().ifPresent(cpu -> attribute(out, "cpu", String.valueOf(cpu)));
        runtime.memory().ifPresent(memory -> attribute(out, "memory", "\"" + memory.toMebibytes() + " MiB\""));
        runtime.disk().ifPresent(disk -> attribute(out, "disks", "\"local-disk " + disk.toGibibytes() + " HDD\""));
        runtime.maxRetries().ifPresent(retries -> attribute(out, "maxRetries", String.valueOf(retries)));
        runtime.preemptible().ifPresent(attempts -> attribute(out, "preemptible", String.valueOf(attempts)));
        for (Map.Entry<String, Expression> custom : runtime.customAttributes().entrySet()) {
            var fieldLocation = String.format("%s runtime '%s'", location, custom.getKey());
            if (Runtime.isRequirement(custom.getKey())) {
                diagnostics.info(DiagnosticKind.UNSUPPORTED_REQUIREMENT,
                        fieldLocation,
                        "Requirement has no WDL runtime equivalent and was dropped");
                continue;
            }
            var rendered = tryRender(() -> renderer.render(custom.getValue()));
            if (rendered.isPresent()) {
                attribute(out, identifier(custom.getKey()), rendered.get());
            } else {
                diagnostics.unsupported(DiagnosticKind.UNSUPPORTED_EXPRESSION, fieldLocation, "JavaScript runtime value dropped");
            }
        }
    }

    private static void attribute(StringBuilder out, String name, String value) {
        out.append(INDENT).append(INDENT).append(name).append(": ").append(value).append("\n");
    }

    private static void writeMeta(Optional<String> description, List<Declaration> inputs, List<Declaration> outputs,
            StringBuilder out) {
        description.ifPresent(text -> out.append("\n")
                .append(INDENT)
                .append("meta {\n")
                .append(INDENT)
                .append(INDENT)
                .append("description: \"")
                .append(WdlExpressionRenderer.escape(text))
                .append("\"\n")
                .append(INDENT)
                .append("}\n"));
        var described = new ArrayList<Declaration>();
        inputs.stream().filter(declaration -> declaration.description().isPresent()).forEach(described::add);
        outputs.stream().filter(declaration -> declaration.description().isPresent()).forEach(described::add);
        if (!described.isEmpty()) {
            out.append("\n").append(INDENT).append("parameter_meta {\n");
            for (Declaration declaration : described) {
                out.append(INDENT)
                        .append(INDENT)
                        .append(identifier(declaration.name()))
                        .append(": \"")
                        .append(WdlExpressionRenderer.escape(declaration.description().orElseThrow()))
                        .append("\"\n");
            }
            out.append(INDENT).append("}\n");
        }
    }

    private void writeWorkflow(Workflow workflow, StringBuilder out, Diagnostics diagnostics) throws UnsupportedConstructException {
        var location = String.format("workflow '%s'", workflow.name());
        var renderer = new WdlExpressionRenderer(WdlWriter::identifier);
        out.append("workflow ").append(identifier(workflow.name())).append(" {\n");
        if (!workflow.inputs().isEmpty()) {
            out.append(INDENT).append("input {\n");
            for (Declaration input : workflow.inputs()) {
                writeDeclaration(input, location + " input", false, renderer, out, diagnostics);
            }
            out.append(INDENT).append("}\n\n");
        }

        writeCalls(workflow.calls(), renderer, out, diagnostics);

        if (!workflow.outputs().isEmpty()) {
            out.append("\n").append(INDENT).append("output {\n");
            for (Declaration output : workflow.outputs()) {
                writeDeclaration(output, location + " output", true, renderer, out, diagnostics);
            }
            out.append(INDENT).append("}\n");
        }
        writeMeta(workflow.description(), workflow.inputs(), workflow.outputs(), out);
        out.append("}\n");
    }

    /**
     * Rebuilds scatter and conditional blocks from the frames of consecutive calls sharing block ids.
     */
    private void writeCalls(List<Call> calls, WdlExpressionRenderer renderer, StringBuilder out, Diagnostics diagnostics)
            throws UnsupportedConstructException {
        var open = new ArrayList<Frame>();
        for (Call call : calls) {
            var frames = writableFrames(call, renderer, diagnostics);
            var shared = 0;
            while (shared < open.size() && shared < frames.size() && open.get(shared).blockId().equals(frames.get(shared).blockId())) {
                shared++;
            }
            while (open.size() > shared) {
                open.remove(open.size() - 1);
                out.append(INDENT.repeat(open.size() + 1)).append("}\n");
            }
            for (Frame frame : frames.subList(shared, frames.size())) {
                var indent = INDENT.repeat(open.size() + 1);
                var expression = renderer.render(frame.expression());
                if (frame.kind() == Frame.Kind.SCATTER) {
                    out.append(indent)
                            .append("scatter (")
                            .append(identifier(frame.variable().orElseThrow()))
                            .append(" in ")
                            .append(expression)
                            .append(") {\n");
                } else {
                    out.append(indent).append("if (").append(expression).append(") {\n");
                }
                open.add(frame);
            }
            writeCall(call, INDENT.repeat(open.size() + 1), renderer, out, diagnostics);
        }
        while (!open.isEmpty()) {
            open.remove(open.size() - 1);
            out.append(INDENT.repeat(open.size() + 1)).append("}\n");
        }
    }

    private List<Frame> writableFrames(Call call, WdlExpressionRenderer renderer, Diagnostics diagnostics)
            throws UnsupportedConstructException {
        var frames = new ArrayList<Frame>();
        for (Frame frame : call.frames()) {
            if (tryRender(() -> renderer.render(frame.expression())).isPresent()) {
                frames.add(frame);
            } else {
                diagnostics.unsupported(DiagnosticKind.UNSUPPORTED_EXPRESSION,
                        String.format("call '%s' %s", call.name(), frame.kind() == Frame.Kind.SCATTER ? "scatter" : "condition"),
                        "JavaScript block expression dropped, the call is no longer guarded by it");
            }
        }
        return frames;
    }

    private void writeCall(Call call, String indent, WdlExpressionRenderer renderer, StringBuilder out, Diagnostics diagnostics)
            throws UnsupportedConstructException {
        var taskName = identifier(call.taskName());
        var callName = identifier(call.name());
        out.append(indent).append("call ").append(taskName);
        if (!callName.equals(taskName)) {
            out.append(" as ").append(callName);
        }
        var bindings = new ArrayList<String>();
        for (Map.Entry<String, Expression> input : call.inputs().entrySet()) {
            var rendered = tryRender(() -> renderer.render(input.getValue()));
            if (rendered.isPresent()) {
                bindings.add(identifier(input.getKey()) + " = " + rendered.get());
            } else {
                diagnostics.unsupported(DiagnosticKind.UNSUPPORTED_EXPRESSION,
                        String.format("call '%s' input '%s'", call.name(), input.getKey()),
                        "JavaScript input binding dropped");
            }
        }
        if (bindings.isEmpty()) {
            out.append("\n");
            return;
        }
        out.append(" {\n").append(indent).append(INDENT).append("input:\n");
        for (var i = 0; i < bindings.size(); i++) {
            out.append(indent).append(INDENT).append(INDENT).append(bindings.get(i)).append(i < bindings.size() - 1 ? ",\n" : "\n");
        }
        out.append(indent).append("}\n");
    }

    private static String renderType(DataType type, String location, Diagnostics diagnostics) throws UnsupportedConstructException {
        String rendered;
        switch (type.kind()) {
            case STRING:
                rendered = "String";
                break;
            case INT:
                rendered = "Int";
                break;
            case FLOAT:
                rendered = "Float";
                break;
            case BOOLEAN:
                rendered = "Boolean";
                break;
            case FILE:
                rendered = "File";
                break;
            case DIRECTORY:
                diagnostics.unsupported(DiagnosticKind.DEGRADED_TYPE, location, "WDL 1.0 has no Directory type, written as File");
                rendered = "File";
                break;
            case ARRAY:
                rendered = "Array[" + renderType(type.itemType().orElseThrow(), location, diagnostics) + "]";
                break;
            case MAP:
                rendered = "Map[" + renderType(type.keyType().orElseThrow(), location, diagnostics) + ", " + renderType(type.valueType()
                        .orElseThrow(), location, diagnostics) + "]";
                break;
            default:
                diagnostics.unsupported(DiagnosticKind.DEGRADED_TYPE, location, "Untyped value written as String");
                rendered = "String";
                break;
        }
        return type.optional() ? rendered + "?" : rendered;
    }

    /**
     * Valid WDL identifier for a name, stable across calls.
     */
    static String identifier(String name) {
        var sanitized = name.replaceAll("[^A-Za-z0-9_]", "_");
        if (sanitized.isEmpty() || !Character.isLetter(sanitized.charAt(0))) {
            sanitized = "v" + sanitized;
        }
        return RESERVED.contains(sanitized) ? sanitized + "_" : sanitized;
    }

    private static Optional<String> tryRender(RenderAction action) {
        try {
            return Optional.of(action.render());
        } catch (UnrenderableExpressionException e) {
            LOGGER.debug("Expression not renderable as WDL: {}", e.getMessage());
            return Optional.empty();
        }
    }

    @FunctionalInterface
    private interface RenderAction {
        String render();
    }
}
