package com.hartwig.miniwt.cwl;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.hartwig.miniwt.diagnostics.DiagnosticKind;
import com.hartwig.miniwt.diagnostics.Diagnostics;
import com.hartwig.miniwt.diagnostics.UnsupportedConstructException;
import com.hartwig.miniwt.expression.ArrayLiteral;
import com.hartwig.miniwt.expression.Expression;
import com.hartwig.miniwt.expression.Expressions;
import com.hartwig.miniwt.expression.FunctionCall;
import com.hartwig.miniwt.expression.Interpolation;
import com.hartwig.miniwt.expression.Literal;
import com.hartwig.miniwt.expression.MemberRef;
import com.hartwig.miniwt.expression.Operation;
import com.hartwig.miniwt.expression.Operator;
import com.hartwig.miniwt.expression.TemplatePart;
import com.hartwig.miniwt.expression.VariableRef;
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

/**
 * Writes a document as CWL. A workflow becomes a packed {@code $graph} with the workflow under id {@code main} and one
 * CommandLineTool per task, a single task becomes a standalone CommandLineTool.
 */
public class CwlWriter implements WorkflowWriter {
    private static final Logger LOGGER = LoggerFactory.getLogger(CwlWriter.class);

    private static final JsonNodeFactory NODES = JsonNodeFactory.instance;
    private static final String MAIN = "main";
    private static final String STDOUT_FILE = "stdout.txt";
    private static final String STDERR_FILE = "stderr.txt";

    private final TranslatorOptions options;
    private final ObjectMapper objectMapper;

    public CwlWriter() {
        this(TranslatorOptions.defaults());
    }

    public CwlWriter(final TranslatorOptions options) {
        this.options = options;
        this.objectMapper = CwlYaml.mapper();
    }

    @Override
    public WriteResult write(Document document) throws UnsupportedConstructException {
        var diagnostics = new Diagnostics(options.strict());
        var root = NODES.objectNode();
        root.put("cwlVersion", options.cwlVersion());
        if (document.task().isPresent()) {
            new ToolWriter(document.task().get(), diagnostics).write(root, Optional.empty());
        } else {
            var workflow = document.workflow().orElseThrow();
            var toolIds = toolIds(workflow);
            var graph = root.putArray("$graph");
            for (Task task : workflow.tasks().values()) {
                new ToolWriter(task, diagnostics).write(graph.addObject(), Optional.of(toolIds.get(task.name())));
            }
            writeWorkflow(workflow, toolIds, graph.addObject(), diagnostics);
        }
        LOGGER.debug("Wrote CWL for [{}] with {} diagnostic(s)", document.name(), diagnostics.entries().size());
        return WriteResult.of(serialize(root), diagnostics.entries());
    }

    private String serialize(ObjectNode root) {
        try {
            return objectMapper.writeValueAsString(root);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Could not serialize CWL document", e);
        }
    }

    private static Map<String, String> toolIds(Workflow workflow) {
        var ids = new LinkedHashMap<String, String>();
        var used = new HashSet<String>();
        used.add(MAIN);
        for (String taskName : workflow.tasks().keySet()) {
            ids.put(taskName, unique(taskName.replaceAll("[^A-Za-z0-9_-]", "_"), used));
        }
        return ids;
    }

    private void writeWorkflow(Workflow workflow, Map<String, String> toolIds, ObjectNode node, Diagnostics diagnostics)
            throws UnsupportedConstructException {
        var location = String.format("workflow '%s'", workflow.name());
        node.put("class", "Workflow");
        node.put("id", MAIN);
        workflow.description().ifPresent(description -> node.put("doc", description));
        var requirements = node.putArray("requirements");

        var inputs = node.putObject("inputs");
        for (Declaration input : workflow.inputs()) {
            var inputLocation = String.format("%s input '%s'", location, input.name());
            var entry = inputs.putObject(input.name());
            entry.set("type", CwlTypes.render(input.type(), inputLocation, diagnostics));
            if (input.expression().isPresent()) {
                var value = literalNode(input.expression().get());
                if (value.isPresent()) {
                    entry.set("default", value.get());
                } else {
                    diagnostics.unsupported(DiagnosticKind.UNSUPPORTED_EXPRESSION, inputLocation, "Computed default value dropped");
                }
            }
            input.description().ifPresent(description -> entry.put("doc", description));
        }

        var outputs = node.putObject("outputs");
        for (Declaration output : workflow.outputs()) {
            var outputLocation = String.format("%s output '%s'", location, output.name());
            var source = output.expression().flatMap(CwlWriter::plainSource);
            if (source.isEmpty()) {
                diagnostics.unsupported(DiagnosticKind.UNSUPPORTED_OUTPUT,
                        outputLocation,
                        "Only call outputs and workflow inputs can be workflow outputs, output dropped");
                continue;
            }
            var entry = outputs.putObject(output.name());
            entry.set("type", CwlTypes.render(output.type(), outputLocation, diagnostics));
            entry.put("outputSource", source.get());
            output.description().ifPresent(description -> entry.put("doc", description));
        }

        var features = new WorkflowFeatures();
        var steps = node.putObject("steps");
        for (Call call : workflow.calls()) {
            new StepWriter(workflow, call, diagnostics, features).write(steps.putObject(call.name()), toolIds.get(call.taskName()));
        }
        if (features.scatter) {
            requirements.addObject().put("class", "ScatterFeatureRequirement");
        }
        if (features.stepInputExpression) {
            requirements.addObject().put("class", "StepInputExpressionRequirement");
        }
        if (features.multipleInput) {
            requirements.addObject().put("class", "MultipleInputFeatureRequirement");
        }
        if (features.javascript) {
            requirements.addObject().put("class", "InlineJavascriptRequirement");
        }
        if (requirements.isEmpty()) {
            node.remove("requirements");
        }
    }

    /**
     * {@code call/output} for call outputs, the input id for workflow inputs.
     */
    private static Optional<String> plainSource(Expression expression) {
        if (expression instanceof MemberRef) {
            var member = (MemberRef) expression;
            return Optional.of(member.callName() + "/" + member.outputName());
        }
        if (expression instanceof VariableRef) {
            return Optional.of(((VariableRef) expression).name());
        }
        return Optional.empty();
    }

    static Optional<JsonNode> literalNode(Expression expression) {
        if (expression instanceof Literal) {
            var literal = (Literal) expression;
            switch (literal.type()) {
                case STRING:
                    return Optional.of(NODES.textNode(literal.value()));
                case INT:
                    return Optional.of(NODES.numberNode(Long.parseLong(literal.value())));
                case FLOAT:
                    return Optional.of(NODES.numberNode(new BigDecimal(literal.value())));
                case BOOLEAN:
                    return Optional.of(NODES.booleanNode(Boolean.parseBoolean(literal.value())));
                default:
                    return Optional.of(NODES.nullNode());
            }
        }
        if (expression instanceof ArrayLiteral) {
            var array = NODES.arrayNode();
            for (Expression item : ((ArrayLiteral) expression).items()) {
                var value = literalNode(item);
                if (value.isEmpty()) {
                    return Optional.empty();
                }
                array.add(value.get());
            }
            return Optional.of(array);
        }
        return Optional.empty();
    }

    private static String unique(String base, Set<String> used) {
        var name = base;
        var suffix = 2;
        while (used.contains(name)) {
            name = base + "_" + suffix++;
        }
        used.add(name);
        return name;
    }

    private static final class WorkflowFeatures {
        private boolean scatter;
        private boolean stepInputExpression;
        private boolean multipleInput;
        private boolean javascript;
    }

    /**
     * Writes one task as a CommandLineTool. Inputs whose default is computed from other inputs have no CWL
     * counterpart and are inlined wherever the task uses them.
     */
    private class ToolWriter {
        private final Task task;
        private final Diagnostics diagnostics;
        private final String location;
        private final Map<String, Expression> computedDefaults;
        private final CwlExpressionRenderer renderer;
        private boolean stdoutUsed;
        private boolean stderrUsed;

        private ToolWriter(final Task task, final Diagnostics diagnostics) {
            this.task = task;
            this.diagnostics = diagnostics;
            this.location = String.format("task '%s'", task.name());
            this.computedDefaults = computedDefaults(task);
            this.renderer = new CwlExpressionRenderer(variable -> "inputs." + variable.name(), member -> {
                throw new UnrenderableExpressionException("Call outputs are not visible inside a task");
            }, name -> task.input(name).map(Declaration::type));
        }

        private void write(ObjectNode tool, Optional<String> id) throws UnsupportedConstructException {
            var inputs = NODES.objectNode();
            for (Declaration input : task.inputs()) {
                if (computedDefaults.containsKey(input.name())) {
                    LOGGER.debug("Inlining computed default of input [{}] of {}", input.name(), location);
                    continue;
                }
                var inputLocation = String.format("%s input '%s'", location, input.name());
                var entry = inputs.putObject(input.name());
                entry.set("type", CwlTypes.render(input.type(), inputLocation, diagnostics));
                input.expression().flatMap(CwlWriter::literalNode).ifPresent(value -> entry.set("default", value));
                input.description().ifPresent(description -> entry.put("doc", description));
            }

            var command = renderCommand();
            var outputs = NODES.objectNode();
            for (Declaration output : task.outputs()) {
                writeOutput(output, outputs);
            }
            var requirements = requirements(!command.isEmpty());

            tool.put("class", "CommandLineTool");
            id.ifPresent(value -> tool.put("id", value));
            task.description().ifPresent(description -> tool.put("doc", description));
            if (!requirements.isEmpty()) {
                tool.set("requirements", requirements);
            }
            if (!command.isEmpty()) {
                var argument = tool.putArray("arguments").addObject();
                argument.put("valueFrom", command);
                argument.put("shellQuote", false);
            }
            if (stdoutUsed) {
                tool.put("stdout", STDOUT_FILE);
            }
            if (stderrUsed) {
                tool.put("stderr", STDERR_FILE);
            }
            tool.set("inputs", inputs);
            tool.set("outputs", outputs);
        }

        private String renderCommand() throws UnsupportedConstructException {
            var command = (Interpolation) Expressions.substitute(task.command(), computedDefaults);
            var result = new StringBuilder();
            for (TemplatePart part : command.parts()) {
                if (part.isText()) {
                    result.append(CwlExpressionRenderer.escape(part.text().orElseThrow()));
                    continue;
                }
                try {
                    result.append(renderer.renderValue(part.expression().orElseThrow()));
                } catch (UnrenderableExpressionException e) {
                    diagnostics.unsupported(DiagnosticKind.UNSUPPORTED_EXPRESSION,
                            location + " command",
                            "Placeholder dropped: " + e.getMessage());
                }
            }
            return result.toString();
        }

        private void writeOutput(Declaration output, ObjectNode outputs) throws UnsupportedConstructException {
            var outputLocation = String.format("%s output '%s'", location, output.name());
            var entry = NODES.objectNode();
            var expression = output.expression().map(value -> Expressions.substitute(value, computedDefaults));
            if (expression.filter(value -> isStream(value, CwlTypes.STDOUT) || isStream(value, CwlTypes.STDERR)).isPresent()
                    && output.type().kind() == DataType.Kind.FILE) {
                entry.put("type", isStream(expression.get(), CwlTypes.STDOUT) ? CwlTypes.STDOUT : CwlTypes.STDERR);
                output.description().ifPresent(description -> entry.put("doc", description));
                outputs.set(output.name(), entry);
                return;
            }
            entry.set("type", CwlTypes.render(output.type(), outputLocation, diagnostics));
            if (expression.isPresent()) {
                try {
                    entry.set("outputBinding", outputBinding(expression.get()));
                } catch (UnrenderableExpressionException e) {
                    diagnostics.unsupported(DiagnosticKind.UNSUPPORTED_OUTPUT, outputLocation, "Output binding dropped: " + e.getMessage());
                }
            } else {
                diagnostics.unsupported(DiagnosticKind.UNSUPPORTED_OUTPUT, outputLocation, "Output has no expression, binding left empty");
            }
            output.description().ifPresent(description -> entry.put("doc", description));
            outputs.set(output.name(), entry);
        }

        private ObjectNode outputBinding(Expression expression) {
            var binding = NODES.objectNode();
            if (expression instanceof FunctionCall) {
                var call = (FunctionCall) expression;
                var reader = outputEval(call.name());
                if (reader.isPresent() && call.args().size() == 1) {
                    binding.put("glob", glob(call.args().get(0)));
                    binding.put("loadContents", true);
                    binding.put("outputEval", reader.get());
                    return binding;
                }
                if (call.isNamed("glob") && call.args().size() == 1) {
                    binding.put("glob", glob(call.args().get(0)));
                    return binding;
                }
                if (call.isNamed(FunctionCall.JAVASCRIPT)) {
                    binding.put("outputEval", renderer.renderValue(call));
                    return binding;
                }
            }
            binding.put("glob", glob(expression));
            return binding;
        }

        private String glob(Expression expression) {
            if (isStream(expression, CwlTypes.STDOUT)) {
                stdoutUsed = true;
                return STDOUT_FILE;
            }
            if (isStream(expression, CwlTypes.STDERR)) {
                stderrUsed = true;
                return STDERR_FILE;
            }
            if (expression instanceof Literal && ((Literal) expression).isString()) {
                return CwlExpressionRenderer.escape(((Literal) expression).value());
            }
            if (expression instanceof Interpolation) {
                return renderer.renderTemplate((Interpolation) expression);
            }
            if (expression instanceof VariableRef) {
                return renderer.renderValue(expression);
            }
            throw new UnrenderableExpressionException("Output path has no glob equivalent");
        }

        private ArrayNode requirements(boolean shellCommand) throws UnsupportedConstructException {
            var requirements = NODES.arrayNode();
            if (shellCommand) {
                requirements.addObject().put("class", "ShellCommandRequirement");
            }
            if (renderer.javascriptUsed()) {
                requirements.addObject().put("class", "InlineJavascriptRequirement");
            }
            if (task.runtime().isEmpty()) {
                return requirements;
            }
            var runtime = task.runtime().get();
            runtime.container().ifPresent(image -> {
                var docker = requirements.addObject();
                docker.put("class", "DockerRequirement");
                docker.put("dockerPull", image);
            });
            if (runtime.cpu().isPresent() || runtime.memory().isPresent() || runtime.disk().isPresent()) {
                var resources = requirements.addObject();
                resources.put("class", "ResourceRequirement");
                runtime.cpu().ifPresent(cpu -> resources.put("coresMin", cpu));
                runtime.memory().ifPresent(memory -> resources.put("ramMin", memory.toMebibytes()));
                runtime.disk().ifPresent(disk -> resources.put("outdirMin", disk.toMebibytes()));
            }
            if (runtime.maxRetries().isPresent()) {
                diagnostics.unsupported(DiagnosticKind.UNSUPPORTED_RUNTIME_FIELD,
                        location + " runtime 'maxRetries'",
                        "CWL v1.2 has no retry count, field dropped");
            }
            if (runtime.preemptible().isPresent()) {
                diagnostics.unsupported(DiagnosticKind.UNSUPPORTED_RUNTIME_FIELD,
                        location + " runtime 'preemptible'",
                        "CWL v1.2 has no preemptible attempts, field dropped");
            }
            for (Map.Entry<String, Expression> attribute : runtime.customAttributes().entrySet()) {
                var requirement = Runtime.isRequirement(attribute.getKey()) ? requirement(attribute.getKey(), attribute.getValue()) : Optional.<ObjectNode>empty();
                if (requirement.isPresent()) {
                    requirements.add(requirement.get());
                } else {
                    diagnostics.unsupported(DiagnosticKind.UNSUPPORTED_RUNTIME_FIELD,
                            String.format("%s runtime '%s'", location, attribute.getKey()),
                            "Runtime attribute has no CWL v1.2 requirement, field dropped");
                }
            }
            return requirements;
        }

        private Optional<ObjectNode> requirement(String attribute, Expression value) {
            if (!(value instanceof Literal) || !((Literal) value).isString()) {
                return Optional.empty();
            }
            try {
                var node = CwlYaml.jsonMapper().readTree(((Literal) value).value());
                if (!node.isObject()) {
                    return Optional.empty();
                }
                var requirement = NODES.objectNode();
                requirement.put("class", attribute.substring(Runtime.REQUIREMENT_PREFIX.length()));
                node.fields().forEachRemaining(field -> {
                    if (!field.getKey().equals("class")) {
                        requirement.set(field.getKey(), field.getValue());
                    }
                });
                return Optional.of(requirement);
            } catch (JsonProcessingException e) {
                LOGGER.warn("Requirement [{}] of {} is not valid JSON: {}", attribute, location, e.getOriginalMessage());
                return Optional.empty();
            }
        }
    }

    private static Map<String, Expression> computedDefaults(Task task) {
        var computed = new LinkedHashMap<String, Expression>();
        for (Declaration input : task.inputs()) {
            if (input.expression().isPresent() && literalNode(input.expression().get()).isEmpty()) {
                computed.put(input.name(), Expressions.substitute(input.expression().get(), computed));
            }
        }
        return computed;
    }

    private static Optional<String> outputEval(String function) {
        switch (function) {
            case "read_int":
                return Optional.of("$(parseInt(self[0].contents))");
            case "read_float":
                return Optional.of("$(parseFloat(self[0].contents))");
            case "read_string":
                return Optional.of("$(self[0].contents.replace(/\\n$/, ''))");
            case "read_boolean":
                return Optional.of("$(self[0].contents.trim() == 'true')");
            default:
                return Optional.empty();
        }
    }

    private static boolean isStream(Expression expression, String stream) {
        return expression instanceof FunctionCall && ((FunctionCall) expression).isNamed(stream)
                && ((FunctionCall) expression).args().isEmpty();
    }

    /**
     * Writes one call as a workflow step. Values a binding or guard needs that are not plain sources travel through
     * hidden step inputs, which the tool does not declare.
     * <p>
     * An output of a call in the same scatter block is read one element at a time, so the step input carrying it is
     * scattered as well. CWL has no step input for such an element inside nested scatters.
     */
    private class StepWriter {
        private final Workflow workflow;
        private final Call call;
        private final Diagnostics diagnostics;
        private final WorkflowFeatures features;
        private final String location;
        private final Task task;
        private final Set<String> usedNames = new HashSet<>();
        private final Map<String, String> carriers = new HashMap<>();
        private final Map<String, String> memberCarriers = new HashMap<>();
        private final Map<String, DataType> types = new HashMap<>();
        private final Map<String, String> hiddenScatterCarriers = new HashMap<>();
        private final List<String> elementwise = new ArrayList<>();
        private final Set<String> scatterBlocks;
        private final CwlExpressionRenderer renderer;
        private ObjectNode in;

        private StepWriter(final Workflow workflow, final Call call, final Diagnostics diagnostics, final WorkflowFeatures features) {
            this.workflow = workflow;
            this.call = call;
            this.diagnostics = diagnostics;
            this.features = features;
            this.location = String.format("call '%s'", call.name());
            this.scatterBlocks = call.frames()
                    .stream()
                    .filter(frame -> frame.kind() == Frame.Kind.SCATTER)
                    .map(Frame::blockId)
                    .collect(Collectors.toSet());
            this.task = workflow.tasks().get(call.taskName());
            if (task != null) {
                task.inputs().forEach(input -> usedNames.add(input.name()));
            }
            usedNames.addAll(call.inputs().keySet());
            workflow.inputs().forEach(input -> types.put(input.name(), input.type()));
            this.renderer = new CwlExpressionRenderer(variable -> "inputs." + carriers.getOrDefault(variable.name(), variable.name()),
                    member -> {
                        var carrier = memberCarriers.get(member.callName() + "/" + member.outputName());
                        if (carrier == null) {
                            throw new UnrenderableExpressionException(String.format("No step input carries '%s.%s'",
                                    member.callName(),
                                    member.outputName()));
                        }
                        return "inputs." + carrier;
                    },
                    name -> Optional.ofNullable(types.get(name)));
        }

        private void write(ObjectNode step, String toolId) throws UnsupportedConstructException {
            step.put("run", "#" + toolId);
            in = step.putObject("in");
            var out = step.putArray("out");
            if (task != null) {
                task.outputs().forEach(output -> out.add(output.name()));
            }

            var computed = task == null ? Set.<String>of() : computedDefaults(task).keySet();
            var scattered = writeScatter(computed);
            for (Map.Entry<String, Expression> binding : call.inputs().entrySet()) {
                var bindingLocation = String.format("%s input '%s'", location, binding.getKey());
                if (computed.contains(binding.getKey())) {
                    diagnostics.unsupported(DiagnosticKind.UNSUPPORTED_EXPRESSION,
                            bindingLocation,
                            "Task input has a computed default and cannot be set by a CWL step, binding dropped");
                } else if (!scattered.contains(binding.getKey()) && !writeSource(binding.getKey(), binding.getValue())) {
                    writeValueFrom(binding.getKey(), binding.getValue(), bindingLocation);
                }
            }

            writeGuard(step);
            if (!elementwise.isEmpty()) {
                dropUnreadScatterCarriers(scattered);
            }

            var scatterInputs = new ArrayList<>(scattered);
            scatterInputs.addAll(elementwise);
            if (!scatterInputs.isEmpty()) {
                var scatter = step.putArray("scatter");
                scatterInputs.forEach(scatter::add);
                if (!elementwise.isEmpty() && scatterInputs.size() > 1) {
                    step.put("scatterMethod", "dotproduct");
                } else if (scattered.size() > 1) {
                    step.put("scatterMethod", "nested_crossproduct");
                }
                features.scatter = true;
            }
            features.javascript |= renderer.javascriptUsed();
        }

        /**
         * Whether the named call sits in one of the scatter blocks of this call.
         */
        private boolean sharesScatter(String callName) {
            return workflow.calls()
                    .stream()
                    .filter(other -> other.name().equals(callName))
                    .findFirst()
                    .map(other -> other.frames()
                            .stream()
                            .anyMatch(frame -> frame.kind() == Frame.Kind.SCATTER && scatterBlocks.contains(frame.blockId())))
                    .orElse(false);
        }

        private boolean readsScatteredSibling(Expression expression) {
            return expression instanceof MemberRef && sharesScatter(((MemberRef) expression).callName());
        }

        /**
         * The scattered sibling outputs already have the length of the collection, a hidden carrier nothing reads is left out.
         */
        private void dropUnreadScatterCarriers(List<String> scattered) {
            var referenced = new HashSet<String>();
            call.inputs().values().forEach(value -> Expressions.references(value).forEach(reference -> referenced.add(reference.name())));
            call.frames()
                    .stream()
                    .filter(frame -> frame.kind() == Frame.Kind.CONDITIONAL)
                    .forEach(frame -> Expressions.references(frame.expression()).forEach(reference -> referenced.add(reference.name())));
            for (Map.Entry<String, String> hidden : hiddenScatterCarriers.entrySet()) {
                if (!referenced.contains(hidden.getKey())) {
                    in.remove(hidden.getValue());
                    scattered.remove(hidden.getValue());
                    carriers.remove(hidden.getKey());
                }
            }
        }

        /**
         * Picks the step input carrying each scatter frame: a binding that is exactly the scatter variable, otherwise
         * a hidden input.
         */
        private List<String> writeScatter(Set<String> computed) throws UnsupportedConstructException {
            var scattered = new ArrayList<String>();
            for (Frame frame : call.frames()) {
                if (frame.kind() != Frame.Kind.SCATTER) {
                    continue;
                }
                var variable = frame.variable().orElseThrow();
                typeOf(frame.expression()).flatMap(DataType::itemType).ifPresent(type -> types.put(variable, type));
                var carrier = call.inputs()
                        .entrySet()
                        .stream()
                        .filter(binding -> binding.getValue().equals(VariableRef.of(variable)) && !computed.contains(binding.getKey())
                                && !scattered.contains(binding.getKey()))
                        .map(Map.Entry::getKey)
                        .findFirst()
                        .orElseGet(() -> unique(variable, usedNames));
                if (!writeSource(carrier, frame.expression())) {
                    diagnostics.unsupported(DiagnosticKind.UNSUPPORTED_EXPRESSION,
                            String.format("%s scatter over '%s'", location, variable),
                            "Scatter collection is not a plain source, scatter dropped");
                    continue;
                }
                if (!call.inputs().containsKey(carrier)) {
                    hiddenScatterCarriers.put(variable, carrier);
                }
                carriers.put(variable, carrier);
                scattered.add(carrier);
            }
            return scattered;
        }

        private boolean writeSource(String name, Expression expression) {
            if (expression instanceof VariableRef && carriers.containsKey(((VariableRef) expression).name())) {
                return false;
            }
            var source = plainSource(expression).filter(value -> !(expression instanceof VariableRef) || workflow.input(value).isPresent());
            if (source.isPresent()) {
                if (readsScatteredSibling(expression)) {
                    if (scatterBlocks.size() > 1) {
                        return false;
                    }
                    elementwise.add(name);
                }
                in.putObject(name).put("source", source.get());
                return true;
            }
            if (expression instanceof ArrayLiteral && ((ArrayLiteral) expression).items().stream().noneMatch(this::readsScatteredSibling)) {
                var items = ((ArrayLiteral) expression).items();
                var sources = items.stream()
                        .map(item -> item instanceof VariableRef && carriers.containsKey(((VariableRef) item).name())
                                ? Optional.<String>empty()
                                : plainSource(item))
                        .collect(Collectors.toList());
                if (!items.isEmpty() && sources.stream().allMatch(Optional::isPresent)) {
                    var array = in.putObject(name).putArray("source");
                    sources.forEach(item -> array.add(item.orElseThrow()));
                    features.multipleInput = true;
                    return true;
                }
            }
            var value = literalNode(expression);
            if (value.isPresent()) {
                in.putObject(name).set("default", value.get());
                return true;
            }
            return false;
        }

        private void writeValueFrom(String name, Expression expression, String bindingLocation) throws UnsupportedConstructException {
            if (expression instanceof VariableRef && carriers.containsKey(((VariableRef) expression).name())) {
                in.putObject(name).put("valueFrom", "$(inputs." + carriers.get(((VariableRef) expression).name()) + ")");
                features.stepInputExpression = true;
                return;
            }
            try {
                carry(expression);
                var rendered = renderer.renderValue(expression);
                in.putObject(name).put("valueFrom", rendered);
                features.stepInputExpression = true;
            } catch (UnrenderableExpressionException e) {
                diagnostics.unsupported(DiagnosticKind.UNSUPPORTED_EXPRESSION, bindingLocation, "Binding dropped: " + e.getMessage());
            }
        }

        private void writeGuard(ObjectNode step) throws UnsupportedConstructException {
            Expression guard = null;
            var seenScatter = false;
            var outerGuard = false;
            for (Frame frame : call.frames()) {
                if (frame.kind() == Frame.Kind.SCATTER) {
                    seenScatter = true;
                    continue;
                }
                outerGuard |= !seenScatter;
                guard = guard == null ? frame.expression() : Operation.binary(Operator.AND, guard, frame.expression());
            }
            if (guard == null) {
                return;
            }
            if (outerGuard && call.isScattered()) {
                diagnostics.info(DiagnosticKind.GUARD_PER_ELEMENT,
                        location,
                        "Condition enclosing a scatter is evaluated once per scattered element");
            }
            try {
                carry(guard);
                step.put("when", renderer.renderValue(guard));
            } catch (UnrenderableExpressionException e) {
                diagnostics.unsupported(DiagnosticKind.UNSUPPORTED_EXPRESSION, location + " condition", "Condition dropped: " + e.getMessage());
            }
        }

        /**
         * Adds hidden step inputs for the workflow inputs and call outputs the expression reads.
         */
        private void carry(Expression expression) {
            for (VariableRef reference : Expressions.references(expression)) {
                var name = reference.name();
                if (!carriers.containsKey(name) && workflow.input(name).isPresent()) {
                    var carrier = unique(name, usedNames);
                    in.putObject(carrier).put("source", name);
                    carriers.put(name, carrier);
                }
            }
            for (MemberRef member : Expressions.memberRefs(expression)) {
                var source = member.callName() + "/" + member.outputName();
                if (!memberCarriers.containsKey(source)) {
                    var sibling = sharesScatter(member.callName());
                    if (sibling && scatterBlocks.size() > 1) {
                        throw new UnrenderableExpressionException(String.format(
                                "'%s.%s' is read per element of nested scatters, no CWL step input carries it",
                                member.callName(),
                                member.outputName()));
                    }
                    var carrier = unique(member.callName() + "_" + member.outputName(), usedNames);
                    in.putObject(carrier).put("source", source);
                    memberCarriers.put(source, carrier);
                    if (sibling) {
                        elementwise.add(carrier);
                    }
                }
            }
        }

        private Optional<DataType> typeOf(Expression expression) {
            if (expression instanceof VariableRef) {
                return Optional.ofNullable(types.get(((VariableRef) expression).name()));
            }
            if (expression instanceof MemberRef) {
                var member = (MemberRef) expression;
                return workflow.calls()
                        .stream()
                        .filter(other -> other.name().equals(member.callName()))
                        .findFirst()
                        .map(other -> workflow.tasks().get(other.taskName()))
                        .flatMap(other -> other.output(member.outputName()))
                        .map(Declaration::type);
            }
            return Optional.empty();
        }
    }
}
