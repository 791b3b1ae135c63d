package com.hartwig.miniwt.cwl;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.Deque;
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
import com.hartwig.miniwt.diagnostics.SemanticException;
import com.hartwig.miniwt.diagnostics.SyntaxException;
import com.hartwig.miniwt.expression.ArrayLiteral;
import com.hartwig.miniwt.expression.Expression;
import com.hartwig.miniwt.expression.Expressions;
import com.hartwig.miniwt.expression.FunctionCall;
import com.hartwig.miniwt.expression.Interpolation;
import com.hartwig.miniwt.expression.Literal;
import com.hartwig.miniwt.expression.MemberRef;
import com.hartwig.miniwt.expression.TemplatePart;
import com.hartwig.miniwt.expression.VariableRef;
import com.hartwig.miniwt.ir.Call;
import com.hartwig.miniwt.ir.DataType;
import com.hartwig.miniwt.ir.Declaration;
import com.hartwig.miniwt.ir.Document;
import com.hartwig.miniwt.ir.Frame;
import com.hartwig.miniwt.ir.ImmutableRuntime;
import com.hartwig.miniwt.ir.ImmutableTask;
import com.hartwig.miniwt.ir.Quantity;
import com.hartwig.miniwt.ir.Runtime;
import com.hartwig.miniwt.ir.Task;
import com.hartwig.miniwt.ir.Workflow;
import com.hartwig.miniwt.language.ImportResolver;
import com.hartwig.miniwt.language.WorkflowParser;

import org.apache.commons.lang3.tuple.Pair;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Reads CWL v1.x documents into a YAML tree and lowers the tree to the workflow model.
 */
public class CwlParser implements WorkflowParser {
    private static final Logger LOGGER = LoggerFactory.getLogger(CwlParser.class);

    private static final Set<String> STRUCTURAL_REQUIREMENTS = Set.of("ShellCommandRequirement",
            "InlineJavascriptRequirement",
            "StepInputExpressionRequirement",
            "ScatterFeatureRequirement",
            "MultipleInputFeatureRequirement",
            "SubworkflowFeatureRequirement");

    private final ObjectMapper objectMapper;
    private final ImportResolver importResolver;

    public CwlParser() {
        this(ImportResolver.NONE);
    }

    public CwlParser(final ImportResolver importResolver) {
        this.objectMapper = CwlYaml.mapper();
        this.importResolver = importResolver;
    }

    @Override
    public Document parse(String text, String sourceName) throws SyntaxException, SemanticException {
        LOGGER.debug("Parsing CWL document [{}]", sourceName);
        var importStack = new ArrayDeque<String>();
        importStack.push(sourceName);
        return lowerDocument(readTree(text), sourceName, importStack);
    }

    private JsonNode readTree(String text) throws SyntaxException {
        try {
            var root = objectMapper.readTree(text);
            if (root == null || root.isMissingNode() || root.isNull()) {
                throw new SyntaxException("Empty document", 1, 1);
            }
            return root;
        } catch (JsonProcessingException e) {
            var location = e.getLocation();
            throw new SyntaxException("Invalid YAML: " + e.getOriginalMessage(),
                    location == null ? 1 : location.getLineNr(),
                    location == null ? 1 : location.getColumnNr(),
                    e);
        }
    }

    private Document lowerDocument(JsonNode root, String sourceName, Deque<String> importStack) throws SemanticException {
        if (!root.isObject()) {
            throw new SemanticException(sourceName, "CWL document should be a mapping");
        }
        var version = Optional.ofNullable(root.get("cwlVersion")).map(JsonNode::asText);
        var processes = new LinkedHashMap<String, JsonNode>();
        JsonNode main = root;
        if (root.has("$graph")) {
            for (JsonNode process : root.get("$graph")) {
                var id = Optional.ofNullable(process.get("id"))
                        .map(node -> stripId(node.asText()))
                        .orElseThrow(() -> new SemanticException(sourceName, "Every $graph entry should have an id"));
                processes.put(id, process);
            }
            main = processes.containsKey("main")
                    ? processes.get("main")
                    : processes.values()
                            .stream()
                            .filter(process -> "Workflow".equals(process.path("class").asText()))
                            .findFirst()
                            .orElseGet(() -> processes.values().iterator().next());
        }
        var context = new Context(sourceName, processes, importStack);
        var document = Document.builder().version(version);
        var processClass = main.path("class").asText();
        switch (processClass) {
            case "CommandLineTool":
                return document.task(lowerTool(main, defaultName(main, sourceName))).build();
            case "Workflow":
                return document.workflow(lowerWorkflow(main, defaultName(main, sourceName), context)).build();
            case "":
                throw new SemanticException(sourceName, "Document has no class");
            default:
                throw new SemanticException(sourceName, String.format("Unsupported class '%s'", processClass));
        }
    }

    private static String defaultName(JsonNode process, String sourceName) {
        var id = Optional.ofNullable(process.get("id")).map(node -> stripId(node.asText())).filter(name -> !name.equals("main"));
        return id.or(() -> Optional.ofNullable(process.get("label")).map(JsonNode::asText).filter(CwlParser::isIdentifier))
                .orElseGet(() -> stem(sourceName));
    }

    Task lowerTool(JsonNode tool, String name) throws SemanticException {
        var location = String.format("tool '%s'", name);
        var inputs = new ArrayList<Declaration>();
        var inputTypes = new LinkedHashMap<String, DataType>();
        for (Pair<String, JsonNode> entry : entries(tool.get("inputs"))) {
            var inputLocation = String.format("%s input '%s'", location, entry.getKey());
            var type = CwlTypes.parse(entry.getValue().get("type"), inputLocation);
            inputTypes.put(entry.getKey(), type);
            var input = Declaration.builder().name(entry.getKey()).type(type).description(description(entry.getValue()));
            if (entry.getValue().has("default")) {
                input.expression(literal(entry.getValue().get("default"), inputLocation));
            }
            inputs.add(input.build());
        }

        var stdoutName = Optional.ofNullable(tool.get(CwlTypes.STDOUT)).map(JsonNode::asText);
        var stderrName = Optional.ofNullable(tool.get(CwlTypes.STDERR)).map(JsonNode::asText);
        var outputs = new ArrayList<Declaration>();
        for (Pair<String, JsonNode> entry : entries(tool.get("outputs"))) {
            var outputLocation = String.format("%s output '%s'", location, entry.getKey());
            var typeNode = entry.getValue().get("type");
            var output = Declaration.builder()
                    .name(entry.getKey())
                    .type(CwlTypes.parse(typeNode, outputLocation))
                    .description(description(entry.getValue()));
            var typeName = CwlTypes.typeName(typeNode);
            if (typeName.filter(CwlTypes.STDOUT::equals).isPresent()) {
                output.expression(FunctionCall.of(CwlTypes.STDOUT));
            } else if (typeName.filter(CwlTypes.STDERR::equals).isPresent()) {
                output.expression(FunctionCall.of(CwlTypes.STDERR));
            } else {
                lowerOutputBinding(entry.getValue().get("outputBinding"), stdoutName, stderrName).ifPresent(output::expression);
            }
            outputs.add(output.build());
        }

        var task = Task.builder()
                .name(name)
                .command(lowerCommand(tool, inputTypes, location))
                .inputs(inputs)
                .outputs(outputs)
                .description(description(tool));
        var runtime = lowerRequirements(tool, location);
        if (!runtime.isEmpty()) {
            task.runtime(runtime);
        }
        return task.build();
    }

    private Optional<Expression> lowerOutputBinding(JsonNode binding, Optional<String> stdoutName, Optional<String> stderrName) {
        if (binding == null || !binding.isObject()) {
            return Optional.empty();
        }
        Optional<Expression> glob = Optional.empty();
        if (binding.has("glob")) {
            var globNode = binding.get("glob");
            var pattern = globNode.isArray() && globNode.size() == 1 ? globNode.get(0) : globNode;
            if (pattern.isTextual()) {
                var text = pattern.asText();
                if (stdoutName.filter(text::equals).isPresent()) {
                    glob = Optional.of(FunctionCall.of(CwlTypes.STDOUT));
                } else if (stderrName.filter(text::equals).isPresent()) {
                    glob = Optional.of(FunctionCall.of(CwlTypes.STDERR));
                } else {
                    glob = Optional.of(CwlExpressionParser.parse(text));
                }
            } else {
                glob = Optional.of(CwlExpressionParser.javascript(pattern.toString()));
            }
        }
        if (binding.has("outputEval")) {
            var outputEval = binding.get("outputEval").asText();
            var reader = binding.path("loadContents").asBoolean(false) ? CwlExpressionParser.readFunction(outputEval) : Optional.<String>empty();
            if (reader.isPresent() && glob.isPresent()) {
                return Optional.of(FunctionCall.of(reader.get(), glob.get()));
            }
            var evaluated = CwlExpressionParser.parse(outputEval);
            if (glob.isPresent() && evaluated instanceof FunctionCall && ((FunctionCall) evaluated).isNamed(FunctionCall.JAVASCRIPT)) {
                var args = new ArrayList<>(((FunctionCall) evaluated).args());
                args.add(glob.get());
                return Optional.of(FunctionCall.of(FunctionCall.JAVASCRIPT, args));
            }
            return Optional.of(evaluated);
        }
        return glob.map(pattern -> pattern instanceof Literal && ((Literal) pattern).value().matches(".*[*?\\[].*")
                ? FunctionCall.of("glob", pattern)
                : pattern);
    }

    private Interpolation lowerCommand(JsonNode tool, Map<String, DataType> inputTypes, String location) throws SemanticException {
        var pieces = new ArrayList<CommandPiece>();
        var order = 0;
        var baseCommand = tool.get("baseCommand");
        if (baseCommand != null) {
            for (JsonNode word : baseCommand.isArray() ? baseCommand : List.of(baseCommand)) {
                pieces.add(new CommandPiece(Double.NEGATIVE_INFINITY, order++, List.of(TemplatePart.text(word.asText()))));
            }
        }
        var arguments = tool.get("arguments");
        if (arguments != null) {
            for (JsonNode argument : arguments) {
                if (argument.isObject()) {
                    var parts = new ArrayList<TemplatePart>();
                    if (argument.has("prefix")) {
                        parts.add(TemplatePart.text(argument.get("prefix").asText() + " "));
                    }
                    parts.addAll(CwlExpressionParser.parseTemplate(argument.path("valueFrom").asText()).parts());
                    pieces.add(new CommandPiece(argument.path("position").asDouble(0), order++, parts));
                } else {
                    pieces.add(new CommandPiece(0, order++, CwlExpressionParser.parseTemplate(argument.asText()).parts()));
                }
            }
        }
        for (Pair<String, JsonNode> entry : entries(tool.get("inputs"))) {
            var binding = entry.getValue().get("inputBinding");
            if (binding == null || !binding.isObject()) {
                continue;
            }
            var name = entry.getKey();
            var type = inputTypes.get(name);
            var prefix = Optional.ofNullable(binding.get("prefix")).map(JsonNode::asText);
            var separate = binding.path("separate").asBoolean(true);
            Expression value = VariableRef.of(name);
            if (binding.has("valueFrom")) {
                value = CwlExpressionParser.parse(binding.get("valueFrom").asText());
            } else if (type.kind() == DataType.Kind.BOOLEAN) {
                value = FunctionCall.of(FunctionCall.IF_THEN_ELSE, value, Literal.ofString(prefix.orElse("")), Literal.ofString(""));
                prefix = Optional.empty();
            } else if (type.kind() == DataType.Kind.ARRAY) {
                value = FunctionCall.of("sep", Literal.ofString(binding.path("itemSeparator").asText(" ")), value);
            }
            var parts = new ArrayList<TemplatePart>();
            prefix.ifPresent(text -> parts.add(TemplatePart.text(separate ? text + " " : text)));
            parts.add(TemplatePart.placeholder(value));
            pieces.add(new CommandPiece(binding.path("position").asDouble(0), order++, parts));
        }
        pieces.sort(Comparator.comparingDouble((CommandPiece piece) -> piece.position).thenComparingInt(piece -> piece.order));

        var parts = new ArrayList<TemplatePart>();
        var text = new StringBuilder();
        for (var i = 0; i < pieces.size(); i++) {
            if (i > 0) {
                text.append(' ');
            }
            for (TemplatePart part : pieces.get(i).parts) {
                if (part.isText()) {
                    text.append(part.text().orElseThrow());
                } else {
                    if (text.length() > 0) {
                        parts.add(TemplatePart.text(text.toString()));
                        text.setLength(0);
                    }
                    parts.add(part);
                }
            }
        }
        if (text.length() > 0) {
            parts.add(TemplatePart.text(text.toString()));
        }
        LOGGER.debug("Lowered command of {} from {} piece(s)", location, pieces.size());
        return Interpolation.of(parts);
    }

    private Runtime lowerRequirements(JsonNode process, String location) throws SemanticException {
        var runtime = Runtime.builder();
        var requirements = new ArrayList<Pair<String, JsonNode>>();
        requirements.addAll(classEntries(process.get("requirements")));
        requirements.addAll(classEntries(process.get("hints")));
        for (Pair<String, JsonNode> requirement : requirements) {
            var body = requirement.getValue();
            switch (requirement.getKey()) {
                case "DockerRequirement":
                    Optional.ofNullable(body.get("dockerPull"))
                            .or(() -> Optional.ofNullable(body.get("dockerImageId")))
                            .map(JsonNode::asText)
                            .ifPresent(runtime::container);
                    break;
                case "ResourceRequirement":
                    try {
                        lowerResources(body, runtime);
                    } catch (ArithmeticException | IllegalStateException e) {
                        throw new SemanticException(location + " ResourceRequirement",
                                String.format("Value out of range: %s", e.getMessage()),
                                e);
                    }
                    break;
                default:
                    if (!STRUCTURAL_REQUIREMENTS.contains(requirement.getKey())) {
                        LOGGER.debug("Keeping requirement {} of {} as custom runtime attribute", requirement.getKey(), location);
                        runtime.putCustomAttributes(Runtime.REQUIREMENT_PREFIX + requirement.getKey(), Literal.ofString(json(body)));
                    }
                    break;
            }
        }
        return runtime.build();
    }

    private static void lowerResources(JsonNode body, ImmutableRuntime.Builder runtime) {
        var cores = body.get("coresMin");
        if (cores != null) {
            if (cores.isNumber()) {
                runtime.cpu(cores.decimalValue().setScale(0, RoundingMode.CEILING).intValueExact());
            } else {
                runtime.putCustomAttributes("cpu", CwlExpressionParser.parse(cores.asText()));
            }
        }
        var ram = body.get("ramMin");
        if (ram != null) {
            if (ram.isNumber()) {
                var memory = Quantity.of(ram.decimalValue(), Quantity.Unit.MiB);
                // has to fit a whole number of MiB
                memory.toMebibytes();
                runtime.memory(memory);
            } else {
                runtime.putCustomAttributes("memory", CwlExpressionParser.parse(ram.asText()));
            }
        }
        var outdir = body.get("outdirMin");
        var tmpdir = body.get("tmpdirMin");
        if ((outdir != null && outdir.isNumber()) || (tmpdir != null && tmpdir.isNumber())) {
            var total = BigDecimal.ZERO;
            if (outdir != null && outdir.isNumber()) {
                total = total.add(outdir.decimalValue());
            }
            if (tmpdir != null && tmpdir.isNumber()) {
                total = total.add(tmpdir.decimalValue());
            }
            var disk = Quantity.of(total, Quantity.Unit.MiB);
            disk.toMebibytes();
            runtime.disk(disk);
        }
    }

    private Workflow lowerWorkflow(JsonNode node, String name, Context context) throws SemanticException {
        var location = String.format("workflow '%s'", name);
        var workflow = Workflow.builder().name(name).description(description(node));
        var inputNames = new HashSet<String>();
        for (Pair<String, JsonNode> entry : entries(node.get("inputs"))) {
            var inputLocation = String.format("%s input '%s'", location, entry.getKey());
            var input = Declaration.builder()
                    .name(entry.getKey())
                    .type(CwlTypes.parse(entry.getValue().get("type"), inputLocation))
                    .description(description(entry.getValue()));
            if (entry.getValue().has("default")) {
                input.expression(literal(entry.getValue().get("default"), inputLocation));
            }
            workflow.addInputs(input.build());
            inputNames.add(entry.getKey());
        }

        var workflowId = Optional.ofNullable(node.get("id")).map(id -> stripId(id.asText())).orElse("main");
        var tasks = new LinkedHashMap<String, Task>();
        var stepNames = entries(node.get("steps")).stream().map(Pair::getKey).collect(Collectors.toSet());
        for (Pair<String, JsonNode> step : entries(node.get("steps"))) {
            var stepLocation = String.format("%s step '%s'", location, step.getKey());
            var task = resolveRun(step.getValue().get("run"), step.getKey(), stepLocation, context);
            var existing = tasks.get(task.name());
            if (existing != null && !existing.equals(task)) {
                task = ImmutableTask.copyOf(task).withName(step.getKey());
            }
            tasks.putIfAbsent(task.name(), task);
            workflow.addCalls(lowerStep(step.getKey(), step.getValue(), task, workflowId, inputNames, stepNames, stepLocation));
        }
        workflow.putAllTasks(tasks);

        for (Pair<String, JsonNode> entry : entries(node.get("outputs"))) {
            var outputLocation = String.format("%s output '%s'", location, entry.getKey());
            var output = Declaration.builder()
                    .name(entry.getKey())
                    .type(CwlTypes.parse(entry.getValue().get("type"), outputLocation))
                    .description(description(entry.getValue()));
            var outputSource = entry.getValue().get("outputSource");
            if (outputSource != null) {
                output.expression(source(outputSource, workflowId));
            }
            workflow.addOutputs(output.build());
        }
        return workflow.build();
    }

    private Call lowerStep(String stepName, JsonNode step, Task task, String workflowId, Set<String> inputNames, Set<String> stepNames,
            String location) throws SemanticException {
        var stepInputs = new LinkedHashMap<String, Expression>();
        var valueFroms = new LinkedHashMap<String, String>();
        for (Pair<String, JsonNode> entry : entries(step.get("in"), "source")) {
            var body = entry.getValue();
            Optional<Expression> value = Optional.ofNullable(body.get("source")).map(source -> source(source, workflowId));
            if (body.has("default")) {
                var fallback = literal(body.get("default"), String.format("%s input '%s'", location, entry.getKey()));
                value = Optional.of(value.<Expression>map(source -> FunctionCall.of("select_first", ArrayLiteral.of(source, fallback)))
                        .orElse(fallback));
            }
            value.ifPresent(expression -> stepInputs.put(entry.getKey(), expression));
            if (body.has("valueFrom")) {
                valueFroms.put(entry.getKey(), body.get("valueFrom").asText());
            }
        }

        // valueFrom sees the other step inputs as inputs.x and its own source as self
        var bindings = new LinkedHashMap<String, Expression>();
        for (Map.Entry<String, Expression> input : stepInputs.entrySet()) {
            if (!valueFroms.containsKey(input.getKey())) {
                bindings.put(input.getKey(), input.getValue());
            }
        }
        for (Map.Entry<String, String> valueFrom : valueFroms.entrySet()) {
            var lowered = Expressions.substitute(CwlExpressionParser.parse(valueFrom.getValue()), stepInputs);
            if (lowered instanceof FunctionCall && ((FunctionCall) lowered).isNamed(FunctionCall.JAVASCRIPT) && stepInputs.containsKey(
                    valueFrom.getKey())) {
                var args = new ArrayList<>(((FunctionCall) lowered).args());
                args.add(stepInputs.get(valueFrom.getKey()));
                lowered = FunctionCall.of(FunctionCall.JAVASCRIPT, args);
            }
            bindings.put(valueFrom.getKey(), lowered);
        }

        var frames = new ArrayList<Frame>();
        var scatterNode = step.get("scatter");
        if (scatterNode != null) {
            var scattered = new ArrayList<String>();
            for (JsonNode name : scatterNode.isArray() ? scatterNode : List.of(scatterNode)) {
                scattered.add(stripStepPrefix(stripId(name.asText())));
            }
            var method = step.path("scatterMethod").asText("");
            if (scattered.size() > 1 && !method.equals("nested_crossproduct")) {
                throw new SemanticException(location,
                        String.format("Scatter method '%s' over several inputs is not supported, only nested_crossproduct is",
                                method.isEmpty() ? "dotproduct" : method));
            }
            for (String input : scattered) {
                var collection = bindings.get(input);
                if (collection == null) {
                    throw new SemanticException(location, String.format("Scattered input '%s' has no source", input));
                }
                var variable = inputNames.contains(input) || stepNames.contains(input) ? input + "_item" : input;
                frames.add(Frame.scatter(stepName + "/scatter/" + input, variable, collection));
                bindings.put(input, VariableRef.of(variable));
            }
        }
        if (step.has("when")) {
            var guard = Expressions.substitute(CwlExpressionParser.parse(step.get("when").asText()), stepInputs);
            frames.add(Frame.conditional(stepName + "/when", guard));
        }

        var declared = task.inputs().stream().map(Declaration::name).collect(Collectors.toSet());
        var inputs = new LinkedHashMap<String, Expression>();
        bindings.forEach((input, expression) -> {
            if (declared.contains(input)) {
                inputs.put(input, expression);
            }
        });
        return Call.builder().name(stepName).taskName(task.name()).inputs(inputs).frames(frames).build();
    }

    private Task resolveRun(JsonNode run, String stepName, String location, Context context) throws SemanticException {
        if (run == null) {
            throw new SemanticException(location, "Step has no 'run'");
        }
        if (run.isObject()) {
            return lowerRunnable(run, stepName, location, context);
        }
        var reference = run.asText();
        if (reference.startsWith("#")) {
            var id = stripId(reference);
            var process = context.processes.get(id);
            if (process == null) {
                throw new SemanticException(location, String.format("Unknown process '%s' in $graph", reference));
            }
            return lowerRunnable(process, id, location, context);
        }
        var runLocation = importResolver.locate(reference, context.sourceName);
        if (context.importStack.contains(runLocation)) {
            throw new SemanticException(location, String.format("Import cycle through '%s'", reference));
        }
        var text = importResolver.read(runLocation)
                .orElseThrow(() -> new SemanticException(location, String.format("Cannot resolve run reference '%s'", reference)));
        JsonNode process;
        try {
            process = readTree(text);
        } catch (SyntaxException e) {
            throw new SemanticException(location, String.format("Run reference '%s' is not valid YAML: %s", reference, e.getMessage()), e);
        }
        context.importStack.push(runLocation);
        var task = lowerRunnable(process, defaultName(process, runLocation), location, context);
        context.importStack.pop();
        return task;
    }

    private Task lowerRunnable(JsonNode process, String name, String location, Context context) throws SemanticException {
        var processClass = process.path("class").asText();
        if (processClass.equals("CommandLineTool")) {
            var id = Optional.ofNullable(process.get("id")).map(node -> stripId(node.asText())).orElse(name);
            return lowerTool(process, id);
        }
        if (processClass.equals("Workflow")) {
            throw new SemanticException(location, "Subworkflow steps are not supported");
        }
        throw new SemanticException(location, String.format("Unsupported step process class '%s'", processClass));
    }

    private static Expression source(JsonNode source, String workflowId) {
        if (source.isArray()) {
            var items = new ArrayList<Expression>();
            source.forEach(item -> items.add(source(item, workflowId)));
            return ArrayLiteral.of(items);
        }
        var path = stripId(source.asText());
        if (path.startsWith(workflowId + "/")) {
            path = path.substring(workflowId.length() + 1);
        }
        var slash = path.indexOf('/');
        return slash < 0 ? VariableRef.of(path) : MemberRef.of(path.substring(0, slash), path.substring(slash + 1));
    }

    private Expression literal(JsonNode value, String location) throws SemanticException {
        if (value.isTextual()) {
            return Literal.ofString(value.asText());
        }
        if (value.isIntegralNumber()) {
            return Literal.ofInt(value.asLong());
        }
        if (value.isNumber()) {
            return Literal.ofFloat(value.asText());
        }
        if (value.isBoolean()) {
            return Literal.ofBoolean(value.asBoolean());
        }
        if (value.isNull()) {
            return Literal.nullValue();
        }
        if (value.isArray()) {
            var items = new ArrayList<Expression>();
            for (JsonNode item : value) {
                items.add(literal(item, location));
            }
            return ArrayLiteral.of(items);
        }
        var fileClass = value.path("class").asText();
        if (fileClass.equals("File") || fileClass.equals("Directory")) {
            return Literal.ofString(value.has("path") ? value.get("path").asText() : value.path("location").asText());
        }
        throw new SemanticException(location, String.format("Unsupported default value %s", value));
    }

    /**
     * Normalizes the map and list forms of inputs, outputs, steps and step inputs to (id, body) pairs. Shorthand
     * values become a body with the value under {@code shorthandKey}.
     */
    private List<Pair<String, JsonNode>> entries(JsonNode section, String shorthandKey) {
        var result = new ArrayList<Pair<String, JsonNode>>();
        if (section == null || section.isNull()) {
            return result;
        }
        if (section.isObject()) {
            section.fields().forEachRemaining(field -> result.add(Pair.of(field.getKey(), body(field.getValue(), shorthandKey))));
        } else if (section.isArray()) {
            for (JsonNode item : section) {
                if (item.isObject() && item.has("id")) {
                    result.add(Pair.of(stripStepPrefix(stripId(item.get("id").asText())), item));
                } else if (item.isTextual()) {
                    result.add(Pair.of(item.asText(), objectMapper.createObjectNode()));
                }
            }
        }
        return result;
    }

    private List<Pair<String, JsonNode>> entries(JsonNode section) {
        return entries(section, "type");
    }

    private JsonNode body(JsonNode value, String shorthandKey) {
        if (value.isObject()) {
            return value;
        }
        var body = objectMapper.createObjectNode();
        body.set(shorthandKey, value);
        return body;
    }

    /**
     * Requirement blocks in list form ({@code - class: X}) or map form ({@code X: {...}}).
     */
    private static List<Pair<String, JsonNode>> classEntries(JsonNode section) {
        var result = new ArrayList<Pair<String, JsonNode>>();
        if (section == null) {
            return result;
        }
        if (section.isArray()) {
            section.forEach(item -> result.add(Pair.of(item.path("class").asText(), item)));
        } else if (section.isObject()) {
            section.fields().forEachRemaining(field -> result.add(Pair.of(field.getKey(), field.getValue())));
        }
        return result;
    }

    private String json(JsonNode node) {
        try {
            return CwlYaml.jsonMapper().writeValueAsString(node);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Could not serialize requirement", e);
        }
    }

    private static Optional<String> description(JsonNode node) {
        return Optional.ofNullable(node.get("doc")).or(() -> Optional.ofNullable(node.get("label"))).map(CwlParser::text);
    }

    private static String text(JsonNode node) {
        if (node.isArray()) {
            var lines = new ArrayList<String>();
            node.forEach(line -> lines.add(line.asText()));
            return String.join("\n", lines);
        }
        return node.asText();
    }

    static String stripId(String id) {
        var hash = id.lastIndexOf('#');
        return hash >= 0 ? id.substring(hash + 1) : id;
    }

    /**
     * Removes the {@code workflow/step/} qualification of ids in list form.
     */
    private static String stripStepPrefix(String id) {
        var slash = id.lastIndexOf('/');
        return slash >= 0 ? id.substring(slash + 1) : id;
    }

    private static boolean isIdentifier(String text) {
        return text.matches("[A-Za-z][A-Za-z0-9_]*");
    }

    static String stem(String sourceName) {
        var fileName = sourceName.substring(sourceName.lastIndexOf('/') + 1);
        var dot = fileName.lastIndexOf('.');
        return dot > 0 ? fileName.substring(0, dot) : fileName;
    }

    private static final class CommandPiece {
        private final double position;
        private final int order;
        private final List<TemplatePart> parts;

        private CommandPiece(final double position, final int order, final List<TemplatePart> parts) {
            this.position = position;
            this.order = order;
            this.parts = parts;
        }
    }

    private static final class Context {
        private final String sourceName;
        private final Map<String, JsonNode> processes;
        private final Deque<String> importStack;

        private Context(final String sourceName, final Map<String, JsonNode> processes, final Deque<String> importStack) {
            this.sourceName = sourceName;
            this.processes = processes;
            this.importStack = importStack;
        }
    }
}
