package com.hartwig.miniwt.wdl;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

import com.hartwig.miniwt.diagnostics.SemanticException;
import com.hartwig.miniwt.diagnostics.SyntaxException;
import com.hartwig.miniwt.expression.ArrayLiteral;
import com.hartwig.miniwt.expression.Expression;
import com.hartwig.miniwt.expression.Interpolation;
import com.hartwig.miniwt.expression.Literal;
import com.hartwig.miniwt.expression.TemplatePart;
import com.hartwig.miniwt.expression.VariableRef;
import com.hartwig.miniwt.ir.Call;
import com.hartwig.miniwt.ir.DataType;
import com.hartwig.miniwt.ir.Declaration;
import com.hartwig.miniwt.ir.Document;
import com.hartwig.miniwt.ir.Frame;
import com.hartwig.miniwt.ir.ImmutableRuntime;
import com.hartwig.miniwt.ir.ImmutableTask;
import com.hartwig.miniwt.ir.ImmutableWorkflow;
import com.hartwig.miniwt.ir.Import;
import com.hartwig.miniwt.ir.Quantity;
import com.hartwig.miniwt.ir.Runtime;
import com.hartwig.miniwt.ir.Task;
import com.hartwig.miniwt.ir.Workflow;
import com.hartwig.miniwt.language.ImportResolver;
import com.hartwig.miniwt.language.WorkflowParser;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Recursive descent parser for WDL 1.0 documents. Instances hold no parse state and can be shared between threads.
 */
public class WdlParser implements WorkflowParser {
    private static final Logger LOGGER = LoggerFactory.getLogger(WdlParser.class);

    private static final Pattern DISK_SIZE = Pattern.compile("(\\d+(?:\\.\\d+)?)\\s*([A-Za-z]+)?");

    private final ImportResolver importResolver;

    public WdlParser() {
        this(ImportResolver.NONE);
    }

    public WdlParser(final ImportResolver importResolver) {
        this.importResolver = importResolver;
    }

    @Override
    public Document parse(String text, String sourceName) throws SyntaxException, SemanticException {
        LOGGER.debug("Parsing WDL document [{}]", sourceName);
        var unit = parseUnit(text, sourceName, new ArrayDeque<>());
        return unit.toDocument(stem(sourceName));
    }

    private ParsedUnit parseUnit(String text, String sourceName, Deque<String> importStack) throws SyntaxException, SemanticException {
        importStack.push(sourceName);
        var unit = new ParsedUnit(new WdlTokenCursor(new WdlLexer(text).tokenize()), sourceName, importStack);
        unit.parseDocument();
        importStack.pop();
        return unit;
    }

    static String stem(String sourceName) {
        var fileName = sourceName.substring(sourceName.lastIndexOf('/') + 1);
        var dot = fileName.lastIndexOf('.');
        return dot > 0 ? fileName.substring(0, dot) : fileName;
    }

    private static String location(WdlToken token) {
        return String.format("line %d, column %d", token.line(), token.column());
    }

    /**
     * Parse state of one source text.
     */
    private class ParsedUnit {
        private final WdlTokenCursor cursor;
        private final String sourceName;
        private final Deque<String> importStack;
        private final List<Import> imports = new ArrayList<>();
        private final Set<String> namespaces = new LinkedHashSet<>();
        private final Map<String, Task> tasks = new LinkedHashMap<>();
        private final Map<String, Task> importedTasks = new LinkedHashMap<>();
        private Optional<String> version = Optional.empty();
        private Workflow workflow;

        private final Deque<Frame> frames = new ArrayDeque<>();
        private final List<Call> calls = new ArrayList<>();
        private int blockCount;

        ParsedUnit(final WdlTokenCursor cursor, final String sourceName, final Deque<String> importStack) {
            this.cursor = cursor;
            this.sourceName = sourceName;
            this.importStack = importStack;
        }

        void parseDocument() throws SyntaxException, SemanticException {
            if (cursor.acceptKeyword("version")) {
                version = Optional.of(cursor.next().text());
            }
            while (!cursor.at(WdlTokenType.EOF)) {
                var token = cursor.peek();
                if (token.isKeyword("import")) {
                    parseImport();
                } else if (token.isKeyword("task")) {
                    var task = parseTask();
                    if (tasks.putIfAbsent(task.name(), task) != null) {
                        throw new SemanticException(location(token), String.format("Duplicate task '%s'", task.name()));
                    }
                } else if (token.isKeyword("workflow")) {
                    if (workflow != null) {
                        throw new SemanticException(location(token),
                                String.format("Only one workflow per document is supported, found a second one after '%s'", workflow.name()));
                    }
                    workflow = parseWorkflow();
                } else {
                    throw cursor.unexpected("'import', 'task' or 'workflow'");
                }
            }
        }

        Document toDocument(String fallbackName) throws SemanticException {
            var document = Document.builder().version(version).imports(imports);
            if (workflow != null) {
                // tasks may follow the workflow in the source
                return document.workflow(ImmutableWorkflow.copyOf(workflow).withTasks(allTasks())).build();
            }
            if (tasks.size() == 1) {
                return document.task(tasks.values().iterator().next()).build();
            }
            if (tasks.isEmpty()) {
                throw new SemanticException(sourceName, "Document declares neither a workflow nor a task");
            }
            return document.workflow(Workflow.builder().name(fallbackName).putAllTasks(allTasks()).build()).build();
        }

        private Map<String, Task> allTasks() {
            var all = new LinkedHashMap<>(tasks);
            all.putAll(importedTasks);
            return all;
        }

        private void parseImport() throws SyntaxException, SemanticException {
            var importToken = cursor.expectKeyword("import");
            var uri = cursor.expect(WdlTokenType.STRING, "import uri").text();
            var alias = cursor.acceptKeyword("as") ? cursor.expectName("import alias").text() : stem(uri);
            var importLocation = importResolver.locate(uri, sourceName);
            if (importStack.contains(importLocation)) {
                throw new SemanticException(location(importToken), String.format("Import cycle: %s -> %s",
                        String.join(" -> ", reversed(importStack)),
                        importLocation));
            }
            if (!namespaces.add(alias)) {
                throw new SemanticException(location(importToken), String.format("Duplicate import alias '%s'", alias));
            }
            var importedText = importResolver.read(importLocation)
                    .orElseThrow(() -> new SemanticException(location(importToken), String.format("Cannot resolve import '%s'", uri)));
            LOGGER.debug("Resolved import '{}' of [{}] as '{}'", uri, sourceName, alias);
            var imported = parseUnit(importedText, importLocation, importStack);
            imported.allTasks().forEach((name, task) -> importedTasks.put(alias + "." + name, ImmutableTask.copyOf(task).withName(alias + "." + name)));
            imports.add(Import.of(uri, alias));
        }

        private List<String> reversed(Deque<String> stack) {
            var result = new ArrayList<>(stack);
            Collections.reverse(result);
            return result;
        }

        private Task parseTask() throws SyntaxException, SemanticException {
            cursor.expectKeyword("task");
            var name = cursor.expectName("task name").text();
            cursor.expect(WdlTokenType.LBRACE, "'{'");
            var task = Task.builder().name(name).command(Interpolation.empty());
            var inputs = new ArrayList<Declaration>();
            var outputs = new ArrayList<Declaration>();
            var parameterMeta = new LinkedHashMap<String, String>();
            while (!cursor.accept(WdlTokenType.RBRACE)) {
                var token = cursor.peek();
                if (token.isKeyword("input")) {
                    cursor.next();
                    inputs.addAll(parseDeclarations(false));
                } else if (token.isKeyword("output")) {
                    cursor.next();
                    outputs.addAll(parseDeclarations(true));
                } else if (token.isKeyword("command")) {
                    cursor.next();
                    task.command(parseCommand(cursor.next()));
                } else if (token.isKeyword("runtime")) {
                    cursor.next();
                    task.runtime(lowerRuntime(name, parseRuntimeSection()));
                } else if (token.isKeyword("meta")) {
                    cursor.next();
                    Optional.ofNullable(parseMeta().get("description")).ifPresent(task::description);
                } else if (token.isKeyword("parameter_meta")) {
                    cursor.next();
                    parameterMeta.putAll(parseMeta());
                } else if (token.is(WdlTokenType.IDENTIFIER)) {
                    // private declarations become inputs with their value as default
                    inputs.add(parseDeclaration(true));
                } else {
                    throw cursor.unexpected("task section");
                }
            }
            return task.inputs(describe(inputs, parameterMeta)).outputs(describe(outputs, parameterMeta)).build();
        }

        private Interpolation parseCommand(WdlToken token) throws SyntaxException {
            if (!token.is(WdlTokenType.COMMAND) && !token.is(WdlTokenType.COMMAND_BRACES)) {
                throw cursor.error(token, "Expected command section");
            }
            var dedented = dedent(token.text());
            var template = WdlTemplateParser.parseCommand(dedented, token.line(), token.column(), token.is(WdlTokenType.COMMAND_BRACES));
            return trim(template);
        }

        private Workflow parseWorkflow() throws SyntaxException, SemanticException {
            cursor.expectKeyword("workflow");
            var name = cursor.expectName("workflow name").text();
            cursor.expect(WdlTokenType.LBRACE, "'{'");
            var builder = Workflow.builder().name(name);
            var inputs = new ArrayList<Declaration>();
            var outputs = new ArrayList<Declaration>();
            var parameterMeta = new LinkedHashMap<String, String>();
            while (!cursor.accept(WdlTokenType.RBRACE)) {
                var token = cursor.peek();
                if (token.isKeyword("input")) {
                    cursor.next();
                    inputs.addAll(parseDeclarations(false));
                } else if (token.isKeyword("output")) {
                    cursor.next();
                    outputs.addAll(parseDeclarations(true));
                } else if (token.isKeyword("meta")) {
                    cursor.next();
                    Optional.ofNullable(parseMeta().get("description")).ifPresent(builder::description);
                } else if (token.isKeyword("parameter_meta")) {
                    cursor.next();
                    parameterMeta.putAll(parseMeta());
                } else {
                    parseBodyElement();
                }
            }
            return builder.inputs(describe(inputs, parameterMeta))
                    .outputs(describe(outputs, parameterMeta))
                    .calls(calls)
                    .build();
        }

        private void parseBodyElement() throws SyntaxException, SemanticException {
            var token = cursor.peek();
            if (token.isKeyword("call")) {
                parseCall();
            } else if (token.isKeyword("scatter")) {
                cursor.next();
                cursor.expect(WdlTokenType.LPAREN, "'('");
                var variable = cursor.expectName("scatter variable").text();
                cursor.expectKeyword("in");
                var collection = new WdlExpressionParser(cursor).parseExpression();
                cursor.expect(WdlTokenType.RPAREN, "')'");
                parseBlock(Frame.scatter("scatter" + blockCount++, variable, collection));
            } else if (token.isKeyword("if")) {
                cursor.next();
                cursor.expect(WdlTokenType.LPAREN, "'('");
                var guard = new WdlExpressionParser(cursor).parseExpression();
                cursor.expect(WdlTokenType.RPAREN, "')'");
                parseBlock(Frame.conditional("if" + blockCount++, guard));
            } else if (token.is(WdlTokenType.IDENTIFIER)) {
                throw cursor.error(token, "Declarations in the workflow body are not supported, declare them in the input section");
            } else {
                throw cursor.unexpected("'call', 'scatter', 'if', 'input', 'output' or 'meta'");
            }
        }

        private void parseBlock(Frame frame) throws SyntaxException, SemanticException {
            cursor.expect(WdlTokenType.LBRACE, "'{'");
            frames.addLast(frame);
            while (!cursor.accept(WdlTokenType.RBRACE)) {
                parseBodyElement();
            }
            frames.removeLast();
        }

        private void parseCall() throws SyntaxException, SemanticException {
            var callToken = cursor.expectKeyword("call");
            var taskToken = cursor.expectName("task name");
            var taskName = taskToken.text();
            var simpleName = taskName;
            if (cursor.accept(WdlTokenType.DOT)) {
                simpleName = cursor.expectName("task name").text();
                if (!namespaces.contains(taskName)) {
                    throw new SemanticException(location(taskToken), String.format("Unknown namespace '%s' in call to '%s.%s'",
                            taskName,
                            taskName,
                            simpleName));
                }
                taskName = taskName + "." + simpleName;
            }
            var name = cursor.acceptKeyword("as") ? cursor.expectName("call alias").text() : simpleName;
            var inputs = new LinkedHashMap<String, Expression>();
            if (cursor.accept(WdlTokenType.LBRACE)) {
                if (cursor.atKeyword("input") && cursor.peek(1).is(WdlTokenType.COLON)) {
                    cursor.next();
                    cursor.next();
                }
                while (!cursor.accept(WdlTokenType.RBRACE)) {
                    var inputToken = cursor.expectName("call input name");
                    var value = cursor.accept(WdlTokenType.ASSIGN)
                            ? new WdlExpressionParser(cursor).parseExpression()
                            : VariableRef.of(inputToken.text());
                    if (inputs.put(inputToken.text(), value) != null) {
                        throw new SemanticException(location(inputToken), String.format("Input '%s' of call '%s' is bound twice",
                                inputToken.text(),
                                name));
                    }
                    if (!cursor.accept(WdlTokenType.COMMA) && !cursor.at(WdlTokenType.RBRACE)) {
                        throw cursor.unexpected("',' or '}'");
                    }
                }
            }
            if (calls.stream().anyMatch(call -> call.name().equals(name))) {
                throw new SemanticException(location(callToken), String.format("Duplicate call name '%s'", name));
            }
            calls.add(Call.builder().name(name).taskName(taskName).inputs(inputs).frames(new ArrayList<>(frames)).build());
        }

        private List<Declaration> parseDeclarations(boolean requireExpression) throws SyntaxException, SemanticException {
            cursor.expect(WdlTokenType.LBRACE, "'{'");
            var declarations = new ArrayList<Declaration>();
            while (!cursor.accept(WdlTokenType.RBRACE)) {
                declarations.add(parseDeclaration(requireExpression));
            }
            return declarations;
        }

        private Declaration parseDeclaration(boolean requireExpression) throws SyntaxException, SemanticException {
            var type = parseType();
            var name = cursor.expectName("declaration name");
            var declaration = Declaration.builder().name(name.text()).type(type);
            if (cursor.accept(WdlTokenType.ASSIGN)) {
                declaration.expression(new WdlExpressionParser(cursor).parseExpression());
            } else if (requireExpression) {
                throw cursor.unexpected(String.format("'=' and a value for '%s'", name.text()));
            }
            return declaration.build();
        }

        private DataType parseType() throws SyntaxException, SemanticException {
            var token = cursor.expect(WdlTokenType.IDENTIFIER, "type");
            DataType type;
            switch (token.text()) {
                case "String":
                    type = DataType.of(DataType.Kind.STRING);
                    break;
                case "Int":
                    type = DataType.of(DataType.Kind.INT);
                    break;
                case "Float":
                    type = DataType.of(DataType.Kind.FLOAT);
                    break;
                case "Boolean":
                    type = DataType.of(DataType.Kind.BOOLEAN);
                    break;
                case "File":
                    type = DataType.of(DataType.Kind.FILE);
                    break;
                case "Directory":
                    type = DataType.of(DataType.Kind.DIRECTORY);
                    break;
                case "Array":
                    cursor.expect(WdlTokenType.LBRACKET, "'['");
                    type = DataType.arrayOf(parseType());
                    cursor.expect(WdlTokenType.RBRACKET, "']'");
                    if (cursor.atOperator("+")) {
                        cursor.next();
                    }
                    break;
                case "Map":
                    cursor.expect(WdlTokenType.LBRACKET, "'['");
                    var keyType = parseType();
                    cursor.expect(WdlTokenType.COMMA, "','");
                    var valueType = parseType();
                    cursor.expect(WdlTokenType.RBRACKET, "']'");
                    type = DataType.mapOf(keyType, valueType);
                    break;
                case "Object":
                    type = DataType.of(DataType.Kind.ANY);
                    break;
                case "Pair":
                    cursor.expect(WdlTokenType.LBRACKET, "'['");
                    parseType();
                    cursor.expect(WdlTokenType.COMMA, "','");
                    parseType();
                    cursor.expect(WdlTokenType.RBRACKET, "']'");
                    type = DataType.of(DataType.Kind.ANY);
                    break;
                default:
                    throw new SemanticException(location(token), String.format("Unknown type '%s'", token.text()));
            }
            return cursor.accept(WdlTokenType.QUESTION) ? type.asOptional() : type;
        }

        private Map<String, Expression> parseRuntimeSection() throws SyntaxException {
            cursor.expect(WdlTokenType.LBRACE, "'{'");
            var attributes = new LinkedHashMap<String, Expression>();
            while (!cursor.accept(WdlTokenType.RBRACE)) {
                var key = cursor.expectName("runtime attribute");
                cursor.expect(WdlTokenType.COLON, "':'");
                attributes.put(key.text(), new WdlExpressionParser(cursor).parseExpression());
                cursor.accept(WdlTokenType.COMMA);
            }
            return attributes;
        }

        /**
         * Reads a meta section, keeping string values and the description of nested objects.
         */
        private Map<String, String> parseMeta() throws SyntaxException {
            cursor.expect(WdlTokenType.LBRACE, "'{'");
            var values = new LinkedHashMap<String, String>();
            while (!cursor.accept(WdlTokenType.RBRACE)) {
                var key = cursor.expectName("meta key");
                cursor.expect(WdlTokenType.COLON, "':'");
                parseMetaValue().ifPresent(value -> values.put(key.text(), value));
                cursor.accept(WdlTokenType.COMMA);
            }
            return values;
        }

        private Optional<String> parseMetaValue() throws SyntaxException {
            var token = cursor.peek();
            switch (token.type()) {
                case STRING:
                    cursor.next();
                    return Optional.of(WdlTemplateParser.parseString(token.text(), token.line(), token.column()).literalText());
                case LBRACE:
                    var nested = parseMeta();
                    return Optional.ofNullable(nested.getOrDefault("description", nested.get("help")));
                case LBRACKET:
                    cursor.next();
                    while (!cursor.accept(WdlTokenType.RBRACKET)) {
                        parseMetaValue();
                        cursor.accept(WdlTokenType.COMMA);
                    }
                    return Optional.empty();
                case INTEGER:
                case FLOAT:
                case IDENTIFIER:
                case KEYWORD:
                    cursor.next();
                    return Optional.empty();
                case OPERATOR:
                    if (token.text().equals("-")) {
                        cursor.next();
                        return parseMetaValue().map(value -> "-" + value);
                    }
                    throw cursor.unexpected("meta value");
                default:
                    throw cursor.unexpected("meta value");
            }
        }
    }

    private static List<Declaration> describe(List<Declaration> declarations, Map<String, String> parameterMeta) {
        return declarations.stream()
                .map(declaration -> parameterMeta.containsKey(declaration.name()) && declaration.description().isEmpty()
                        ? Declaration.builder().from(declaration).description(parameterMeta.get(declaration.name())).build()
                        : declaration)
                .collect(Collectors.toList());
    }

    /**
     * Maps the runtime attributes the IR models onto {@link Runtime}, keeping the others as custom attributes.
     */
    static Runtime lowerRuntime(String taskName, Map<String, Expression> attributes) throws SemanticException {
        var runtime = Runtime.builder();
        for (Map.Entry<String, Expression> attribute : attributes.entrySet()) {
            try {
                if (!lowerAttribute(runtime, attribute.getKey(), attribute.getValue())) {
                    runtime.putCustomAttributes(attribute.getKey(), attribute.getValue());
                }
            } catch (ArithmeticException | IllegalStateException e) {
                throw new SemanticException(String.format("task '%s' runtime '%s'", taskName, attribute.getKey()),
                        String.format("Value out of range: %s", e.getMessage()),
                        e);
            }
        }
        return runtime.build();
    }

    private static boolean lowerAttribute(ImmutableRuntime.Builder runtime, String key, Expression value) {
        var lowered = false;
        switch (key) {
            case "docker":
            case "container":
                var image = value instanceof ArrayLiteral && !((ArrayLiteral) value).items().isEmpty()
                        ? ((ArrayLiteral) value).items().get(0)
                        : value;
                var container = stringValue(image);
                container.ifPresent(runtime::container);
                lowered = container.isPresent();
                break;
            case "cpu":
                var cpu = numberValue(value).map(number -> number.setScale(0, RoundingMode.CEILING).intValueExact());
                cpu.ifPresent(runtime::cpu);
                lowered = cpu.isPresent();
                break;
            case "memory":
                var memory = stringValue(value).flatMap(Quantity::parse)
                        .or(() -> numberValue(value).map(bytes -> Quantity.of(bytes, Quantity.Unit.B)));
                // sizes have to fit a whole number of MiB
                memory.ifPresent(Quantity::toMebibytes);
                memory.ifPresent(runtime::memory);
                lowered = memory.isPresent();
                break;
            case "disks":
            case "disk":
                var disk = stringValue(value).flatMap(WdlParser::parseDisk);
                disk.ifPresent(Quantity::toMebibytes);
                disk.ifPresent(runtime::disk);
                lowered = disk.isPresent();
                break;
            case "maxRetries":
                var retries = numberValue(value).map(number -> number.setScale(0, RoundingMode.DOWN).intValueExact());
                retries.ifPresent(runtime::maxRetries);
                lowered = retries.isPresent();
                break;
            case "preemptible":
                var preemptible = numberValue(value).map(number -> number.setScale(0, RoundingMode.DOWN).intValueExact())
                        .or(() -> booleanValue(value).map(enabled -> enabled ? 1 : 0));
                preemptible.ifPresent(runtime::preemptible);
                lowered = preemptible.isPresent();
                break;
            default:
                break;
        }
        return lowered;
    }

    /**
     * Size from a {@code disks} value like {@code "local-disk 100 HDD"}. Sizes without a unit are GiB.
     */
    static Optional<Quantity> parseDisk(String disks) {
        var matcher = DISK_SIZE.matcher(disks);
        while (matcher.find()) {
            var unit = Optional.ofNullable(matcher.group(2)).flatMap(Quantity.Unit::parse);
            if (matcher.group(2) == null || unit.isPresent() || matcher.group(2).equalsIgnoreCase("HDD") || matcher.group(2)
                    .equalsIgnoreCase("SSD")) {
                return Optional.of(Quantity.of(new BigDecimal(matcher.group(1)), unit.orElse(Quantity.Unit.GiB)));
            }
        }
        return Optional.empty();
    }

    private static Optional<String> stringValue(Expression expression) {
        if (expression instanceof Literal && ((Literal) expression).isString()) {
            return Optional.of(((Literal) expression).value());
        }
        return Optional.empty();
    }

    private static Optional<BigDecimal> numberValue(Expression expression) {
        if (expression instanceof Literal) {
            var literal = (Literal) expression;
            if (literal.type() == Literal.Type.INT || literal.type() == Literal.Type.FLOAT || literal.isString()) {
                try {
                    return Optional.of(new BigDecimal(literal.value().trim()));
                } catch (NumberFormatException e) {
                    return Optional.empty();
                }
            }
        }
        return Optional.empty();
    }

    private static Optional<Boolean> booleanValue(Expression expression) {
        if (expression instanceof Literal && ((Literal) expression).type() == Literal.Type.BOOLEAN) {
            return Optional.of(Boolean.parseBoolean(((Literal) expression).value()));
        }
        return Optional.empty();
    }

    /**
     * Removes the indentation shared by all non-blank lines. Line breaks are kept so positions stay on the same line.
     */
    static String dedent(String raw) {
        var lines = raw.split("\n", -1);
        var indent = Integer.MAX_VALUE;
        for (String line : lines) {
            if (!line.isBlank()) {
                var width = 0;
                while (width < line.length() && (line.charAt(width) == ' ' || line.charAt(width) == '\t')) {
                    width++;
                }
                indent = Math.min(indent, width);
            }
        }
        if (indent == Integer.MAX_VALUE || indent == 0) {
            return raw;
        }
        var result = new ArrayList<String>();
        for (String line : lines) {
            result.add(line.length() >= indent ? line.substring(indent) : line.strip());
        }
        return String.join("\n", result);
    }

    /**
     * Strips the leading blank line and trailing whitespace of a command template.
     */
    static Interpolation trim(Interpolation template) {
        var parts = new ArrayList<>(template.parts());
        if (!parts.isEmpty() && parts.get(0).isText()) {
            var text = parts.get(0).text().orElseThrow().replaceFirst("^[ \\t]*\\n", "");
            replaceText(parts, 0, text);
        }
        if (!parts.isEmpty() && parts.get(parts.size() - 1).isText()) {
            var text = parts.get(parts.size() - 1).text().orElseThrow().stripTrailing();
            replaceText(parts, parts.size() - 1, text);
        }
        return Interpolation.of(parts);
    }

    private static void replaceText(List<TemplatePart> parts, int index, String text) {
        if (text.isEmpty()) {
            parts.remove(index);
        } else {
            parts.set(index, TemplatePart.text(text));
        }
    }
}
