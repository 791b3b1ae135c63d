package com.hartwig.miniwt.cwl;

import java.util.ArrayList;
import java.util.Optional;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.hartwig.miniwt.diagnostics.DiagnosticKind;
import com.hartwig.miniwt.diagnostics.Diagnostics;
import com.hartwig.miniwt.diagnostics.SemanticException;
import com.hartwig.miniwt.diagnostics.UnsupportedConstructException;
import com.hartwig.miniwt.ir.DataType;

/**
 * Mapping between CWL type declarations and {@link DataType}.
 */
final class CwlTypes {
    static final String STDOUT = "stdout";
    static final String STDERR = "stderr";

    private static final JsonNodeFactory NODES = JsonNodeFactory.instance;

    private CwlTypes() {
    }

    /**
     * Parses a type in any of its forms: a name with {@code ?} and {@code []} shorthands, a union list or an array
     * schema. The stream types {@code stdout} and {@code stderr} read as File.
     */
    static DataType parse(JsonNode node, String location) throws SemanticException {
        if (node == null || node.isNull() || node.isMissingNode()) {
            throw new SemanticException(location, "Missing type");
        }
        if (node.isTextual()) {
            return parseName(node.asText(), location);
        }
        if (node.isArray()) {
            var optional = false;
            var members = new ArrayList<DataType>();
            for (JsonNode member : node) {
                if (member.isTextual() && member.asText().equals("null")) {
                    optional = true;
                } else {
                    members.add(parse(member, location));
                }
            }
            var type = members.size() == 1 ? members.get(0) : DataType.of(DataType.Kind.ANY);
            return optional ? type.asOptional() : type;
        }
        if (node.isObject()) {
            var kind = node.path("type").asText();
            switch (kind) {
                case "array":
                    return DataType.arrayOf(parse(node.get("items"), location));
                case "enum":
                    return DataType.of(DataType.Kind.STRING);
                case "record":
                    return DataType.of(DataType.Kind.ANY);
                default:
                    return parse(node.get("type"), location);
            }
        }
        throw new SemanticException(location, String.format("Unsupported type declaration %s", node));
    }

    private static DataType parseName(String name, String location) throws SemanticException {
        if (name.endsWith("?")) {
            return parseName(name.substring(0, name.length() - 1), location).asOptional();
        }
        if (name.endsWith("[]")) {
            return DataType.arrayOf(parseName(name.substring(0, name.length() - 2), location));
        }
        switch (name) {
            case "string":
                return DataType.of(DataType.Kind.STRING);
            case "int":
            case "long":
                return DataType.of(DataType.Kind.INT);
            case "float":
            case "double":
                return DataType.of(DataType.Kind.FLOAT);
            case "boolean":
                return DataType.of(DataType.Kind.BOOLEAN);
            case "File":
            case STDOUT:
            case STDERR:
                return DataType.of(DataType.Kind.FILE);
            case "Directory":
                return DataType.of(DataType.Kind.DIRECTORY);
            case "Any":
                return DataType.of(DataType.Kind.ANY);
            default:
                throw new SemanticException(location, String.format("Unknown type '%s'", name));
        }
    }

    /**
     * Optional types render as a union with {@code "null"} so absence stays distinguishable from an empty value.
     */
    static JsonNode render(DataType type, String location, Diagnostics diagnostics) throws UnsupportedConstructException {
        var required = renderRequired(type, location, diagnostics);
        if (!type.optional()) {
            return required;
        }
        return NODES.arrayNode().add("null").add(required);
    }

    private static JsonNode renderRequired(DataType type, String location, Diagnostics diagnostics) throws UnsupportedConstructException {
        switch (type.kind()) {
            case STRING:
                return NODES.textNode("string");
            case INT:
                return NODES.textNode("int");
            case FLOAT:
                return NODES.textNode("float");
            case BOOLEAN:
                return NODES.textNode("boolean");
            case FILE:
                return NODES.textNode("File");
            case DIRECTORY:
                return NODES.textNode("Directory");
            case ARRAY:
                var array = NODES.objectNode();
                array.put("type", "array");
                array.set("items", render(type.itemType().orElseThrow(), location, diagnostics));
                return array;
            case MAP:
                diagnostics.unsupported(DiagnosticKind.DEGRADED_TYPE, location, "CWL has no map type, written as Any");
                return NODES.textNode("Any");
            default:
                return NODES.textNode("Any");
        }
    }

    static Optional<String> typeName(JsonNode node) {
        return node != null && node.isTextual() ? Optional.of(node.asText()) : Optional.empty();
    }
}
