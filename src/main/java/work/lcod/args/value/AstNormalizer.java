package work.lcod.args.value;

import com.fasterxml.jackson.databind.JsonNode;
import java.math.BigInteger;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;

/**
 * Translates parser AST value nodes (JSON AST interchange form, read from JSON or YAML) into {@link RawValue}.
 * Variable nodes become {@link RawValue.VariableRef} and are resolved later, against the type expected where they
 * appear.
 */
public final class AstNormalizer {
    private AstNormalizer() {}

    public static RawValue normalize(JsonNode node) {
        if (node == null || node.isMissingNode() || node.isNull()) {
            return RawValue.ABSENT;
        }
        if (!node.isObject()) {
            throw new IllegalArgumentException("AST value node must be an object: " + node);
        }
        String kind = node.path("kind").asText("");
        switch (kind) {
            case "IntValue":
                return new RawValue.LiteralInt(parseInt(node.get("value")));
            case "FloatValue":
                return new RawValue.LiteralFloat(parseFloat(node.get("value")));
            case "StringValue":
                return new RawValue.LiteralString(requireText(node, "value"));
            case "BooleanValue":
                return new RawValue.LiteralBoolean(parseBoolean(node.get("value")));
            case "NullValue":
                return RawValue.NULL;
            case "EnumValue":
                return new RawValue.LiteralEnum(requireText(node, "value"));
            case "ListValue":
                return normalizeList(node);
            case "ObjectValue":
                return normalizeObject(node);
            case "Variable":
                return new RawValue.VariableRef(nameOf(node.get("name")));
            default:
                throw new IllegalArgumentException("Unsupported AST value kind: " + (kind.isEmpty() ? node : kind));
        }
    }

    /**
     * Reads a {@code Name} node; a bare string is accepted for hand-written YAML documents.
     */
    public static String nameOf(JsonNode node) {
        if (node == null || node.isNull() || node.isMissingNode()) {
            throw new IllegalArgumentException("AST node is missing a name");
        }
        if (node.isTextual()) {
            return node.asText();
        }
        var value = node.get("value");
        if (value == null || !value.isTextual() || value.asText().isBlank()) {
            throw new IllegalArgumentException("Malformed Name node: " + node);
        }
        return value.asText();
    }

    private static RawValue normalizeList(JsonNode node) {
        var values = node.path("values");
        List<RawValue> items = new ArrayList<>();
        for (var item : values) {
            var normalized = normalize(item);
            if (normalized instanceof RawValue.Absent) {
                throw new IllegalArgumentException("List literal contains an empty node: " + node);
            }
            items.add(normalized);
        }
        return new RawValue.LiteralList(items);
    }

    private static RawValue normalizeObject(JsonNode node) {
        var fields = new LinkedHashMap<String, RawValue>();
        for (var field : node.path("fields")) {
            var name = nameOf(field.get("name"));
            var value = normalize(field.get("value"));
            if (value instanceof RawValue.Absent) {
                throw new IllegalArgumentException("Object field " + name + " has no value node");
            }
            fields.put(name, value);
        }
        return new RawValue.LiteralObject(fields);
    }

    private static BigInteger parseInt(JsonNode value) {
        if (value != null && value.isIntegralNumber()) {
            return value.bigIntegerValue();
        }
        if (value != null && value.isTextual()) {
            try {
                return new BigInteger(value.asText().trim());
            } catch (NumberFormatException ex) {
                throw new IllegalArgumentException("Malformed IntValue: " + value.asText(), ex);
            }
        }
        throw new IllegalArgumentException("Malformed IntValue: " + value);
    }

    private static double parseFloat(JsonNode value) {
        if (value != null && value.isNumber()) {
            return value.doubleValue();
        }
        if (value != null && value.isTextual()) {
            try {
                return Double.parseDouble(value.asText().trim());
            } catch (NumberFormatException ex) {
                throw new IllegalArgumentException("Malformed FloatValue: " + value.asText(), ex);
            }
        }
        throw new IllegalArgumentException("Malformed FloatValue: " + value);
    }

    private static boolean parseBoolean(JsonNode value) {
        if (value != null && value.isBoolean()) {
            return value.booleanValue();
        }
        throw new IllegalArgumentException("Malformed BooleanValue: " + value);
    }

    private static String requireText(JsonNode node, String field) {
        var value = node.get(field);
        if (value == null || !value.isTextual()) {
            throw new IllegalArgumentException("AST node " + node.path("kind").asText() + " is missing textual '" + field + "'");
        }
        return value.asText();
    }
}
