package work.lcod.args.runtime;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import work.lcod.args.coerce.VariableDefinition;
import work.lcod.args.schema.Schema;
import work.lcod.args.schema.TypeDescriptor;
import work.lcod.args.value.AstNormalizer;
import work.lcod.args.value.RawValue;

/**
 * Loads a parsed query operation from its JSON AST form (JSON or YAML file) into an {@link Operation}.
 * Variable types are resolved against the schema; argument values are normalized but not resolved.
 */
public final class OperationLoader {
    private static final Logger log = LoggerFactory.getLogger(OperationLoader.class);
    private static final ObjectMapper YAML_MAPPER = new ObjectMapper(new YAMLFactory());

    private OperationLoader() {}

    public static Operation loadFromFile(Path path, Schema schema) {
        try (var in = Files.newInputStream(path)) {
            return load(in, schema);
        } catch (IOException ex) {
            throw new IllegalStateException("Failed to read operation document: " + path, ex);
        }
    }

    public static Operation load(InputStream in, Schema schema) throws IOException {
        return fromNode(YAML_MAPPER.readTree(in), schema);
    }

    public static Operation fromString(String document, Schema schema) {
        try {
            return fromNode(YAML_MAPPER.readTree(document), schema);
        } catch (IOException ex) {
            throw new IllegalArgumentException("Invalid operation document", ex);
        }
    }

    public static Operation fromNode(JsonNode root, Schema schema) {
        if (root == null || root.isNull() || root.isMissingNode()) {
            throw new IllegalArgumentException("Operation document is empty");
        }
        var definition = operationDefinition(root);
        var operationType = definition.path("operation").asText("query");
        if (!"query".equals(operationType)) {
            throw new IllegalArgumentException("Unsupported operation type: " + operationType);
        }
        var nameNode = definition.get("name");
        String name = nameNode == null || nameNode.isNull() ? null : AstNormalizer.nameOf(nameNode);

        var variables = new ArrayList<VariableDefinition>();
        for (var variableNode : definition.path("variableDefinitions")) {
            variables.add(readVariable(variableNode, schema));
        }
        var selections = new ArrayList<FieldSelection>();
        for (var selectionNode : definition.path("selectionSet").path("selections")) {
            selections.add(readSelection(selectionNode));
        }
        log.debug("Loaded operation {} with {} variable(s) and {} selection(s)", name, variables.size(), selections.size());
        return new Operation(name, variables, selections);
    }

    private static JsonNode operationDefinition(JsonNode root) {
        var kind = root.path("kind").asText("");
        if ("OperationDefinition".equals(kind)) {
            return root;
        }
        if ("Document".equals(kind)) {
            for (var definition : root.path("definitions")) {
                if ("OperationDefinition".equals(definition.path("kind").asText())) {
                    return definition;
                }
            }
            throw new IllegalArgumentException("Document contains no operation definition");
        }
        throw new IllegalArgumentException("Expected a Document or OperationDefinition node, got: " + (kind.isEmpty() ? "<none>" : kind));
    }

    private static VariableDefinition readVariable(JsonNode node, Schema schema) {
        var variable = node.get("variable");
        if (variable == null) {
            throw new IllegalArgumentException("VariableDefinition without variable: " + node);
        }
        var name = AstNormalizer.nameOf(variable.isTextual() ? variable : variable.get("name"));
        var type = readType(node.get("type"), schema);
        var defaultValue = AstNormalizer.normalize(node.get("defaultValue"));
        return new VariableDefinition(name, type, defaultValue);
    }

    private static TypeDescriptor readType(JsonNode node, Schema schema) {
        if (node == null || node.isNull()) {
            throw new IllegalArgumentException("Variable definition is missing its type");
        }
        if (node.isTextual()) {
            return schema.typeRef(node.asText());
        }
        var kind = node.path("kind").asText("");
        switch (kind) {
            case "NamedType":
                var name = AstNormalizer.nameOf(node.get("name"));
                var type = schema.type(name);
                if (type == null) {
                    throw new IllegalArgumentException("Unknown type: " + name);
                }
                return type;
            case "ListType":
                return TypeDescriptor.listOf(readType(node.get("type"), schema));
            case "NonNullType":
                return TypeDescriptor.nonNull(readType(node.get("type"), schema));
            default:
                throw new IllegalArgumentException("Unsupported type node: " + node);
        }
    }

    private static FieldSelection readSelection(JsonNode node) {
        var kind = node.path("kind").asText("Field");
        if (!"Field".equals(kind)) {
            throw new IllegalArgumentException("Unsupported selection kind: " + kind);
        }
        var name = AstNormalizer.nameOf(node.get("name"));
        var aliasNode = node.get("alias");
        String alias = aliasNode == null || aliasNode.isNull() ? null : AstNormalizer.nameOf(aliasNode);
        var arguments = new LinkedHashMap<String, RawValue>();
        for (var argument : node.path("arguments")) {
            var argumentName = AstNormalizer.nameOf(argument.get("name"));
            var value = AstNormalizer.normalize(argument.get("value"));
            if (value instanceof RawValue.Absent) {
                throw new IllegalArgumentException("Argument " + argumentName + " of " + name + " has no value node");
            }
            if (arguments.put(argumentName, value) != null) {
                throw new IllegalArgumentException("Argument " + argumentName + " given twice on " + name);
            }
        }
        return new FieldSelection(name, alias, arguments);
    }
}
