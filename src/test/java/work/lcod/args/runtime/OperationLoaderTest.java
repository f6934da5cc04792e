package work.lcod.args.runtime;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static work.lcod.args.support.ArgsTestSupport.variables;

import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;
import work.lcod.args.schema.SchemaLoader;
import work.lcod.args.support.ArgsTestSupport;
import work.lcod.args.value.RawValue;

class OperationLoaderTest {
    private static final Path OPERATIONS = Path.of("src", "test", "resources", "operations");

    @Test
    void loadsDocumentWithVariables() throws Exception {
        var schema = ArgsTestSupport.demoSchema();

        var operation = OperationLoader.loadFromFile(OPERATIONS.resolve("find-user.yaml"), schema);

        assertEquals("FindUser", operation.name());
        assertEquals(1, operation.variables().size());
        assertEquals("ContactInput!", operation.variables().get(0).type().render());
        var selection = operation.selections().get(0);
        assertEquals("user", selection.name());
        assertNull(selection.alias());
        assertEquals(RawValue.variable("contact"), selection.arguments().get("contact"));

        var result = new OperationExecutor(schema).execute(operation, variables("contact", Map.of("email", "bubba@joe.com")), new ExecutionContext());
        assertEquals(Map.of("user", "bubba@joe.com"), result.data());
    }

    @Test
    void loadsBareOperationDefinitionFromJson() {
        var schema = SchemaLoader.load(Path.of("src", "test", "resources", "schemas", "shop.toml"));

        var operation = OperationLoader.loadFromFile(OPERATIONS.resolve("search-products.json"), schema);

        assertEquals("SearchProducts", operation.displayName());
        assertEquals(RawValue.enumValue("GREEN"), operation.variables().get(0).defaultValue());
        assertEquals("Int", operation.variables().get(1).type().render());
        assertEquals("matches", operation.selections().get(0).responseKey());
    }

    @Test
    void coercionReportFollowsSelections() {
        var schema = SchemaLoader.load(Path.of("src", "test", "resources", "schemas", "shop.toml"));
        var operation = OperationLoader.loadFromFile(OPERATIONS.resolve("search-products.json"), schema);

        var report = new OperationExecutor(schema).coerce(operation, Map.of());

        var matches = report.get(0);
        assertEquals("matches", matches.selection().responseKey());
        var filter = (Map<?, ?>) matches.arguments().get("filter");
        assertEquals("boots", filter.get("term"));
        assertEquals("GREEN", filter.get("color"));
        assertEquals(Map.of("size", 20), filter.get("page"));
        assertEquals(List.of("new"), filter.get("tags"));
        assertEquals(10, matches.arguments().get("limit"));

        var contacts = report.get(1);
        assertFalse(contacts.ok());
        assertEquals("Field `contacts': Argument `emails[0]' (String): Expected AST type 'StringValue' but was 'IntValue'.",
            contacts.error().message());
    }

    @Test
    void suppliedVariableOverridesNestedDefault() {
        var schema = SchemaLoader.load(Path.of("src", "test", "resources", "schemas", "shop.toml"));
        var operation = OperationLoader.loadFromFile(OPERATIONS.resolve("search-products.json"), schema);

        var report = new OperationExecutor(schema).coerce(operation, variables("size", 5, "color", "BLUE"));

        var filter = (Map<?, ?>) report.get(0).arguments().get("filter");
        assertEquals(Map.of("size", 5), filter.get("page"));
        assertEquals("BLUE", filter.get("color"));
    }

    @Test
    void acceptsTextualTypesAndNames() {
        var document = "kind: OperationDefinition\n"
            + "variableDefinitions:\n"
            + "  - variable: flag\n"
            + "    type: \"Boolean!\"\n"
            + "selectionSet:\n"
            + "  selections:\n"
            + "    - name: something\n"
            + "      arguments:\n"
            + "        - name: flag\n"
            + "          value: { kind: Variable, name: flag }\n";

        var operation = OperationLoader.fromString(document, ArgsTestSupport.demoSchema());

        assertNull(operation.name());
        assertEquals("Boolean!", operation.variables().get(0).type().render());
        assertEquals(RawValue.variable("flag"), operation.selections().get(0).arguments().get("flag"));
    }

    @Test
    void rejectsUnsupportedDocuments() {
        var schema = ArgsTestSupport.demoSchema();

        var mutation = assertThrows(IllegalArgumentException.class,
            () -> OperationLoader.loadFromFile(OPERATIONS.resolve("mutation.yaml"), schema));
        assertEquals("Unsupported operation type: mutation", mutation.getMessage());

        assertThrows(IllegalArgumentException.class, () -> OperationLoader.fromString("kind: Document\ndefinitions: []\n", schema));
        assertThrows(IllegalArgumentException.class, () -> OperationLoader.fromString("kind: FragmentDefinition\n", schema));
        assertThrows(IllegalArgumentException.class, () -> OperationLoader.fromString(
            "kind: OperationDefinition\nvariableDefinitions:\n  - variable: x\n    type: Unknown\n", schema));
        assertThrows(IllegalStateException.class,
            () -> OperationLoader.loadFromFile(OPERATIONS.resolve("missing.yaml"), schema));
    }
}
