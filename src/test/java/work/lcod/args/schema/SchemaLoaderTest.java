package work.lcod.args.schema;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;
import work.lcod.args.runtime.ExecutionContext;
import work.lcod.args.runtime.FieldResolver;
import work.lcod.args.runtime.FieldResult;
import work.lcod.args.runtime.FieldSelection;
import work.lcod.args.runtime.Operation;
import work.lcod.args.runtime.OperationExecutor;
import work.lcod.args.support.ArgsTestSupport;
import work.lcod.args.value.RawValue;

class SchemaLoaderTest {
    private static final Path SHOP = Path.of("src", "test", "resources", "schemas", "shop.toml").toAbsolutePath();

    @Test
    void loadsEnumsInputsAndQueryFields() {
        var schema = SchemaLoader.load(SHOP);

        var color = assertInstanceOf(TypeDescriptor.EnumType.class, schema.type("Color"));
        assertEquals(List.of("RED", "GREEN", "BLUE"), color.values());

        var filter = assertInstanceOf(TypeDescriptor.InputObject.class, schema.type("ProductFilter"));
        assertEquals("String!", filter.field("term").type().render());
        assertSame(schema.type("PageInput"), filter.field("page").type());
        assertEquals("RED", filter.field("color").defaultValue());
        assertEquals(List.of("new"), filter.field("tags").defaultValue());

        var products = schema.queryField("products");
        assertEquals("[String]", products.returnType().render());
        var limit = products.arguments().stream().filter(argument -> argument.name().equals("limit")).findFirst().orElseThrow();
        assertTrue(limit.hasDefault());
        assertEquals(10, limit.defaultValue());
    }

    @Test
    void defaultsAreCoercedWhileLoading() {
        var schema = SchemaLoader.load(SHOP);

        var page = (TypeDescriptor.InputObject) schema.type("PageInput");

        assertEquals(Integer.valueOf(20), page.field("size").defaultValue());
        assertFalse(page.field("after").hasDefault());
    }

    @Test
    void resolversAreBoundByFieldName() throws Exception {
        FieldResolver products = (args, ctx) -> {
            var filter = (Map<?, ?>) args.get("filter");
            return FieldResult.ok(List.of(filter.get("term") + ":" + filter.get("color") + ":" + args.get("limit")));
        };
        var schema = SchemaLoader.load(SHOP, Schema.builder(), Map.of("products", products));
        var operation = Operation.of(
            FieldSelection.of("products", Map.of("filter", ArgsTestSupport.object("term", RawValue.of("boots")))),
            FieldSelection.of("contacts", Map.of("emails", RawValue.list(RawValue.of("a@b.com"))))
        );

        var result = new OperationExecutor(schema).execute(operation, Map.of(), new ExecutionContext());

        assertEquals(Map.of("products", List.of("boots:RED:10")), result.data());
        assertEquals("Field `contacts': No resolver registered for contacts", result.errors().get(0).message());
    }

    @Test
    void customScalarsComeFromTheBuilder() {
        var builder = Schema.builder().scalar(ArgsTestSupport.NAME);
        var toml = "[inputs.Person]\n"
            + "name = { type = \"Name!\", default = \"Ann\" }\n";

        var schema = SchemaLoader.parse(toml, builder, Map.of());

        var person = (TypeDescriptor.InputObject) schema.type("Person");
        assertEquals(new ArgsTestSupport.PersonName("Ann"), person.field("name").defaultValue());
    }

    @Test
    void recursiveInputsAreRejected() {
        var error = assertThrows(IllegalStateException.class,
            () -> SchemaLoader.load(Path.of("src", "test", "resources", "schemas", "cyclic.toml")));

        assertTrue(error.getMessage().startsWith("Recursive input objects are not supported"), error.getMessage());
    }

    @Test
    void invalidDefaultFailsTheLoad() {
        var toml = "[inputs.Page]\n"
            + "size = { type = \"Int\", default = \"ten\" }\n";

        var error = assertThrows(IllegalStateException.class, () -> SchemaLoader.parse(toml, Schema.builder(), Map.of()));

        assertEquals("Invalid default for inputs.Page.size: Expected AST type 'IntValue' but was 'StringValue'.", error.getMessage());
    }

    @Test
    void unknownTypeReferenceFailsTheLoad() {
        var toml = "[query.lookup]\n"
            + "type = \"String\"\n"
            + "args.id = \"Identifier\"\n";

        var error = assertThrows(IllegalArgumentException.class, () -> SchemaLoader.parse(toml, Schema.builder(), Map.of()));

        assertEquals("Unknown type: Identifier", error.getMessage());
    }

    @Test
    void malformedTomlIsReported() {
        var error = assertThrows(IllegalStateException.class, () -> SchemaLoader.parse("[query.x\n", Schema.builder(), Map.of()));

        assertTrue(error.getMessage().startsWith("Invalid schema manifest"));
    }
}
