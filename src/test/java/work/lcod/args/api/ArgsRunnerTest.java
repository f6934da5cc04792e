package work.lcod.args.api;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;
import work.lcod.args.coerce.RequiredArgumentPolicy;

class ArgsRunnerTest {
    private static final Path RESOURCES = Path.of("src", "test", "resources").toAbsolutePath();

    @Test
    void coercesVariablesIntoFieldArguments() throws Exception {
        var config = ArgsRunConfiguration.builder()
            .schemaPath(RESOURCES.resolve("schemas/users.toml"))
            .operationPath(RESOURCES.resolve("operations/find-user.yaml"))
            .variablesPayload(Files.readString(RESOURCES.resolve("variables/find-user.json")))
            .build();

        var result = new ArgsRunner().run(config);

        assertEquals(RunResult.Status.SUCCESS, result.status());
        assertEquals("FindUser", result.metadata().get("operation"));
        assertEquals("DEFER_TO_VALIDATION", result.metadata().get("requiredArguments"));
        assertEquals(Map.of("contact", Map.of("email", "bubba@joe.com")), result.arguments("user").orElseThrow());
        assertEquals(List.of(), result.failedFields());
        assertEquals(
            List.of(Map.of("field", "user", "arguments", Map.of("contact", Map.of("email", "bubba@joe.com")))),
            result.toSerializableMap().get("fields")
        );
    }

    @Test
    void missingRequiredVariableFailsTheRun() {
        var config = ArgsRunConfiguration.builder()
            .schemaPath(RESOURCES.resolve("schemas/users.toml"))
            .operationPath(RESOURCES.resolve("operations/find-user.yaml"))
            .build();

        var result = new ArgsRunner().run(config);

        assertEquals(RunResult.Status.FAILURE, result.status());
        assertEquals(1, result.status().exitCode());
        assertEquals("1 field(s) failed argument coercion", result.error());
        assertEquals(List.of("user"), result.failedFields());
        assertTrue(result.arguments("user").isEmpty());
        assertEquals("Field `user': Argument `contact' (ContactInput!): variable $contact of required type ContactInput! was not provided",
            result.fields().get(0).error().message());
    }

    @Test
    void requiredArgumentPolicyIsConfigurable() {
        var builder = ArgsRunConfiguration.builder()
            .schemaPath(RESOURCES.resolve("schemas/users.toml"))
            .operationPath(RESOURCES.resolve("operations/required-thing.yaml"));

        var deferred = new ArgsRunner().run(builder.build());
        var enforced = new ArgsRunner().run(builder.requiredArgumentPolicy(RequiredArgumentPolicy.ENFORCE).build());

        assertEquals(RunResult.Status.SUCCESS, deferred.status());
        assertEquals(Map.of(), deferred.arguments("requiredThing").orElseThrow());
        assertEquals(RunResult.Status.FAILURE, enforced.status());
        assertEquals("ENFORCE", enforced.metadata().get("requiredArguments"));
        assertEquals(List.of("requiredThing"), enforced.failedFields());
    }

    @Test
    void loadErrorsBecomeFailedResults() {
        var config = ArgsRunConfiguration.builder()
            .schemaPath(RESOURCES.resolve("schemas/users.toml"))
            .operationPath(RESOURCES.resolve("operations/find-user.yaml"))
            .variablesPayload("{not json")
            .build();

        var result = new ArgsRunner().run(config);

        assertEquals(RunResult.Status.FAILURE, result.status());
        assertEquals("Invalid JSON variables payload", result.error());
        assertTrue(result.fields().isEmpty());
        assertTrue(result.toPrettyJson().contains("\"status\" : \"failure\""));
    }

    @Test
    void fieldsAreReportedByResponseKey() {
        var config = ArgsRunConfiguration.builder()
            .schemaPath(RESOURCES.resolve("schemas/shop.toml"))
            .operationPath(RESOURCES.resolve("operations/search-products.json"))
            .build();

        var result = new ArgsRunner().run(config);

        assertEquals(RunResult.Status.FAILURE, result.status());
        assertEquals(List.of("contacts"), result.failedFields());
        var matches = result.arguments("matches").orElseThrow();
        assertEquals(10, matches.get("limit"));
        assertEquals("GREEN", ((Map<?, ?>) matches.get("filter")).get("color"));
        assertTrue(result.arguments("products").isEmpty());
        assertTrue(result.arguments("contacts").isEmpty());
    }
}
