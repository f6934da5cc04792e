package work.lcod.args.api;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.io.IOException;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import work.lcod.args.coerce.ArgumentCoercer;
import work.lcod.args.runtime.OperationExecutor;
import work.lcod.args.runtime.OperationLoader;
import work.lcod.args.schema.SchemaLoader;

/**
 * Public entry point for coercing an operation document's arguments against a schema manifest.
 */
public final class ArgsRunner {
    private static final Logger log = LoggerFactory.getLogger(ArgsRunner.class);
    private static final ObjectMapper JSON = new ObjectMapper();
    private static final TypeReference<Map<String, Object>> MAP_REF = new TypeReference<>() {};

    public RunResult run(ArgsRunConfiguration configuration) {
        var started = Instant.now();
        try {
            var schema = SchemaLoader.load(configuration.schemaPath());
            var operation = OperationLoader.loadFromFile(configuration.operationPath(), schema);
            var variables = parseVariables(configuration.variablesPayload());
            var executor = new OperationExecutor(schema, new ArgumentCoercer(configuration.requiredArgumentPolicy()));
            var report = executor.coerce(operation, variables);

            var metadata = new LinkedHashMap<String, Object>();
            metadata.put("schema", configuration.schemaPath().toString());
            metadata.put("operation", operation.displayName());
            metadata.put("requiredArguments", configuration.requiredArgumentPolicy().name());
            var result = RunResult.coerced(report, metadata, started);
            if (result.status() == RunResult.Status.FAILURE) {
                log.debug("Operation {} has failing fields {}", operation.displayName(), result.failedFields());
            }
            return result;
        } catch (Exception ex) {
            var errorMeta = new LinkedHashMap<String, Object>();
            errorMeta.put("schema", configuration.schemaPath().toString());
            errorMeta.put("operationPath", configuration.operationPath().toString());
            if (ex.getMessage() != null && !ex.getMessage().isBlank()) {
                errorMeta.put("error", ex.getMessage());
            }
            if (Boolean.getBoolean("lcod.debug")) {
                log.error("Argument coercion run failed", ex);
            }
            return RunResult.failure(ex.getMessage(), errorMeta, started);
        }
    }

    private Map<String, Object> parseVariables(String payload) {
        if (payload == null || payload.isBlank()) {
            return new LinkedHashMap<>();
        }
        try {
            var parsed = JSON.readValue(payload, MAP_REF);
            return parsed == null ? new LinkedHashMap<>() : new LinkedHashMap<>(parsed);
        } catch (IOException ex) {
            throw new IllegalArgumentException("Invalid JSON variables payload", ex);
        }
    }
}
