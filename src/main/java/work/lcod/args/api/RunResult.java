package work.lcod.args.api;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.ObjectWriter;
import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.stream.Collectors;
import work.lcod.args.runtime.FieldArguments;

/**
 * Coercion report of one operation run by {@link ArgsRunner}: the outcome per selected field, plus run metadata.
 *
 * <p>A run fails when any field failed coercion, or when the schema, operation or variables could not be loaded;
 * in the latter case {@link #fields()} is empty and {@link #error()} carries the load error.
 */
public record RunResult(Status status, Map<String, Object> metadata, List<FieldArguments> fields, Instant startedAt, Instant finishedAt) {
    private static final ObjectWriter WRITER = new ObjectMapper().writerWithDefaultPrettyPrinter();

    public RunResult {
        metadata = Collections.unmodifiableMap(new LinkedHashMap<>(metadata));
        fields = List.copyOf(fields);
    }

    public static RunResult coerced(List<FieldArguments> fields, Map<String, Object> metadata, Instant startedAt) {
        long failed = fields.stream().filter(field -> !field.ok()).count();
        if (failed == 0) {
            return new RunResult(Status.SUCCESS, metadata, fields, startedAt, Instant.now());
        }
        Map<String, Object> meta = new LinkedHashMap<>(metadata);
        meta.put("error", failed + " field(s) failed argument coercion");
        return new RunResult(Status.FAILURE, meta, fields, startedAt, Instant.now());
    }

    public static RunResult failure(String message, Map<String, Object> metadata, Instant startedAt) {
        Map<String, Object> meta = new LinkedHashMap<>(metadata);
        if (message != null) {
            meta.putIfAbsent("error", message);
        }
        return new RunResult(Status.FAILURE, meta, List.of(), startedAt, Instant.now());
    }

    public String error() {
        return (String) metadata.get("error");
    }

    /**
     * Response keys of the fields whose arguments did not coerce, in selection order.
     */
    public List<String> failedFields() {
        return fields.stream()
            .filter(field -> !field.ok())
            .map(field -> field.selection().responseKey())
            .collect(Collectors.toList());
    }

    /**
     * Coerced arguments of the field answering under {@code responseKey}; empty when it failed or was not selected.
     */
    public Optional<Map<String, Object>> arguments(String responseKey) {
        return fields.stream()
            .filter(field -> field.ok() && field.selection().responseKey().equals(responseKey))
            .findFirst()
            .map(FieldArguments::arguments);
    }

    public Map<String, Object> toSerializableMap() {
        Map<String, Object> serializable = new LinkedHashMap<>();
        serializable.put("status", status.name().toLowerCase(Locale.ROOT));
        serializable.put("metadata", metadata);
        serializable.put("fields", fields.stream().map(FieldArguments::toMap).collect(Collectors.toList()));
        serializable.put("startedAt", startedAt.toString());
        serializable.put("finishedAt", finishedAt.toString());
        return serializable;
    }

    public String toPrettyJson() {
        try {
            return WRITER.writeValueAsString(toSerializableMap());
        } catch (Exception ex) {
            return "{\"status\":\"error\",\"message\":\"" + ex.getMessage() + "\"}";
        }
    }

    public enum Status {
        SUCCESS(0),
        FAILURE(1);

        private final int exitCode;

        Status(int exitCode) {
            this.exitCode = exitCode;
        }

        public int exitCode() {
            return exitCode;
        }
    }
}
