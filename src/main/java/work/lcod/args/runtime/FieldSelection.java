package work.lcod.args.runtime;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import work.lcod.args.value.RawValue;

/**
 * A top-level field selected by an operation, with its raw (normalized, unresolved) arguments.
 */
public record FieldSelection(String name, String alias, Map<String, RawValue> arguments) {
    public FieldSelection {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("Selected field name must not be blank");
        }
        arguments = arguments == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(arguments));
    }

    public static FieldSelection of(String name) {
        return new FieldSelection(name, null, Map.of());
    }

    public static FieldSelection of(String name, Map<String, RawValue> arguments) {
        return new FieldSelection(name, null, arguments);
    }

    public String responseKey() {
        return alias == null || alias.isBlank() ? name : alias;
    }
}
