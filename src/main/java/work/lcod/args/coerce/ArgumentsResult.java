package work.lcod.args.coerce;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Coerced arguments of one field: the values that were determined, plus every failure that occurred.
 */
public record ArgumentsResult(Map<String, Object> values, List<CoercionFailure> failures) {
    public ArgumentsResult {
        values = Collections.unmodifiableMap(new LinkedHashMap<>(values));
        failures = List.copyOf(failures);
    }

    public boolean isSuccess() {
        return failures.isEmpty();
    }
}
