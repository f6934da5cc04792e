package work.lcod.args.runtime;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;
import work.lcod.args.error.FieldError;

/**
 * Response shape: resolved field data keyed by response key, plus one error per failed field.
 */
public record ExecutionResult(Map<String, Object> data, List<FieldError> errors) {
    public ExecutionResult {
        data = Collections.unmodifiableMap(new LinkedHashMap<>(data));
        errors = List.copyOf(errors);
    }

    public boolean hasErrors() {
        return !errors.isEmpty();
    }

    public Map<String, Object> toMap() {
        var map = new LinkedHashMap<String, Object>();
        map.put("data", data);
        if (!errors.isEmpty()) {
            map.put("errors", errors.stream().map(FieldError::toMap).collect(Collectors.toList()));
        }
        return map;
    }
}
