package work.lcod.args.error;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import work.lcod.args.coerce.CoercionFailure;

/**
 * User-visible error attributed to one field. {@code failures} is empty when the error came from the resolver.
 */
public record FieldError(String field, String message, List<CoercionFailure> failures) {
    public FieldError {
        Objects.requireNonNull(field, "field");
        Objects.requireNonNull(message, "message");
        failures = failures == null ? List.of() : List.copyOf(failures);
    }

    /**
     * Response entry; only the message is exposed.
     */
    public Map<String, Object> toMap() {
        var map = new LinkedHashMap<String, Object>();
        map.put("message", message);
        return map;
    }
}
