package work.lcod.args.runtime;

import java.util.LinkedHashMap;
import java.util.Map;
import work.lcod.args.error.FieldError;

/**
 * Argument coercion outcome for one selection: either the argument map or the field's error.
 */
public record FieldArguments(FieldSelection selection, Map<String, Object> arguments, FieldError error) {
    public boolean ok() {
        return error == null;
    }

    public Map<String, Object> toMap() {
        var map = new LinkedHashMap<String, Object>();
        map.put("field", selection.responseKey());
        if (error == null) {
            map.put("arguments", arguments);
        } else {
            map.put("error", error.message());
        }
        return map;
    }
}
