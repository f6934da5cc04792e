package work.lcod.args.runtime;

import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Thrown by defensive resolver code when the argument map lacks a key it expects. The coercer leaves omitted
 * top-level arguments out of the map, so a required argument can reach the resolver missing.
 */
public final class ArgumentMismatchException extends FieldResolutionException {
    public static final String CODE = "ResolutionArgumentMismatch";

    public ArgumentMismatchException(String message) {
        super(CODE, message);
    }

    /**
     * Builds {@code Got %{name: "bob"} instead} for the arguments actually received.
     */
    public static ArgumentMismatchException unexpected(Map<String, ?> arguments) {
        return new ArgumentMismatchException("Got " + inspect(arguments) + " instead");
    }

    /**
     * Returns the argument or throws when the key is missing.
     */
    public static Object require(Map<String, ?> arguments, String name) {
        if (arguments == null || !arguments.containsKey(name)) {
            throw unexpected(arguments == null ? Map.of() : arguments);
        }
        return arguments.get(name);
    }

    static String inspect(Object value) {
        if (value == null) {
            return "null";
        }
        if (value instanceof Map<?, ?> map) {
            return map.entrySet().stream()
                .map(entry -> entry.getKey() + ": " + inspect(entry.getValue()))
                .collect(Collectors.joining(", ", "%{", "}"));
        }
        if (value instanceof List<?> list) {
            return list.stream().map(ArgumentMismatchException::inspect).collect(Collectors.joining(", ", "[", "]"));
        }
        if (value instanceof CharSequence text) {
            return '"' + text.toString() + '"';
        }
        return String.valueOf(value);
    }
}
