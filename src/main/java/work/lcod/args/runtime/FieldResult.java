package work.lcod.args.runtime;

/**
 * Resolver outcome: a value to serialize, or an error message for the field.
 */
public record FieldResult(boolean ok, Object value, String error) {
    public static FieldResult ok(Object value) {
        return new FieldResult(true, value, null);
    }

    public static FieldResult error(String message) {
        return new FieldResult(false, null, message);
    }
}
