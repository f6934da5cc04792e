package work.lcod.args.schema;

/**
 * Converts a domain value back to its external (JSON-like) form.
 */
@FunctionalInterface
public interface ScalarSerializer {
    Object serialize(Object value);
}
