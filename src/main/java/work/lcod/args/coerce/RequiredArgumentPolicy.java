package work.lcod.args.coerce;

/**
 * How a top-level non-null argument that the query omits entirely (no literal, no variable, no default) is treated.
 * Nested positions and variables are always enforced.
 */
public enum RequiredArgumentPolicy {
    /** Leave the key out of the argument map; an upstream validation phase (or the resolver) reports it. */
    DEFER_TO_VALIDATION,
    /** Fail the argument with {@link FailureKind#VALUE_REQUIRED}. */
    ENFORCE
}
