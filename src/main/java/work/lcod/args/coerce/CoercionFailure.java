package work.lcod.args.coerce;

import java.util.Objects;

/**
 * One coercion failure, attributed to a position inside an argument.
 *
 * @param expectedType SDL rendering of the type expected at {@code path}
 */
public record CoercionFailure(ArgumentPath path, FailureKind kind, String expectedType, String reason) {
    public CoercionFailure {
        Objects.requireNonNull(path, "path");
        Objects.requireNonNull(kind, "kind");
        Objects.requireNonNull(reason, "reason");
    }

    /**
     * Renders {@code Argument `contacts[1].email' (String!): no value provided}.
     */
    public String describe() {
        var out = new StringBuilder("Argument `").append(path.render()).append('\'');
        if (expectedType != null) {
            out.append(" (").append(expectedType).append(')');
        }
        return out.append(": ").append(reason).toString();
    }
}
