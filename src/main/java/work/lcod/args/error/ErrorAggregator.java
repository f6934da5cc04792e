package work.lcod.args.error;

import java.util.List;
import java.util.stream.Collectors;
import work.lcod.args.coerce.CoercionFailure;

/**
 * Folds the failures of one field into a single error of the form {@code Field `name': reason}.
 */
public final class ErrorAggregator {
    private static final String SEPARATOR = "; ";

    private ErrorAggregator() {}

    public static FieldError report(String fieldName, List<CoercionFailure> failures) {
        if (failures == null || failures.isEmpty()) {
            throw new IllegalArgumentException("No failures to report for field " + fieldName);
        }
        var reason = failures.stream().map(CoercionFailure::describe).collect(Collectors.joining(SEPARATOR));
        return new FieldError(fieldName, format(fieldName, reason), failures);
    }

    public static FieldError fromResolver(String fieldName, String reason) {
        var text = reason == null || reason.isBlank() ? "Unexpected error" : reason;
        return new FieldError(fieldName, format(fieldName, text), List.of());
    }

    static String format(String fieldName, String reason) {
        return "Field `" + fieldName + "': " + reason;
    }
}
