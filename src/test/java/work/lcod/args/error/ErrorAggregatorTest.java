package work.lcod.args.error;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;
import work.lcod.args.coerce.ArgumentPath;
import work.lcod.args.coerce.CoercionFailure;
import work.lcod.args.coerce.FailureKind;

class ErrorAggregatorTest {
    @Test
    void joinsFailuresInOrder() {
        var failures = List.of(
            new CoercionFailure(ArgumentPath.of("contacts").index(1).field("email"), FailureKind.VALUE_REQUIRED, "String!", "no value provided"),
            new CoercionFailure(ArgumentPath.of("limit"), FailureKind.SCALAR_COERCION_FAILED, "Int", "Expected AST type 'IntValue' but was 'StringValue'.")
        );

        var error = ErrorAggregator.report("contacts", failures);

        assertEquals("Field `contacts': Argument `contacts[1].email' (String!): no value provided; "
            + "Argument `limit' (Int): Expected AST type 'IntValue' but was 'StringValue'.", error.message());
        assertEquals(failures, error.failures());
        assertEquals(Map.of("message", error.message()), error.toMap());
    }

    @Test
    void resolverReasonIsPrefixedWithField() {
        var error = ErrorAggregator.fromResolver("user", "Got %{} instead");

        assertEquals("Field `user': Got %{} instead", error.message());
        assertTrue(error.failures().isEmpty());
        assertEquals("Field `user': Unexpected error", ErrorAggregator.fromResolver("user", " ").message());
    }

    @Test
    void emptyReportIsAProgrammingError() {
        assertThrows(IllegalArgumentException.class, () -> ErrorAggregator.report("x", List.of()));
    }
}
