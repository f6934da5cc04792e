package work.lcod.args.value;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotSame;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;

class ExternalValuesTest {
    @Test
    void convertsJsonShapes() {
        var input = new LinkedHashMap<String, Object>();
        input.put("email", "a@b.com");
        input.put("age", 30);
        input.put("score", new BigDecimal("1.25"));
        input.put("tags", List.of("x", false));
        input.put("note", null);

        var raw = (RawValue.LiteralObject) ExternalValues.toRaw(input);

        assertEquals(RawValue.of("a@b.com"), raw.fields().get("email"));
        assertEquals(RawValue.of(30), raw.fields().get("age"));
        assertEquals(RawValue.of(1.25), raw.fields().get("score"));
        assertEquals(RawValue.list(RawValue.of("x"), RawValue.of(false)), raw.fields().get("tags"));
        assertSame(RawValue.NULL, raw.fields().get("note"));
    }

    @Test
    void stringsAreNeverEnumsOrVariables() {
        assertEquals(new RawValue.LiteralString("$contact"), ExternalValues.toRaw("$contact"));
        assertEquals(new RawValue.LiteralString("RED"), ExternalValues.toRaw("RED"));
    }

    @Test
    void unsupportedValuesAreRejected() {
        assertThrows(IllegalArgumentException.class, () -> ExternalValues.toRaw(new Object()));
        assertThrows(IllegalArgumentException.class, () -> ExternalValues.toRaw(RawValue.of(1)));
    }

    @Test
    void deepCopyDetachesNestedCollections() {
        var inner = new ArrayList<Object>(List.of("a"));
        var source = Map.<String, Object>of("items", inner);

        @SuppressWarnings("unchecked")
        var copy = (Map<String, Object>) ExternalValues.deepCopy(source);
        inner.add("b");

        assertEquals(List.of("a"), copy.get("items"));
        assertNotSame(inner, copy.get("items"));
        assertEquals("x", ExternalValues.deepCopy("x"));
    }
}
