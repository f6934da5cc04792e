package work.lcod.args.value;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Structural conversion of JSON-like request values (maps, lists, numbers, strings, booleans, null) into
 * {@link RawValue}. Variable values arrive pre-parsed, so strings are never read as variable references or enum
 * literals here.
 */
public final class ExternalValues {
    private ExternalValues() {}

    public static RawValue toRaw(Object value) {
        if (value == null) {
            return RawValue.NULL;
        }
        if (value instanceof Map<?, ?> map) {
            var fields = new LinkedHashMap<String, RawValue>();
            for (Map.Entry<?, ?> entry : map.entrySet()) {
                fields.put(String.valueOf(entry.getKey()), toRaw(entry.getValue()));
            }
            return new RawValue.LiteralObject(fields);
        }
        if (value instanceof List<?> list) {
            List<RawValue> items = new ArrayList<>(list.size());
            for (Object item : list) {
                items.add(toRaw(item));
            }
            return new RawValue.LiteralList(items);
        }
        if (value instanceof String str) {
            return new RawValue.LiteralString(str);
        }
        if (value instanceof Boolean bool) {
            return new RawValue.LiteralBoolean(bool);
        }
        if (value instanceof BigInteger big) {
            return new RawValue.LiteralInt(big);
        }
        if (value instanceof Long || value instanceof Integer || value instanceof Short || value instanceof Byte) {
            return RawValue.of(((Number) value).longValue());
        }
        if (value instanceof BigDecimal decimal) {
            return new RawValue.LiteralFloat(decimal.doubleValue());
        }
        if (value instanceof Number number) {
            return new RawValue.LiteralFloat(number.doubleValue());
        }
        throw new IllegalArgumentException("Unsupported variable value type: " + value.getClass().getName());
    }

    /**
     * Copies nested maps and lists so callers never share mutable structure with the schema or the request.
     */
    public static Object deepCopy(Object value) {
        if (value instanceof Map<?, ?> map) {
            Map<String, Object> copy = new LinkedHashMap<>();
            for (Map.Entry<?, ?> entry : map.entrySet()) {
                copy.put(String.valueOf(entry.getKey()), deepCopy(entry.getValue()));
            }
            return copy;
        }
        if (value instanceof List<?> list) {
            List<Object> copy = new ArrayList<>(list.size());
            for (Object item : list) {
                copy.add(deepCopy(item));
            }
            return copy;
        }
        return value;
    }
}
