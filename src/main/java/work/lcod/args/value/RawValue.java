package work.lcod.args.value;

import java.math.BigInteger;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * Pre-coercion value: an inline literal, a variable reference, or the marker for "nothing supplied".
 * {@link Absent} and {@link LiteralNull} are deliberately different cases: defaults only ever replace the former.
 */
public sealed interface RawValue
    permits RawValue.LiteralInt, RawValue.LiteralFloat, RawValue.LiteralString, RawValue.LiteralBoolean,
        RawValue.LiteralEnum, RawValue.LiteralList, RawValue.LiteralObject, RawValue.LiteralNull,
        RawValue.VariableRef, RawValue.Absent {

    LiteralNull NULL = new LiteralNull();
    Absent ABSENT = new Absent();

    /**
     * Renders the value in query-literal syntax, for error messages.
     */
    String render();

    static LiteralInt of(long value) {
        return new LiteralInt(BigInteger.valueOf(value));
    }

    static LiteralFloat of(double value) {
        return new LiteralFloat(value);
    }

    static LiteralString of(String value) {
        return new LiteralString(value);
    }

    static LiteralBoolean of(boolean value) {
        return new LiteralBoolean(value);
    }

    static LiteralEnum enumValue(String name) {
        return new LiteralEnum(name);
    }

    static LiteralList list(RawValue... items) {
        return new LiteralList(List.of(items));
    }

    static VariableRef variable(String name) {
        return new VariableRef(name);
    }

    record LiteralInt(BigInteger value) implements RawValue {
        public LiteralInt {
            Objects.requireNonNull(value, "value");
        }

        @Override
        public String render() {
            return value.toString();
        }
    }

    record LiteralFloat(double value) implements RawValue {
        @Override
        public String render() {
            return Double.toString(value);
        }
    }

    record LiteralString(String value) implements RawValue {
        public LiteralString {
            Objects.requireNonNull(value, "value");
        }

        @Override
        public String render() {
            return '"' + value.replace("\\", "\\\\").replace("\"", "\\\"") + '"';
        }
    }

    record LiteralBoolean(boolean value) implements RawValue {
        @Override
        public String render() {
            return Boolean.toString(value);
        }
    }

    record LiteralEnum(String name) implements RawValue {
        public LiteralEnum {
            Objects.requireNonNull(name, "name");
        }

        @Override
        public String render() {
            return name;
        }
    }

    record LiteralList(List<RawValue> items) implements RawValue {
        public LiteralList {
            items = List.copyOf(items);
        }

        @Override
        public String render() {
            return items.stream().map(RawValue::render).collect(Collectors.joining(", ", "[", "]"));
        }
    }

    /**
     * Object literal; field order is preserved as written.
     */
    record LiteralObject(Map<String, RawValue> fields) implements RawValue {
        public LiteralObject {
            var copy = new LinkedHashMap<String, RawValue>();
            for (var entry : fields.entrySet()) {
                copy.put(Objects.requireNonNull(entry.getKey(), "field name"), Objects.requireNonNull(entry.getValue(), entry.getKey()));
            }
            fields = Collections.unmodifiableMap(copy);
        }

        @Override
        public String render() {
            return fields.entrySet().stream()
                .map(entry -> entry.getKey() + ": " + entry.getValue().render())
                .collect(Collectors.joining(", ", "{", "}"));
        }
    }

    record LiteralNull() implements RawValue {
        @Override
        public String render() {
            return "null";
        }
    }

    record VariableRef(String name) implements RawValue {
        public VariableRef {
            if (name == null || name.isBlank()) {
                throw new IllegalArgumentException("Variable name must not be blank");
            }
        }

        @Override
        public String render() {
            return "$" + name;
        }
    }

    record Absent() implements RawValue {
        @Override
        public String render() {
            return "<absent>";
        }
    }
}
