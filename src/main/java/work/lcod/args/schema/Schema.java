package work.lcod.args.schema;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.function.Function;
import work.lcod.args.runtime.FieldDefinition;
import work.lcod.args.runtime.FieldResolver;

/**
 * Immutable schema: named input/leaf types plus the query root's fields. Safe to share across threads.
 */
public final class Schema {
    private final Map<String, TypeDescriptor> types;
    private final Map<String, FieldDefinition> queryFields;

    private Schema(Map<String, TypeDescriptor> types, Map<String, FieldDefinition> queryFields) {
        this.types = Collections.unmodifiableMap(new LinkedHashMap<>(types));
        this.queryFields = Collections.unmodifiableMap(new LinkedHashMap<>(queryFields));
    }

    /**
     * Builder pre-populated with the built-in scalars.
     */
    public static Builder builder() {
        var builder = new Builder();
        BuiltinScalars.all().forEach(builder::scalar);
        return builder;
    }

    public TypeDescriptor type(String name) {
        return types.get(name);
    }

    public Map<String, TypeDescriptor> types() {
        return types;
    }

    /**
     * Resolves an SDL type reference such as {@code [ContactInput!]!}.
     */
    public TypeDescriptor typeRef(String ref) {
        return parseTypeRef(ref, types::get);
    }

    public FieldDefinition queryField(String name) {
        return queryFields.get(name);
    }

    public Map<String, FieldDefinition> queryFields() {
        return queryFields;
    }

    static TypeDescriptor parseTypeRef(String ref, Function<String, TypeDescriptor> lookup) {
        if (ref == null || ref.isBlank()) {
            throw new IllegalArgumentException("Type reference must not be blank");
        }
        var parser = new TypeRefParser(ref.replaceAll("\\s+", ""), lookup);
        var type = parser.parseType();
        if (parser.position != parser.text.length()) {
            throw new IllegalArgumentException("Unexpected trailing characters in type reference: " + ref);
        }
        return type;
    }

    private static final class TypeRefParser {
        private final String text;
        private final Function<String, TypeDescriptor> lookup;
        private int position;

        TypeRefParser(String text, Function<String, TypeDescriptor> lookup) {
            this.text = text;
            this.lookup = lookup;
        }

        TypeDescriptor parseType() {
            TypeDescriptor type;
            if (peek() == '[') {
                position++;
                var inner = parseType();
                if (peek() != ']') {
                    throw new IllegalArgumentException("Unclosed list in type reference: " + text);
                }
                position++;
                type = TypeDescriptor.listOf(inner);
            } else {
                type = parseNamed();
            }
            if (peek() == '!') {
                position++;
                type = TypeDescriptor.nonNull(type);
            }
            return type;
        }

        private TypeDescriptor parseNamed() {
            int start = position;
            while (position < text.length() && (Character.isLetterOrDigit(text.charAt(position)) || text.charAt(position) == '_')) {
                position++;
            }
            if (start == position) {
                throw new IllegalArgumentException("Expected a type name at offset " + start + " in: " + text);
            }
            var name = text.substring(start, position);
            var type = lookup.apply(name);
            if (type == null) {
                throw new IllegalArgumentException("Unknown type: " + name);
            }
            return type;
        }

        private char peek() {
            return position < text.length() ? text.charAt(position) : '\0';
        }
    }

    public static final class Builder {
        private final Map<String, TypeDescriptor> types = new LinkedHashMap<>();
        private final Map<String, FieldDefinition> queryFields = new LinkedHashMap<>();

        private Builder() {}

        public Builder scalar(TypeDescriptor.Scalar scalar) {
            return named(scalar.name(), scalar);
        }

        public Builder enumType(TypeDescriptor.EnumType enumType) {
            return named(enumType.name(), enumType);
        }

        public Builder enumType(String name, String... values) {
            return enumType(new TypeDescriptor.EnumType(name, List.of(values)));
        }

        public Builder inputObject(TypeDescriptor.InputObject inputObject) {
            return named(inputObject.name(), inputObject);
        }

        public Builder inputObject(String name, InputValueDefinition... fields) {
            return inputObject(new TypeDescriptor.InputObject(name, List.of(fields)));
        }

        public Builder queryField(FieldDefinition field) {
            Objects.requireNonNull(field, "field");
            if (queryFields.putIfAbsent(field.name(), field) != null) {
                throw new IllegalArgumentException("Duplicate query field: " + field.name());
            }
            return this;
        }

        public Builder queryField(String name, TypeDescriptor returnType, FieldResolver resolver, InputValueDefinition... arguments) {
            return queryField(new FieldDefinition(name, returnType, List.of(arguments), resolver));
        }

        public TypeDescriptor type(String name) {
            return types.get(name);
        }

        public TypeDescriptor typeRef(String ref) {
            return parseTypeRef(ref, types::get);
        }

        public Schema build() {
            return new Schema(types, queryFields);
        }

        private Builder named(String name, TypeDescriptor type) {
            if (types.putIfAbsent(name, type) != null) {
                throw new IllegalArgumentException("Duplicate type name: " + name);
            }
            return this;
        }
    }
}
