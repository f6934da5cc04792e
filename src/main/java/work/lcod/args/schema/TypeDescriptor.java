package work.lcod.args.schema;

import java.util.HashSet;
import java.util.List;
import java.util.Objects;

/**
 * Immutable description of an input type. The set of cases is closed so the coercer can dispatch exhaustively;
 * descriptor graphs are built once per schema and shared read-only across executions.
 */
public sealed interface TypeDescriptor
    permits TypeDescriptor.Scalar, TypeDescriptor.EnumType, TypeDescriptor.InputObject, TypeDescriptor.ListOf, TypeDescriptor.NonNull {

    /**
     * Renders the descriptor as an SDL type reference ({@code [ContactInput!]!}).
     */
    String render();

    /**
     * Strips list and non-null wrappers.
     */
    default TypeDescriptor namedType() {
        TypeDescriptor current = this;
        while (true) {
            if (current instanceof NonNull nonNull) {
                current = nonNull.of();
            } else if (current instanceof ListOf list) {
                current = list.of();
            } else {
                return current;
            }
        }
    }

    static ListOf listOf(TypeDescriptor of) {
        return new ListOf(of);
    }

    static NonNull nonNull(TypeDescriptor of) {
        return new NonNull(of);
    }

    record Scalar(String name, ScalarParser parser, ScalarSerializer serializer) implements TypeDescriptor {
        public Scalar {
            requireName(name);
            Objects.requireNonNull(parser, "parser");
            Objects.requireNonNull(serializer, "serializer");
        }

        @Override
        public String render() {
            return name;
        }
    }

    record EnumType(String name, List<String> values) implements TypeDescriptor {
        public EnumType {
            requireName(name);
            values = List.copyOf(values);
            if (values.isEmpty()) {
                throw new IllegalArgumentException("Enum " + name + " must declare at least one value");
            }
        }

        public boolean contains(String value) {
            return values.contains(value);
        }

        @Override
        public String render() {
            return name;
        }
    }

    record InputObject(String name, List<InputValueDefinition> fields) implements TypeDescriptor {
        public InputObject {
            requireName(name);
            var seen = new HashSet<String>();
            for (var field : fields) {
                if (!seen.add(field.name())) {
                    throw new IllegalArgumentException("Duplicate field " + field.name() + " on input " + name);
                }
            }
            fields = List.copyOf(fields);
        }

        public InputValueDefinition field(String fieldName) {
            for (var field : fields) {
                if (field.name().equals(fieldName)) {
                    return field;
                }
            }
            return null;
        }

        @Override
        public String render() {
            return name;
        }
    }

    record ListOf(TypeDescriptor of) implements TypeDescriptor {
        public ListOf {
            Objects.requireNonNull(of, "of");
        }

        @Override
        public String render() {
            return "[" + of.render() + "]";
        }
    }

    record NonNull(TypeDescriptor of) implements TypeDescriptor {
        public NonNull {
            Objects.requireNonNull(of, "of");
            if (of instanceof NonNull) {
                throw new IllegalArgumentException("NonNull cannot wrap another NonNull: " + of.render());
            }
        }

        @Override
        public String render() {
            return of.render() + "!";
        }
    }

    private static void requireName(String name) {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("Type name must not be blank");
        }
    }
}
