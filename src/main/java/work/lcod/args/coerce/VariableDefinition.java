package work.lcod.args.coerce;

import java.util.Objects;
import work.lcod.args.schema.TypeDescriptor;
import work.lcod.args.value.RawValue;

/**
 * A variable declared by an operation. {@code defaultValue} is a literal, {@link RawValue#ABSENT} when undeclared.
 */
public record VariableDefinition(String name, TypeDescriptor type, RawValue defaultValue) {
    public VariableDefinition {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("Variable name must not be blank");
        }
        Objects.requireNonNull(type, "type");
        defaultValue = defaultValue == null ? RawValue.ABSENT : defaultValue;
        if (defaultValue instanceof RawValue.VariableRef) {
            throw new IllegalArgumentException("Default for $" + name + " cannot reference a variable");
        }
    }

    public static VariableDefinition of(String name, TypeDescriptor type) {
        return new VariableDefinition(name, type, RawValue.ABSENT);
    }

    public boolean hasDefault() {
        return !(defaultValue instanceof RawValue.Absent);
    }
}
