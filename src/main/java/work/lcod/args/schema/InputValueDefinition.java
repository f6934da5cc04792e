package work.lcod.args.schema;

import java.util.Objects;

/**
 * A typed input position: a field argument or an input object field, with an optional default.
 * The default is already coerced; {@code hasDefault} distinguishes "defaults to null" from "no default".
 */
public record InputValueDefinition(String name, TypeDescriptor type, boolean hasDefault, Object defaultValue) {
    public InputValueDefinition {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("Input value name must not be blank");
        }
        Objects.requireNonNull(type, "type");
        if (!hasDefault) {
            defaultValue = null;
        }
    }

    public static InputValueDefinition of(String name, TypeDescriptor type) {
        return new InputValueDefinition(name, type, false, null);
    }

    public static InputValueDefinition withDefault(String name, TypeDescriptor type, Object defaultValue) {
        return new InputValueDefinition(name, type, true, defaultValue);
    }
}
