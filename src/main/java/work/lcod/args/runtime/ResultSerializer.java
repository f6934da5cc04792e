package work.lcod.args.runtime;

import java.util.ArrayList;
import java.util.Collection;
import work.lcod.args.schema.TypeDescriptor;

/**
 * Renders resolver values into their external form following the field's return type.
 */
final class ResultSerializer {
    static final String INVALID_RESULT = "InvalidResult";

    private ResultSerializer() {}

    static Object serialize(TypeDescriptor type, Object value) {
        if (type instanceof TypeDescriptor.NonNull nonNull) {
            if (value == null) {
                throw new FieldResolutionException(INVALID_RESULT, "Cannot return null for non-nullable type " + type.render());
            }
            return serialize(nonNull.of(), value);
        }
        if (value == null) {
            return null;
        }
        if (type instanceof TypeDescriptor.ListOf list) {
            if (!(value instanceof Collection<?> items)) {
                throw new FieldResolutionException(INVALID_RESULT, "Expected a list for " + type.render() + ", got " + value.getClass().getSimpleName());
            }
            var serialized = new ArrayList<Object>(items.size());
            for (Object item : items) {
                serialized.add(serialize(list.of(), item));
            }
            return serialized;
        }
        if (type instanceof TypeDescriptor.Scalar scalar) {
            return scalar.serializer().serialize(value);
        }
        if (type instanceof TypeDescriptor.EnumType enumType) {
            var symbol = value instanceof Enum<?> constant ? constant.name() : String.valueOf(value);
            if (!enumType.contains(symbol)) {
                throw new FieldResolutionException(INVALID_RESULT, "Enum " + enumType.name() + " cannot represent value: " + symbol);
            }
            return symbol;
        }
        throw new IllegalStateException("Cannot serialize a value of input type " + type.render());
    }
}
