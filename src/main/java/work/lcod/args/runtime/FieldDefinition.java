package work.lcod.args.runtime;

import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import work.lcod.args.schema.InputValueDefinition;
import work.lcod.args.schema.TypeDescriptor;

/**
 * A field on the query root: its return type, declared arguments (in order) and resolver.
 */
public record FieldDefinition(String name, TypeDescriptor returnType, List<InputValueDefinition> arguments, FieldResolver resolver) {
    public FieldDefinition {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("Field name must not be blank");
        }
        Objects.requireNonNull(returnType, "returnType");
        Objects.requireNonNull(resolver, "resolver");
        if (returnType.namedType() instanceof TypeDescriptor.InputObject) {
            throw new IllegalArgumentException("Field " + name + " cannot return input type " + returnType.render());
        }
        var seen = new HashSet<String>();
        for (var argument : arguments) {
            if (!seen.add(argument.name())) {
                throw new IllegalArgumentException("Duplicate argument " + argument.name() + " on field " + name);
            }
        }
        arguments = List.copyOf(arguments);
    }
}
