package work.lcod.args.coerce;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import work.lcod.args.schema.TypeDescriptor;
import work.lcod.args.value.ExternalValues;
import work.lcod.args.value.RawValue;

/**
 * Resolves a variable reference against the type expected where it appears.
 * <p>
 * Supplied values are converted structurally and coerced by the owning {@link ArgumentCoercer}; a missing variable
 * falls back to its declared default literal, fails when declared non-null, and is otherwise absent.
 */
public final class VariableResolver {
    private static final Logger log = LoggerFactory.getLogger(VariableResolver.class);

    private final ArgumentCoercer coercer;

    VariableResolver(ArgumentCoercer coercer) {
        this.coercer = coercer;
    }

    public CoercionResult resolve(String name, TypeDescriptor expectedType, CoercionScope scope) {
        return resolve(name, expectedType, ArgumentPath.root(), scope);
    }

    CoercionResult resolve(String name, TypeDescriptor expectedType, ArgumentPath path, CoercionScope scope) {
        var definition = scope.definition(name);
        if (definition == null) {
            return ArgumentCoercer.failure(path, FailureKind.UNDEFINED_VARIABLE, expectedType,
                "variable $" + name + " is not defined by the operation");
        }
        if (!scope.isSupplied(name)) {
            if (definition.hasDefault()) {
                log.trace("Variable ${} not supplied, using its default {}", name, definition.defaultValue().render());
                return coercer.coerce(expectedType, definition.defaultValue(), path, scope.forLiteral());
            }
            if (definition.type() instanceof TypeDescriptor.NonNull) {
                return ArgumentCoercer.failure(path, FailureKind.MISSING_REQUIRED_VARIABLE, definition.type(),
                    "variable $" + name + " of required type " + definition.type().render() + " was not provided");
            }
            return CoercionResult.absent();
        }
        var supplied = scope.variable(name);
        if (supplied == null && definition.type() instanceof TypeDescriptor.NonNull) {
            return ArgumentCoercer.failure(path, FailureKind.VALUE_REQUIRED, definition.type(),
                "variable $" + name + " of required type " + definition.type().render() + " was null");
        }
        RawValue raw;
        try {
            raw = ExternalValues.toRaw(supplied);
        } catch (IllegalArgumentException ex) {
            return ArgumentCoercer.failure(path, FailureKind.SHAPE_MISMATCH, expectedType, ex.getMessage());
        }
        return coercer.coerce(expectedType, raw, path, scope.forVariableValue());
    }
}
