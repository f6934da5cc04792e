package work.lcod.args.coerce;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import work.lcod.args.schema.InputValueDefinition;
import work.lcod.args.schema.ParseResult;
import work.lcod.args.schema.TypeDescriptor;
import work.lcod.args.value.ExternalValues;
import work.lcod.args.value.RawValue;

/**
 * Recursive coercion of raw argument values against their declared types.
 * <p>
 * Failures are returned as values and collected across list elements and input object fields; nothing here throws
 * for bad user input. Instances are stateless apart from the policy and can be shared across threads.
 */
public final class ArgumentCoercer {
    private static final Logger log = LoggerFactory.getLogger(ArgumentCoercer.class);

    private final RequiredArgumentPolicy requiredArgumentPolicy;
    private final VariableResolver variableResolver;

    public ArgumentCoercer() {
        this(RequiredArgumentPolicy.DEFER_TO_VALIDATION);
    }

    public ArgumentCoercer(RequiredArgumentPolicy requiredArgumentPolicy) {
        this.requiredArgumentPolicy = Objects.requireNonNull(requiredArgumentPolicy, "requiredArgumentPolicy");
        this.variableResolver = new VariableResolver(this);
    }

    public RequiredArgumentPolicy requiredArgumentPolicy() {
        return requiredArgumentPolicy;
    }

    /**
     * Coerces every declared argument of a field. Arguments that end up absent are left out of the map.
     * Raw arguments the field does not declare are ignored.
     */
    public ArgumentsResult coerceArguments(List<InputValueDefinition> arguments, Map<String, RawValue> rawArguments, CoercionScope scope) {
        var raw = rawArguments == null ? Map.<String, RawValue>of() : rawArguments;
        var values = new LinkedHashMap<String, Object>();
        var failures = new ArrayList<CoercionFailure>();
        boolean defer = requiredArgumentPolicy == RequiredArgumentPolicy.DEFER_TO_VALIDATION;
        for (var argument : arguments) {
            var result = coerceInputValue(argument, raw.getOrDefault(argument.name(), RawValue.ABSENT), ArgumentPath.of(argument.name()), scope, defer);
            if (result.isFailed()) {
                failures.addAll(result.failures());
            } else if (result.hasValue()) {
                values.put(argument.name(), result.value());
            }
        }
        if (log.isDebugEnabled()) {
            for (var name : raw.keySet()) {
                if (arguments.stream().noneMatch(argument -> argument.name().equals(name))) {
                    log.debug("Ignoring undeclared argument {}", name);
                }
            }
        }
        return new ArgumentsResult(values, failures);
    }

    /**
     * Coerces a single value against {@code type}, starting at the root path.
     */
    public CoercionResult coerce(TypeDescriptor type, RawValue raw, CoercionScope scope) {
        return coerce(type, raw, ArgumentPath.root(), scope);
    }

    CoercionResult coerce(TypeDescriptor type, RawValue raw, ArgumentPath path, CoercionScope scope) {
        Objects.requireNonNull(type, "type");
        var value = raw == null ? RawValue.ABSENT : raw;
        if (value instanceof RawValue.VariableRef ref) {
            return variableResolver.resolve(ref.name(), type, path, scope);
        }
        if (type instanceof TypeDescriptor.NonNull nonNull) {
            if (value instanceof RawValue.Absent || value instanceof RawValue.LiteralNull) {
                return valueRequired(type, path);
            }
            return coerce(nonNull.of(), value, path, scope);
        }
        if (value instanceof RawValue.Absent) {
            return CoercionResult.absent();
        }
        if (value instanceof RawValue.LiteralNull) {
            return CoercionResult.of(null);
        }
        if (type instanceof TypeDescriptor.Scalar scalar) {
            return coerceScalar(scalar, value, path);
        }
        if (type instanceof TypeDescriptor.EnumType enumType) {
            return coerceEnum(enumType, value, path, scope);
        }
        if (type instanceof TypeDescriptor.ListOf list) {
            return coerceList(list, value, path, scope);
        }
        if (type instanceof TypeDescriptor.InputObject inputObject) {
            return coerceInputObject(inputObject, value, path, scope);
        }
        throw new IllegalStateException("Unhandled type descriptor: " + type);
    }

    /**
     * Coerces an argument or input object field, substituting its default only when the position is absent.
     * With {@code deferRequired}, an omitted position without default stays absent even when non-null.
     */
    private CoercionResult coerceInputValue(InputValueDefinition definition, RawValue raw, ArgumentPath path, CoercionScope scope, boolean deferRequired) {
        if (raw instanceof RawValue.Absent) {
            if (definition.hasDefault()) {
                return CoercionResult.of(ExternalValues.deepCopy(definition.defaultValue()));
            }
            if (deferRequired) {
                if (definition.type() instanceof TypeDescriptor.NonNull) {
                    log.debug("Required argument {} omitted; leaving it to validation", path);
                }
                return CoercionResult.absent();
            }
            return coerce(definition.type(), raw, path, scope);
        }
        var result = coerce(definition.type(), raw, path, scope);
        if (result.isAbsent()) {
            // only reachable through a variable that resolved to nothing
            if (definition.hasDefault()) {
                return CoercionResult.of(ExternalValues.deepCopy(definition.defaultValue()));
            }
            if (definition.type() instanceof TypeDescriptor.NonNull) {
                return valueRequired(definition.type(), path);
            }
        }
        return result;
    }

    private CoercionResult coerceScalar(TypeDescriptor.Scalar scalar, RawValue raw, ArgumentPath path) {
        ParseResult parsed;
        try {
            parsed = scalar.parser().parse(raw);
        } catch (RuntimeException ex) {
            log.debug("Parser for scalar {} threw on {}", scalar.name(), raw.render(), ex);
            var message = ex.getMessage() == null || ex.getMessage().isBlank() ? ex.getClass().getSimpleName() : ex.getMessage();
            return failure(path, FailureKind.SCALAR_COERCION_FAILED, scalar, message);
        }
        if (parsed == null) {
            return failure(path, FailureKind.SCALAR_COERCION_FAILED, scalar, "invalid value " + raw.render());
        }
        if (!parsed.ok()) {
            return failure(path, FailureKind.SCALAR_COERCION_FAILED, scalar, parsed.reason());
        }
        return CoercionResult.of(parsed.value());
    }

    private CoercionResult coerceEnum(TypeDescriptor.EnumType enumType, RawValue raw, ArgumentPath path, CoercionScope scope) {
        String symbol = null;
        if (raw instanceof RawValue.LiteralEnum literal) {
            symbol = literal.name();
        } else if (raw instanceof RawValue.LiteralString string && scope.isVariableSourced()) {
            symbol = string.value();
        }
        if (symbol == null || !enumType.contains(symbol)) {
            return failure(path, FailureKind.INVALID_ENUM_VALUE, enumType,
                "expected one of " + enumType.values() + ", got: " + raw.render());
        }
        return CoercionResult.of(symbol);
    }

    private CoercionResult coerceList(TypeDescriptor.ListOf list, RawValue raw, ArgumentPath path, CoercionScope scope) {
        if (!(raw instanceof RawValue.LiteralList literal)) {
            return failure(path, FailureKind.SHAPE_MISMATCH, list, "expected a list, got: " + raw.render());
        }
        var items = literal.items();
        var values = new ArrayList<Object>(items.size());
        var failures = new ArrayList<CoercionFailure>();
        for (int index = 0; index < items.size(); index++) {
            var itemPath = path.index(index);
            var result = coerce(list.of(), items.get(index), itemPath, scope);
            if (result.isFailed()) {
                failures.addAll(result.failures());
            } else if (result.isAbsent()) {
                if (list.of() instanceof TypeDescriptor.NonNull) {
                    failures.addAll(valueRequired(list.of(), itemPath).failures());
                } else {
                    values.add(null);
                }
            } else {
                values.add(result.value());
            }
        }
        return failures.isEmpty() ? CoercionResult.of(values) : CoercionResult.failed(failures);
    }

    private CoercionResult coerceInputObject(TypeDescriptor.InputObject inputObject, RawValue raw, ArgumentPath path, CoercionScope scope) {
        if (!(raw instanceof RawValue.LiteralObject literal)) {
            return failure(path, FailureKind.SHAPE_MISMATCH, inputObject, "expected an input object, got: " + raw.render());
        }
        var supplied = literal.fields();
        var values = new LinkedHashMap<String, Object>();
        var failures = new ArrayList<CoercionFailure>();
        for (var field : inputObject.fields()) {
            var result = coerceInputValue(field, supplied.getOrDefault(field.name(), RawValue.ABSENT), path.field(field.name()), scope, false);
            if (result.isFailed()) {
                failures.addAll(result.failures());
            } else if (result.hasValue()) {
                values.put(field.name(), result.value());
            }
        }
        if (log.isDebugEnabled()) {
            for (var key : supplied.keySet()) {
                if (inputObject.field(key) == null) {
                    log.debug("Dropping unknown field {} of input {} at {}", key, inputObject.name(), path);
                }
            }
        }
        return failures.isEmpty() ? CoercionResult.of(values) : CoercionResult.failed(failures);
    }

    private static CoercionResult valueRequired(TypeDescriptor type, ArgumentPath path) {
        return failure(path, FailureKind.VALUE_REQUIRED, type, "no value provided");
    }

    static CoercionResult failure(ArgumentPath path, FailureKind kind, TypeDescriptor type, String reason) {
        return CoercionResult.failed(new CoercionFailure(path, kind, type == null ? null : type.render(), reason));
    }
}
