package work.lcod.args.schema;

import java.math.BigInteger;
import java.util.List;
import work.lcod.args.value.RawValue;

/**
 * The five standard scalars. Int is 32-bit; Float accepts integer literals; ID accepts strings and integers.
 * Parse failures name the AST kind that was expected and the one received.
 */
public final class BuiltinScalars {
    private static final BigInteger INT_MIN = BigInteger.valueOf(Integer.MIN_VALUE);
    private static final BigInteger INT_MAX = BigInteger.valueOf(Integer.MAX_VALUE);

    public static final TypeDescriptor.Scalar INT = new TypeDescriptor.Scalar("Int", BuiltinScalars::parseInt, BuiltinScalars::serializeInt);
    public static final TypeDescriptor.Scalar FLOAT = new TypeDescriptor.Scalar("Float", BuiltinScalars::parseFloat, BuiltinScalars::serializeFloat);
    public static final TypeDescriptor.Scalar STRING = new TypeDescriptor.Scalar("String", BuiltinScalars::parseString, value -> value);
    public static final TypeDescriptor.Scalar BOOLEAN = new TypeDescriptor.Scalar("Boolean", BuiltinScalars::parseBoolean, value -> value);
    public static final TypeDescriptor.Scalar ID = new TypeDescriptor.Scalar("ID", BuiltinScalars::parseId, value -> value == null ? null : String.valueOf(value));

    private BuiltinScalars() {}

    public static List<TypeDescriptor.Scalar> all() {
        return List.of(INT, FLOAT, STRING, BOOLEAN, ID);
    }

    private static ParseResult parseInt(RawValue raw) {
        if (raw instanceof RawValue.LiteralInt literal) {
            var value = literal.value();
            if (value.compareTo(INT_MIN) < 0 || value.compareTo(INT_MAX) > 0) {
                return ParseResult.failure("Expected value to be in the Integer range but it was '" + value + "'");
            }
            return ParseResult.ok(value.intValue());
        }
        return ParseResult.failure("Expected AST type 'IntValue' but was '" + astType(raw) + "'.");
    }

    private static ParseResult parseFloat(RawValue raw) {
        if (raw instanceof RawValue.LiteralFloat literal) {
            return ParseResult.ok(literal.value());
        }
        if (raw instanceof RawValue.LiteralInt literal) {
            return ParseResult.ok(literal.value().doubleValue());
        }
        return ParseResult.failure("Expected AST type 'IntValue' or 'FloatValue' but was '" + astType(raw) + "'.");
    }

    private static ParseResult parseString(RawValue raw) {
        if (raw instanceof RawValue.LiteralString literal) {
            return ParseResult.ok(literal.value());
        }
        return ParseResult.failure("Expected AST type 'StringValue' but was '" + astType(raw) + "'.");
    }

    private static ParseResult parseBoolean(RawValue raw) {
        if (raw instanceof RawValue.LiteralBoolean literal) {
            return ParseResult.ok(literal.value());
        }
        return ParseResult.failure("Expected AST type 'BooleanValue' but was '" + astType(raw) + "'.");
    }

    private static ParseResult parseId(RawValue raw) {
        if (raw instanceof RawValue.LiteralString literal) {
            return ParseResult.ok(literal.value());
        }
        if (raw instanceof RawValue.LiteralInt literal) {
            return ParseResult.ok(literal.value().toString());
        }
        return ParseResult.failure("Expected AST type 'IntValue' or 'StringValue' but was '" + astType(raw) + "'.");
    }

    /**
     * AST kind of a raw value. Variable values are converted to literals first, so they report the literal kind.
     */
    static String astType(RawValue raw) {
        if (raw instanceof RawValue.LiteralInt) {
            return "IntValue";
        }
        if (raw instanceof RawValue.LiteralFloat) {
            return "FloatValue";
        }
        if (raw instanceof RawValue.LiteralString) {
            return "StringValue";
        }
        if (raw instanceof RawValue.LiteralBoolean) {
            return "BooleanValue";
        }
        if (raw instanceof RawValue.LiteralEnum) {
            return "EnumValue";
        }
        if (raw instanceof RawValue.LiteralList) {
            return "ListValue";
        }
        if (raw instanceof RawValue.LiteralObject) {
            return "ObjectValue";
        }
        if (raw instanceof RawValue.LiteralNull) {
            return "NullValue";
        }
        if (raw instanceof RawValue.VariableRef) {
            return "Variable";
        }
        return "null";
    }

    private static Object serializeInt(Object value) {
        if (value instanceof Number number) {
            return number.intValue();
        }
        return value;
    }

    private static Object serializeFloat(Object value) {
        if (value instanceof Number number) {
            return number.doubleValue();
        }
        return value;
    }
}
