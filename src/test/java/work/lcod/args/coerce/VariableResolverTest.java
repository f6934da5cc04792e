package work.lcod.args.coerce;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static work.lcod.args.schema.TypeDescriptor.listOf;
import static work.lcod.args.schema.TypeDescriptor.nonNull;
import static work.lcod.args.support.ArgsTestSupport.variables;

import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;
import work.lcod.args.schema.BuiltinScalars;
import work.lcod.args.schema.TypeDescriptor;
import work.lcod.args.support.ArgsTestSupport;
import work.lcod.args.value.RawValue;

class VariableResolverTest {
    private static final TypeDescriptor.EnumType COLOR = new TypeDescriptor.EnumType("Color", List.of("RED", "GREEN"));

    private final VariableResolver resolver = new VariableResolver(new ArgumentCoercer());

    @Test
    void suppliedValueIsCoercedAgainstTheUseSite() {
        var scope = CoercionScope.of(List.of(VariableDefinition.of("contact", ArgsTestSupport.CONTACT_INPUT)),
            variables("contact", Map.of("email", "bubba@joe.com", "ignored", 1)));

        var result = resolver.resolve("contact", ArgsTestSupport.CONTACT_INPUT, scope);

        assertEquals(Map.of("email", "bubba@joe.com"), result.value());
    }

    @Test
    void undefinedVariableFails() {
        var result = resolver.resolve("ghost", BuiltinScalars.STRING, CoercionScope.empty());

        assertEquals(FailureKind.UNDEFINED_VARIABLE, result.failures().get(0).kind());
        assertEquals("variable $ghost is not defined by the operation", result.failures().get(0).reason());
    }

    @Test
    void declaredDefaultIsReadAsLiteral() {
        var definition = new VariableDefinition("color", COLOR, RawValue.enumValue("GREEN"));
        var quoted = new VariableDefinition("shade", COLOR, RawValue.of("GREEN"));
        var scope = CoercionScope.of(List.of(definition, quoted), Map.of());

        assertEquals("GREEN", resolver.resolve("color", COLOR, scope).value());
        assertEquals(FailureKind.INVALID_ENUM_VALUE, resolver.resolve("shade", COLOR, scope).failures().get(0).kind());
    }

    @Test
    void missingValueDependsOnDeclaredType() {
        var scope = CoercionScope.of(List.of(
            VariableDefinition.of("optional", BuiltinScalars.INT),
            VariableDefinition.of("required", nonNull(BuiltinScalars.INT))
        ), Map.of());

        assertTrue(resolver.resolve("optional", BuiltinScalars.INT, scope).isAbsent());
        var required = resolver.resolve("required", BuiltinScalars.INT, scope);
        assertEquals(FailureKind.MISSING_REQUIRED_VARIABLE, required.failures().get(0).kind());
        assertEquals("Int!", required.failures().get(0).expectedType());
    }

    @Test
    void explicitNullIsKeptUnlessDeclaredNonNull() {
        var scope = CoercionScope.of(List.of(
            VariableDefinition.of("optional", BuiltinScalars.INT),
            VariableDefinition.of("required", nonNull(BuiltinScalars.INT))
        ), variables("optional", null, "required", null));

        var optional = resolver.resolve("optional", BuiltinScalars.INT, scope);
        assertTrue(optional.hasValue());
        assertNull(optional.value());
        assertEquals(FailureKind.VALUE_REQUIRED, resolver.resolve("required", BuiltinScalars.INT, scope).failures().get(0).kind());
    }

    @Test
    void variableValuesAreNotPromotedToLists() {
        var scope = CoercionScope.of(List.of(VariableDefinition.of("ids", listOf(BuiltinScalars.INT))), variables("ids", 5));

        var result = resolver.resolve("ids", listOf(BuiltinScalars.INT), scope);

        assertEquals(FailureKind.SHAPE_MISMATCH, result.failures().get(0).kind());
    }

    @Test
    void unconvertibleValueIsAShapeMismatch() {
        var scope = CoercionScope.of(List.of(VariableDefinition.of("when", BuiltinScalars.STRING)), variables("when", new Object()));

        var result = resolver.resolve("when", BuiltinScalars.STRING, scope);

        assertEquals(FailureKind.SHAPE_MISMATCH, result.failures().get(0).kind());
    }
}
