package work.lcod.args.coerce;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Per-request inputs to coercion: the operation's declared variables and the values supplied for them.
 * Whether the value being coerced came from a variable changes how strings are read for enums.
 */
public final class CoercionScope {
    private static final CoercionScope EMPTY = new CoercionScope(Map.of(), Map.of(), false);
    private static final CoercionScope EXTERNAL = new CoercionScope(Map.of(), Map.of(), true);

    private final Map<String, VariableDefinition> definitions;
    private final Map<String, Object> variables;
    private final boolean variableSourced;

    private CoercionScope(Map<String, VariableDefinition> definitions, Map<String, Object> variables, boolean variableSourced) {
        this.definitions = definitions;
        this.variables = variables;
        this.variableSourced = variableSourced;
    }

    public static CoercionScope empty() {
        return EMPTY;
    }

    /**
     * Scope for values that arrive pre-parsed (configuration, manifests) rather than as query literals.
     */
    public static CoercionScope externalValues() {
        return EXTERNAL;
    }

    public static CoercionScope of(List<VariableDefinition> definitions, Map<String, Object> variables) {
        var byName = new LinkedHashMap<String, VariableDefinition>();
        if (definitions != null) {
            for (var definition : definitions) {
                if (byName.put(definition.name(), definition) != null) {
                    throw new IllegalArgumentException("Variable $" + definition.name() + " is declared twice");
                }
            }
        }
        Map<String, Object> supplied = variables == null
            ? Map.of()
            : Collections.unmodifiableMap(new LinkedHashMap<>(variables));
        return new CoercionScope(Collections.unmodifiableMap(byName), supplied, false);
    }

    public VariableDefinition definition(String name) {
        return definitions.get(name);
    }

    public boolean isSupplied(String name) {
        return variables.containsKey(name);
    }

    public Object variable(String name) {
        return variables.get(name);
    }

    public boolean isVariableSourced() {
        return variableSourced;
    }

    CoercionScope forVariableValue() {
        return variableSourced ? this : new CoercionScope(definitions, variables, true);
    }

    CoercionScope forLiteral() {
        return variableSourced ? new CoercionScope(definitions, variables, false) : this;
    }
}
