package work.lcod.args.runtime;

import java.util.List;
import work.lcod.args.coerce.VariableDefinition;

/**
 * A query operation: optional name, declared variables and the selected root fields.
 */
public record Operation(String name, List<VariableDefinition> variables, List<FieldSelection> selections) {
    public Operation {
        variables = variables == null ? List.of() : List.copyOf(variables);
        selections = selections == null ? List.of() : List.copyOf(selections);
    }

    public static Operation of(FieldSelection... selections) {
        return new Operation(null, List.of(), List.of(selections));
    }

    public String displayName() {
        return name == null || name.isBlank() ? "<anonymous>" : name;
    }
}
