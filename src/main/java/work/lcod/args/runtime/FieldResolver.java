package work.lcod.args.runtime;

import java.util.Map;

/**
 * Resolves a query field from its coerced arguments. Keys are present only for arguments that had a value.
 */
@FunctionalInterface
public interface FieldResolver {
    FieldResult resolve(Map<String, Object> arguments, ExecutionContext ctx) throws Exception;
}
