package work.lcod.args.runtime;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.Executor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import work.lcod.args.coerce.ArgumentCoercer;
import work.lcod.args.coerce.CoercionScope;
import work.lcod.args.error.ErrorAggregator;
import work.lcod.args.error.FieldError;
import work.lcod.args.schema.Schema;

/**
 * Runs the root fields of an operation: coerces each field's arguments, calls its resolver and serializes the
 * result. A field that fails (coercion or resolver) contributes one error and no data; siblings are unaffected.
 * <p>
 * With an {@link Executor} the fields are processed concurrently; results keep selection order either way.
 */
public final class OperationExecutor {
    private static final Logger log = LoggerFactory.getLogger(OperationExecutor.class);
    private static final String UNKNOWN_FIELD = "Cannot query field on type Query";

    private final Schema schema;
    private final ArgumentCoercer coercer;
    private final Executor executor;

    public OperationExecutor(Schema schema) {
        this(schema, new ArgumentCoercer(), null);
    }

    public OperationExecutor(Schema schema, ArgumentCoercer coercer) {
        this(schema, coercer, null);
    }

    public OperationExecutor(Schema schema, ArgumentCoercer coercer, Executor executor) {
        this.schema = Objects.requireNonNull(schema, "schema");
        this.coercer = Objects.requireNonNull(coercer, "coercer");
        this.executor = executor;
    }

    /**
     * Coerces the arguments of every selected field without resolving anything.
     */
    public List<FieldArguments> coerce(Operation operation, Map<String, Object> variables) {
        var scope = CoercionScope.of(operation.variables(), variables);
        var report = new ArrayList<FieldArguments>(operation.selections().size());
        for (var selection : operation.selections()) {
            report.add(coerceField(selection, scope));
        }
        return report;
    }

    public ExecutionResult execute(Operation operation, Map<String, Object> variables, ExecutionContext ctx) throws Exception {
        var context = ctx == null ? new ExecutionContext() : ctx;
        var scope = CoercionScope.of(operation.variables(), variables);
        log.debug("Executing operation {} ({} field(s))", operation.displayName(), operation.selections().size());

        List<FieldOutcome> outcomes = executor == null
            ? runSequentially(operation, scope, context)
            : runConcurrently(operation, scope, context);

        var data = new LinkedHashMap<String, Object>();
        var errors = new ArrayList<FieldError>();
        for (var outcome : outcomes) {
            if (outcome.error() == null) {
                data.put(outcome.selection().responseKey(), outcome.value());
            } else {
                errors.add(outcome.error());
            }
        }
        return new ExecutionResult(data, errors);
    }

    private List<FieldOutcome> runSequentially(Operation operation, CoercionScope scope, ExecutionContext ctx) throws Exception {
        var outcomes = new ArrayList<FieldOutcome>(operation.selections().size());
        for (var selection : operation.selections()) {
            outcomes.add(resolveField(selection, scope, ctx));
        }
        return outcomes;
    }

    private List<FieldOutcome> runConcurrently(Operation operation, CoercionScope scope, ExecutionContext ctx) throws Exception {
        var futures = new ArrayList<CompletableFuture<FieldOutcome>>(operation.selections().size());
        for (var selection : operation.selections()) {
            futures.add(CompletableFuture.supplyAsync(() -> {
                try {
                    return resolveField(selection, scope, ctx);
                } catch (RuntimeException ex) {
                    throw ex;
                } catch (Exception ex) {
                    throw new CompletionException(ex);
                }
            }, executor));
        }
        var outcomes = new ArrayList<FieldOutcome>(futures.size());
        try {
            for (var future : futures) {
                outcomes.add(future.join());
            }
        } catch (CompletionException ex) {
            futures.forEach(future -> future.cancel(false));
            var cause = ex.getCause();
            if (cause instanceof Exception checked) {
                throw checked;
            }
            throw ex;
        }
        return outcomes;
    }

    private FieldArguments coerceField(FieldSelection selection, CoercionScope scope) {
        var field = schema.queryField(selection.name());
        if (field == null) {
            return new FieldArguments(selection, Map.of(), ErrorAggregator.fromResolver(selection.name(), UNKNOWN_FIELD));
        }
        var result = coercer.coerceArguments(field.arguments(), selection.arguments(), scope);
        if (!result.isSuccess()) {
            log.debug("Field {} failed argument coercion: {}", selection.name(), result.failures());
            return new FieldArguments(selection, Map.of(), ErrorAggregator.report(selection.name(), result.failures()));
        }
        return new FieldArguments(selection, result.values(), null);
    }

    private FieldOutcome resolveField(FieldSelection selection, CoercionScope scope, ExecutionContext ctx) throws Exception {
        ctx.ensureNotCancelled();
        var coerced = coerceField(selection, scope);
        if (!coerced.ok()) {
            return FieldOutcome.failed(selection, coerced.error());
        }
        var field = schema.queryField(selection.name());
        try {
            var result = field.resolver().resolve(coerced.arguments(), ctx);
            if (result == null) {
                result = FieldResult.ok(null);
            }
            if (!result.ok()) {
                return FieldOutcome.failed(selection, ErrorAggregator.fromResolver(selection.name(), result.error()));
            }
            return FieldOutcome.resolved(selection, ResultSerializer.serialize(field.returnType(), result.value()));
        } catch (FieldResolutionException ex) {
            log.debug("Resolver for {} failed with {}", selection.name(), ex.code());
            return FieldOutcome.failed(selection, ErrorAggregator.fromResolver(selection.name(), ex.getMessage()));
        }
    }

    private record FieldOutcome(FieldSelection selection, Object value, FieldError error) {
        static FieldOutcome resolved(FieldSelection selection, Object value) {
            return new FieldOutcome(selection, value, null);
        }

        static FieldOutcome failed(FieldSelection selection, FieldError error) {
            return new FieldOutcome(selection, null, error);
        }
    }
}
