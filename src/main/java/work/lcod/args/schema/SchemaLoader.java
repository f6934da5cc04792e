package work.lcod.args.schema;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.tomlj.Toml;
import org.tomlj.TomlArray;
import org.tomlj.TomlParseResult;
import org.tomlj.TomlTable;
import work.lcod.args.coerce.ArgumentCoercer;
import work.lcod.args.coerce.CoercionScope;
import work.lcod.args.runtime.FieldDefinition;
import work.lcod.args.runtime.FieldResolver;
import work.lcod.args.runtime.FieldResult;
import work.lcod.args.value.ExternalValues;

/**
 * Builds a {@link Schema} from a TOML manifest:
 * <pre>
 * [enums.Color]
 * values = ["RED", "GREEN"]
 *
 * [inputs.ContactInput]
 * email = "String"
 * kind = { type = "ContactKind", default = "EMAIL" }
 *
 * [query.user]
 * type = "String"
 * args.contact = "ContactInput"
 * </pre>
 * Custom scalars must already be registered on the builder. Defaults are coerced while loading.
 */
public final class SchemaLoader {
    private static final Logger log = LoggerFactory.getLogger(SchemaLoader.class);
    private static final ArgumentCoercer DEFAULTS_COERCER = new ArgumentCoercer();

    private SchemaLoader() {}

    public static Schema load(Path manifestPath) {
        return load(manifestPath, Schema.builder(), Map.of());
    }

    public static Schema load(Path manifestPath, Schema.Builder builder, Map<String, FieldResolver> resolvers) {
        try {
            return parse(Files.readString(manifestPath), builder, resolvers);
        } catch (IOException ex) {
            throw new IllegalStateException("Failed to read schema manifest: " + manifestPath, ex);
        }
    }

    public static Schema parse(String toml, Schema.Builder builder, Map<String, FieldResolver> resolvers) {
        TomlParseResult result = Toml.parse(toml);
        if (result.hasErrors()) {
            var errors = result.errors().stream().map(Object::toString).collect(Collectors.joining("; "));
            throw new IllegalStateException("Invalid schema manifest: " + errors);
        }
        readEnums(result.getTable("enums"), builder);
        new InputResolver(result.getTable("inputs"), builder).resolveAll();
        readQuery(result.getTable("query"), builder, resolvers == null ? Map.of() : resolvers);
        return builder.build();
    }

    private static void readEnums(TomlTable enums, Schema.Builder builder) {
        if (enums == null) {
            return;
        }
        for (String name : enums.keySet()) {
            var table = requireTable(enums, name, "enums." + name);
            var values = table.getArray("values");
            if (values == null) {
                throw new IllegalStateException("enums." + name + " must declare a values array");
            }
            var symbols = new ArrayList<String>();
            for (Object value : values.toList()) {
                symbols.add(String.valueOf(value));
            }
            builder.enumType(new TypeDescriptor.EnumType(name, symbols));
        }
    }

    private static void readQuery(TomlTable query, Schema.Builder builder, Map<String, FieldResolver> resolvers) {
        if (query == null) {
            return;
        }
        for (String fieldName : query.keySet()) {
            var table = requireTable(query, fieldName, "query." + fieldName);
            var typeRef = table.getString("type");
            if (typeRef == null) {
                throw new IllegalStateException("query." + fieldName + " must declare a type");
            }
            var returnType = builder.typeRef(typeRef);
            var arguments = new ArrayList<InputValueDefinition>();
            var args = table.getTable("args");
            if (args != null) {
                for (String argumentName : args.keySet()) {
                    arguments.add(readInputValue(args.get(List.of(argumentName)), argumentName, "query." + fieldName + ".args", builder::typeRef));
                }
            }
            var resolver = resolvers.get(fieldName);
            if (resolver == null) {
                log.debug("No resolver registered for query field {}", fieldName);
                resolver = unresolved(fieldName);
            }
            builder.queryField(new FieldDefinition(fieldName, returnType, arguments, resolver));
        }
    }

    private static FieldResolver unresolved(String fieldName) {
        return (arguments, ctx) -> FieldResult.error("No resolver registered for " + fieldName);
    }

    static InputValueDefinition readInputValue(Object spec, String name, String owner, TypeLookup lookup) {
        String typeRef;
        boolean hasDefault = false;
        Object rawDefault = null;
        if (spec instanceof String ref) {
            typeRef = ref;
        } else if (spec instanceof TomlTable table) {
            typeRef = table.getString("type");
            if (table.contains("default")) {
                hasDefault = true;
                rawDefault = plain(table.get(List.of("default")));
            }
        } else {
            throw new IllegalStateException(owner + "." + name + " must be a type reference or a table");
        }
        if (typeRef == null || typeRef.isBlank()) {
            throw new IllegalStateException(owner + "." + name + " is missing its type");
        }
        var type = lookup.typeRef(typeRef);
        if (!hasDefault) {
            return InputValueDefinition.of(name, type);
        }
        var coerced = DEFAULTS_COERCER.coerce(type, ExternalValues.toRaw(rawDefault), CoercionScope.externalValues());
        if (coerced.isFailed()) {
            var reasons = coerced.failures().stream().map(failure -> failure.reason()).collect(Collectors.joining("; "));
            throw new IllegalStateException("Invalid default for " + owner + "." + name + ": " + reasons);
        }
        return InputValueDefinition.withDefault(name, type, coerced.hasValue() ? coerced.value() : null);
    }

    private static TomlTable requireTable(TomlTable parent, String key, String display) {
        var value = parent.get(List.of(key));
        if (!(value instanceof TomlTable table)) {
            throw new IllegalStateException(display + " must be a table");
        }
        return table;
    }

    private static Object plain(Object value) {
        if (value instanceof TomlTable table) {
            var map = new LinkedHashMap<String, Object>();
            for (String key : table.keySet()) {
                map.put(key, plain(table.get(List.of(key))));
            }
            return map;
        }
        if (value instanceof TomlArray array) {
            var list = new ArrayList<Object>(array.size());
            for (int i = 0; i < array.size(); i++) {
                list.add(plain(array.get(i)));
            }
            return list;
        }
        if (value instanceof String || value instanceof Number || value instanceof Boolean) {
            return value;
        }
        return value == null ? null : value.toString();
    }

    @FunctionalInterface
    interface TypeLookup {
        TypeDescriptor typeRef(String ref);
    }

    /**
     * Resolves input objects on demand so they may reference each other in any order. Cycles are rejected.
     */
    private static final class InputResolver {
        private final TomlTable inputs;
        private final Schema.Builder builder;
        private final Set<String> resolving = new LinkedHashSet<>();
        private final Set<String> done = new HashSet<>();

        InputResolver(TomlTable inputs, Schema.Builder builder) {
            this.inputs = inputs;
            this.builder = builder;
        }

        void resolveAll() {
            if (inputs == null) {
                return;
            }
            for (String name : inputs.keySet()) {
                resolve(name);
            }
        }

        private TypeDescriptor lookup(String name) {
            if (inputs != null && inputs.keySet().contains(name) && !done.contains(name)) {
                resolve(name);
            }
            return builder.type(name);
        }

        private void resolve(String name) {
            if (done.contains(name)) {
                return;
            }
            if (!resolving.add(name)) {
                throw new IllegalStateException("Recursive input objects are not supported: " + String.join(" -> ", resolving) + " -> " + name);
            }
            var table = requireTable(inputs, name, "inputs." + name);
            var fields = new ArrayList<InputValueDefinition>();
            for (String fieldName : table.keySet()) {
                fields.add(readInputValue(table.get(List.of(fieldName)), fieldName, "inputs." + name,
                    ref -> Schema.parseTypeRef(ref, this::lookup)));
            }
            builder.inputObject(new TypeDescriptor.InputObject(name, fields));
            resolving.remove(name);
            done.add(name);
        }
    }
}
