package work.lcod.args.cli;

import java.io.IOException;
import java.io.PrintWriter;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;
import picocli.CommandLine;
import work.lcod.args.api.ArgsRunConfiguration;
import work.lcod.args.api.ArgsRunner;
import work.lcod.args.api.LogLevel;
import work.lcod.args.api.RunResult;
import work.lcod.args.coerce.RequiredArgumentPolicy;

@CommandLine.Command(
    name = "lcod-args",
    description = "Coerce the field arguments of query operations against a schema manifest.",
    mixinStandardHelpOptions = true,
    versionProvider = VersionProvider.class,
    showDefaultValues = true
)
final class CoerceCommand implements Callable<Integer> {
    private static final String SIMPLE_LOGGER_LEVEL = "org.slf4j.simpleLogger.defaultLogLevel";

    @CommandLine.Spec
    private CommandLine.Model.CommandSpec spec;

    @CommandLine.Option(
        names = {"-s", "--schema"},
        required = true,
        description = "Schema manifest (TOML)."
    )
    private Path schema;

    @CommandLine.Option(
        names = {"-o", "--operation"},
        required = true,
        description = "Operation document(s) in JSON AST form (JSON or YAML).",
        arity = "1..*"
    )
    private List<Path> operations = new ArrayList<>();

    @CommandLine.Option(
        names = {"-v", "--variables"},
        paramLabel = "PATH|-",
        description = "JSON variables file; use '-' to read from stdin (default: {}).",
        defaultValue = CommandLine.Option.NULL_VALUE
    )
    private String variables;

    @CommandLine.Option(
        names = "--enforce-required",
        description = "Fail omitted non-null arguments instead of leaving them to validation."
    )
    private boolean enforceRequired;

    @CommandLine.Option(
        names = "--log-level",
        description = "Log threshold (trace|debug|info|warn|error|off).",
        defaultValue = CommandLine.Option.NULL_VALUE
    )
    private String logLevelRaw;

    @Override
    public Integer call() throws Exception {
        LogLevel logLevel = LogLevel.from(logLevelRaw);
        if (System.getProperty(SIMPLE_LOGGER_LEVEL) == null) {
            System.setProperty(SIMPLE_LOGGER_LEVEL, logLevel.simpleLoggerName());
        }
        String payload = loadVariablesPayload();
        RequiredArgumentPolicy policy = enforceRequired
            ? RequiredArgumentPolicy.ENFORCE
            : RequiredArgumentPolicy.DEFER_TO_VALIDATION;

        ArgsRunner runner = new ArgsRunner();
        PrintWriter out = spec.commandLine().getOut();
        int exitCode = 0;
        for (Path operation : operations) {
            ArgsRunConfiguration configuration = ArgsRunConfiguration.builder()
                .schemaPath(schema.toAbsolutePath().normalize())
                .operationPath(operation.toAbsolutePath().normalize())
                .variablesPayload(payload)
                .requiredArgumentPolicy(policy)
                .logLevel(logLevel)
                .build();
            RunResult result = runner.run(configuration);
            exitCode = Math.max(exitCode, result.status().exitCode());
            out.println(result.toPrettyJson());
        }
        out.flush();
        return exitCode;
    }

    private String loadVariablesPayload() {
        if (variables == null || variables.isBlank()) {
            return "{}";
        }
        try {
            if ("-".equals(variables)) {
                byte[] bytes = System.in.readAllBytes();
                return bytes.length == 0 ? "{}" : new String(bytes, StandardCharsets.UTF_8);
            }
            return Files.readString(Path.of(variables));
        } catch (IOException ex) {
            throw new CommandLine.ExecutionException(spec.commandLine(), "Unable to read variables: " + ex.getMessage(), ex);
        }
    }
}
