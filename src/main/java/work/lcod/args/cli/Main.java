package work.lcod.args.cli;

import picocli.CommandLine;

/**
 * Entry point for the {@code java -jar} distribution.
 */
public final class Main {
    private static final String SIMPLE_LOGGER_SHORT_NAME = "org.slf4j.simpleLogger.showShortLogName";

    private Main() {}

    public static void main(String[] args) {
        if (System.getProperty(SIMPLE_LOGGER_SHORT_NAME) == null) {
            System.setProperty(SIMPLE_LOGGER_SHORT_NAME, "true");
        }
        System.exit(commandLine().execute(args));
    }

    /**
     * The {@code lcod-args} command. Reports go to the command line's out writer, diagnostics to its err writer.
     */
    static CommandLine commandLine() {
        return new CommandLine(new CoerceCommand())
            .setExecutionExceptionHandler(new ShortErrorHandler())
            .setUsageHelpAutoWidth(true);
    }
}
