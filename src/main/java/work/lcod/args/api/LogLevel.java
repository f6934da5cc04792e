package work.lcod.args.api;

import java.util.Locale;

/**
 * Log thresholds accepted by the runner and CLI.
 */
public enum LogLevel {
    TRACE,
    DEBUG,
    INFO,
    WARN,
    ERROR,
    OFF;

    public static LogLevel from(String value) {
        if (value == null || value.isBlank()) {
            return WARN;
        }
        try {
            return LogLevel.valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException ex) {
            throw new IllegalArgumentException("Unsupported log level: " + value);
        }
    }

    /**
     * Level name understood by the slf4j-simple binding.
     */
    public String simpleLoggerName() {
        return name().toLowerCase(Locale.ROOT);
    }
}
