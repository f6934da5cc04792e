package work.lcod.args.api;

import java.nio.file.Path;
import java.util.Objects;
import work.lcod.args.coerce.RequiredArgumentPolicy;

/**
 * Immutable configuration for coercing the arguments of one operation document.
 */
public record ArgsRunConfiguration(
    Path schemaPath,
    Path operationPath,
    String variablesPayload,
    RequiredArgumentPolicy requiredArgumentPolicy,
    LogLevel logLevel
) {
    public ArgsRunConfiguration {
        Objects.requireNonNull(schemaPath, "schemaPath");
        Objects.requireNonNull(operationPath, "operationPath");
        Objects.requireNonNull(variablesPayload, "variablesPayload");
        Objects.requireNonNull(requiredArgumentPolicy, "requiredArgumentPolicy");
        Objects.requireNonNull(logLevel, "logLevel");
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private Path schemaPath;
        private Path operationPath;
        private String variablesPayload = "{}";
        private RequiredArgumentPolicy requiredArgumentPolicy = RequiredArgumentPolicy.DEFER_TO_VALIDATION;
        private LogLevel logLevel = LogLevel.WARN;

        public Builder schemaPath(Path schemaPath) {
            this.schemaPath = schemaPath;
            return this;
        }

        public Builder operationPath(Path operationPath) {
            this.operationPath = operationPath;
            return this;
        }

        public Builder variablesPayload(String variablesPayload) {
            this.variablesPayload = variablesPayload;
            return this;
        }

        public Builder requiredArgumentPolicy(RequiredArgumentPolicy requiredArgumentPolicy) {
            this.requiredArgumentPolicy = requiredArgumentPolicy;
            return this;
        }

        public Builder logLevel(LogLevel logLevel) {
            this.logLevel = logLevel;
            return this;
        }

        public ArgsRunConfiguration build() {
            return new ArgsRunConfiguration(
                schemaPath,
                operationPath,
                variablesPayload,
                requiredArgumentPolicy,
                logLevel
            );
        }
    }
}
