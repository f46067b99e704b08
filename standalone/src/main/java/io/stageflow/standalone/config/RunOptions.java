package io.stageflow.standalone.config;

import java.nio.file.Path;
import java.util.Objects;

/**
 * Fully resolved options for one runner invocation. Use {@link #builder()} to construct.
 *
 * @param configPath    pipeline spec file
 * @param onlyStage     run only the transformer of this name (or containing this stage), or
 *                      {@code null}
 * @param fromStage     resume from this transformer or stage, or {@code null}
 * @param dryRun        validate wiring only
 * @param parallel      forced global parallel flag, or {@code null} to keep the spec's
 * @param maxWorkers    {@code max-workers} injected into every unit config, or {@code null}
 * @param checkpointId  checkpoint to save after a non-dry run, or {@code null}
 * @param checkpointDir overrides the spec's checkpoint directory, or {@code null}
 * @param pluginsDir    directory or jar scanned for unit providers, or {@code null}
 * @param logFormat     {@code text} or {@code json}
 * @param logLevel      root log level
 * @param verbose       forces DEBUG logging
 * @param help          print usage and exit
 */
public record RunOptions(
        Path configPath,
        String onlyStage,
        String fromStage,
        boolean dryRun,
        Boolean parallel,
        Integer maxWorkers,
        String checkpointId,
        Path checkpointDir,
        Path pluginsDir,
        String logFormat,
        String logLevel,
        boolean verbose,
        boolean help) {

    public static final Path DEFAULT_CONFIG_FILE = Path.of("pipeline.yaml");
    public static final String DEFAULT_LOG_FORMAT = "text";
    public static final String DEFAULT_LOG_LEVEL = "INFO";

    public RunOptions {
        Objects.requireNonNull(configPath, "configPath must not be null");
        Objects.requireNonNull(logFormat, "logFormat must not be null");
        Objects.requireNonNull(logLevel, "logLevel must not be null");
    }

    /** The level the root logger should run at, taking {@link #verbose()} into account. */
    public String effectiveLogLevel() {
        return verbose ? "DEBUG" : logLevel;
    }

    public static Builder builder() {
        return new Builder();
    }

    /** Builder for {@link RunOptions}. Unset fields keep the documented defaults. */
    public static final class Builder {

        private Path configPath = DEFAULT_CONFIG_FILE;
        private String onlyStage;
        private String fromStage;
        private boolean dryRun;
        private Boolean parallel;
        private Integer maxWorkers;
        private String checkpointId;
        private Path checkpointDir;
        private Path pluginsDir;
        private String logFormat = DEFAULT_LOG_FORMAT;
        private String logLevel = DEFAULT_LOG_LEVEL;
        private boolean verbose;
        private boolean help;

        Builder() {}

        public Builder configPath(Path value) {
            this.configPath = value;
            return this;
        }

        public Builder onlyStage(String value) {
            this.onlyStage = value;
            return this;
        }

        public Builder fromStage(String value) {
            this.fromStage = value;
            return this;
        }

        public Builder dryRun(boolean value) {
            this.dryRun = value;
            return this;
        }

        public Builder parallel(Boolean value) {
            this.parallel = value;
            return this;
        }

        public Builder maxWorkers(Integer value) {
            this.maxWorkers = value;
            return this;
        }

        public Builder checkpointId(String value) {
            this.checkpointId = value;
            return this;
        }

        public Builder checkpointDir(Path value) {
            this.checkpointDir = value;
            return this;
        }

        public Builder pluginsDir(Path value) {
            this.pluginsDir = value;
            return this;
        }

        public Builder logFormat(String value) {
            this.logFormat = value;
            return this;
        }

        public Builder logLevel(String value) {
            this.logLevel = value;
            return this;
        }

        public Builder verbose(boolean value) {
            this.verbose = value;
            return this;
        }

        public Builder help(boolean value) {
            this.help = value;
            return this;
        }

        public RunOptions build() {
            return new RunOptions(
                    configPath,
                    onlyStage,
                    fromStage,
                    dryRun,
                    parallel,
                    maxWorkers,
                    checkpointId,
                    checkpointDir,
                    pluginsDir,
                    logFormat,
                    logLevel,
                    verbose,
                    help);
        }
    }
}
