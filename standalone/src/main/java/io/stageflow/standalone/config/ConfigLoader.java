package io.stageflow.standalone.config;

import java.util.Locale;
import java.util.Objects;
import java.util.Set;
import java.util.function.Consumer;
import java.util.function.Function;

/**
 * Resolves {@link RunOptions} from command-line flags with an environment variable overlay.
 *
 * <p>
 * Precedence, highest first: command-line flag, environment variable, pipeline spec (for the
 * parallel flag and checkpoint directory), built-in default. An environment variable counts as
 * set only if it is defined and its trimmed value is non-empty; blank values fall through to the
 * next source.
 *
 * <p>
 * Recognised variables: {@value #ENV_CONFIG}, {@value #ENV_PARALLEL}, {@value #ENV_MAX_WORKERS},
 * {@value #ENV_CHECKPOINT_DIR}, {@value #ENV_PLUGINS_DIR}, {@value #ENV_LOG_FORMAT},
 * {@value #ENV_LOG_LEVEL}.
 */
public final class ConfigLoader {

    public static final String ENV_CONFIG = "STAGEFLOW_CONFIG";
    public static final String ENV_PARALLEL = "STAGEFLOW_PARALLEL";
    public static final String ENV_MAX_WORKERS = "STAGEFLOW_MAX_WORKERS";
    public static final String ENV_CHECKPOINT_DIR = "STAGEFLOW_CHECKPOINT_DIR";
    public static final String ENV_PLUGINS_DIR = "STAGEFLOW_PLUGINS_DIR";
    public static final String ENV_LOG_FORMAT = "STAGEFLOW_LOG_FORMAT";
    public static final String ENV_LOG_LEVEL = "STAGEFLOW_LOG_LEVEL";

    private static final Set<String> LOG_LEVELS = Set.of("TRACE", "DEBUG", "INFO", "WARN", "ERROR", "OFF");

    private ConfigLoader() {
        // utility class
    }

    /** Resolves options from {@code args} and {@link System#getenv}. */
    public static RunOptions load(String[] args) {
        return load(args, System::getenv);
    }

    /**
     * Resolves options from {@code args} and the supplied environment lookup.
     *
     * @param envLookup maps a variable name to its value, or {@code null} when undefined
     * @throws ConfigLoadException on an invalid flag or environment value
     */
    public static RunOptions load(String[] args, Function<String, String> envLookup) {
        Objects.requireNonNull(args, "args must not be null");
        Objects.requireNonNull(envLookup, "envLookup must not be null");
        CommandLineOptions cli = CommandLineOptions.parse(args);

        RunOptions.Builder builder = RunOptions.builder();
        applyEnvOverrides(builder, envLookup);
        cli.applyTo(builder);
        return builder.build();
    }

    private static void applyEnvOverrides(RunOptions.Builder builder, Function<String, String> envLookup) {
        env(envLookup, ENV_CONFIG, v -> builder.configPath(CommandLineOptions.toPath(ENV_CONFIG, v)));
        env(envLookup, ENV_PARALLEL, v -> builder.parallel(parseBoolean(ENV_PARALLEL, v)));
        env(envLookup, ENV_MAX_WORKERS, v -> builder.maxWorkers(CommandLineOptions.parseWorkers(ENV_MAX_WORKERS, v)));
        env(envLookup, ENV_CHECKPOINT_DIR, v -> builder.checkpointDir(CommandLineOptions.toPath(ENV_CHECKPOINT_DIR, v)));
        env(envLookup, ENV_PLUGINS_DIR, v -> builder.pluginsDir(CommandLineOptions.toPath(ENV_PLUGINS_DIR, v)));
        env(envLookup, ENV_LOG_FORMAT, v -> builder.logFormat(CommandLineOptions.parseLogFormat(ENV_LOG_FORMAT, v)));
        env(envLookup, ENV_LOG_LEVEL, v -> builder.logLevel(parseLevel(ENV_LOG_LEVEL, v)));
    }

    private static boolean isSet(Function<String, String> envLookup, String envVar) {
        String value = envLookup.apply(envVar);
        return value != null && !value.trim().isEmpty();
    }

    private static void env(Function<String, String> envLookup, String envVar, Consumer<String> setter) {
        if (isSet(envLookup, envVar)) {
            setter.accept(envLookup.apply(envVar).trim());
        }
    }

    private static boolean parseBoolean(String envVar, String value) {
        if ("true".equalsIgnoreCase(value)) {
            return true;
        }
        if ("false".equalsIgnoreCase(value)) {
            return false;
        }
        throw new ConfigLoadException(envVar + " must be 'true' or 'false', got: " + value);
    }

    private static String parseLevel(String envVar, String value) {
        String level = value.toUpperCase(Locale.ROOT);
        if (!LOG_LEVELS.contains(level)) {
            throw new ConfigLoadException(envVar + " must be one of " + LOG_LEVELS + ", got: " + value);
        }
        return level;
    }
}
