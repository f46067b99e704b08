package io.stageflow.standalone.config;

import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.util.Locale;

/**
 * Command-line flags as given. Every field is {@code null} (or {@code false}) when the flag was not
 * passed, so that {@link ConfigLoader} can tell "not given" from an explicit value.
 */
public record CommandLineOptions(
        Path configPath,
        String onlyStage,
        String fromStage,
        boolean dryRun,
        Boolean parallel,
        Integer maxWorkers,
        String checkpointId,
        Path pluginsDir,
        String logFormat,
        boolean verbose,
        boolean help) {

    static final String USAGE = """
            Usage: stageflow [--config <pipeline.yaml>] [options]

              --config <path>        pipeline spec (default: pipeline.yaml)
              --stage <name>         run only the transformer named, or the one containing this stage
              --from-stage <name>    resume from a transformer or stage
              --dry-run              validate the graph wiring without running any unit
              --parallel             force parallel execution on
              --no-parallel          force parallel execution off
              --max-workers <n>      worker pool size injected into every unit config
              --checkpoint <id>      save a checkpoint after a non-dry run
              --plugins-dir <dir>    discover unit jars (*-units.jar) before building the graph
              --log-format text|json log output format (default: text)
              --verbose              DEBUG logging
              --help                 print this text
            """;

    public static String usage() {
        return USAGE;
    }

    /**
     * Parses {@code args}.
     *
     * @throws ConfigLoadException on an unknown flag, a missing or invalid value, or conflicting
     *                             flags
     */
    public static CommandLineOptions parse(String[] args) {
        Path configPath = null;
        String onlyStage = null;
        String fromStage = null;
        boolean dryRun = false;
        Boolean parallel = null;
        Integer maxWorkers = null;
        String checkpointId = null;
        Path pluginsDir = null;
        String logFormat = null;
        boolean verbose = false;
        boolean help = false;

        for (int i = 0; i < args.length; i++) {
            String arg = args[i];
            switch (arg) {
                case "--config" -> configPath = toPath(arg, requireValue(args, i++));
                case "--stage" -> onlyStage = requireValue(args, i++);
                case "--from-stage" -> fromStage = requireValue(args, i++);
                case "--dry-run" -> dryRun = true;
                case "--parallel", "--no-parallel" -> {
                    boolean value = arg.equals("--parallel");
                    if (parallel != null && parallel != value) {
                        throw new ConfigLoadException("--parallel and --no-parallel are mutually exclusive");
                    }
                    parallel = value;
                }
                case "--max-workers" -> maxWorkers = parseWorkers(arg, requireValue(args, i++));
                case "--checkpoint" -> checkpointId = requireValue(args, i++);
                case "--plugins-dir" -> pluginsDir = toPath(arg, requireValue(args, i++));
                case "--log-format" -> logFormat = parseLogFormat(arg, requireValue(args, i++));
                case "--verbose", "-v" -> verbose = true;
                case "--help", "-h" -> help = true;
                default -> throw new ConfigLoadException("Unknown option: " + arg);
            }
        }

        if (onlyStage != null && fromStage != null) {
            throw new ConfigLoadException("--stage and --from-stage are mutually exclusive");
        }
        return new CommandLineOptions(
                configPath,
                onlyStage,
                fromStage,
                dryRun,
                parallel,
                maxWorkers,
                checkpointId,
                pluginsDir,
                logFormat,
                verbose,
                help);
    }

    /** Copies every flag that was given onto {@code builder}. */
    void applyTo(RunOptions.Builder builder) {
        if (configPath != null) {
            builder.configPath(configPath);
        }
        if (onlyStage != null) {
            builder.onlyStage(onlyStage);
        }
        if (fromStage != null) {
            builder.fromStage(fromStage);
        }
        if (dryRun) {
            builder.dryRun(true);
        }
        if (parallel != null) {
            builder.parallel(parallel);
        }
        if (maxWorkers != null) {
            builder.maxWorkers(maxWorkers);
        }
        if (checkpointId != null) {
            builder.checkpointId(checkpointId);
        }
        if (pluginsDir != null) {
            builder.pluginsDir(pluginsDir);
        }
        if (logFormat != null) {
            builder.logFormat(logFormat);
        }
        if (verbose) {
            builder.verbose(true);
        }
        if (help) {
            builder.help(true);
        }
    }

    static int parseWorkers(String source, String value) {
        try {
            int workers = Integer.parseInt(value.trim());
            if (workers < 1) {
                throw new ConfigLoadException(source + " must be at least 1, got: " + value);
            }
            return workers;
        } catch (NumberFormatException e) {
            throw new ConfigLoadException(source + " must be an integer, got: " + value, e);
        }
    }

    static String parseLogFormat(String source, String value) {
        String format = value.trim().toLowerCase(Locale.ROOT);
        if (!format.equals("text") && !format.equals("json")) {
            throw new ConfigLoadException(source + " must be 'text' or 'json', got: " + value);
        }
        return format;
    }

    static Path toPath(String source, String value) {
        try {
            return Path.of(value.trim());
        } catch (InvalidPathException e) {
            throw new ConfigLoadException(source + " is not a valid path: " + value, e);
        }
    }

    private static String requireValue(String[] args, int flagIndex) {
        if (flagIndex + 1 >= args.length || args[flagIndex + 1].startsWith("--")) {
            throw new ConfigLoadException(args[flagIndex] + " requires a value");
        }
        return args[flagIndex + 1];
    }
}
