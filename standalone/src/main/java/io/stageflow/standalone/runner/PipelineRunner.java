package io.stageflow.standalone.runner;

import io.stageflow.core.engine.DiscoveryReport;
import io.stageflow.core.engine.ExecutionRequest;
import io.stageflow.core.engine.PipelineEngine;
import io.stageflow.core.engine.UnitRegistry;
import io.stageflow.core.error.StageflowException;
import io.stageflow.core.model.PipelineResult;
import io.stageflow.core.model.PipelineSpec;
import io.stageflow.core.parallel.ParallelOptions;
import io.stageflow.standalone.config.CommandLineOptions;
import io.stageflow.standalone.config.ConfigLoadException;
import io.stageflow.standalone.config.ConfigLoader;
import io.stageflow.standalone.config.RunOptions;
import io.stageflow.standalone.logging.LogbackConfigurator;
import java.io.PrintStream;
import java.nio.file.Path;
import java.util.Objects;
import java.util.Optional;
import java.util.function.Function;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Runs one pipeline from the command line and reports an exit status.
 *
 * <p>
 * Sequence:
 * <ol>
 * <li>Resolve options from flags and environment</li>
 * <li>Configure Logback</li>
 * <li>Register class-path units, then units found in the plugins directory</li>
 * <li>Load the spec and apply overrides (parallel flag, worker count, checkpoint dir)</li>
 * <li>Build the runtime graph</li>
 * <li>Execute (whole pipeline, single transformer, resume, or dry run) and print the summary</li>
 * <li>Save the requested checkpoint</li>
 * </ol>
 *
 * <p>
 * Separate from {@link io.stageflow.standalone.StandaloneMain} so tests can drive a run without
 * going through {@code System.exit}.
 */
public final class PipelineRunner {

    private static final Logger LOG = LoggerFactory.getLogger(PipelineRunner.class);

    public static final int EXIT_SUCCESS = 0;
    public static final int EXIT_FAILURE = 1;
    public static final int EXIT_USAGE = 2;

    private PipelineRunner() {
        // utility class
    }

    /** Full run against the process environment and the global registry. */
    public static int run(String[] args, PrintStream out) {
        return run(args, System::getenv, UnitRegistry.global(), out);
    }

    /**
     * Resolves options, configures logging and runs the pipeline.
     *
     * @return {@link #EXIT_SUCCESS}, {@link #EXIT_FAILURE} or {@link #EXIT_USAGE}
     */
    public static int run(String[] args, Function<String, String> envLookup, UnitRegistry registry, PrintStream out) {
        RunOptions options;
        try {
            options = ConfigLoader.load(args, envLookup);
        } catch (ConfigLoadException e) {
            out.println("error: " + e.getMessage());
            out.println(CommandLineOptions.usage());
            return EXIT_USAGE;
        }
        if (options.help()) {
            out.println(CommandLineOptions.usage());
            return EXIT_SUCCESS;
        }
        LogbackConfigurator.configure(options.logFormat(), options.effectiveLogLevel());
        return execute(options, registry, out);
    }

    /** Runs the pipeline described by already-resolved options. Does not touch logging setup. */
    public static int execute(RunOptions options, UnitRegistry registry, PrintStream out) {
        Objects.requireNonNull(options, "options must not be null");
        Objects.requireNonNull(registry, "registry must not be null");
        long startTime = System.nanoTime();
        try {
            registry.discoverClasspath(PipelineRunner.class.getClassLoader());
            if (options.pluginsDir() != null) {
                DiscoveryReport report = registry.discover(options.pluginsDir());
                report.skipped().forEach(s -> out.println("warning: skipped unit candidate " + s));
            }

            PipelineEngine engine = new PipelineEngine(registry);
            engine.loadSpec(options.configPath());
            engine.applyOverrides(spec -> applyOverrides(spec, options));
            engine.buildGraph();
            LOG.info(
                    "Pipeline '{}' ready in {}ms",
                    engine.spec().name(),
                    (System.nanoTime() - startTime) / 1_000_000);

            PipelineResult result;
            if (options.onlyStage() != null && !options.dryRun()) {
                result = engine.executeTransformer(options.onlyStage());
            } else {
                result = engine.execute(new ExecutionRequest(options.fromStage(), options.dryRun(), null));
            }
            RunSummaryPrinter.print(result, out);

            if (options.checkpointId() != null && !options.dryRun()) {
                Optional<Path> saved = engine.saveCheckpoint(options.checkpointId(), result);
                out.println(saved.map(p -> "Checkpoint saved: " + p)
                        .orElse("Checkpointing is disabled for this pipeline; checkpoint not saved"));
            }
            return result.success() ? EXIT_SUCCESS : EXIT_FAILURE;
        } catch (StageflowException e) {
            LOG.error("Pipeline run aborted during {}: {}", e.phase(), e.getMessage(), e);
            out.println("error: " + e.getMessage());
            return EXIT_FAILURE;
        } catch (IllegalArgumentException e) {
            LOG.error("Pipeline run aborted: {}", e.getMessage(), e);
            out.println("error: " + e.getMessage());
            return EXIT_FAILURE;
        }
    }

    /** Applies caller overrides on top of the loaded spec. */
    static PipelineSpec applyOverrides(PipelineSpec spec, RunOptions options) {
        PipelineSpec result = spec;
        if (options.parallel() != null) {
            LOG.info("Parallel execution {} by override", options.parallel() ? "enabled" : "disabled");
            result = result.withParallel(options.parallel());
        }
        if (options.maxWorkers() != null) {
            LOG.info("Setting {}={} for every unit", ParallelOptions.MAX_WORKERS_KEY, options.maxWorkers());
            result = result.withUnitConfig(ParallelOptions.MAX_WORKERS_KEY, options.maxWorkers());
        }
        if (options.checkpointDir() != null) {
            result = result.withCheckpointDir(options.checkpointDir());
        }
        return result;
    }
}
