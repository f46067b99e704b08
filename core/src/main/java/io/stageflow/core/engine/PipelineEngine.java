package io.stageflow.core.engine;

import io.stageflow.core.model.Checkpoint;
import io.stageflow.core.model.ExecutionContext;
import io.stageflow.core.model.PipelineResult;
import io.stageflow.core.model.PipelineSpec;
import io.stageflow.core.model.TransformerResult;
import io.stageflow.core.spec.PipelineSpecParser;
import io.stageflow.core.spi.ExecutionListener;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.function.UnaryOperator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

/**
 * Orchestrates one pipeline: loads its spec, builds the runtime graph and executes it.
 *
 * <p>
 * Lifecycle: {@code UNLOADED -> SPEC_LOADED -> GRAPH_BUILT -> (DRY_RUN_VALIDATED | EXECUTING) ->
 * COMPLETED}. Calling an operation outside the states it allows raises
 * {@link IllegalStateException}. A built, validated or completed engine may execute again; every
 * execution gets its own {@link ExecutionContext}.
 *
 * <p>
 * Transformers and stages run strictly sequentially on the calling thread. Load and build errors
 * propagate as exceptions and the run never starts; once execution has begun, stage failures are
 * recorded in the context and the returned {@link PipelineResult} reports how far the run got.
 *
 * <p>
 * Not thread-safe: one engine drives one run at a time.
 */
public final class PipelineEngine {

    private static final Logger LOG = LoggerFactory.getLogger(PipelineEngine.class);

    /** MDC key holding the pipeline name while the engine executes. */
    public static final String MDC_PIPELINE = "pipeline";
    /** MDC key holding the current transformer name. */
    public static final String MDC_TRANSFORMER = "transformer";
    /** MDC key holding the current stage name. */
    public static final String MDC_STAGE = "stage";

    /** Engine lifecycle states. */
    public enum State {
        UNLOADED,
        SPEC_LOADED,
        GRAPH_BUILT,
        DRY_RUN_VALIDATED,
        EXECUTING,
        COMPLETED
    }

    private final UnitRegistry registry;
    private final PipelineSpecParser parser;
    private final ListenerNotifier notifier;
    private final Clock clock;

    private State state = State.UNLOADED;
    private PipelineSpec spec;
    private Pipeline pipeline;

    /** Engine over the given registry, with no listener. */
    public PipelineEngine(UnitRegistry registry) {
        this(registry, new PipelineSpecParser(), null, Clock.systemUTC());
    }

    public PipelineEngine(UnitRegistry registry, ExecutionListener listener) {
        this(registry, new PipelineSpecParser(), listener, Clock.systemUTC());
    }

    /**
     * @param registry resolves unit references at {@link #buildGraph()} time
     * @param parser   parses spec files for {@link #loadSpec(Path)}
     * @param listener optional execution hooks, may be {@code null}
     * @param clock    source of run start instants and checkpoint timestamps
     */
    public PipelineEngine(UnitRegistry registry, PipelineSpecParser parser, ExecutionListener listener, Clock clock) {
        this.registry = Objects.requireNonNull(registry, "registry must not be null");
        this.parser = Objects.requireNonNull(parser, "parser must not be null");
        this.notifier = listener != null ? new ListenerNotifier(listener) : ListenerNotifier.NONE;
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
    }

    /** Loads the spec file and builds its graph in one step. */
    public static PipelineEngine fromSpec(Path specFile, UnitRegistry registry) {
        PipelineEngine engine = new PipelineEngine(registry);
        engine.loadSpec(specFile);
        engine.buildGraph();
        return engine;
    }

    public State state() {
        return state;
    }

    /** The loaded spec, with any overrides applied. */
    public PipelineSpec spec() {
        requireSpec();
        return spec;
    }

    /** The runtime graph. Available once {@link #buildGraph()} has succeeded. */
    public Pipeline pipeline() {
        if (pipeline == null) {
            throw new IllegalStateException("Runtime graph not built; call buildGraph() first (state " + state + ")");
        }
        return pipeline;
    }

    public UnitRegistry registry() {
        return registry;
    }

    /**
     * Parses and validates a spec file.
     *
     * @throws io.stageflow.core.error.SpecParseException if the document is malformed
     */
    public PipelineEngine loadSpec(Path specFile) {
        requireState("loadSpec", State.UNLOADED);
        PipelineSpec parsed = parser.parse(specFile);
        LOG.info("Loaded pipeline '{}' v{} from {}", parsed.name(), parsed.version(), specFile);
        return loadSpec(parsed);
    }

    /** Adopts an already-built spec, e.g. one assembled in code. */
    public PipelineEngine loadSpec(PipelineSpec value) {
        requireState("loadSpec", State.UNLOADED);
        this.spec = Objects.requireNonNull(value, "spec must not be null");
        this.state = State.SPEC_LOADED;
        LOG.debug(
                "Pipeline '{}': {} transformer(s), {} stage(s), parallel={}, checkpoint={}",
                spec.name(),
                spec.transformers().size(),
                spec.stageCount(),
                spec.parallel(),
                spec.checkpointEnabled());
        return this;
    }

    /** Replaces the loaded spec with {@code overrides.apply(spec)}. Only allowed before the build. */
    public PipelineEngine applyOverrides(UnaryOperator<PipelineSpec> overrides) {
        requireState("applyOverrides", State.SPEC_LOADED);
        Objects.requireNonNull(overrides, "overrides must not be null");
        this.spec = Objects.requireNonNull(overrides.apply(spec), "overrides must not return null");
        return this;
    }

    /**
     * Resolves every unit reference into the runtime graph.
     *
     * @throws io.stageflow.core.error.UnitResolveException for the first unit that fails to
     *         resolve; the engine stays in {@code SPEC_LOADED}
     */
    public PipelineEngine buildGraph() {
        requireState("buildGraph", State.SPEC_LOADED);
        this.pipeline = Pipeline.build(spec, registry);
        this.state = State.GRAPH_BUILT;
        LOG.info("Built runtime graph for pipeline '{}': {} stage(s)", spec.name(), spec.stageCount());
        return this;
    }

    /** Runs every transformer from an empty input. */
    public PipelineResult execute() {
        return execute(ExecutionRequest.full());
    }

    /**
     * Executes the pipeline, or only validates its wiring when {@code request.dryRun()} is set.
     *
     * <p>
     * {@code startFrom} names a transformer, or a stage; in the latter case the run begins at the
     * transformer containing it and that transformer's earlier stages are skipped. Transformers
     * before the start point do not run and leave no trace in the context. An unknown start name
     * is recorded as an error and nothing runs.
     */
    public PipelineResult execute(ExecutionRequest request) {
        Objects.requireNonNull(request, "request must not be null");
        requireState("execute", State.GRAPH_BUILT, State.DRY_RUN_VALIDATED, State.COMPLETED);
        return request.dryRun() ? dryRun() : run(request);
    }

    /**
     * Runs exactly one transformer, picked by its own name or by the name of one of its stages.
     * The whole transformer runs in either case.
     *
     * @throws IllegalArgumentException if no transformer or stage has that name
     */
    public PipelineResult executeTransformer(String name) {
        Objects.requireNonNull(name, "name must not be null");
        requireState("executeTransformer", State.GRAPH_BUILT, State.DRY_RUN_VALIDATED, State.COMPLETED);
        Pipeline.StartPoint start = pipeline.locate(name)
                .orElseThrow(() -> new IllegalArgumentException("No transformer or stage named '" + name
                        + "'; available transformers: " + pipeline.transformerNames()));
        Transformer transformer = pipeline.transformers().get(start.transformerIndex());
        return runTransformers(List.of(transformer), null, ExecutionRequest.full());
    }

    /**
     * Saves a checkpoint of {@code result} under the spec's checkpoint directory.
     *
     * @return the written file, or empty when checkpointing is disabled in the spec
     * @throws io.stageflow.core.error.CheckpointException if the record cannot be written
     */
    public Optional<Path> saveCheckpoint(String checkpointId, PipelineResult result) {
        Objects.requireNonNull(result, "result must not be null");
        requireSpec();
        if (!spec.checkpointEnabled()) {
            LOG.info("Checkpointing is disabled for pipeline '{}'; checkpoint '{}' not saved", spec.name(), checkpointId);
            return Optional.empty();
        }
        Checkpoint checkpoint = Checkpoint.of(checkpointId, result, clock.instant());
        return Optional.of(checkpointStore().write(checkpoint));
    }

    /** Store over the spec's checkpoint directory. */
    public CheckpointStore checkpointStore() {
        requireSpec();
        return new CheckpointStore(spec.checkpointDir());
    }

    private PipelineResult dryRun() {
        ExecutionContext context = newContext();
        long startNanos = System.nanoTime();
        for (Transformer transformer : pipeline.transformers()) {
            for (TransformerStage stage : transformer.stages()) {
                if (stage.processor() == null) {
                    context.addError(transformer.name() + "/" + stage.name() + ": no processor resolved");
                }
            }
        }
        context.recordElapsed(Duration.ofNanos(System.nanoTime() - startNanos));
        PipelineResult result = new PipelineResult(spec.name(), !context.hasErrors(), List.of(), context, true);
        state = State.DRY_RUN_VALIDATED;
        LOG.info(
                "Dry run of pipeline '{}': {} stage(s) checked, {}",
                spec.name(),
                spec.stageCount(),
                result.success() ? "wiring is valid" : context.errors().size() + " error(s)");
        notifier.pipelineCompleted(result);
        return result;
    }

    private PipelineResult run(ExecutionRequest request) {
        List<Transformer> all = pipeline.transformers();
        if (request.startFrom() == null) {
            return runTransformers(all, null, request);
        }
        Optional<Pipeline.StartPoint> start = pipeline.locate(request.startFrom());
        if (start.isEmpty()) {
            ExecutionContext context = newContext();
            context.addError("Unknown start point '" + request.startFrom()
                    + "': no transformer or stage with that name; available transformers: "
                    + pipeline.transformerNames());
            LOG.error("Pipeline '{}' not started: unknown start point '{}'", spec.name(), request.startFrom());
            PipelineResult result = new PipelineResult(spec.name(), false, List.of(), context, false);
            state = State.COMPLETED;
            notifier.pipelineCompleted(result);
            return result;
        }
        int index = start.get().transformerIndex();
        LOG.info(
                "Resuming pipeline '{}' from '{}': skipping {} transformer(s)", spec.name(), request.startFrom(), index);
        return runTransformers(all.subList(index, all.size()), start.get().stageName(), request);
    }

    /**
     * Runs {@code transformers} in order. {@code resumeStage}, when set, applies to the first one
     * only.
     */
    private PipelineResult runTransformers(
            List<Transformer> transformers, String resumeStage, ExecutionRequest request) {
        ExecutionContext context = newContext();
        List<TransformerResult> results = new ArrayList<>(transformers.size());
        long startNanos = System.nanoTime();
        state = State.EXECUTING;
        MDC.put(MDC_PIPELINE, spec.name());
        try {
            try {
                LOG.info("Executing pipeline '{}': {} transformer(s)", spec.name(), transformers.size());
                notifier.pipelineStarted(spec.name(), transformers.size());
                for (int i = 0; i < transformers.size(); i++) {
                    Transformer transformer = transformers.get(i);
                    MDC.put(MDC_TRANSFORMER, transformer.name());
                    try {
                        LOG.info("Running transformer '{}'", transformer.name());
                        notifier.transformerStarted(spec.name(), transformer.name());
                        TransformerResult result = transformer.execute(
                                request.input(), context, i == 0 ? resumeStage : null, notifier);
                        results.add(result);
                        if (!result.success() && spec.failFast()) {
                            LOG.warn(
                                    "Transformer '{}' failed and fail-fast is set; skipping {} remaining transformer(s)",
                                    transformer.name(),
                                    transformers.size() - i - 1);
                            break;
                        }
                    } finally {
                        MDC.remove(MDC_TRANSFORMER);
                    }
                }
            } finally {
                context.recordElapsed(Duration.ofNanos(System.nanoTime() - startNanos));
                state = State.COMPLETED;
            }

            boolean success = results.stream().allMatch(TransformerResult::success) && !context.hasErrors();
            PipelineResult result = new PipelineResult(spec.name(), success, results, context, false);
            LOG.info(
                    "Pipeline '{}' {}: items={}, errors={}, warnings={}, elapsed={}ms",
                    spec.name(),
                    success ? "succeeded" : "failed",
                    context.itemsProcessed(),
                    context.errors().size(),
                    context.warnings().size(),
                    context.elapsed().toMillis());
            notifier.pipelineCompleted(result);
            return result;
        } finally {
            MDC.remove(MDC_PIPELINE);
        }
    }

    private ExecutionContext newContext() {
        ExecutionContext context = new ExecutionContext(spec.name());
        context.metadata().put(ExecutionContext.PARALLEL, spec.parallel());
        context.markStarted(Instant.now(clock));
        return context;
    }

    private void requireSpec() {
        if (spec == null) {
            throw new IllegalStateException("No pipeline spec loaded; call loadSpec() first");
        }
    }

    private void requireState(String operation, State... allowed) {
        for (State s : allowed) {
            if (state == s) {
                return;
            }
        }
        throw new IllegalStateException(operation + "() is not allowed in state " + state + "; expected one of "
                + List.of(allowed));
    }
}
