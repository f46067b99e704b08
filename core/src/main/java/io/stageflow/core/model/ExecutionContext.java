package io.stageflow.core.model;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * The single mutable object shared by every unit of one pipeline run.
 *
 * <p>
 * Errors and warnings are append-only: they are never cleared or reordered for the lifetime of
 * the run. The items counter only grows.
 *
 * <p>
 * Not thread-safe. The engine calls units one at a time, so at pipeline level there is exactly one
 * writer. Workers running inside {@link io.stageflow.core.parallel.ParallelTaskRunner} must not
 * touch the context; they return a {@link io.stageflow.core.parallel.TaskResult} and the calling
 * unit folds the aggregate in after the pool has drained.
 *
 * <p>
 * Once the run is over the engine {@linkplain #seal() seals} the context; from then on every
 * mutator throws {@link IllegalStateException} and {@link #metadata()} is read-only.
 */
public final class ExecutionContext {

    /** Metadata key holding the effective global parallel flag ({@link Boolean}). */
    public static final String PARALLEL = "parallel";

    private final String pipelineName;
    private final List<String> errors = new ArrayList<>();
    private final List<String> warnings = new ArrayList<>();
    private final Map<String, Object> metadata = new LinkedHashMap<>();
    private long itemsProcessed;
    private String transformerName;
    private String stageName;
    private Instant startedAt;
    private Duration elapsed = Duration.ZERO;
    private boolean sealed;

    public ExecutionContext(String pipelineName) {
        this.pipelineName = Objects.requireNonNull(pipelineName, "pipelineName must not be null");
    }

    public String pipelineName() {
        return pipelineName;
    }

    public long itemsProcessed() {
        return itemsProcessed;
    }

    public void incrementItems() {
        requireOpen();
        itemsProcessed++;
    }

    /**
     * Adds {@code count} to the processed-items counter.
     *
     * @throws IllegalArgumentException if {@code count} is negative
     */
    public void addItems(long count) {
        requireOpen();
        if (count < 0) {
            throw new IllegalArgumentException("count must not be negative, got: " + count);
        }
        itemsProcessed += count;
    }

    public void addError(String error) {
        requireOpen();
        errors.add(Objects.requireNonNull(error, "error must not be null"));
    }

    public void addWarning(String warning) {
        requireOpen();
        warnings.add(Objects.requireNonNull(warning, "warning must not be null"));
    }

    /** Read-only view, in the order errors were recorded. */
    public List<String> errors() {
        return Collections.unmodifiableList(errors);
    }

    /** Read-only view, in the order warnings were recorded. */
    public List<String> warnings() {
        return Collections.unmodifiableList(warnings);
    }

    public boolean hasErrors() {
        return !errors.isEmpty();
    }

    /** Free-form metadata map for cross-cutting signals between units; read-only once sealed. */
    public Map<String, Object> metadata() {
        return sealed ? Collections.unmodifiableMap(metadata) : metadata;
    }

    /** The global parallel flag recorded by the engine; {@code false} when absent. */
    public boolean isParallel() {
        return Boolean.TRUE.equals(metadata.get(PARALLEL));
    }

    public String transformerName() {
        return transformerName;
    }

    public String stageName() {
        return stageName;
    }

    /** Called by the engine when it moves on to another stage. */
    public void enterStage(String transformer, String stage) {
        requireOpen();
        this.transformerName = transformer;
        this.stageName = stage;
    }

    public Instant startedAt() {
        return startedAt;
    }

    public void markStarted(Instant instant) {
        requireOpen();
        this.startedAt = instant;
    }

    public Duration elapsed() {
        return elapsed;
    }

    public void recordElapsed(Duration duration) {
        requireOpen();
        this.elapsed = Objects.requireNonNull(duration, "duration must not be null");
    }

    /** Freezes the context. Idempotent. */
    public void seal() {
        sealed = true;
    }

    public boolean isSealed() {
        return sealed;
    }

    private void requireOpen() {
        if (sealed) {
            throw new IllegalStateException("Execution context of pipeline '" + pipelineName + "' is sealed");
        }
    }

    @Override
    public String toString() {
        return "ExecutionContext[pipeline=" + pipelineName + ", items=" + itemsProcessed + ", errors=" + errors.size()
                + ", warnings=" + warnings.size() + "]";
    }
}
