package io.stageflow.core.model;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Objects;

/**
 * Immutable, timestamped snapshot of a completed run's outcome. Checkpoints are observational: the
 * engine never resumes from one, only from a named transformer or stage.
 */
public record Checkpoint(String checkpointId, String pipelineName, Instant timestamp, boolean success, Summary summary) {

    public Checkpoint {
        Objects.requireNonNull(checkpointId, "checkpointId must not be null");
        Objects.requireNonNull(pipelineName, "pipelineName must not be null");
        Objects.requireNonNull(timestamp, "timestamp must not be null");
        Objects.requireNonNull(summary, "summary must not be null");
    }

    /** Builds a checkpoint from a pipeline result at the given instant. */
    public static Checkpoint of(String checkpointId, PipelineResult result, Instant timestamp) {
        ExecutionContext ctx = result.context();
        return new Checkpoint(
                checkpointId,
                result.pipelineName(),
                timestamp,
                result.success(),
                new Summary(ctx.itemsProcessed(), ctx.errors(), ctx.warnings(), ctx.elapsed()));
    }

    /** Counts and audit trail copied from the run's {@link ExecutionContext}. */
    public record Summary(long itemsProcessed, List<String> errors, List<String> warnings, Duration elapsed) {

        public Summary {
            errors = List.copyOf(errors);
            warnings = List.copyOf(warnings);
            elapsed = elapsed != null ? elapsed : Duration.ZERO;
        }
    }
}
