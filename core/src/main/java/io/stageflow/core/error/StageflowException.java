package io.stageflow.core.error;

/**
 * Abstract base for all stageflow exceptions. Never thrown directly; use the concrete subclasses
 * under {@link PipelineLoadException}, {@link UnitResolveException}, {@link
 * StageExecutionException} or {@link CheckpointException}.
 */
public abstract class StageflowException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    /** Phase of the pipeline lifecycle in which the error occurred. */
    public enum Phase {
        LOAD,
        BUILD,
        EXECUTION,
        CHECKPOINT
    }

    private final String pipelineName;
    private final Phase phase;

    protected StageflowException(String message, String pipelineName, Phase phase) {
        super(message);
        this.pipelineName = pipelineName;
        this.phase = phase;
    }

    protected StageflowException(String message, Throwable cause, String pipelineName, Phase phase) {
        super(message, cause);
        this.pipelineName = pipelineName;
        this.phase = phase;
    }

    /** The pipeline that triggered the error, or {@code null} if not yet identified. */
    public String pipelineName() {
        return pipelineName;
    }

    /** Human-readable error description (alias for {@link #getMessage()}). */
    public String detail() {
        return getMessage();
    }

    /** The phase in which the error occurred. */
    public Phase phase() {
        return phase;
    }
}
