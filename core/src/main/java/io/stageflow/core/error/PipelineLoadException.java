package io.stageflow.core.error;

/**
 * Abstract parent for load-time specification errors. Thrown by {@code
 * PipelineEngine.loadSpec()} before any unit is resolved. Carries a {@code source} field
 * identifying the file or resource that caused the error.
 */
public abstract class PipelineLoadException extends StageflowException {

    private static final long serialVersionUID = 1L;

    private final String source;

    protected PipelineLoadException(String message, String pipelineName, String source) {
        super(message, pipelineName, Phase.LOAD);
        this.source = source;
    }

    protected PipelineLoadException(String message, Throwable cause, String pipelineName, String source) {
        super(message, cause, pipelineName, Phase.LOAD);
        this.source = source;
    }

    /** The file path or resource identifier that caused the error. */
    public String source() {
        return source;
    }
}
