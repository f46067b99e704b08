package io.stageflow.core.error;

/** Thrown when a pipeline spec has invalid syntax, unknown keys or missing required fields. */
public final class SpecParseException extends PipelineLoadException {

    private static final long serialVersionUID = 1L;

    public SpecParseException(String message, String pipelineName, String source) {
        super(message, pipelineName, source);
    }

    public SpecParseException(String message, Throwable cause, String pipelineName, String source) {
        super(message, cause, pipelineName, source);
    }
}
