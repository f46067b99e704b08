package io.stageflow.core.error;

/**
 * Thrown by a unit to fail the current stage. The engine catches it (like any other runtime
 * exception raised by a unit), records it as a context error and skips the remaining stages of
 * the current transformer.
 */
public class StageExecutionException extends StageflowException {

    private static final long serialVersionUID = 1L;

    public StageExecutionException(String message) {
        super(message, null, Phase.EXECUTION);
    }

    public StageExecutionException(String message, Throwable cause) {
        super(message, cause, null, Phase.EXECUTION);
    }
}
