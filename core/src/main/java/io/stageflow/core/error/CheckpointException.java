package io.stageflow.core.error;

/** Thrown when a checkpoint record cannot be written or read back. */
public final class CheckpointException extends StageflowException {

    private static final long serialVersionUID = 1L;

    private final String checkpointId;

    public CheckpointException(String message, String checkpointId, String pipelineName) {
        super(message, pipelineName, Phase.CHECKPOINT);
        this.checkpointId = checkpointId;
    }

    public CheckpointException(String message, Throwable cause, String checkpointId, String pipelineName) {
        super(message, cause, pipelineName, Phase.CHECKPOINT);
        this.checkpointId = checkpointId;
    }

    public String checkpointId() {
        return checkpointId;
    }
}
