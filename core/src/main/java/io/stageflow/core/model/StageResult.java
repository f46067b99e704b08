package io.stageflow.core.model;

import java.util.Objects;

/**
 * Outcome of one stage. Exactly one of three states:
 *
 * <ul>
 * <li>{@link Status#SUCCEEDED}: {@code output} holds the post-processed envelope.
 * <li>{@link Status#FAILED}: {@code error} holds the failure message.
 * <li>{@link Status#SKIPPED}: the stage never ran (an earlier stage failed, or it precedes the
 * resume point).
 * </ul>
 */
public final class StageResult {

    public enum Status {
        SUCCEEDED,
        FAILED,
        SKIPPED
    }

    private final String stageName;
    private final Status status;
    private final ProcessorOutput output;
    private final String error;

    private StageResult(String stageName, Status status, ProcessorOutput output, String error) {
        this.stageName = Objects.requireNonNull(stageName, "stageName must not be null");
        this.status = status;
        this.output = output;
        this.error = error;
    }

    public static StageResult succeeded(String stageName, ProcessorOutput output) {
        Objects.requireNonNull(output, "output must not be null for SUCCEEDED");
        return new StageResult(stageName, Status.SUCCEEDED, output, null);
    }

    public static StageResult failed(String stageName, String error) {
        Objects.requireNonNull(error, "error must not be null for FAILED");
        return new StageResult(stageName, Status.FAILED, null, error);
    }

    public static StageResult skipped(String stageName) {
        return new StageResult(stageName, Status.SKIPPED, null, null);
    }

    public String stageName() {
        return stageName;
    }

    public Status status() {
        return status;
    }

    /** Only set when {@code status() == SUCCEEDED}. */
    public ProcessorOutput output() {
        return output;
    }

    /** Only set when {@code status() == FAILED}. */
    public String error() {
        return error;
    }

    public boolean isSuccess() {
        return status == Status.SUCCEEDED;
    }

    public boolean isFailed() {
        return status == Status.FAILED;
    }

    public boolean isSkipped() {
        return status == Status.SKIPPED;
    }

    @Override
    public String toString() {
        return switch (status) {
            case SUCCEEDED -> "StageResult[" + stageName + ", SUCCEEDED]";
            case FAILED -> "StageResult[" + stageName + ", FAILED: " + error + "]";
            case SKIPPED -> "StageResult[" + stageName + ", SKIPPED]";
        };
    }
}
