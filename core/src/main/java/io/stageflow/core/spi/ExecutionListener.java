package io.stageflow.core.spi;

import io.stageflow.core.model.PipelineResult;
import io.stageflow.core.model.StageResult;

/**
 * Observability hooks for pipeline execution. All methods default to no-ops, so implementations
 * override only what they need.
 *
 * <p>
 * Listeners are called on the engine thread. Exceptions they throw are caught and logged by the
 * engine and do not affect execution.
 */
public interface ExecutionListener {

    default void onPipelineStarted(String pipelineName, int transformerCount) {}

    default void onTransformerStarted(String pipelineName, String transformerName) {}

    default void onStageCompleted(String transformerName, StageResult result) {}

    default void onStageFailed(String transformerName, StageResult result) {}

    default void onPipelineCompleted(PipelineResult result) {}
}
