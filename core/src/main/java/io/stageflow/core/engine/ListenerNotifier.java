package io.stageflow.core.engine;

import io.stageflow.core.model.PipelineResult;
import io.stageflow.core.model.StageResult;
import io.stageflow.core.spi.ExecutionListener;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Calls an {@link ExecutionListener}, logging and discarding anything it throws. A {@code null}
 * listener turns every call into a no-op.
 */
final class ListenerNotifier {

    private static final Logger LOG = LoggerFactory.getLogger(ListenerNotifier.class);

    static final ListenerNotifier NONE = new ListenerNotifier(null);

    private final ExecutionListener listener;

    ListenerNotifier(ExecutionListener listener) {
        this.listener = listener;
    }

    void pipelineStarted(String pipelineName, int transformerCount) {
        if (listener == null) {
            return;
        }
        try {
            listener.onPipelineStarted(pipelineName, transformerCount);
        } catch (Exception e) {
            LOG.warn("ExecutionListener.onPipelineStarted failed", e);
        }
    }

    void transformerStarted(String pipelineName, String transformerName) {
        if (listener == null) {
            return;
        }
        try {
            listener.onTransformerStarted(pipelineName, transformerName);
        } catch (Exception e) {
            LOG.warn("ExecutionListener.onTransformerStarted failed", e);
        }
    }

    void stageCompleted(String transformerName, StageResult result) {
        if (listener == null) {
            return;
        }
        try {
            listener.onStageCompleted(transformerName, result);
        } catch (Exception e) {
            LOG.warn("ExecutionListener.onStageCompleted failed", e);
        }
    }

    void stageFailed(String transformerName, StageResult result) {
        if (listener == null) {
            return;
        }
        try {
            listener.onStageFailed(transformerName, result);
        } catch (Exception e) {
            LOG.warn("ExecutionListener.onStageFailed failed", e);
        }
    }

    void pipelineCompleted(PipelineResult result) {
        if (listener == null) {
            return;
        }
        try {
            listener.onPipelineCompleted(result);
        } catch (Exception e) {
            LOG.warn("ExecutionListener.onPipelineCompleted failed", e);
        }
    }
}
