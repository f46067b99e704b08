package io.stageflow.core.spi;

import io.stageflow.core.model.ExecutionContext;
import io.stageflow.core.model.ProcessorOutput;

/**
 * Optional refinement unit applied to a processor's output within the same stage. Stages without
 * one use {@link io.stageflow.core.engine.IdentityPostProcessor}. Same side-effect and failure
 * contract as {@link Processor}.
 */
public interface PostProcessor extends StageUnit {

    ProcessorOutput postProcess(ProcessorOutput output, ExecutionContext context);

    default boolean validateInput(ProcessorOutput output) {
        return true;
    }

    default boolean validateOutput(ProcessorOutput output) {
        return true;
    }
}
