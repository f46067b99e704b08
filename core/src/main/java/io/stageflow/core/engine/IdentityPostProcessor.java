package io.stageflow.core.engine;

import io.stageflow.core.model.ExecutionContext;
import io.stageflow.core.model.ProcessorOutput;
import io.stageflow.core.spi.PostProcessor;

/**
 * Pass-through post-processor substituted for stages that declare none. Also registered in every
 * {@link UnitRegistry} under {@value #NAME}.
 */
public final class IdentityPostProcessor implements PostProcessor {

    public static final String NAME = "identity";

    static final IdentityPostProcessor INSTANCE = new IdentityPostProcessor();

    @Override
    public ProcessorOutput postProcess(ProcessorOutput output, ExecutionContext context) {
        return output;
    }
}
