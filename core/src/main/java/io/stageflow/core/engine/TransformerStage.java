package io.stageflow.core.engine;

import io.stageflow.core.error.StageExecutionException;
import io.stageflow.core.model.ExecutionContext;
import io.stageflow.core.model.ProcessorInput;
import io.stageflow.core.model.ProcessorOutput;
import io.stageflow.core.model.TransformerStageSpec;
import io.stageflow.core.spi.PostProcessor;
import io.stageflow.core.spi.Processor;
import java.util.Objects;

/**
 * Runtime stage: the spec plus its resolved units. Stages without a declared post-processor hold
 * {@link IdentityPostProcessor}.
 */
public final class TransformerStage {

    private final TransformerStageSpec spec;
    private final Processor processor;
    private final PostProcessor postProcessor;

    TransformerStage(TransformerStageSpec spec, Processor processor, PostProcessor postProcessor) {
        this.spec = Objects.requireNonNull(spec, "spec must not be null");
        this.processor = processor;
        this.postProcessor = postProcessor != null ? postProcessor : IdentityPostProcessor.INSTANCE;
    }

    public String name() {
        return spec.name();
    }

    public TransformerStageSpec spec() {
        return spec;
    }

    /** The resolved processor; {@code null} only for a graph that failed to wire. */
    public Processor processor() {
        return processor;
    }

    public PostProcessor postProcessor() {
        return postProcessor;
    }

    /**
     * Runs the processor, then the post-processor, on the same context. Validation hooks that
     * return {@code false} add a warning and the stage carries on. Exceptions thrown by either unit
     * propagate to the caller.
     */
    ProcessorOutput run(ProcessorInput input, ExecutionContext context) {
        if (processor == null) {
            throw new StageExecutionException("no processor resolved");
        }
        if (!processor.validateInput(input)) {
            context.addWarning(name() + ": processor input validation failed");
        }
        ProcessorOutput output = processor.process(input, context);
        if (output == null) {
            throw new StageExecutionException("processor '" + spec.processor().name() + "' returned no output");
        }
        if (!processor.validateOutput(output)) {
            context.addWarning(name() + ": processor output validation failed");
        }

        if (!postProcessor.validateInput(output)) {
            context.addWarning(name() + ": post-processor input validation failed");
        }
        ProcessorOutput refined = postProcessor.postProcess(output, context);
        if (refined == null) {
            throw new StageExecutionException("post-processor returned no output");
        }
        if (!postProcessor.validateOutput(refined)) {
            context.addWarning(name() + ": post-processor output validation failed");
        }
        return refined;
    }

    @Override
    public String toString() {
        return "TransformerStage[" + name() + "]";
    }
}
