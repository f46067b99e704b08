package io.stageflow.core.spi;

import io.stageflow.core.model.ExecutionContext;
import io.stageflow.core.model.ProcessorInput;
import io.stageflow.core.model.ProcessorOutput;

/**
 * The mandatory unit of every stage: consumes the current envelope and produces the next one.
 *
 * <p>
 * Implementations may read and write the shared {@link ExecutionContext} (add items, append
 * warnings or errors, read the parallel flag) and may perform any side effect of their own. A call
 * is synchronous from the engine's point of view and happens at most once per stage invocation.
 * Throwing fails the stage, and so does any {@link Error} short of a {@link VirtualMachineError};
 * {@link io.stageflow.core.error.StageExecutionException} is the conventional choice.
 */
public interface Processor extends StageUnit {

    ProcessorOutput process(ProcessorInput input, ExecutionContext context);

    /**
     * Checked before {@link #process}. Returning {@code false} records a warning; it does not stop
     * the stage. Units that want to fail outright should throw from {@link #process} instead.
     */
    default boolean validateInput(ProcessorInput input) {
        return true;
    }

    /** Checked after {@link #process}; same warning-only contract as {@link #validateInput}. */
    default boolean validateOutput(ProcessorOutput output) {
        return true;
    }
}
