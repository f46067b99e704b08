package io.stageflow.core.engine;

import io.stageflow.core.model.ProcessorInput;

/**
 * Parameters of one {@link PipelineEngine#execute(ExecutionRequest)} call.
 *
 * @param startFrom transformer or stage name to resume from; {@code null} runs everything
 * @param dryRun    validate the graph's wiring without invoking any unit
 * @param input     envelope each executed transformer starts from; defaults to
 *                  {@link ProcessorInput#empty()}
 */
public record ExecutionRequest(String startFrom, boolean dryRun, ProcessorInput input) {

    public ExecutionRequest {
        input = input != null ? input : ProcessorInput.empty();
    }

    /** Runs every transformer from an empty input. */
    public static ExecutionRequest full() {
        return new ExecutionRequest(null, false, null);
    }

    public static ExecutionRequest dryRunOnly() {
        return new ExecutionRequest(null, true, null);
    }

    public static ExecutionRequest startingFrom(String name) {
        return new ExecutionRequest(name, false, null);
    }

    public ExecutionRequest withInput(ProcessorInput value) {
        return new ExecutionRequest(startFrom, dryRun, value);
    }
}
