package io.stageflow.core.model;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Outcome of one executed transformer: one {@link StageResult} per declared stage, in order.
 * Successful only if every stage that was meant to run succeeded.
 */
public record TransformerResult(String transformerName, boolean success, List<StageResult> stageResults) {

    public TransformerResult {
        Objects.requireNonNull(transformerName, "transformerName must not be null");
        stageResults = List.copyOf(stageResults);
    }

    public Optional<StageResult> stage(String stageName) {
        return stageResults.stream().filter(r -> r.stageName().equals(stageName)).findFirst();
    }

    /** Output of the last stage that succeeded, if any. */
    public Optional<ProcessorOutput> lastOutput() {
        for (int i = stageResults.size() - 1; i >= 0; i--) {
            StageResult r = stageResults.get(i);
            if (r.isSuccess()) {
                return Optional.of(r.output());
            }
        }
        return Optional.empty();
    }
}
