package io.stageflow.core.model;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Outcome of one pipeline run. Immutable: constructing a result {@linkplain ExecutionContext#seal()
 * seals} the context it references, so counts, errors and warnings can no longer change.
 *
 * @param success            every executed stage succeeded and the context holds no errors
 * @param transformerResults results of the transformers that actually ran, in execution order
 * @param dryRun             {@code true} when produced by a structural validation run
 */
public record PipelineResult(
        String pipelineName,
        boolean success,
        List<TransformerResult> transformerResults,
        ExecutionContext context,
        boolean dryRun) {

    public PipelineResult {
        Objects.requireNonNull(pipelineName, "pipelineName must not be null");
        Objects.requireNonNull(context, "context must not be null");
        transformerResults = List.copyOf(transformerResults);
        context.seal();
    }

    public Optional<TransformerResult> transformer(String transformerName) {
        return transformerResults.stream()
                .filter(r -> r.transformerName().equals(transformerName))
                .findFirst();
    }
}
