package io.stageflow.core.model;

import java.util.Objects;
import java.util.Optional;

/**
 * One stage: a mandatory processor and an optional post-processor.
 *
 * @param postProcessor the post-processor spec, or {@code null} for the identity pass-through
 */
public record TransformerStageSpec(
        String name, String description, ProcessorSpec processor, PostProcessorSpec postProcessor) {

    public TransformerStageSpec {
        Objects.requireNonNull(name, "name must not be null");
        Objects.requireNonNull(processor, "processor must not be null");
    }

    public static TransformerStageSpec of(String name, ProcessorSpec processor) {
        return new TransformerStageSpec(name, null, processor, null);
    }

    public static TransformerStageSpec of(String name, ProcessorSpec processor, PostProcessorSpec postProcessor) {
        return new TransformerStageSpec(name, null, processor, postProcessor);
    }

    public Optional<PostProcessorSpec> postProcessorSpec() {
        return Optional.ofNullable(postProcessor);
    }

    TransformerStageSpec withUnitConfig(String key, Object value) {
        return new TransformerStageSpec(
                name,
                description,
                processor.withConfigValue(key, value),
                postProcessor != null ? postProcessor.withConfigValue(key, value) : null);
    }
}
