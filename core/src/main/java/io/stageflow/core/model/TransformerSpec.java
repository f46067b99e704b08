package io.stageflow.core.model;

import java.util.List;
import java.util.Objects;

/** A named phase of work: an ordered, non-empty list of stages. */
public record TransformerSpec(String name, String description, List<TransformerStageSpec> stages) {

    public TransformerSpec {
        Objects.requireNonNull(name, "name must not be null");
        Objects.requireNonNull(stages, "stages must not be null");
        stages = List.copyOf(stages);
    }

    public static TransformerSpec of(String name, TransformerStageSpec... stages) {
        return new TransformerSpec(name, null, List.of(stages));
    }

    /** Returns {@code true} if one of this transformer's stages is named {@code stageName}. */
    public boolean hasStage(String stageName) {
        return stages.stream().anyMatch(s -> s.name().equals(stageName));
    }

    TransformerSpec withUnitConfig(String key, Object value) {
        return new TransformerSpec(
                name,
                description,
                stages.stream().map(s -> s.withUnitConfig(key, value)).toList());
    }
}
