package io.stageflow.core.engine;

import io.stageflow.core.model.PipelineSpec;
import io.stageflow.core.model.TransformerSpec;
import io.stageflow.core.model.TransformerStageSpec;
import io.stageflow.core.spi.PostProcessor;
import io.stageflow.core.spi.Processor;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * The runtime graph: built once from a {@link PipelineSpec} by resolving every unit reference, then
 * read-only for the rest of the engine's life.
 */
public final class Pipeline {

    /**
     * Where an execution starts: a transformer index, plus the stage to resume at within it
     * ({@code null} to run the transformer from its first stage).
     */
    record StartPoint(int transformerIndex, String stageName) {}

    private final PipelineSpec spec;
    private final List<Transformer> transformers;

    private Pipeline(PipelineSpec spec, List<Transformer> transformers) {
        this.spec = spec;
        this.transformers = List.copyOf(transformers);
    }

    /**
     * Resolves every processor and post-processor of {@code spec} through {@code registry}. The
     * first resolution failure aborts the build.
     *
     * @throws io.stageflow.core.error.UnitResolveException naming the failing stage and unit
     */
    static Pipeline build(PipelineSpec spec, UnitRegistry registry) {
        Objects.requireNonNull(spec, "spec must not be null");
        Objects.requireNonNull(registry, "registry must not be null");
        List<Transformer> transformers = new ArrayList<>(spec.transformers().size());
        for (TransformerSpec transformerSpec : spec.transformers()) {
            List<TransformerStage> stages = new ArrayList<>(transformerSpec.stages().size());
            for (TransformerStageSpec stageSpec : transformerSpec.stages()) {
                Processor processor = registry.resolveProcessor(stageSpec.processor(), stageSpec.name());
                PostProcessor postProcessor = stageSpec.postProcessorSpec()
                        .map(pp -> registry.resolvePostProcessor(pp, stageSpec.name()))
                        .orElse(null);
                stages.add(new TransformerStage(stageSpec, processor, postProcessor));
            }
            transformers.add(new Transformer(transformerSpec, stages));
        }
        return new Pipeline(spec, transformers);
    }

    public String name() {
        return spec.name();
    }

    public PipelineSpec spec() {
        return spec;
    }

    public List<Transformer> transformers() {
        return transformers;
    }

    public Optional<Transformer> transformer(String transformerName) {
        return transformers.stream().filter(t -> t.name().equals(transformerName)).findFirst();
    }

    /** Names of all transformers, in declaration order. */
    public List<String> transformerNames() {
        return transformers.stream().map(Transformer::name).toList();
    }

    /**
     * Finds the start point named {@code name}: a transformer name first, otherwise the
     * transformer containing a stage of that name.
     */
    Optional<StartPoint> locate(String name) {
        for (int i = 0; i < transformers.size(); i++) {
            if (transformers.get(i).name().equals(name)) {
                return Optional.of(new StartPoint(i, null));
            }
        }
        for (int i = 0; i < transformers.size(); i++) {
            if (transformers.get(i).stage(name).isPresent()) {
                return Optional.of(new StartPoint(i, name));
            }
        }
        return Optional.empty();
    }
}
