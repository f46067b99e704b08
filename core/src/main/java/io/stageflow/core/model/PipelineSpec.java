package io.stageflow.core.model;

import java.nio.file.Path;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Top-level pipeline description. Immutable: caller-driven overrides ({@link #withParallel},
 * {@link #withCheckpointDir}, {@link #withUnitConfig}) return modified copies and must be applied
 * before the runtime graph is built.
 *
 * @param failFast          stop after the first failed transformer instead of continuing with the
 *                          next one
 * @param checkpointDir     where checkpoint records are written
 */
public record PipelineSpec(
        String name,
        String version,
        String description,
        List<TransformerSpec> transformers,
        boolean parallel,
        boolean failFast,
        boolean checkpointEnabled,
        Path checkpointDir) {

    public static final String DEFAULT_VERSION = "1.0.0";
    public static final Path DEFAULT_CHECKPOINT_DIR = Path.of(".checkpoints");

    public PipelineSpec {
        Objects.requireNonNull(name, "name must not be null");
        Objects.requireNonNull(transformers, "transformers must not be null");
        version = version != null ? version : DEFAULT_VERSION;
        transformers = List.copyOf(transformers);
        checkpointDir = checkpointDir != null ? checkpointDir : DEFAULT_CHECKPOINT_DIR;
    }

    /** Minimal spec: sequential, continue-on-failure, checkpoints enabled in the default dir. */
    public static PipelineSpec of(String name, TransformerSpec... transformers) {
        return new PipelineSpec(name, DEFAULT_VERSION, null, List.of(transformers), false, false, true, null);
    }

    public PipelineSpec withParallel(boolean value) {
        return new PipelineSpec(
                name, version, description, transformers, value, failFast, checkpointEnabled, checkpointDir);
    }

    public PipelineSpec withFailFast(boolean value) {
        return new PipelineSpec(
                name, version, description, transformers, parallel, value, checkpointEnabled, checkpointDir);
    }

    public PipelineSpec withCheckpointEnabled(boolean value) {
        return new PipelineSpec(name, version, description, transformers, parallel, failFast, value, checkpointDir);
    }

    public PipelineSpec withCheckpointDir(Path dir) {
        return new PipelineSpec(name, version, description, transformers, parallel, failFast, checkpointEnabled, dir);
    }

    /**
     * Injects {@code key = value} into the config map of every processor and post-processor, e.g.
     * a uniform {@code max-workers} override.
     */
    public PipelineSpec withUnitConfig(String key, Object value) {
        Objects.requireNonNull(key, "key must not be null");
        List<TransformerSpec> updated =
                transformers.stream().map(t -> t.withUnitConfig(key, value)).toList();
        return new PipelineSpec(name, version, description, updated, parallel, failFast, checkpointEnabled, checkpointDir);
    }

    public Optional<TransformerSpec> transformer(String transformerName) {
        return transformers.stream().filter(t -> t.name().equals(transformerName)).findFirst();
    }

    public int stageCount() {
        return transformers.stream().mapToInt(t -> t.stages().size()).sum();
    }
}
