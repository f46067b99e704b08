package io.stageflow.core.model;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.nio.file.Path;
import java.util.Map;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class PipelineSpecTest {

    private static PipelineSpec sample() {
        return PipelineSpec.of(
                "sample",
                TransformerSpec.of(
                        "ingest",
                        TransformerStageSpec.of("scan", ProcessorSpec.of("scanner", "file-scan")),
                        TransformerStageSpec.of(
                                "digest",
                                ProcessorSpec.of("digester", "file-digest", Map.of("algorithm", "MD5")),
                                PostProcessorSpec.of("writer", "manifest-writer"))),
                TransformerSpec.of("publish", TransformerStageSpec.of("upload", ProcessorSpec.of("up", "noop"))));
    }

    @Test
    @DisplayName("defaults: version 1.0.0, sequential, continue on failure, checkpoints on")
    void defaults() {
        PipelineSpec spec = sample();

        assertThat(spec.version()).isEqualTo(PipelineSpec.DEFAULT_VERSION);
        assertThat(spec.parallel()).isFalse();
        assertThat(spec.failFast()).isFalse();
        assertThat(spec.checkpointEnabled()).isTrue();
        assertThat(spec.checkpointDir()).isEqualTo(Path.of(".checkpoints"));
        assertThat(spec.stageCount()).isEqualTo(3);
    }

    @Test
    void overridesReturnCopies() {
        PipelineSpec spec = sample();
        PipelineSpec changed =
                spec.withParallel(true).withFailFast(true).withCheckpointDir(Path.of("/tmp/cp"));

        assertThat(changed.parallel()).isTrue();
        assertThat(changed.failFast()).isTrue();
        assertThat(changed.checkpointDir()).isEqualTo(Path.of("/tmp/cp"));
        assertThat(spec.parallel()).isFalse();
        assertThat(spec.checkpointDir()).isEqualTo(PipelineSpec.DEFAULT_CHECKPOINT_DIR);
    }

    @Test
    @DisplayName("withUnitConfig reaches every processor and post-processor, keeping existing keys")
    void withUnitConfigInjectsEverywhere() {
        PipelineSpec changed = sample().withUnitConfig("max-workers", 3);

        TransformerStageSpec digest = changed.transformer("ingest").orElseThrow().stages().get(1);
        assertThat(digest.processor().config()).containsEntry("max-workers", 3).containsEntry("algorithm", "MD5");
        assertThat(digest.postProcessorSpec().orElseThrow().config()).containsEntry("max-workers", 3);
        TransformerStageSpec upload = changed.transformer("publish").orElseThrow().stages().get(0);
        assertThat(upload.processor().config()).containsEntry("max-workers", 3);
    }

    @Test
    void transformersListIsImmutable() {
        PipelineSpec spec = sample();

        assertThatThrownBy(() -> spec.transformers().clear()).isInstanceOf(UnsupportedOperationException.class);
    }

    @Test
    void blankImplementationNameIsRejected() {
        assertThatThrownBy(() -> ImplementationRef.named(" "))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("blank");
    }

    @Test
    void transformerLooksUpStages() {
        TransformerSpec ingest = sample().transformer("ingest").orElseThrow();

        assertThat(ingest.hasStage("digest")).isTrue();
        assertThat(ingest.hasStage("upload")).isFalse();
        assertThat(sample().transformer("missing")).isEmpty();
    }
}
