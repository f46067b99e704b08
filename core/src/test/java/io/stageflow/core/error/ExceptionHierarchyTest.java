package io.stageflow.core.error;

import static org.assertj.core.api.Assertions.assertThat;

import org.junit.jupiter.api.Test;

/** Tests for the exception hierarchy: phases, common fields and the concrete types. */
class ExceptionHierarchyTest {

    // --- Hierarchy structure ---

    @Test
    void stageflowExceptionIsAbstractAndUnchecked() {
        assertThat(StageflowException.class).isAbstract();
        assertThat(StageflowException.class.getSuperclass()).isEqualTo(RuntimeException.class);
    }

    @Test
    void loadAndResolveTiersAreAbstract() {
        assertThat(PipelineLoadException.class).isAbstract();
        assertThat(PipelineLoadException.class.getSuperclass()).isEqualTo(StageflowException.class);
        assertThat(UnitResolveException.class).isAbstract();
        assertThat(UnitResolveException.class.getSuperclass()).isEqualTo(StageflowException.class);
    }

    // --- Load phase ---

    @Test
    void specParseExceptionCarriesPipelineAndSource() {
        var ex = new SpecParseException("bad yaml", "nightly", "/etc/pipeline.yaml");

        assertThat(ex).isInstanceOf(PipelineLoadException.class);
        assertThat(ex.pipelineName()).isEqualTo("nightly");
        assertThat(ex.source()).isEqualTo("/etc/pipeline.yaml");
        assertThat(ex.detail()).isEqualTo("bad yaml");
        assertThat(ex.phase()).isEqualTo(StageflowException.Phase.LOAD);
    }

    @Test
    void specParseExceptionKeepsCause() {
        var cause = new IllegalStateException("scanner");
        var ex = new SpecParseException("bad yaml", cause, null, "inline");

        assertThat(ex.getCause()).isSameAs(cause);
        assertThat(ex.pipelineName()).isNull();
    }

    // --- Build phase ---

    @Test
    void unitNotFoundIsBuildPhase() {
        var ex = new UnitNotFoundException("missing", "scan", "file-scan");

        assertThat(ex).isInstanceOf(UnitResolveException.class);
        assertThat(ex.phase()).isEqualTo(StageflowException.Phase.BUILD);
        assertThat(ex.stageName()).isEqualTo("scan");
        assertThat(ex.unitName()).isEqualTo("file-scan");
    }

    @Test
    void unitTypeMismatchNamesBothTypes() {
        var ex = new UnitTypeMismatchException("wrong kind", "digest", "identity", "Processor", "x.Identity");

        assertThat(ex.expectedType()).isEqualTo("Processor");
        assertThat(ex.actualType()).isEqualTo("x.Identity");
        assertThat(ex.phase()).isEqualTo(StageflowException.Phase.BUILD);
    }

    @Test
    void unitInstantiationKeepsCause() {
        var cause = new IllegalArgumentException("bad config");
        var ex = new UnitInstantiationException("ctor failed", cause, "digest", "file-digest");

        assertThat(ex.getCause()).isSameAs(cause);
        assertThat(ex).isInstanceOf(UnitResolveException.class);
    }

    // --- Execution and checkpoint phases ---

    @Test
    void stageExecutionExceptionIsExecutionPhaseAndExtensible() {
        var ex = new StageExecutionException("boom");

        assertThat(ex.phase()).isEqualTo(StageflowException.Phase.EXECUTION);
        assertThat(StageExecutionException.class).isNotFinal();
    }

    @Test
    void checkpointExceptionCarriesId() {
        var ex = new CheckpointException("disk full", "run-1", "nightly");

        assertThat(ex.phase()).isEqualTo(StageflowException.Phase.CHECKPOINT);
        assertThat(ex.checkpointId()).isEqualTo("run-1");
        assertThat(ex.pipelineName()).isEqualTo("nightly");
    }
}
