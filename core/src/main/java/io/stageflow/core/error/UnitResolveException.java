package io.stageflow.core.error;

/**
 * Abstract parent for graph-build errors. Thrown by {@code PipelineEngine.buildGraph()} when a
 * processor or post-processor reference cannot be turned into a live unit. The whole build is
 * aborted; {@link #stageName()} and {@link #unitName()} identify the failing unit.
 */
public abstract class UnitResolveException extends StageflowException {

    private static final long serialVersionUID = 1L;

    private final String stageName;
    private final String unitName;

    protected UnitResolveException(String message, String stageName, String unitName) {
        super(message, null, Phase.BUILD);
        this.stageName = stageName;
        this.unitName = unitName;
    }

    protected UnitResolveException(String message, Throwable cause, String stageName, String unitName) {
        super(message, cause, null, Phase.BUILD);
        this.stageName = stageName;
        this.unitName = unitName;
    }

    /** The stage whose unit failed to resolve, or {@code null} when resolved outside a stage. */
    public String stageName() {
        return stageName;
    }

    /** The implementation name that failed to resolve. */
    public String unitName() {
        return unitName;
    }
}
