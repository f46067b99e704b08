package io.stageflow.core.error;

/** Thrown when a registered factory fails while constructing a unit from its spec. */
public final class UnitInstantiationException extends UnitResolveException {

    private static final long serialVersionUID = 1L;

    public UnitInstantiationException(String message, Throwable cause, String stageName, String unitName) {
        super(message, cause, stageName, unitName);
    }
}
