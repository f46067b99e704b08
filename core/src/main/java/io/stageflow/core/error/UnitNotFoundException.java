package io.stageflow.core.error;

/** Thrown when no factory is registered (or discoverable) under an implementation name. */
public final class UnitNotFoundException extends UnitResolveException {

    private static final long serialVersionUID = 1L;

    public UnitNotFoundException(String message, String stageName, String unitName) {
        super(message, stageName, unitName);
    }
}
