package io.stageflow.core.error;

/**
 * Thrown when a resolved unit does not provide the requested capability, e.g. a post-processor
 * implementation referenced from a {@code processor} block.
 */
public final class UnitTypeMismatchException extends UnitResolveException {

    private static final long serialVersionUID = 1L;

    private final String expectedType;
    private final String actualType;

    public UnitTypeMismatchException(
            String message, String stageName, String unitName, String expectedType, String actualType) {
        super(message, stageName, unitName);
        this.expectedType = expectedType;
        this.actualType = actualType;
    }

    /** Simple name of the required capability interface. */
    public String expectedType() {
        return expectedType;
    }

    /** Class name of the instance the factory produced. */
    public String actualType() {
        return actualType;
    }
}
