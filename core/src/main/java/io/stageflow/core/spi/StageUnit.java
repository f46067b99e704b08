package io.stageflow.core.spi;

/**
 * Marker for anything a {@link UnitFactory} may produce. The registry checks the concrete
 * capability ({@link Processor} or {@link PostProcessor}) when it resolves a reference.
 */
public interface StageUnit {}
