package io.stageflow.core.spi;

import io.stageflow.core.model.UnitSpec;

/**
 * Builds a unit from its spec. Registered under a name in
 * {@link io.stageflow.core.engine.UnitRegistry}; typically a constructor reference such as
 * {@code MyProcessor::new}.
 */
@FunctionalInterface
public interface UnitFactory {

    StageUnit create(UnitSpec spec);
}
