package io.stageflow.core.model;

import java.util.Map;

/**
 * Common view of {@link ProcessorSpec} and {@link PostProcessorSpec}: what a unit factory receives
 * when it builds a unit.
 */
public interface UnitSpec {

    String name();

    String description();

    ImplementationRef impl();

    /** The open option map. Keys the unit does not understand are passed through untouched. */
    Map<String, Object> config();
}
