package io.stageflow.core.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Specification of a stage's mandatory processor. Immutable; {@link #withConfigValue} returns a
 * copy so that orchestration-level overrides can be applied before the graph is built.
 */
public record ProcessorSpec(String name, String description, ImplementationRef impl, Map<String, Object> config)
        implements UnitSpec {

    public ProcessorSpec {
        Objects.requireNonNull(name, "name must not be null");
        Objects.requireNonNull(impl, "impl must not be null");
        // LinkedHashMap keeps declaration order and tolerates null values from YAML
        config = config != null ? Collections.unmodifiableMap(new LinkedHashMap<>(config)) : Map.of();
    }

    public static ProcessorSpec of(String name, String implName) {
        return new ProcessorSpec(name, null, ImplementationRef.named(implName), Map.of());
    }

    public static ProcessorSpec of(String name, String implName, Map<String, Object> config) {
        return new ProcessorSpec(name, null, ImplementationRef.named(implName), config);
    }

    /** Returns a copy with {@code key} set to {@code value} in the config map. */
    public ProcessorSpec withConfigValue(String key, Object value) {
        Map<String, Object> updated = new LinkedHashMap<>(config);
        updated.put(key, value);
        return new ProcessorSpec(name, description, impl, updated);
    }
}
