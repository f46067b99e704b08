package io.stageflow.core.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/** Specification of a stage's optional post-processor. Same shape as {@link ProcessorSpec}. */
public record PostProcessorSpec(
        String name, String description, ImplementationRef impl, Map<String, Object> config) implements UnitSpec {

    public PostProcessorSpec {
        Objects.requireNonNull(name, "name must not be null");
        Objects.requireNonNull(impl, "impl must not be null");
        config = config != null ? Collections.unmodifiableMap(new LinkedHashMap<>(config)) : Map.of();
    }

    public static PostProcessorSpec of(String name, String implName) {
        return new PostProcessorSpec(name, null, ImplementationRef.named(implName), Map.of());
    }

    public static PostProcessorSpec of(String name, String implName, Map<String, Object> config) {
        return new PostProcessorSpec(name, null, ImplementationRef.named(implName), config);
    }

    public PostProcessorSpec withConfigValue(String key, Object value) {
        Map<String, Object> updated = new LinkedHashMap<>(config);
        updated.put(key, value);
        return new PostProcessorSpec(name, description, impl, updated);
    }
}
