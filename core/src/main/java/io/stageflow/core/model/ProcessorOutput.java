package io.stageflow.core.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Envelope returned by a processor or post-processor. Within a transformer the output of stage N
 * becomes the input of stage N+1 via {@link #toInput()}.
 */
public record ProcessorOutput(Object data, Map<String, Object> metadata) {

    public ProcessorOutput {
        metadata = metadata != null ? Collections.unmodifiableMap(new LinkedHashMap<>(metadata)) : Map.of();
    }

    public static ProcessorOutput of(Object data) {
        return new ProcessorOutput(data, Map.of());
    }

    public static ProcessorOutput of(Object data, Map<String, Object> metadata) {
        return new ProcessorOutput(data, metadata);
    }

    /** Wraps an input unchanged, for units that only act on the context. */
    public static ProcessorOutput passThrough(ProcessorInput input) {
        return new ProcessorOutput(input.data(), input.metadata());
    }

    /** Returns a copy whose metadata additionally contains {@code key = value}. */
    public ProcessorOutput withMetadata(String key, Object value) {
        Map<String, Object> updated = new LinkedHashMap<>(metadata);
        updated.put(key, value);
        return new ProcessorOutput(data, updated);
    }

    public ProcessorInput toInput() {
        return new ProcessorInput(data, metadata);
    }
}
