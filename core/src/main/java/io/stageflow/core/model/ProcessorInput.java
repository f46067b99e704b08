package io.stageflow.core.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Envelope handed to a processor: an opaque payload plus a metadata map. The engine never
 * inspects the payload.
 *
 * @param data     the payload, may be {@code null}
 * @param metadata metadata carried alongside the payload; never null
 */
public record ProcessorInput(Object data, Map<String, Object> metadata) {

    public ProcessorInput {
        metadata = metadata != null ? Collections.unmodifiableMap(new LinkedHashMap<>(metadata)) : Map.of();
    }

    /** Input with no payload and no metadata; the default start of every transformer. */
    public static ProcessorInput empty() {
        return new ProcessorInput(null, Map.of());
    }

    public static ProcessorInput of(Object data) {
        return new ProcessorInput(data, Map.of());
    }
}
