package io.stageflow.core.spi;

import io.stageflow.core.model.UnitSpec;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Typed read access to a unit's open config map. Absent keys fall back to the supplied default;
 * present keys with an unusable value raise {@link IllegalArgumentException} naming the unit and
 * key, so that a bad option fails the graph build instead of silently using a default.
 */
public final class UnitConfig {

    private final String unitName;
    private final Map<String, Object> values;

    public UnitConfig(String unitName, Map<String, Object> values) {
        this.unitName = Objects.requireNonNull(unitName, "unitName must not be null");
        this.values = values != null ? values : Map.of();
    }

    public static UnitConfig of(UnitSpec spec) {
        return new UnitConfig(spec.name(), spec.config());
    }

    public boolean has(String key) {
        return values.get(key) != null;
    }

    public Map<String, Object> asMap() {
        return values;
    }

    public String getString(String key, String defaultValue) {
        Object value = values.get(key);
        return value != null ? value.toString() : defaultValue;
    }

    public String requireString(String key) {
        Object value = values.get(key);
        if (value == null || value.toString().isBlank()) {
            throw new IllegalArgumentException("Unit '" + unitName + "' requires config key '" + key + "'");
        }
        return value.toString();
    }

    public int getInt(String key, int defaultValue) {
        Object value = values.get(key);
        if (value == null) {
            return defaultValue;
        }
        if (value instanceof Number number) {
            double asDouble = number.doubleValue();
            if (asDouble != Math.rint(asDouble) || asDouble < Integer.MIN_VALUE || asDouble > Integer.MAX_VALUE) {
                throw invalid(key, value, "an integer in the int range");
            }
            return number.intValue();
        }
        try {
            return Integer.parseInt(value.toString().trim());
        } catch (NumberFormatException e) {
            throw invalid(key, value, "an integer");
        }
    }

    public boolean getBoolean(String key, boolean defaultValue) {
        return getOptionalBoolean(key).orElse(defaultValue);
    }

    /** Empty when the key is absent; lets callers distinguish "unset" from {@code false}. */
    public Optional<Boolean> getOptionalBoolean(String key) {
        Object value = values.get(key);
        if (value == null) {
            return Optional.empty();
        }
        if (value instanceof Boolean b) {
            return Optional.of(b);
        }
        String text = value.toString().trim();
        if ("true".equalsIgnoreCase(text)) {
            return Optional.of(Boolean.TRUE);
        }
        if ("false".equalsIgnoreCase(text)) {
            return Optional.of(Boolean.FALSE);
        }
        throw invalid(key, value, "a boolean");
    }

    public Path getPath(String key, Path defaultValue) {
        Object value = values.get(key);
        if (value == null) {
            return defaultValue;
        }
        return value instanceof Path p ? p : Path.of(value.toString());
    }

    /** Returns the list under {@code key} with every element rendered as a string. */
    public List<String> getList(String key, List<String> defaultValue) {
        Object value = values.get(key);
        if (value == null) {
            return defaultValue;
        }
        if (value instanceof List<?> list) {
            return list.stream().map(String::valueOf).toList();
        }
        throw invalid(key, value, "a list");
    }

    private IllegalArgumentException invalid(String key, Object value, String expected) {
        return new IllegalArgumentException(
                "Unit '" + unitName + "' config key '" + key + "' must be " + expected + ", got: " + value);
    }
}
