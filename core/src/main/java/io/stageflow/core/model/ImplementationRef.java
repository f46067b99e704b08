package io.stageflow.core.model;

import java.nio.file.Path;
import java.util.Objects;

/**
 * Points at the concrete unit implementation a spec wants instantiated: a registry name, plus an
 * optional location (directory or jar) that is scanned for providers when the name is not yet
 * registered.
 *
 * @param name     registry name of the implementation, e.g. {@code "file-digest"}
 * @param location discovery location, or {@code null} when the name must already be registered
 */
public record ImplementationRef(String name, Path location) {

    public ImplementationRef {
        Objects.requireNonNull(name, "name must not be null");
        if (name.isBlank()) {
            throw new IllegalArgumentException("implementation name must not be blank");
        }
    }

    /** Creates a reference to an explicitly registered implementation. */
    public static ImplementationRef named(String name) {
        return new ImplementationRef(name, null);
    }

    public boolean hasLocation() {
        return location != null;
    }

    @Override
    public String toString() {
        return location != null ? name + " @ " + location : name;
    }
}
