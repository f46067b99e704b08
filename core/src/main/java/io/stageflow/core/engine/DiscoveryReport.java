package io.stageflow.core.engine;

import java.nio.file.Path;
import java.util.List;
import java.util.Objects;

/**
 * Outcome of one {@link UnitRegistry#discover(Path)} pass.
 *
 * @param location   the scanned directory or jar
 * @param registered provider ids registered by this pass, in discovery order
 * @param skipped    one human-readable line per candidate that failed to load
 */
public record DiscoveryReport(Path location, List<String> registered, List<String> skipped) {

    public DiscoveryReport {
        Objects.requireNonNull(location, "location must not be null");
        registered = List.copyOf(registered);
        skipped = List.copyOf(skipped);
    }

    public boolean hasSkipped() {
        return !skipped.isEmpty();
    }
}
