package io.stageflow.units.files;

import java.nio.file.Path;
import java.util.Objects;

/**
 * Digest of one file.
 *
 * @param path      the digested file
 * @param algorithm {@link java.security.MessageDigest} algorithm name, e.g. {@code SHA-256}
 * @param digest    lowercase hex digest
 * @param size      file size in bytes
 */
public record FileDigest(Path path, String algorithm, String digest, long size) {

    public FileDigest {
        Objects.requireNonNull(path, "path must not be null");
        Objects.requireNonNull(algorithm, "algorithm must not be null");
        Objects.requireNonNull(digest, "digest must not be null");
    }
}
