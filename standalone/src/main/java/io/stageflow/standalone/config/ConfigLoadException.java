package io.stageflow.standalone.config;

/**
 * Thrown when the runner's options cannot be resolved: an unknown or incomplete command-line
 * flag, or an environment variable holding an unusable value. The message is printed as-is,
 * followed by the usage text.
 */
public class ConfigLoadException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    public ConfigLoadException(String message) {
        super(message);
    }

    public ConfigLoadException(String message, Throwable cause) {
        super(message, cause);
    }
}
