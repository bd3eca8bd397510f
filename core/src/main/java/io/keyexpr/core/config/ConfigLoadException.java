package io.keyexpr.core.config;

/**
 * Thrown when key generator configuration can not be loaded: missing file, invalid YAML, a missing
 * expression or a delimiter that is not a single character.
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
