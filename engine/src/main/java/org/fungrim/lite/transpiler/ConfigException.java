package org.fungrim.lite.transpiler;

/**
 * Thrown when a settings location exists but cannot be read or parsed.
 */
public class ConfigException extends RuntimeException {

    public ConfigException(String message, Throwable cause) {
        super(message, cause);
    }
}
