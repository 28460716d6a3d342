package io.cwrelay.core;

/**
 * The rule file or run settings are missing or invalid. Raised before any window is computed.
 */
public class ConfigurationException extends RuntimeException {

    public ConfigurationException(String message) {
        super(message);
    }

    public ConfigurationException(String message, Throwable cause) {
        super(message, cause);
    }
}
