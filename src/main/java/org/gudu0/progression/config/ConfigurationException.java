package org.gudu0.progression.config;

/**
 * Malformed static configuration (catalog or engine config). Fatal at startup.
 */
public class ConfigurationException extends RuntimeException {
    public ConfigurationException(String message) {
        super(message);
    }

    public ConfigurationException(String message, Throwable cause) {
        super(message, cause);
    }
}
