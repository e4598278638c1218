package com.tracker.sync.api;

/**
 * Configuration problem that makes the whole pass pointless, such as a target project that
 * does not exist or a malformed field mapping.
 */
public class ConfigurationException extends RuntimeException {

    public ConfigurationException(String message) {
        super(message);
    }

    public ConfigurationException(String message, Throwable cause) {
        super(message, cause);
    }
}
