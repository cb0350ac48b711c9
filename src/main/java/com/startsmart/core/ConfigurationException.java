package com.startsmart.core;

/**
 * Invalid engine configuration. Fatal at startup, never retried.
 */
public class ConfigurationException extends StartSmartException {
    public ConfigurationException(String message) {
        super(message);
    }

    public ConfigurationException(String message, Throwable cause) {
        super(message, cause);
    }
}
