package com.startsmart.core;

/**
 * A business or social data source could not be reached.
 */
public class UpstreamUnavailableException extends StartSmartException {
    public UpstreamUnavailableException(String message) {
        super(message);
    }

    public UpstreamUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}
