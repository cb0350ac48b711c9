package com.startsmart.core;

/**
 * Root of the engine's unchecked failures.
 */
public class StartSmartException extends RuntimeException {
    public StartSmartException(String message) {
        super(message);
    }

    public StartSmartException(String message, Throwable cause) {
        super(message, cause);
    }
}
