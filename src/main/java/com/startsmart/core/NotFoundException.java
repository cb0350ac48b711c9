package com.startsmart.core;

/**
 * Unknown region, grid or category requested by the caller.
 */
public class NotFoundException extends StartSmartException {
    public NotFoundException(String message) {
        super(message);
    }

    public NotFoundException(String message, Throwable cause) {
        super(message, cause);
    }
}
