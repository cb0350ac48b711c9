package com.startsmart.core;

/**
 * The loaded grid partition overlaps or leaves gaps.
 */
public class DataIntegrityException extends StartSmartException {
    public DataIntegrityException(String message) {
        super(message);
    }

    public DataIntegrityException(String message, Throwable cause) {
        super(message, cause);
    }
}
