package com.startsmart.core;

/**
 * The contextual evaluator failed, timed out, or returned an unusable answer.
 */
public class ContextualEvaluatorException extends StartSmartException {
    public ContextualEvaluatorException(String message) {
        super(message);
    }

    public ContextualEvaluatorException(String message, Throwable cause) {
        super(message, cause);
    }
}
