package com.z254.arbiter.domain.exception;

/**
 * Raised by a model handle when it cannot produce a class distribution.
 */
public class ModelInferenceException extends RuntimeException {

    public ModelInferenceException(String message) {
        super(message);
    }

    public ModelInferenceException(String message, Throwable cause) {
        super(message, cause);
    }
}
