package com.z254.arbiter.domain.exception;

/**
 * Raised when training, evaluating or persisting a model fails.
 */
public class ModelTrainingException extends RuntimeException {

    public ModelTrainingException(String message, Throwable cause) {
        super(message, cause);
    }
}
