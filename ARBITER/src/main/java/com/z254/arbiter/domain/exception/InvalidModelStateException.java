package com.z254.arbiter.domain.exception;

/**
 * Raised when a lifecycle transition is not allowed for a model version.
 */
public class InvalidModelStateException extends RuntimeException {

    public InvalidModelStateException(String message) {
        super(message);
    }
}
