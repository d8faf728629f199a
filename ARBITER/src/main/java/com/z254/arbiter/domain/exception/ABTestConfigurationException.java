package com.z254.arbiter.domain.exception;

/**
 * Raised when an A/B test references unknown or incompatible versions, or an
 * invalid traffic split.
 */
public class ABTestConfigurationException extends RuntimeException {

    public ABTestConfigurationException(String message) {
        super(message);
    }
}
