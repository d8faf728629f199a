package com.z254.arbiter.domain.exception;

/**
 * Raised when a model version or its artifact is not registered.
 */
public class ModelNotFoundException extends RuntimeException {

    private final String versionId;

    public ModelNotFoundException(String versionId) {
        super("Model version not found: " + versionId);
        this.versionId = versionId;
    }

    public String getVersionId() {
        return versionId;
    }
}
