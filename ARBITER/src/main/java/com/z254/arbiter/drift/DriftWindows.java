package com.z254.arbiter.drift;

/**
 * Reference and current feature matrices, one row per logged prediction.
 */
public record DriftWindows(double[][] reference, double[][] current) {

    public int referenceSize() {
        return reference.length;
    }

    public int currentSize() {
        return current.length;
    }
}
