package com.z254.arbiter.registry;

import com.z254.arbiter.domain.model.ABTest;
import com.z254.arbiter.domain.model.ModelType;
import com.z254.arbiter.domain.model.ModelVersion;

import java.util.Map;

/**
 * Immutable registry state. A new snapshot replaces the old one on every
 * write, so a reader holding one always sees a consistent set of active
 * pointers.
 */
record RegistrySnapshot(Map<String, ModelVersion> versions,
                        Map<ModelType, String> active,
                        Map<String, ABTest> abTests) {

    static RegistrySnapshot empty() {
        return new RegistrySnapshot(Map.of(), Map.of(), Map.of());
    }

    RegistrySnapshot withVersions(Map<String, ModelVersion> newVersions, Map<ModelType, String> newActive) {
        return new RegistrySnapshot(Map.copyOf(newVersions), Map.copyOf(newActive), abTests);
    }

    RegistrySnapshot withAbTests(Map<String, ABTest> newTests) {
        return new RegistrySnapshot(versions, active, Map.copyOf(newTests));
    }
}
