package com.z254.arbiter.domain.model;

import lombok.Builder;
import lombok.Value;

import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Point-in-time engine overview.
 */
@Value
@Builder
public class EngineStatus {

    Map<ModelType, String> activeVersions;

    List<ABTestReport> activeAbTests;

    Set<ModelType> degradedTypes;

    long totalPredictions;

    long fallbackPredictions;

    double meanLatencyMs;

    double onlineUpdates;

    String storeType;

    String driftMode;
}
