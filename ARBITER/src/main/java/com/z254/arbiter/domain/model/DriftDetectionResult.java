package com.z254.arbiter.domain.model;

import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * Outcome of a drift check that had enough data to run. The absence of a
 * result means "no data", which is distinct from {@code driftDetected=false}.
 */
@Value
@Builder
@Jacksonized
public class DriftDetectionResult {

    String checkId;

    String modelVersion;

    boolean driftDetected;

    double driftScore;

    double threshold;

    @Builder.Default
    List<String> affectedFeatures = List.of();

    Instant timestamp;

    @Builder.Default
    Map<String, Object> details = Map.of();
}
