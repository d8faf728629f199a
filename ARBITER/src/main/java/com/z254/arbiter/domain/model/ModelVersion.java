package com.z254.arbiter.domain.model;

import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.time.Instant;
import java.util.Map;

/**
 * Registry record for one trained model version. Immutable; status changes
 * produce a new instance through {@code toBuilder()}.
 */
@Value
@Builder(toBuilder = true)
@Jacksonized
public class ModelVersion {

    String versionId;

    ModelType modelType;

    @Builder.Default
    ModelStatus status = ModelStatus.TRAINING;

    double accuracy;

    double precision;

    double recall;

    double f1Score;

    long trainingSamples;

    long validationSamples;

    Instant createdAt;

    Instant deployedAt;

    Instant retiredAt;

    @Builder.Default
    Map<String, String> metadata = Map.of();

    public boolean isActive() {
        return status == ModelStatus.ACTIVE;
    }
}
