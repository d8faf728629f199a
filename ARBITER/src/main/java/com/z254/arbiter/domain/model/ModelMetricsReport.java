package com.z254.arbiter.domain.model;

import lombok.Builder;
import lombok.Value;

/**
 * Offline evaluation scores and live counts for one model version.
 */
@Value
@Builder
public class ModelMetricsReport {

    String versionId;

    ModelType modelType;

    ModelStatus status;

    double accuracy;

    double precision;

    double recall;

    double f1Score;

    long trainingSamples;

    long predictions;

    long feedback;

    /** Share of CORRECT among judged feedback; null before any */
    Double feedbackAccuracy;
}
