package com.z254.arbiter.drift;

import com.z254.arbiter.domain.model.FeatureVector;
import com.z254.arbiter.domain.model.PredictionRecord;
import com.z254.arbiter.store.PredictionLog;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Objects;

/**
 * Reads both windows back from the prediction log: current is
 * {@code [now - currentWindow, now)}, reference is the span before it back to
 * {@code now - referenceWindow}. Only entries served by the checked version
 * are used when a version is given.
 */
public class PredictionLogDriftDataSource implements DriftDataSource {

    private final PredictionLog predictionLog;
    private final Duration currentWindow;
    private final Duration referenceWindow;

    public PredictionLogDriftDataSource(PredictionLog predictionLog, Duration currentWindow, Duration referenceWindow) {
        if (referenceWindow.compareTo(currentWindow) <= 0) {
            throw new IllegalArgumentException("Reference window must be longer than the current window");
        }
        this.predictionLog = predictionLog;
        this.currentWindow = currentWindow;
        this.referenceWindow = referenceWindow;
    }

    @Override
    public Mono<DriftWindows> windows(String modelVersion, Instant now) {
        Instant currentStart = now.minus(currentWindow);
        Instant referenceStart = now.minus(referenceWindow);
        Mono<double[][]> reference = rows(modelVersion, referenceStart, currentStart);
        Mono<double[][]> current = rows(modelVersion, currentStart, now.plusMillis(1));
        return Mono.zip(reference, current)
                .map(pair -> new DriftWindows(pair.getT1(), pair.getT2()));
    }

    private Mono<double[][]> rows(String modelVersion, Instant from, Instant to) {
        return predictionLog.findBetween(from, to)
                .filter(r -> modelVersion == null || Objects.equals(modelVersion, r.getModelVersion()))
                .map(PredictionRecord::getFeatures)
                .filter(Objects::nonNull)
                .map(FeatureVector::toArray)
                .collectList()
                .map(PredictionLogDriftDataSource::toMatrix);
    }

    private static double[][] toMatrix(List<double[]> rows) {
        return rows.toArray(new double[0][]);
    }
}
