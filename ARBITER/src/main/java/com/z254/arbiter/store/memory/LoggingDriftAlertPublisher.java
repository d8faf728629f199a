package com.z254.arbiter.store.memory;

import com.z254.arbiter.domain.model.DriftDetectionResult;
import com.z254.arbiter.store.DriftAlertPublisher;
import lombok.extern.slf4j.Slf4j;
import reactor.core.publisher.Mono;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Keeps published alerts in memory and logs them; used when no broker is configured.
 */
@Slf4j
public class LoggingDriftAlertPublisher implements DriftAlertPublisher {

    private final List<DriftDetectionResult> published = new CopyOnWriteArrayList<>();

    @Override
    public Mono<Void> publish(DriftDetectionResult result) {
        return Mono.fromRunnable(() -> {
            published.add(result);
            log.warn("Drift alert for {}: score={} threshold={} features={}",
                    result.getModelVersion(), result.getDriftScore(), result.getThreshold(),
                    result.getAffectedFeatures());
        });
    }

    public List<DriftDetectionResult> published() {
        return List.copyOf(published);
    }
}
