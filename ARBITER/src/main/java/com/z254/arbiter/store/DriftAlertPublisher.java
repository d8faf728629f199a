package com.z254.arbiter.store;

import com.z254.arbiter.domain.model.DriftDetectionResult;
import reactor.core.publisher.Mono;

public interface DriftAlertPublisher {

    Mono<Void> publish(DriftDetectionResult result);
}
