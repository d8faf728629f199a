package com.z254.arbiter.store;

import com.z254.arbiter.domain.model.DriftDetectionResult;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

public interface DriftHistoryStore {

    Mono<Void> append(DriftDetectionResult result);

    /**
     * Most recent results first. A null {@code modelVersion} returns results
     * for every version.
     */
    Flux<DriftDetectionResult> history(String modelVersion, int limit);
}
