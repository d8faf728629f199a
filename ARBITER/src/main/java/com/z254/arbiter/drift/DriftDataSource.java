package com.z254.arbiter.drift;

import reactor.core.publisher.Mono;

import java.time.Instant;

/**
 * Supplies the feature windows a drift check compares.
 */
public interface DriftDataSource {

    /**
     * Windows ending at {@code now}; empty when no data can be provided.
     */
    Mono<DriftWindows> windows(String modelVersion, Instant now);
}
