package com.z254.arbiter.drift;

import reactor.core.publisher.Mono;

import java.time.Instant;

/**
 * Never provides data, so every drift check reports "no data".
 */
public class DisabledDriftDataSource implements DriftDataSource {

    @Override
    public Mono<DriftWindows> windows(String modelVersion, Instant now) {
        return Mono.empty();
    }
}
