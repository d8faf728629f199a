package com.z254.arbiter.store;

import com.z254.arbiter.domain.model.PredictionRecord;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.Instant;

/**
 * Append-only, TTL-bounded log of issued decisions keyed by request id.
 */
public interface PredictionLog {

    Mono<Void> append(PredictionRecord record);

    /**
     * Logged decision for a request id; empty when unknown or expired.
     */
    Mono<PredictionRecord> find(String requestId);

    /**
     * Unexpired entries whose timestamp falls in {@code [from, to)}.
     */
    Flux<PredictionRecord> findBetween(Instant from, Instant to);
}
