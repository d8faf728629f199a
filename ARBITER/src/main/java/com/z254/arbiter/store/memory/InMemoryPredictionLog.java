package com.z254.arbiter.store.memory;

import com.github.benmanes.caffeine.cache.Cache;
import com.z254.arbiter.domain.model.PredictionRecord;
import com.z254.arbiter.store.PredictionLog;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Comparator;

/**
 * Process-local {@link PredictionLog}. Entries expire {@code ttl} after they
 * were appended, measured on the injected clock.
 */
public class InMemoryPredictionLog implements PredictionLog {

    private final Cache<String, PredictionRecord> store;

    public InMemoryPredictionLog(Clock clock, Duration ttl, long maximumSize) {
        this.store = MemoryCaches.expiring(clock, ttl, maximumSize);
    }

    @Override
    public Mono<Void> append(PredictionRecord record) {
        return Mono.fromRunnable(() -> store.asMap().putIfAbsent(record.getRequestId(), record));
    }

    @Override
    public Mono<PredictionRecord> find(String requestId) {
        return Mono.fromSupplier(() -> store.getIfPresent(requestId));
    }

    @Override
    public Flux<PredictionRecord> findBetween(Instant from, Instant to) {
        return Flux.defer(() -> Flux.fromStream(store.asMap().values().stream()
                .filter(r -> r.getTimestamp() != null)
                .filter(r -> !r.getTimestamp().isBefore(from) && r.getTimestamp().isBefore(to))
                .sorted(Comparator.comparing(PredictionRecord::getTimestamp))));
    }

    /**
     * Number of live entries.
     */
    public long size() {
        store.cleanUp();
        return store.estimatedSize();
    }
}
