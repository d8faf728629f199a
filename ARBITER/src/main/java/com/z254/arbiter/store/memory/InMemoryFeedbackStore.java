package com.z254.arbiter.store.memory;

import com.github.benmanes.caffeine.cache.Cache;
import com.z254.arbiter.domain.model.FeedbackRecord;
import com.z254.arbiter.store.FeedbackStore;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.time.Duration;

/**
 * Process-local {@link FeedbackStore}; the latest submission per request id wins.
 */
public class InMemoryFeedbackStore implements FeedbackStore {

    private final Cache<String, FeedbackRecord> store;

    public InMemoryFeedbackStore(Clock clock, Duration ttl, long maximumSize) {
        this.store = MemoryCaches.expiring(clock, ttl, maximumSize);
    }

    @Override
    public Mono<Void> save(FeedbackRecord record) {
        return Mono.fromRunnable(() -> store.put(record.getRequestId(), record));
    }

    @Override
    public Mono<FeedbackRecord> find(String requestId) {
        return Mono.fromSupplier(() -> store.getIfPresent(requestId));
    }

    public long size() {
        store.cleanUp();
        return store.estimatedSize();
    }
}
