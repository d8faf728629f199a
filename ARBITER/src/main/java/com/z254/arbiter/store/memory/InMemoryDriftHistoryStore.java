package com.z254.arbiter.store.memory;

import com.z254.arbiter.domain.model.DriftDetectionResult;
import com.z254.arbiter.store.DriftHistoryStore;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;
import java.util.Objects;

/**
 * Process-local drift history capped at {@code capacity} results, newest first.
 */
public class InMemoryDriftHistoryStore implements DriftHistoryStore {

    private final Deque<DriftDetectionResult> results = new ArrayDeque<>();
    private final int capacity;

    public InMemoryDriftHistoryStore(int capacity) {
        this.capacity = Math.max(1, capacity);
    }

    @Override
    public Mono<Void> append(DriftDetectionResult result) {
        return Mono.fromRunnable(() -> {
            synchronized (results) {
                results.addFirst(result);
                while (results.size() > capacity) {
                    results.removeLast();
                }
            }
        });
    }

    @Override
    public Flux<DriftDetectionResult> history(String modelVersion, int limit) {
        return Flux.defer(() -> {
            List<DriftDetectionResult> copy;
            synchronized (results) {
                copy = List.copyOf(results);
            }
            return Flux.fromIterable(copy)
                    .filter(r -> modelVersion == null || Objects.equals(modelVersion, r.getModelVersion()))
                    .take(Math.max(0, limit));
        });
    }
}
