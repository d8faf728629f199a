package com.z254.arbiter.store;

import com.z254.arbiter.observability.ArbiterMetrics;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.util.function.Supplier;

/**
 * Runs store writes off the response path. A failed write is logged and
 * counted under {@code arbiter.store.write.failures{store}}, never rethrown.
 */
@Slf4j
@Component
public class BestEffortWriter {

    public static final String PREDICTIONS = "predictions";
    public static final String FEEDBACK = "feedback";
    public static final String CORRECTIONS = "corrections";
    public static final String DRIFT_HISTORY = "drift_history";
    public static final String DRIFT_ALERTS = "drift_alerts";

    private final ArbiterMetrics metrics;

    public BestEffortWriter(ArbiterMetrics metrics) {
        this.metrics = metrics;
    }

    /**
     * Fire and forget.
     */
    public void submit(String store, String key, Supplier<Mono<Void>> write) {
        attempt(store, key, write)
                .subscribeOn(Schedulers.boundedElastic())
                .subscribe();
    }

    /**
     * Run the write and report whether it succeeded.
     */
    public Mono<Boolean> attempt(String store, String key, Supplier<Mono<Void>> write) {
        return Mono.defer(write)
                .thenReturn(true)
                .onErrorResume(error -> {
                    metrics.recordStoreWriteFailure(store);
                    log.warn("Write to {} failed for {}: {}", store, key, error.getMessage());
                    return Mono.just(false);
                });
    }
}
