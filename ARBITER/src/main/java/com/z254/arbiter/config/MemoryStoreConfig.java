package com.z254.arbiter.config;

import com.z254.arbiter.store.CorrectionStore;
import com.z254.arbiter.store.DriftAlertPublisher;
import com.z254.arbiter.store.DriftHistoryStore;
import com.z254.arbiter.store.FeedbackStore;
import com.z254.arbiter.store.PredictionLog;
import com.z254.arbiter.store.memory.InMemoryCorrectionStore;
import com.z254.arbiter.store.memory.InMemoryDriftHistoryStore;
import com.z254.arbiter.store.memory.InMemoryFeedbackStore;
import com.z254.arbiter.store.memory.InMemoryPredictionLog;
import com.z254.arbiter.store.memory.LoggingDriftAlertPublisher;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

/**
 * Process-local stores, selected with {@code arbiter.store.type=memory}.
 */
@Configuration
@ConditionalOnProperty(name = "arbiter.store.type", havingValue = "memory")
public class MemoryStoreConfig {

    @Bean
    public PredictionLog predictionLog(ArbiterProperties properties, Clock clock) {
        return new InMemoryPredictionLog(clock, properties.getStore().getPredictionTtl(),
                properties.getStore().getMemoryMaxEntries());
    }

    @Bean
    public FeedbackStore feedbackStore(ArbiterProperties properties, Clock clock) {
        return new InMemoryFeedbackStore(clock, properties.getStore().getFeedbackTtl(),
                properties.getStore().getMemoryMaxEntries());
    }

    @Bean
    public CorrectionStore correctionStore() {
        return new InMemoryCorrectionStore();
    }

    @Bean
    public DriftHistoryStore driftHistoryStore(ArbiterProperties properties) {
        return new InMemoryDriftHistoryStore(properties.getStore().getDriftHistoryLimit());
    }

    @Bean
    public DriftAlertPublisher driftAlertPublisher() {
        return new LoggingDriftAlertPublisher();
    }
}
