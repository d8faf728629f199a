package com.z254.arbiter.config;

import com.z254.arbiter.drift.DisabledDriftDataSource;
import com.z254.arbiter.drift.DriftDataSource;
import com.z254.arbiter.drift.DriftScoreCalculator;
import com.z254.arbiter.drift.KolmogorovSmirnovDriftCalculator;
import com.z254.arbiter.drift.PredictionLogDriftDataSource;
import com.z254.arbiter.model.FileSystemModelArtifactStore;
import com.z254.arbiter.model.ModelArtifactStore;
import com.z254.arbiter.model.ModelTrainer;
import com.z254.arbiter.model.SyntheticDataGenerator;
import com.z254.arbiter.store.PredictionLog;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.nio.file.Path;
import java.time.Clock;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Core engine wiring: clock, inference pool, training and drift components.
 */
@Slf4j
@Configuration
public class EngineConfig {

    private static final int INFERENCE_QUEUE_PER_THREAD = 64;

    private final ArbiterProperties properties;

    public EngineConfig(ArbiterProperties properties) {
        this.properties = properties;
    }

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    // ==================== Inference ====================

    /**
     * Bounded pool for model invocations. A full queue rejects, which the
     * prediction path turns into a fallback decision.
     */
    @Bean(name = "inferenceExecutor", destroyMethod = "shutdown")
    public ExecutorService inferenceExecutor() {
        int threads = properties.getPrediction().getInferenceThreads();
        AtomicInteger counter = new AtomicInteger();
        ThreadFactory factory = runnable -> {
            Thread thread = new Thread(runnable, "arbiter-inference-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        };
        return new ThreadPoolExecutor(threads, threads, 60L, TimeUnit.SECONDS,
                new ArrayBlockingQueue<>(threads * INFERENCE_QUEUE_PER_THREAD), factory,
                new ThreadPoolExecutor.AbortPolicy());
    }

    // ==================== Training ====================

    @Bean
    public ModelTrainer modelTrainer(Clock clock) {
        return new ModelTrainer(clock);
    }

    @Bean
    public SyntheticDataGenerator syntheticDataGenerator() {
        return new SyntheticDataGenerator();
    }

    @Bean
    public ModelArtifactStore modelArtifactStore() {
        Path directory = Path.of(properties.getModels().getArtifactDir());
        log.info("Model artifacts directory: {}", directory.toAbsolutePath());
        return new FileSystemModelArtifactStore(directory);
    }

    // ==================== Drift ====================

    @Bean
    public DriftDataSource driftDataSource(PredictionLog predictionLog) {
        ArbiterProperties.Drift drift = properties.getDrift();
        if (drift.getMode() == ArbiterProperties.DriftMode.PREDICTION_LOG) {
            log.info("Drift windows read from the prediction log (current={}, reference={})",
                    drift.getCurrentWindow(), drift.getReferenceWindow());
            return new PredictionLogDriftDataSource(predictionLog, drift.getCurrentWindow(), drift.getReferenceWindow());
        }
        log.info("Drift data source disabled; drift checks report no data");
        return new DisabledDriftDataSource();
    }

    @Bean
    public DriftScoreCalculator driftScoreCalculator() {
        return new KolmogorovSmirnovDriftCalculator();
    }
}
