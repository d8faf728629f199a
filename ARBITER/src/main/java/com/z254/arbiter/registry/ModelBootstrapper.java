package com.z254.arbiter.registry;

import com.z254.arbiter.config.ArbiterProperties;
import com.z254.arbiter.domain.model.ModelStatus;
import com.z254.arbiter.domain.model.ModelType;
import com.z254.arbiter.domain.model.ModelVersion;
import com.z254.arbiter.model.HoeffdingTreeLearner;
import com.z254.arbiter.model.LabeledSample;
import com.z254.arbiter.model.ModelArtifactStore;
import com.z254.arbiter.model.ModelTrainer;
import com.z254.arbiter.model.SyntheticDataGenerator;
import com.z254.arbiter.observability.ArbiterStructuredLogger;
import com.z254.arbiter.observability.ArbiterStructuredLogger.ModelEventType;
import jakarta.annotation.PostConstruct;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.util.EnumSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Guarantees an ACTIVE version per supported model type before traffic is
 * served, and trains replacement random forest candidates on demand.
 * <p>
 * A failure for one type marks that type degraded and leaves the others
 * untouched.
 */
@Slf4j
@Component
public class ModelBootstrapper {

    private final ArbiterProperties.Models config;
    private final ModelRegistry registry;
    private final ModelArtifactStore artifactStore;
    private final ModelTrainer trainer;
    private final SyntheticDataGenerator generator;
    private final ArbiterStructuredLogger structuredLogger;
    private final Clock clock;

    private final Set<ModelType> degradedTypes = EnumSet.noneOf(ModelType.class);
    private final AtomicLong retrainGeneration = new AtomicLong();

    public ModelBootstrapper(ArbiterProperties properties,
                             ModelRegistry registry,
                             ModelArtifactStore artifactStore,
                             ModelTrainer trainer,
                             SyntheticDataGenerator generator,
                             ArbiterStructuredLogger structuredLogger,
                             Clock clock) {
        this.config = properties.getModels();
        this.registry = registry;
        this.artifactStore = artifactStore;
        this.trainer = trainer;
        this.generator = generator;
        this.structuredLogger = structuredLogger;
        this.clock = clock;
    }

    @PostConstruct
    public void provision() {
        if (config.getBaseline().isEnabled()) {
            provisionType(ModelType.RANDOM_FOREST, this::provisionBaseline);
        }
        if (config.getOnline().isEnabled()) {
            provisionType(ModelType.ONLINE_LEARNER, this::provisionOnlineLearner);
        }
        log.info("Model provisioning finished: active={}, degraded={}", registry.activeVersions(), degradedTypes());
    }

    public synchronized Set<ModelType> degradedTypes() {
        return degradedTypes.isEmpty() ? Set.of() : EnumSet.copyOf(degradedTypes);
    }

    /**
     * Train a new random forest from fresh synthetic data and register it as
     * CANDIDATE, ready for an A/B test against the active baseline.
     */
    public ModelVersion retrain() {
        ArbiterProperties.Models.Baseline baseline = config.getBaseline();
        long generation = retrainGeneration.incrementAndGet();
        String versionId = "rf-" + UUID.randomUUID().toString().substring(0, 8);
        int seed = (int) (baseline.getSeed() + generation);

        List<LabeledSample> samples = generator.generate(baseline.getSyntheticSamples(), seed);
        ModelTrainer.TrainingResult result = trainer.trainRandomForest(versionId, samples, settings(seed));
        persist(result);
        ModelVersion candidate = registry.register(
                result.version().toBuilder().status(ModelStatus.CANDIDATE).build(), result.model());
        structuredLogger.logModelEvent(versionId, ModelEventType.TRAINED, "Candidate model trained", Map.of(
                "accuracy", candidate.getAccuracy(),
                "f1", candidate.getF1Score(),
                "seed", seed));
        return candidate;
    }

    private void provisionType(ModelType type, Runnable action) {
        try {
            action.run();
            synchronized (this) {
                degradedTypes.remove(type);
            }
        } catch (RuntimeException e) {
            synchronized (this) {
                degradedTypes.add(type);
            }
            structuredLogger.logModelEvent(null, ModelEventType.PROVISIONING_FAILED,
                    "Failed to provision model type", Map.of(
                            "modelType", type.name(),
                            "error", String.valueOf(e.getMessage())));
            log.debug("Provisioning failure for {}", type, e);
        }
    }

    private void provisionBaseline() {
        ArbiterProperties.Models.Baseline baseline = config.getBaseline();
        String versionId = baseline.getVersionId();

        Optional<ModelArtifactStore.StoredModel> stored = artifactStore.load(versionId);
        if (stored.isPresent()) {
            ModelVersion version = stored.get().version().toBuilder()
                    .status(ModelStatus.TRAINING)
                    .deployedAt(null)
                    .retiredAt(null)
                    .build();
            registry.register(version, stored.get().model());
            registry.promote(versionId);
            structuredLogger.logModelEvent(versionId, ModelEventType.LOADED, "Baseline loaded from artifact store",
                    Map.of("trainingSamples", version.getTrainingSamples()));
            return;
        }

        int seed = (int) baseline.getSeed();
        List<LabeledSample> samples = generator.generate(baseline.getSyntheticSamples(), seed);
        ModelTrainer.TrainingResult result = trainer.trainRandomForest(versionId, samples, settings(seed));
        persist(result);
        registry.register(result.version(), result.model());
        registry.promote(versionId);
        structuredLogger.logModelEvent(versionId, ModelEventType.TRAINED, "Baseline trained from synthetic data",
                Map.of(
                        "trainingSamples", result.version().getTrainingSamples(),
                        "accuracy", result.version().getAccuracy()));
    }

    private void provisionOnlineLearner() {
        ArbiterProperties.Models.Online online = config.getOnline();
        int warmStart = Math.max(0, online.getWarmStartSamples());
        List<LabeledSample> samples = warmStart > 0 ? generator.generate(warmStart, online.getSeed()) : List.of();
        HoeffdingTreeLearner learner = HoeffdingTreeLearner.warmStarted(online.getVersionId(), samples);

        ModelVersion version = ModelVersion.builder()
                .versionId(online.getVersionId())
                .modelType(ModelType.ONLINE_LEARNER)
                .status(ModelStatus.TRAINING)
                .trainingSamples(samples.size())
                .createdAt(clock.instant())
                .metadata(Map.of(
                        "algorithm", "weka.classifiers.trees.HoeffdingTree",
                        "warmStartSamples", String.valueOf(samples.size())))
                .build();
        registry.register(version, learner);
        registry.promote(online.getVersionId());
    }

    private void persist(ModelTrainer.TrainingResult result) {
        try {
            artifactStore.save(result.version(), result.model());
        } catch (RuntimeException e) {
            log.warn("Model {} trained but not persisted: {}", result.version().getVersionId(), e.getMessage());
        }
    }

    private ModelTrainer.ForestSettings settings(int seed) {
        ArbiterProperties.Models.Baseline baseline = config.getBaseline();
        return new ModelTrainer.ForestSettings(
                baseline.getNumTrees(), baseline.getMaxDepth(), seed, baseline.getValidationFraction());
    }
}
