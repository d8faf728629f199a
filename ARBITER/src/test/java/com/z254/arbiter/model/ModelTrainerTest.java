package com.z254.arbiter.model;

import com.z254.arbiter.config.ArbiterProperties;
import com.z254.arbiter.domain.exception.ModelTrainingException;
import com.z254.arbiter.domain.model.Decision;
import com.z254.arbiter.domain.model.FeatureVector;
import com.z254.arbiter.domain.model.GovernanceRequest;
import com.z254.arbiter.domain.model.ModelStatus;
import com.z254.arbiter.domain.model.ModelType;
import com.z254.arbiter.domain.model.ModelVersion;
import com.z254.arbiter.features.FeatureExtractor;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.Arrays;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

class ModelTrainerTest {

    private static final Instant NOW = Instant.parse("2024-03-01T00:00:00Z");
    private static final ModelTrainer.ForestSettings SETTINGS = new ModelTrainer.ForestSettings(10, 6, 42, 0.2);

    private static List<LabeledSample> samples;
    private static ModelTrainer.TrainingResult result;

    @BeforeAll
    static void train() {
        samples = new SyntheticDataGenerator().generate(300, 42L);
        result = new ModelTrainer(Clock.fixed(NOW, ZoneOffset.UTC)).trainRandomForest("rf-test", samples, SETTINGS);
    }

    @Test
    @DisplayName("should report holdout metrics as fractions")
    void metrics() {
        ModelVersion version = result.version();

        assertThat(version.getModelType()).isEqualTo(ModelType.RANDOM_FOREST);
        assertThat(version.getStatus()).isEqualTo(ModelStatus.TRAINING);
        assertThat(version.getAccuracy()).isBetween(0.0, 1.0);
        assertThat(version.getPrecision()).isBetween(0.0, 1.0);
        assertThat(version.getRecall()).isBetween(0.0, 1.0);
        assertThat(version.getF1Score()).isBetween(0.0, 1.0);
        assertThat(version.getTrainingSamples()).isEqualTo(300);
        assertThat(version.getValidationSamples()).isEqualTo(60);
        assertThat(version.getCreatedAt()).isEqualTo(NOW);
        assertThat(version.getMetadata()).containsEntry("numTrees", "10");
    }

    @Test
    @DisplayName("should learn a rule the generator applies")
    void learnsRules() {
        assertThat(result.version().getAccuracy()).isGreaterThan(0.5);
    }

    @Test
    @DisplayName("should produce a four-class distribution")
    void predicts() {
        double[] distribution = result.model().predictProba(samples.get(0).features());

        assertThat(distribution).hasSize(4);
        assertThat(Arrays.stream(distribution).sum()).isCloseTo(1.0, within(1e-6));
    }

    @Test
    @DisplayName("should deny neutral text carrying a high toxicity score in its context")
    void contextToxicity() {
        ModelTrainer.ForestSettings coldStart = new ModelTrainer.ForestSettings(100, 10, 42, 0.2);
        WekaClassifierModel model = new ModelTrainer(Clock.fixed(NOW, ZoneOffset.UTC))
                .trainRandomForest("rf-cold", new SyntheticDataGenerator().generate(1000, 42L), coldStart)
                .model();
        // Saturday 23:00 UTC
        Instant lateWeekend = Instant.parse("2024-03-02T23:00:00Z");
        FeatureExtractor extractor = new FeatureExtractor(new ArbiterProperties(), Clock.fixed(lateWeekend, ZoneOffset.UTC));

        for (Instant at : List.of(NOW.plusSeconds(11 * 3600), lateWeekend)) {
            FeatureVector features = extractor.extract(GovernanceRequest.builder()
                    .requestId("toxic-context")
                    .content("hello there")
                    .context(Map.of("toxicity_score", 0.95))
                    .timestamp(at)
                    .build());
            double[] distribution = model.predictProba(features.toArray());

            assertThat(features.getContentToxicityScore()).isCloseTo(0.95, within(1e-9));
            assertThat(Decision.fromIndex(argMax(distribution))).isIn(Decision.DENY, Decision.ESCALATE);
        }
    }

    private static int argMax(double[] values) {
        int best = 0;
        for (int i = 1; i < values.length; i++) {
            if (values[i] > values[best]) {
                best = i;
            }
        }
        return best;
    }

    @Test
    @DisplayName("should refuse to train on too few samples")
    void tooFewSamples() {
        ModelTrainer trainer = new ModelTrainer(Clock.systemUTC());
        List<LabeledSample> few = samples.subList(0, 5);

        assertThatThrownBy(() -> trainer.trainRandomForest("rf-small", few, SETTINGS))
                .isInstanceOf(ModelTrainingException.class)
                .hasMessageContaining("Not enough samples");
    }
}
