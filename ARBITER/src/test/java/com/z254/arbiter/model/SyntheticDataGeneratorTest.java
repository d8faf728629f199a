package com.z254.arbiter.model;

import com.z254.arbiter.domain.model.Decision;
import com.z254.arbiter.domain.model.FeatureVector;
import com.z254.arbiter.domain.model.IntentClass;
import com.z254.arbiter.domain.model.RiskLevel;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;

class SyntheticDataGeneratorTest {

    private final SyntheticDataGenerator generator = new SyntheticDataGenerator();

    @Test
    @DisplayName("should reproduce the same dataset for the same seed")
    void deterministic() {
        List<LabeledSample> first = generator.generate(50, 42L);
        List<LabeledSample> second = generator.generate(50, 42L);

        assertThat(first).hasSize(50);
        for (int i = 0; i < first.size(); i++) {
            assertThat(first.get(i).features()).containsExactly(second.get(i).features());
            assertThat(first.get(i).label()).isEqualTo(second.get(i).label());
        }
    }

    @Test
    @DisplayName("should produce normalized rows covering several classes")
    void normalizedRows() {
        List<LabeledSample> samples = generator.generate(500, 7L);

        Set<Decision> labels = EnumSet.noneOf(Decision.class);
        for (LabeledSample sample : samples) {
            assertThat(sample.features()).hasSize(FeatureVector.DIMENSIONS);
            assertThat(Arrays.stream(sample.features()).allMatch(v -> v >= 0.0 && v <= 1.0)).isTrue();
            labels.add(sample.label());
        }
        assertThat(labels).contains(Decision.ALLOW, Decision.DENY, Decision.MONITOR);
    }

    @Nested
    @DisplayName("labeling rules")
    class Labeling {

        private FeatureVector.FeatureVectorBuilder base() {
            return FeatureVector.builder()
                    .intentClass(IntentClass.NEUTRAL)
                    .intentConfidence(0.5)
                    .riskLevel(RiskLevel.LOW)
                    .businessHours(true);
        }

        @Test
        @DisplayName("should deny harmful, toxic or very risky content")
        void deny() {
            assertThat(SyntheticDataGenerator.label(base().intentIsHarmful(true).build(), 0.1, 0))
                    .isEqualTo(Decision.DENY);
            assertThat(SyntheticDataGenerator.label(base().contentToxicityScore(0.75).build(), 0.1, 0))
                    .isEqualTo(Decision.DENY);
            assertThat(SyntheticDataGenerator.label(base().riskLevel(RiskLevel.CRITICAL).build(), 0.85, 0))
                    .isEqualTo(Decision.DENY);
        }

        @Test
        @DisplayName("should escalate high risk with a policy denial")
        void escalate() {
            FeatureVector risky = base().riskLevel(RiskLevel.HIGH).build();

            assertThat(SyntheticDataGenerator.label(risky, 0.7, 1)).isEqualTo(Decision.ESCALATE);
            assertThat(SyntheticDataGenerator.label(risky, 0.7, 0)).isEqualTo(Decision.MONITOR);
        }

        @Test
        @DisplayName("should allow confident helpful requests")
        void allow() {
            FeatureVector helpful = base().intentIsHelpful(true).intentConfidence(0.75).build();

            assertThat(SyntheticDataGenerator.label(helpful, 0.2, 0)).isEqualTo(Decision.ALLOW);
            assertThat(SyntheticDataGenerator.label(base().intentConfidence(0.9).build(), 0.5, 0))
                    .isEqualTo(Decision.ALLOW);
        }

        @Test
        @DisplayName("should monitor everything else")
        void monitor() {
            assertThat(SyntheticDataGenerator.label(base().build(), 0.4, 0)).isEqualTo(Decision.MONITOR);
        }
    }
}
