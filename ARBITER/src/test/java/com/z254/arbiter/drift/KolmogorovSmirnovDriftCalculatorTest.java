package com.z254.arbiter.drift;

import com.z254.arbiter.domain.model.FeatureVector;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

class KolmogorovSmirnovDriftCalculatorTest {

    private final KolmogorovSmirnovDriftCalculator calculator = new KolmogorovSmirnovDriftCalculator();

    private static double[][] rows(int count, int column, double start, double step) {
        double[][] rows = new double[count][FeatureVector.DIMENSIONS];
        for (int i = 0; i < count; i++) {
            rows[i][column] = start + i * step;
        }
        return rows;
    }

    @Test
    @DisplayName("should score identical windows as zero")
    void identical() {
        double[][] reference = rows(50, 7, 0.0, 0.01);

        DriftScore score = calculator.score(new DriftWindows(reference, rows(50, 7, 0.0, 0.01)));

        assertThat(score.score()).isCloseTo(0.0, within(1e-9));
        assertThat(score.featureScores()).hasSize(FeatureVector.DIMENSIONS);
    }

    @Test
    @DisplayName("should attribute a shifted column to its feature name")
    void shiftedColumn() {
        DriftScore score = calculator.score(new DriftWindows(
                rows(50, 7, 0.0, 0.005),
                rows(50, 7, 0.6, 0.005)));

        assertThat(score.featureScores().get("content_toxicity_score")).isCloseTo(1.0, within(1e-9));
        assertThat(score.featureScores().get("intent_confidence")).isCloseTo(0.0, within(1e-9));
        assertThat(score.score()).isCloseTo(1.0 / FeatureVector.DIMENSIONS, within(1e-9));
    }
}
