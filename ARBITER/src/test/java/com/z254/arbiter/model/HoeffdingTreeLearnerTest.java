package com.z254.arbiter.model;

import com.z254.arbiter.domain.exception.ModelInferenceException;
import com.z254.arbiter.domain.model.Decision;
import com.z254.arbiter.domain.model.ModelType;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

class HoeffdingTreeLearnerTest {

    @Test
    @DisplayName("should refuse to predict before seeing any example")
    void freshLearner() {
        HoeffdingTreeLearner learner = HoeffdingTreeLearner.fresh("ol-fresh");

        assertThat(learner.modelType()).isEqualTo(ModelType.ONLINE_LEARNER);
        assertThat(learner.samplesSeen()).isZero();
        assertThatThrownBy(() -> learner.predictProba(new double[18]))
                .isInstanceOf(ModelInferenceException.class);
    }

    @Test
    @DisplayName("should start predicting after the first update")
    void firstUpdate() {
        HoeffdingTreeLearner learner = HoeffdingTreeLearner.fresh("ol-fresh");

        learner.learnOne(new double[18], Decision.DENY);

        assertThat(learner.samplesSeen()).isEqualTo(1);
        assertThat(learner.updateCount()).isEqualTo(1);
        assertThat(learner.predictProba(new double[18])).hasSize(4);
    }

    @Test
    @DisplayName("should count warm-start samples and later updates separately")
    void warmStart() {
        List<LabeledSample> samples = new SyntheticDataGenerator().generate(100, 3L);
        HoeffdingTreeLearner learner = HoeffdingTreeLearner.warmStarted("ol-1", samples);

        assertThat(learner.samplesSeen()).isEqualTo(100);
        assertThat(learner.updateCount()).isZero();

        learner.learnOne(samples.get(0).features(), Decision.ESCALATE);
        learner.learnOne(samples.get(1).features(), Decision.ALLOW);

        assertThat(learner.samplesSeen()).isEqualTo(102);
        assertThat(learner.updateCount()).isEqualTo(2);
        double[] distribution = learner.predictProba(samples.get(2).features());
        assertThat(Arrays.stream(distribution).sum()).isCloseTo(1.0, within(1e-6));
    }

    @Test
    @DisplayName("should reject vectors of the wrong width")
    void wrongWidth() {
        HoeffdingTreeLearner learner = HoeffdingTreeLearner.warmStarted("ol-1",
                new SyntheticDataGenerator().generate(20, 1L));

        assertThatThrownBy(() -> learner.predictProba(new double[3]))
                .isInstanceOf(RuntimeException.class);
    }
}
