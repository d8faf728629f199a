package com.z254.arbiter.model;

import com.z254.arbiter.domain.exception.ModelTrainingException;
import com.z254.arbiter.domain.model.ModelStatus;
import com.z254.arbiter.domain.model.ModelType;
import com.z254.arbiter.domain.model.ModelVersion;
import lombok.extern.slf4j.Slf4j;
import weka.classifiers.Evaluation;
import weka.classifiers.trees.RandomForest;
import weka.core.Instances;

import java.time.Clock;
import java.util.List;
import java.util.Map;

/**
 * Trains and evaluates random forest versions.
 * <p>
 * Metrics come from a hold-out split; the returned classifier is then fitted
 * on the full sample set.
 */
@Slf4j
public class ModelTrainer {

    private final Clock clock;

    public ModelTrainer(Clock clock) {
        this.clock = clock;
    }

    public record ForestSettings(int numTrees, int maxDepth, int seed, double validationFraction) {
    }

    public record TrainingResult(WekaClassifierModel model, ModelVersion version) {
    }

    public TrainingResult trainRandomForest(String versionId, List<LabeledSample> samples, ForestSettings settings) {
        if (samples.size() < 10) {
            throw new ModelTrainingException("Not enough samples to train " + versionId + ": " + samples.size(), null);
        }
        try {
            Instances all = WekaSchema.dataset(samples);
            int validationSize = Math.max(1, (int) Math.round(all.numInstances() * settings.validationFraction()));
            int trainSize = all.numInstances() - validationSize;
            Instances train = new Instances(all, 0, trainSize);
            Instances validation = new Instances(all, trainSize, validationSize);

            RandomForest holdoutModel = newForest(settings);
            holdoutModel.buildClassifier(train);
            Evaluation evaluation = new Evaluation(train);
            evaluation.evaluateModel(holdoutModel, validation);

            RandomForest finalModel = newForest(settings);
            finalModel.buildClassifier(all);

            ModelVersion version = ModelVersion.builder()
                    .versionId(versionId)
                    .modelType(ModelType.RANDOM_FOREST)
                    .status(ModelStatus.TRAINING)
                    .accuracy(finite(evaluation.pctCorrect() / 100.0))
                    .precision(finite(evaluation.weightedPrecision()))
                    .recall(finite(evaluation.weightedRecall()))
                    .f1Score(finite(evaluation.weightedFMeasure()))
                    .trainingSamples(all.numInstances())
                    .validationSamples(validationSize)
                    .createdAt(clock.instant())
                    .metadata(Map.of(
                            "algorithm", "weka.classifiers.trees.RandomForest",
                            "numTrees", String.valueOf(settings.numTrees()),
                            "maxDepth", String.valueOf(settings.maxDepth()),
                            "seed", String.valueOf(settings.seed())))
                    .build();

            log.info("Trained {} on {} samples: accuracy={}, f1={}",
                    versionId, all.numInstances(), version.getAccuracy(), version.getF1Score());
            return new TrainingResult(new WekaClassifierModel(versionId, ModelType.RANDOM_FOREST, finalModel), version);
        } catch (ModelTrainingException e) {
            throw e;
        } catch (Exception e) {
            throw new ModelTrainingException("Training failed for " + versionId, e);
        }
    }

    private static RandomForest newForest(ForestSettings settings) {
        RandomForest forest = new RandomForest();
        forest.setNumIterations(settings.numTrees());
        forest.setMaxDepth(settings.maxDepth());
        forest.setSeed(settings.seed());
        return forest;
    }

    private static double finite(double value) {
        return Double.isFinite(value) ? value : 0.0;
    }
}
