package com.z254.arbiter.model;

import com.z254.arbiter.domain.exception.ModelInferenceException;
import com.z254.arbiter.domain.model.ModelType;
import weka.classifiers.Classifier;
import weka.core.Instances;

/**
 * Read-only handle over a trained Weka classifier.
 * <p>
 * The wrapped classifier is never retrained after construction, so
 * concurrent {@code distributionForInstance} calls only read tree state.
 */
public class WekaClassifierModel implements GovernanceModel {

    private final String versionId;
    private final ModelType modelType;
    private final Classifier classifier;
    private final Instances header;

    public WekaClassifierModel(String versionId, ModelType modelType, Classifier classifier) {
        this.versionId = versionId;
        this.modelType = modelType;
        this.classifier = classifier;
        this.header = WekaSchema.emptyDataset(0);
    }

    @Override
    public String versionId() {
        return versionId;
    }

    @Override
    public ModelType modelType() {
        return modelType;
    }

    @Override
    public double[] predictProba(double[] features) {
        try {
            return classifier.distributionForInstance(WekaSchema.unlabeled(features, header));
        } catch (Exception e) {
            throw new ModelInferenceException("Inference failed for " + versionId, e);
        }
    }

    public Classifier classifier() {
        return classifier;
    }
}
