package com.z254.arbiter.model;

import com.z254.arbiter.domain.model.ModelType;

/**
 * Inference handle for one registered model version.
 * <p>
 * Implementations must be safe for concurrent {@link #predictProba} calls.
 */
public interface GovernanceModel {

    String versionId();

    ModelType modelType();

    /**
     * Class probabilities indexed by {@code Decision.index()}.
     *
     * @param features model-ready vector of {@code FeatureVector.DIMENSIONS} values
     * @throws com.z254.arbiter.domain.exception.ModelInferenceException when no distribution can be produced
     */
    double[] predictProba(double[] features);
}
