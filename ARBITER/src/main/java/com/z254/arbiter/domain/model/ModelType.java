package com.z254.arbiter.domain.model;

/**
 * Kinds of model the registry manages.
 */
public enum ModelType {
    /** Batch-trained baseline classifier */
    RANDOM_FOREST,
    /** Incrementally updated classifier fed by feedback */
    ONLINE_LEARNER,
    /** Reserved combinator type */
    ENSEMBLE;

    /**
     * Whether a version of this type may be A/B tested against a version of
     * {@code other}. Random forest and online learner versions share the
     * feature schema and label set; ensembles only pair with ensembles.
     */
    public boolean isCompatibleWith(ModelType other) {
        return switch (this) {
            case RANDOM_FOREST, ONLINE_LEARNER -> other == RANDOM_FOREST || other == ONLINE_LEARNER;
            case ENSEMBLE -> other == ENSEMBLE;
        };
    }
}
