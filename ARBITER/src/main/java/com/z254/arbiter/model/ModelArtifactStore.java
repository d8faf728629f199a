package com.z254.arbiter.model;

import com.z254.arbiter.domain.model.ModelVersion;

import java.util.Optional;

/**
 * Durable storage for trained model artifacts and their metadata.
 */
public interface ModelArtifactStore {

    record StoredModel(ModelVersion version, GovernanceModel model) {
    }

    Optional<StoredModel> load(String versionId);

    void save(ModelVersion version, WekaClassifierModel model);
}
