package com.z254.arbiter.model;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.z254.arbiter.domain.exception.ModelTrainingException;
import com.z254.arbiter.domain.model.ModelVersion;
import lombok.extern.slf4j.Slf4j;
import weka.classifiers.Classifier;
import weka.core.SerializationHelper;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Optional;

/**
 * Stores each version as {@code <dir>/<versionId>.model} (Weka serialized
 * classifier) next to a {@code <versionId>.json} metadata record.
 */
@Slf4j
public class FileSystemModelArtifactStore implements ModelArtifactStore {

    private final Path directory;
    private final ObjectMapper objectMapper;

    public FileSystemModelArtifactStore(Path directory) {
        this.directory = directory;
        this.objectMapper = new ObjectMapper();
        this.objectMapper.registerModule(new JavaTimeModule());
        this.objectMapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        this.objectMapper.disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
    }

    @Override
    public Optional<StoredModel> load(String versionId) {
        Path modelFile = modelFile(versionId);
        Path metadataFile = metadataFile(versionId);
        if (!Files.isRegularFile(modelFile) || !Files.isRegularFile(metadataFile)) {
            return Optional.empty();
        }
        try {
            ModelVersion version = objectMapper.readValue(metadataFile.toFile(), ModelVersion.class);
            Classifier classifier = (Classifier) SerializationHelper.read(modelFile.toString());
            log.info("Loaded model artifact {} from {}", versionId, modelFile);
            return Optional.of(new StoredModel(version,
                    new WekaClassifierModel(versionId, version.getModelType(), classifier)));
        } catch (Exception e) {
            log.warn("Unreadable model artifact {}, ignoring it: {}", versionId, e.getMessage());
            return Optional.empty();
        }
    }

    @Override
    public void save(ModelVersion version, WekaClassifierModel model) {
        try {
            Files.createDirectories(directory);
            SerializationHelper.write(modelFile(version.getVersionId()).toString(), model.classifier());
            objectMapper.writerWithDefaultPrettyPrinter()
                    .writeValue(metadataFile(version.getVersionId()).toFile(), version);
            log.info("Persisted model artifact {} to {}", version.getVersionId(), directory);
        } catch (IOException e) {
            throw new ModelTrainingException("Failed to persist " + version.getVersionId(), e);
        } catch (Exception e) {
            throw new ModelTrainingException("Failed to serialize " + version.getVersionId(), e);
        }
    }

    private Path modelFile(String versionId) {
        return directory.resolve(versionId + ".model");
    }

    private Path metadataFile(String versionId) {
        return directory.resolve(versionId + ".json");
    }
}
