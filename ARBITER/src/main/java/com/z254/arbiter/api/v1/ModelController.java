package com.z254.arbiter.api.v1;

import com.z254.arbiter.domain.model.ModelMetricsReport;
import com.z254.arbiter.domain.model.ModelType;
import com.z254.arbiter.domain.model.ModelVersion;
import com.z254.arbiter.domain.model.OnlineLearnerStatus;
import com.z254.arbiter.domain.service.GovernanceEngine;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.util.List;

/**
 * REST API controller for model versions and lifecycle.
 */
@Slf4j
@RestController
@RequestMapping("/api/v1/models")
@Tag(name = "Models", description = "Model versions, metrics and lifecycle")
public class ModelController {

    private final GovernanceEngine engine;

    public ModelController(GovernanceEngine engine) {
        this.engine = engine;
    }

    @GetMapping("/metrics")
    @Operation(summary = "Model metrics",
               description = "Per-version accuracy, precision, recall, F1, prediction and feedback counts")
    public Mono<ResponseEntity<List<ModelMetricsReport>>> metrics() {
        return Mono.fromCallable(engine::modelMetrics).map(ResponseEntity::ok);
    }

    @GetMapping("/online-learning")
    @Operation(summary = "Online learning status", description = "Activity of every registered online learner")
    public Mono<ResponseEntity<List<OnlineLearnerStatus>>> onlineLearning() {
        return Mono.fromCallable(engine::onlineLearningStatus).map(ResponseEntity::ok);
    }

    @GetMapping("/versions")
    @Operation(summary = "List versions", description = "All registered model versions")
    public Mono<ResponseEntity<List<ModelVersion>>> versions() {
        return Mono.fromCallable(engine::versions).map(ResponseEntity::ok);
    }

    @PostMapping("/{versionId}/promote")
    @Operation(summary = "Promote version",
               description = "Make a version ACTIVE, retiring the previous active version of its type")
    public Mono<ResponseEntity<ModelVersion>> promote(
            @Parameter(description = "Model version ID") @PathVariable String versionId) {
        return Mono.fromCallable(() -> engine.promote(versionId)).map(ResponseEntity::ok);
    }

    @PostMapping("/{modelType}/rollback")
    @Operation(summary = "Roll back", description = "Re-promote the most recently retired version of a type")
    public Mono<ResponseEntity<ModelVersion>> rollback(
            @Parameter(description = "Model type") @PathVariable ModelType modelType) {
        return Mono.fromCallable(() -> engine.rollback(modelType)).map(ResponseEntity::ok);
    }

    @PostMapping("/retrain")
    @Operation(summary = "Train candidate",
               description = "Train a new random forest from synthetic data and register it as CANDIDATE")
    public Mono<ResponseEntity<ModelVersion>> retrain() {
        return Mono.fromCallable(engine::retrain)
                .subscribeOn(Schedulers.boundedElastic())
                .map(version -> ResponseEntity.status(HttpStatus.CREATED).body(version));
    }
}
