package com.z254.arbiter.api.v1;

import com.z254.arbiter.domain.model.DriftDetectionResult;
import com.z254.arbiter.domain.service.GovernanceEngine;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;

import java.util.List;

/**
 * REST API controller for drift checks.
 */
@Slf4j
@Validated
@RestController
@RequestMapping("/api/v1/drift")
@Tag(name = "Drift", description = "Feature drift checks and history")
public class DriftController {

    private final GovernanceEngine engine;

    public DriftController(GovernanceEngine engine) {
        this.engine = engine;
    }

    @PostMapping("/check")
    @Operation(summary = "Run drift check",
               description = "Compare recent features against the reference window; 204 when there is not enough data")
    public Mono<ResponseEntity<DriftDetectionResult>> check(
            @Parameter(description = "Model version; defaults to the active baseline")
            @RequestParam(required = false) String modelVersion) {
        return engine.checkDrift(modelVersion)
                .map(ResponseEntity::ok)
                .defaultIfEmpty(ResponseEntity.noContent().build());
    }

    @GetMapping("/history")
    @Operation(summary = "Drift history", description = "Past drift check results, newest first")
    public Mono<ResponseEntity<List<DriftDetectionResult>>> history(
            @Parameter(description = "Filter by model version")
            @RequestParam(required = false) String modelVersion,
            @Parameter(description = "Maximum number of results")
            @RequestParam(defaultValue = "20") @Min(1) @Max(1000) int limit) {
        return engine.driftHistory(modelVersion, limit)
                .collectList()
                .map(ResponseEntity::ok);
    }
}
