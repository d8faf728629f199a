package com.z254.arbiter.api.v1;

import com.z254.arbiter.api.dto.CreateAbTestRequest;
import com.z254.arbiter.api.dto.TrafficSplitRequest;
import com.z254.arbiter.domain.model.ABTestReport;
import com.z254.arbiter.domain.service.GovernanceEngine;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;

import java.util.List;

/**
 * REST API controller for champion/candidate A/B tests.
 */
@Slf4j
@RestController
@RequestMapping("/api/v1/ab-tests")
@Tag(name = "A/B Tests", description = "Champion/candidate experiments")
public class ABTestController {

    private final GovernanceEngine engine;

    public ABTestController(GovernanceEngine engine) {
        this.engine = engine;
    }

    @GetMapping
    @Operation(summary = "List A/B tests", description = "Active tests by default; all tests with includeEnded")
    public Mono<ResponseEntity<List<ABTestReport>>> list(
            @Parameter(description = "Include completed, cancelled and superseded tests")
            @RequestParam(defaultValue = "false") boolean includeEnded) {
        return Mono.fromCallable(() -> includeEnded ? engine.allAbTests() : engine.abTests())
                .map(ResponseEntity::ok);
    }

    @PostMapping
    @Operation(summary = "Create A/B test", description = "Route a share of traffic to a candidate version")
    public Mono<ResponseEntity<ABTestReport>> create(@Valid @RequestBody CreateAbTestRequest request) {
        return Mono.fromCallable(() -> engine.createAbTest(
                        request.getChampionVersion(), request.getCandidateVersion(), request.getTrafficSplit()))
                .map(report -> ResponseEntity.status(HttpStatus.CREATED).body(report));
    }

    @PutMapping("/{testId}/split")
    @Operation(summary = "Change traffic split",
               description = "Supersede the test with a new one using the given split")
    public Mono<ResponseEntity<ABTestReport>> updateSplit(
            @Parameter(description = "A/B test ID") @PathVariable String testId,
            @Valid @RequestBody TrafficSplitRequest request) {
        return Mono.fromCallable(() -> engine.updateTrafficSplit(testId, request.getTrafficSplit()))
                .map(ResponseEntity::ok);
    }

    @PostMapping("/{testId}/complete")
    @Operation(summary = "Complete A/B test", description = "End the test, optionally promoting the candidate")
    public Mono<ResponseEntity<ABTestReport>> complete(
            @Parameter(description = "A/B test ID") @PathVariable String testId,
            @Parameter(description = "Promote the candidate version")
            @RequestParam(defaultValue = "false") boolean promoteCandidate) {
        return Mono.fromCallable(() -> engine.completeAbTest(testId, promoteCandidate))
                .map(ResponseEntity::ok);
    }

    @PostMapping("/{testId}/cancel")
    @Operation(summary = "Cancel A/B test", description = "End the test without promotion")
    public Mono<ResponseEntity<ABTestReport>> cancel(
            @Parameter(description = "A/B test ID") @PathVariable String testId) {
        return Mono.fromCallable(() -> engine.cancelAbTest(testId)).map(ResponseEntity::ok);
    }
}
