package com.z254.arbiter.api.v1;

import com.z254.arbiter.api.dto.FeedbackAck;
import com.z254.arbiter.api.dto.FeedbackRequest;
import com.z254.arbiter.api.dto.PredictRequest;
import com.z254.arbiter.api.mapper.GovernanceMapper;
import com.z254.arbiter.domain.model.EngineStatus;
import com.z254.arbiter.domain.model.GovernanceResponse;
import com.z254.arbiter.domain.service.GovernanceEngine;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

/**
 * REST API controller for governance decisions and feedback.
 */
@Slf4j
@RestController
@RequestMapping("/api/v1/governance")
@Tag(name = "Governance", description = "Decisions, feedback and engine status")
public class GovernanceController {

    private final GovernanceEngine engine;

    public GovernanceController(GovernanceEngine engine) {
        this.engine = engine;
    }

    @PostMapping("/predict")
    @Operation(summary = "Decide on content",
               description = "Returns ALLOW, DENY, ESCALATE or MONITOR with confidence and reasoning")
    public Mono<ResponseEntity<GovernanceResponse>> predict(@Valid @RequestBody PredictRequest request) {
        // Inference waits on the model pool with a bounded timeout
        return Mono.fromCallable(() -> engine.predict(
                        GovernanceMapper.toGovernanceRequest(request), request.isUseAbTest()))
                .subscribeOn(Schedulers.boundedElastic())
                .map(ResponseEntity::ok);
    }

    @PostMapping("/feedback")
    @Operation(summary = "Submit feedback",
               description = "Record reviewer feedback on an issued decision; corrections update the online learner")
    public Mono<ResponseEntity<FeedbackAck>> submitFeedback(@Valid @RequestBody FeedbackRequest request) {
        return engine.submitFeedback(GovernanceMapper.toSubmission(request))
                .map(accepted -> ResponseEntity.ok(FeedbackAck.builder()
                        .requestId(request.getRequestId())
                        .accepted(accepted)
                        .message(accepted ? "Feedback recorded" : "Unknown or expired request id")
                        .build()));
    }

    @GetMapping("/status")
    @Operation(summary = "Engine status",
               description = "Active versions per type, active A/B tests and aggregate metrics")
    public Mono<ResponseEntity<EngineStatus>> status() {
        return Mono.fromCallable(engine::status).map(ResponseEntity::ok);
    }
}
