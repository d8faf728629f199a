package com.z254.arbiter.domain.service;

import com.z254.arbiter.config.ArbiterProperties;
import com.z254.arbiter.domain.model.ABTest;
import com.z254.arbiter.domain.model.ABTestReport;
import com.z254.arbiter.domain.model.DriftDetectionResult;
import com.z254.arbiter.domain.model.EngineStatus;
import com.z254.arbiter.domain.model.FeatureVector;
import com.z254.arbiter.domain.model.FeedbackSubmission;
import com.z254.arbiter.domain.model.GovernanceRequest;
import com.z254.arbiter.domain.model.GovernanceResponse;
import com.z254.arbiter.domain.model.ModelMetricsReport;
import com.z254.arbiter.domain.model.ModelType;
import com.z254.arbiter.domain.model.ModelVersion;
import com.z254.arbiter.domain.model.OnlineLearnerStatus;
import com.z254.arbiter.domain.model.PredictionRecord;
import com.z254.arbiter.drift.DriftMonitor;
import com.z254.arbiter.features.FeatureExtractor;
import com.z254.arbiter.feedback.FeedbackLoop;
import com.z254.arbiter.model.OnlineGovernanceModel;
import com.z254.arbiter.observability.ArbiterMetrics;
import com.z254.arbiter.observability.ArbiterStructuredLogger;
import com.z254.arbiter.observability.ArbiterStructuredLogger.DecisionEventType;
import com.z254.arbiter.prediction.PredictionExecutor;
import com.z254.arbiter.prediction.PredictionOutcome;
import com.z254.arbiter.reasoning.ReasoningGenerator;
import com.z254.arbiter.registry.ABTestMetrics;
import com.z254.arbiter.registry.ModelBootstrapper;
import com.z254.arbiter.registry.ModelRegistry;
import com.z254.arbiter.routing.ABRouter;
import com.z254.arbiter.routing.RoutingDecision;
import com.z254.arbiter.store.BestEffortWriter;
import com.z254.arbiter.store.PredictionLog;
import io.micrometer.core.instrument.Timer;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.time.Instant;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.OptionalDouble;
import java.util.UUID;

/**
 * Entry point for every governance operation. Constructed once by Spring and
 * handed to the HTTP adapters.
 * <p>
 * {@link #predict} and {@link #submitFeedback} never throw for model or
 * storage faults; admin operations propagate the registry's exceptions.
 */
@Slf4j
@Service
public class GovernanceEngine {

    private final FeatureExtractor featureExtractor;
    private final ABRouter router;
    private final PredictionExecutor executor;
    private final ReasoningGenerator reasoningGenerator;
    private final FeedbackLoop feedbackLoop;
    private final DriftMonitor driftMonitor;
    private final ModelRegistry registry;
    private final ModelBootstrapper bootstrapper;
    private final PredictionLog predictionLog;
    private final BestEffortWriter writer;
    private final ArbiterMetrics metrics;
    private final ArbiterStructuredLogger structuredLogger;
    private final ArbiterProperties properties;
    private final Clock clock;

    public GovernanceEngine(FeatureExtractor featureExtractor,
                            ABRouter router,
                            PredictionExecutor executor,
                            ReasoningGenerator reasoningGenerator,
                            FeedbackLoop feedbackLoop,
                            DriftMonitor driftMonitor,
                            ModelRegistry registry,
                            ModelBootstrapper bootstrapper,
                            PredictionLog predictionLog,
                            BestEffortWriter writer,
                            ArbiterMetrics metrics,
                            ArbiterStructuredLogger structuredLogger,
                            ArbiterProperties properties,
                            Clock clock) {
        this.featureExtractor = featureExtractor;
        this.router = router;
        this.executor = executor;
        this.reasoningGenerator = reasoningGenerator;
        this.feedbackLoop = feedbackLoop;
        this.driftMonitor = driftMonitor;
        this.registry = registry;
        this.bootstrapper = bootstrapper;
        this.predictionLog = predictionLog;
        this.writer = writer;
        this.metrics = metrics;
        this.structuredLogger = structuredLogger;
        this.properties = properties;
        this.clock = clock;
    }

    // ==================== Decisions ====================

    /**
     * Decide on one request. Blocks for at most the inference timeout; call
     * from a thread that may block.
     */
    public GovernanceResponse predict(GovernanceRequest request, boolean useAbTest) {
        Timer.Sample timer = metrics.startPredictionTimer();
        long started = System.nanoTime();

        String requestId = request.getRequestId() != null && !request.getRequestId().isBlank()
                ? request.getRequestId()
                : UUID.randomUUID().toString();
        Instant timestamp = request.getTimestamp() != null ? request.getTimestamp() : clock.instant();
        GovernanceRequest normalized = GovernanceRequest.builder()
                .requestId(requestId)
                .content(request.getContent())
                .context(request.getContext() != null ? request.getContext() : Map.of())
                .userId(request.getUserId())
                .sessionId(request.getSessionId())
                .timestamp(timestamp)
                .build();

        FeatureVector features = featureExtractor.extract(normalized);
        ModelType modelType = properties.getPrediction().getDefaultModelType();
        RoutingDecision route = router.select(modelType, useAbTest, normalized.getUserId());
        PredictionOutcome outcome = executor.predict(features, route.versionId());
        String reasoning = reasoningGenerator.explain(features, outcome.decision(), outcome.confidence());

        GovernanceResponse response = GovernanceResponse.builder()
                .requestId(requestId)
                .decision(outcome.decision())
                .confidence(outcome.confidence())
                .reasoning(reasoning)
                .modelVersion(route.versionId())
                .features(features)
                .processingTimeMs((System.nanoTime() - started) / 1_000_000.0)
                .timestamp(timestamp)
                .abTestId(route.abTestId())
                .abArm(route.arm() != null ? route.arm().name().toLowerCase(Locale.ROOT) : null)
                .fallback(outcome.isFallback())
                .build();

        PredictionRecord record = PredictionRecord.from(response, normalized.getUserId());
        writer.submit(BestEffortWriter.PREDICTIONS, requestId, () -> predictionLog.append(record));

        metrics.recordPrediction(timer, response.getDecision(), response.getConfidence(),
                response.getModelVersion(), response.usedAbTest());
        logDecision(response, outcome);
        return response;
    }

    /**
     * Apply reviewer feedback. Emits false for an unknown request id.
     */
    public Mono<Boolean> submitFeedback(FeedbackSubmission feedback) {
        return feedbackLoop.submit(feedback);
    }

    // ==================== Reporting ====================

    public EngineStatus status() {
        return EngineStatus.builder()
                .activeVersions(registry.activeVersions())
                .activeAbTests(abTests())
                .degradedTypes(bootstrapper.degradedTypes())
                .totalPredictions(metrics.totalPredictions())
                .fallbackPredictions(metrics.fallbackCount())
                .meanLatencyMs(metrics.meanPredictionLatency().toNanos() / 1_000_000.0)
                .onlineUpdates(metrics.getOnlineUpdates().count())
                .storeType(properties.getStore().getType().name())
                .driftMode(properties.getDrift().getMode().name())
                .build();
    }

    public List<ModelMetricsReport> modelMetrics() {
        return registry.listVersions().stream()
                .map(this::metricsFor)
                .toList();
    }

    public List<ABTestReport> abTests() {
        return registry.getActiveAbTests().stream()
                .map(this::reportFor)
                .toList();
    }

    public List<ABTestReport> allAbTests() {
        return registry.listAbTests().stream()
                .map(this::reportFor)
                .toList();
    }

    public List<OnlineLearnerStatus> onlineLearningStatus() {
        Optional<String> active = registry.getActive(ModelType.ONLINE_LEARNER);
        return registry.listVersions().stream()
                .filter(version -> version.getModelType() == ModelType.ONLINE_LEARNER)
                .map(version -> {
                    Optional<OnlineGovernanceModel> learner = registry.findArtifact(version.getVersionId())
                            .filter(OnlineGovernanceModel.class::isInstance)
                            .map(OnlineGovernanceModel.class::cast);
                    return OnlineLearnerStatus.builder()
                            .versionId(version.getVersionId())
                            .status(version.getStatus())
                            .active(active.map(version.getVersionId()::equals).orElse(false))
                            .loaded(learner.isPresent())
                            .samplesSeen(learner.map(OnlineGovernanceModel::samplesSeen).orElse(0L))
                            .updateCount(learner.map(OnlineGovernanceModel::updateCount).orElse(0L))
                            .build();
                })
                .toList();
    }

    // ==================== Drift ====================

    /**
     * Empty when there is not enough data to run the check.
     */
    public Mono<DriftDetectionResult> checkDrift(String modelVersion) {
        return driftMonitor.check(modelVersion);
    }

    public Flux<DriftDetectionResult> driftHistory(String modelVersion, int limit) {
        return driftMonitor.history(modelVersion, limit);
    }

    // ==================== Model Lifecycle ====================

    public List<ModelVersion> versions() {
        return registry.listVersions();
    }

    public ModelVersion promote(String versionId) {
        return registry.promote(versionId);
    }

    public ModelVersion rollback(ModelType type) {
        return registry.rollback(type);
    }

    public ModelVersion retrain() {
        return bootstrapper.retrain();
    }

    // ==================== A/B Tests ====================

    public ABTestReport createAbTest(String championVersion, String candidateVersion, double trafficSplit) {
        return reportFor(registry.createAbTest(championVersion, candidateVersion, trafficSplit));
    }

    public ABTestReport updateTrafficSplit(String testId, double trafficSplit) {
        return reportFor(registry.updateTrafficSplit(testId, trafficSplit));
    }

    public ABTestReport completeAbTest(String testId, boolean promoteCandidate) {
        return reportFor(registry.completeAbTest(testId, promoteCandidate));
    }

    public ABTestReport cancelAbTest(String testId) {
        return reportFor(registry.cancelAbTest(testId));
    }

    private ABTestReport reportFor(ABTest test) {
        ABTestMetrics tally = registry.abTestMetrics(test.getTestId());
        return ABTestReport.builder()
                .test(test)
                .requests(tally.requests())
                .championRequests(tally.championRequests())
                .candidateRequests(tally.candidateRequests())
                .observedCandidateShare(tally.candidateShare())
                .build();
    }

    private ModelMetricsReport metricsFor(ModelVersion version) {
        String versionId = version.getVersionId();
        OptionalDouble feedbackAccuracy = metrics.feedbackAccuracy(versionId);
        return ModelMetricsReport.builder()
                .versionId(versionId)
                .modelType(version.getModelType())
                .status(version.getStatus())
                .accuracy(version.getAccuracy())
                .precision(version.getPrecision())
                .recall(version.getRecall())
                .f1Score(version.getF1Score())
                .trainingSamples(version.getTrainingSamples())
                .predictions(metrics.predictionCount(versionId))
                .feedback(metrics.feedbackCount(versionId))
                .feedbackAccuracy(feedbackAccuracy.isPresent() ? feedbackAccuracy.getAsDouble() : null)
                .build();
    }

    private void logDecision(GovernanceResponse response, PredictionOutcome outcome) {
        Map<String, Object> details = new HashMap<>();
        details.put("decision", response.getDecision().name());
        details.put("confidence", response.getConfidence());
        details.put("processingTimeMs", response.getProcessingTimeMs());
        if (response.getAbArm() != null) {
            details.put("abArm", response.getAbArm());
        }
        if (outcome.isFallback()) {
            details.put("fallbackReason", outcome.fallbackReason());
            structuredLogger.logDecisionEvent(response.getRequestId(), response.getModelVersion(),
                    response.getAbTestId(), DecisionEventType.FALLBACK, "Conservative fallback decision", details);
        } else {
            structuredLogger.logDecisionEvent(response.getRequestId(), response.getModelVersion(),
                    response.getAbTestId(), DecisionEventType.DECIDED, "Governance decision issued", details);
        }
    }
}
