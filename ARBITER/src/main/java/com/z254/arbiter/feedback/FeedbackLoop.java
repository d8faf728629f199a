package com.z254.arbiter.feedback;

import com.z254.arbiter.domain.model.CorrectionRecord;
import com.z254.arbiter.domain.model.Decision;
import com.z254.arbiter.domain.model.FeedbackRecord;
import com.z254.arbiter.domain.model.FeedbackSubmission;
import com.z254.arbiter.domain.model.ModelType;
import com.z254.arbiter.domain.model.PredictionRecord;
import com.z254.arbiter.model.GovernanceModel;
import com.z254.arbiter.model.OnlineGovernanceModel;
import com.z254.arbiter.observability.ArbiterMetrics;
import com.z254.arbiter.observability.ArbiterStructuredLogger;
import com.z254.arbiter.observability.ArbiterStructuredLogger.FeedbackEventType;
import com.z254.arbiter.registry.ModelRegistry;
import com.z254.arbiter.store.BestEffortWriter;
import com.z254.arbiter.store.CorrectionStore;
import com.z254.arbiter.store.FeedbackStore;
import com.z254.arbiter.store.PredictionLog;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.time.Clock;
import java.util.HashMap;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

/**
 * Consumes reviewer feedback on logged decisions.
 * <p>
 * For a known request id the feedback record is stored, and a corrected
 * decision that differs from the logged one is fed to the active online
 * learner and written to the long-term correction store. The three steps are
 * independent: the submission succeeds when any of them does.
 */
@Slf4j
@Component
public class FeedbackLoop {

    private final PredictionLog predictionLog;
    private final FeedbackStore feedbackStore;
    private final CorrectionStore correctionStore;
    private final ModelRegistry registry;
    private final BestEffortWriter writer;
    private final ArbiterMetrics metrics;
    private final ArbiterStructuredLogger structuredLogger;
    private final Clock clock;

    public FeedbackLoop(PredictionLog predictionLog,
                        FeedbackStore feedbackStore,
                        CorrectionStore correctionStore,
                        ModelRegistry registry,
                        BestEffortWriter writer,
                        ArbiterMetrics metrics,
                        ArbiterStructuredLogger structuredLogger,
                        Clock clock) {
        this.predictionLog = predictionLog;
        this.feedbackStore = feedbackStore;
        this.correctionStore = correctionStore;
        this.registry = registry;
        this.writer = writer;
        this.metrics = metrics;
        this.structuredLogger = structuredLogger;
        this.clock = clock;
    }

    public Mono<Boolean> submit(FeedbackSubmission feedback) {
        String requestId = feedback.getRequestId();
        return predictionLog.find(requestId)
                .map(Optional::of)
                .defaultIfEmpty(Optional.empty())
                .onErrorResume(error -> {
                    log.warn("Prediction lookup failed for {}: {}", requestId, error.getMessage());
                    return Mono.just(Optional.empty());
                })
                .flatMap(found -> found
                        .map(prediction -> process(feedback, prediction))
                        .orElseGet(() -> unknownRequest(feedback)));
    }

    private Mono<Boolean> unknownRequest(FeedbackSubmission feedback) {
        metrics.getFeedbackUnknownTarget().increment();
        structuredLogger.logFeedbackEvent(feedback.getRequestId(), FeedbackEventType.UNKNOWN_REQUEST,
                "Feedback references an unknown request", null);
        return Mono.just(false);
    }

    private Mono<Boolean> process(FeedbackSubmission feedback, PredictionRecord prediction) {
        String requestId = feedback.getRequestId();
        FeedbackRecord record = FeedbackRecord.of(feedback, prediction, clock.instant());

        Mono<Boolean> stored = writer.attempt(BestEffortWriter.FEEDBACK, requestId, () -> feedbackStore.save(record));
        return stored.flatMap(storedOk -> {
            metrics.recordFeedback(feedback.getFeedbackType(), prediction.getModelVersion());
            Map<String, Object> details = new HashMap<>();
            details.put("feedbackType", String.valueOf(feedback.getFeedbackType()));
            details.put("modelVersion", prediction.getModelVersion());
            details.put("stored", storedOk);
            structuredLogger.logFeedbackEvent(requestId,
                    storedOk ? FeedbackEventType.RECEIVED : FeedbackEventType.STORE_FAILED,
                    storedOk ? "Feedback stored" : "Feedback not stored", details);

            Optional<Decision> corrected = feedback.correctDecisionOpt()
                    .filter(decision -> decision != prediction.getDecision());
            if (corrected.isEmpty()) {
                return Mono.just(storedOk);
            }
            return Mono.fromCallable(() -> updateLearner(prediction, corrected.get()))
                    .subscribeOn(Schedulers.boundedElastic())
                    .flatMap(update -> recordCorrection(feedback, prediction, corrected.get(), update)
                            .map(correctionOk -> storedOk || update.applied() || correctionOk));
        });
    }

    /**
     * One incremental update on the active online learner.
     */
    LearnerUpdate updateLearner(PredictionRecord prediction, Decision correctLabel) {
        Optional<String> learnerVersion = registry.getActive(ModelType.ONLINE_LEARNER);
        Optional<OnlineGovernanceModel> learner = learnerVersion
                .flatMap(registry::findArtifact)
                .filter(OnlineGovernanceModel.class::isInstance)
                .map(OnlineGovernanceModel.class::cast);
        if (learner.isEmpty()) {
            log.warn("No active online learner; correction for {} not applied", prediction.getRequestId());
            return new LearnerUpdate(learnerVersion.orElse(null), false);
        }
        String versionId = learner.map(GovernanceModel::versionId).get();
        try {
            learner.get().learnOne(prediction.getFeatures().toArray(), correctLabel);
            metrics.recordOnlineUpdate(true);
            structuredLogger.logFeedbackEvent(prediction.getRequestId(), FeedbackEventType.LEARNER_UPDATED,
                    "Online learner updated", Map.of(
                            "learnerVersion", versionId,
                            "originalDecision", prediction.getDecision().name(),
                            "correctedDecision", correctLabel.name()));
            return new LearnerUpdate(versionId, true);
        } catch (RuntimeException e) {
            metrics.recordOnlineUpdate(false);
            structuredLogger.logFeedbackEvent(prediction.getRequestId(), FeedbackEventType.LEARNER_FAILED,
                    "Online learner update failed", Map.of(
                            "learnerVersion", versionId,
                            "error", String.valueOf(e.getMessage())));
            return new LearnerUpdate(versionId, false);
        }
    }

    private Mono<Boolean> recordCorrection(FeedbackSubmission feedback, PredictionRecord prediction,
                                           Decision correctLabel, LearnerUpdate update) {
        CorrectionRecord correction = CorrectionRecord.builder()
                .correctionId(UUID.randomUUID().toString())
                .requestId(prediction.getRequestId())
                .modelVersion(prediction.getModelVersion())
                .learnerVersion(update.learnerVersion())
                .originalDecision(prediction.getDecision())
                .correctedDecision(correctLabel)
                .features(prediction.getFeatures())
                .feedbackType(feedback.getFeedbackType())
                .userId(feedback.getUserId())
                .learnerUpdated(update.applied())
                .createdAt(clock.instant())
                .build();
        return writer.attempt(BestEffortWriter.CORRECTIONS, prediction.getRequestId(),
                        () -> correctionStore.append(correction))
                .doOnNext(ok -> {
                    if (ok) {
                        metrics.getCorrectionsRecorded().increment();
                    }
                    structuredLogger.logFeedbackEvent(prediction.getRequestId(),
                            ok ? FeedbackEventType.CORRECTION_RECORDED : FeedbackEventType.CORRECTION_FAILED,
                            ok ? "Correction recorded" : "Correction not recorded",
                            Map.of("correctionId", correction.getCorrectionId()));
                });
    }

    record LearnerUpdate(String learnerVersion, boolean applied) {
    }
}
