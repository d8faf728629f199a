package com.z254.arbiter.api.v1;

import com.z254.arbiter.api.dto.CreateAbTestRequest;
import com.z254.arbiter.api.dto.FeedbackRequest;
import com.z254.arbiter.api.dto.PredictRequest;
import com.z254.arbiter.domain.model.Decision;
import com.z254.arbiter.domain.model.FeedbackType;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.reactive.AutoConfigureWebTestClient;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.http.MediaType;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.web.reactive.server.WebTestClient;

import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Integration tests for the governance HTTP API.
 */
@SpringBootTest(webEnvironment = SpringBootTest.WebEnvironment.RANDOM_PORT)
@AutoConfigureWebTestClient
@ActiveProfiles("test")
class GovernanceApiIntegrationTest {

    @Autowired
    private WebTestClient webTestClient;

    private WebTestClient.ResponseSpec predict(PredictRequest request) {
        return webTestClient.post()
                .uri("/api/v1/governance/predict")
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue(request)
                .exchange();
    }

    private static PredictRequest request(String requestId, String content) {
        PredictRequest request = new PredictRequest();
        request.setRequestId(requestId);
        request.setContent(content);
        request.setUserId("user-1");
        return request;
    }

    @Nested
    @DisplayName("POST /api/v1/governance/predict")
    class Predict {

        @Test
        @DisplayName("should return a decision with reasoning and the serving version")
        void predictsDecision() {
            predict(request("it-predict-1", "Can you help me summarize this quarterly report?"))
                    .expectStatus().isOk()
                    .expectBody()
                    .jsonPath("$.requestId").isEqualTo("it-predict-1")
                    .jsonPath("$.decision").exists()
                    .jsonPath("$.confidence").isNumber()
                    .jsonPath("$.reasoning").value(reasoning ->
                            assertThat((String) reasoning).contains("decision with").contains("confidence"))
                    .jsonPath("$.modelVersion").exists()
                    .jsonPath("$.features.intentConfidence").isNumber();
        }

        @Test
        @DisplayName("should not allow toxic content and should mention toxicity")
        void toxicContent() {
            predict(request("it-toxic-1", "I hate you, you idiot, I will kill you"))
                    .expectStatus().isOk()
                    .expectBody()
                    .jsonPath("$.decision").value(decision ->
                            assertThat(decision).isIn(Decision.DENY.name(), Decision.ESCALATE.name()))
                    .jsonPath("$.reasoning").value(reasoning ->
                            assertThat((String) reasoning).contains("toxicity"));
        }

        @Test
        @DisplayName("should deny or escalate when the caller reports high toxicity")
        void contextToxicity() {
            PredictRequest toxic = request("it-toxic-2", "hello there");
            toxic.setContext(Map.of("toxicity_score", 0.95));

            predict(toxic)
                    .expectStatus().isOk()
                    .expectBody()
                    .jsonPath("$.features.contentToxicityScore").isEqualTo(0.95)
                    .jsonPath("$.decision").value(decision ->
                            assertThat(decision).isIn(Decision.DENY.name(), Decision.ESCALATE.name()))
                    .jsonPath("$.reasoning").value(reasoning ->
                            assertThat((String) reasoning).contains("High toxicity score detected"));
        }

        @Test
        @DisplayName("should generate a request id when none is given")
        void generatesRequestId() {
            predict(request(null, "hello"))
                    .expectStatus().isOk()
                    .expectBody()
                    .jsonPath("$.requestId").isNotEmpty();
        }

        @Test
        @DisplayName("should reject a request without content")
        void missingContent() {
            predict(request("it-invalid-1", null))
                    .expectStatus().isBadRequest()
                    .expectBody()
                    .jsonPath("$.status").isEqualTo(400);
        }
    }

    @Nested
    @DisplayName("POST /api/v1/governance/feedback")
    class Feedback {

        private WebTestClient.BodyContentSpec feedback(String requestId, Decision correct) {
            FeedbackRequest request = new FeedbackRequest();
            request.setRequestId(requestId);
            request.setUserId("reviewer-1");
            request.setFeedbackType(FeedbackType.INCORRECT);
            request.setCorrectDecision(correct);
            return webTestClient.post()
                    .uri("/api/v1/governance/feedback")
                    .contentType(MediaType.APPLICATION_JSON)
                    .bodyValue(request)
                    .exchange()
                    .expectStatus().isOk()
                    .expectBody();
        }

        @Test
        @DisplayName("should not accept feedback for an unknown request id")
        void unknownRequest() {
            feedback("never-issued", Decision.DENY)
                    .jsonPath("$.accepted").isEqualTo(false);
        }

        @Test
        @DisplayName("should accept a correction for an issued decision")
        void acceptsCorrection() throws InterruptedException {
            predict(request("it-feedback-1", "Please review this paragraph")).expectStatus().isOk();

            // the prediction log write is asynchronous
            boolean accepted = false;
            for (int attempt = 0; attempt < 50 && !accepted; attempt++) {
                Boolean result = (Boolean) webTestClient.post()
                        .uri("/api/v1/governance/feedback")
                        .contentType(MediaType.APPLICATION_JSON)
                        .bodyValue(Map.of(
                                "requestId", "it-feedback-1",
                                "feedbackType", "CORRECT"))
                        .exchange()
                        .expectStatus().isOk()
                        .expectBody(Map.class)
                        .returnResult()
                        .getResponseBody()
                        .get("accepted");
                accepted = Boolean.TRUE.equals(result);
                if (!accepted) {
                    Thread.sleep(50);
                }
            }
            assertThat(accepted).isTrue();

            feedback("it-feedback-1", Decision.ESCALATE)
                    .jsonPath("$.accepted").isEqualTo(true);
        }

        @Test
        @DisplayName("should reject feedback without a type")
        void missingType() {
            webTestClient.post()
                    .uri("/api/v1/governance/feedback")
                    .contentType(MediaType.APPLICATION_JSON)
                    .bodyValue(Map.of("requestId", "it-feedback-2"))
                    .exchange()
                    .expectStatus().isBadRequest();
        }
    }

    @Nested
    @DisplayName("reporting")
    class Reporting {

        @Test
        @DisplayName("should report active versions in the engine status")
        void status() {
            webTestClient.get()
                    .uri("/api/v1/governance/status")
                    .exchange()
                    .expectStatus().isOk()
                    .expectBody()
                    .jsonPath("$.activeVersions.RANDOM_FOREST").exists()
                    .jsonPath("$.activeVersions.ONLINE_LEARNER").exists()
                    .jsonPath("$.storeType").isEqualTo("MEMORY");
        }

        @Test
        @DisplayName("should report the engine healthy once models are provisioned")
        void health() {
            webTestClient.get()
                    .uri("/actuator/health")
                    .exchange()
                    .expectStatus().isOk()
                    .expectBody()
                    .jsonPath("$.components.arbiter.status").isEqualTo("UP");
        }

        @Test
        @DisplayName("should list metrics for every registered version")
        void modelMetrics() {
            webTestClient.get()
                    .uri("/api/v1/models/metrics")
                    .exchange()
                    .expectStatus().isOk()
                    .expectBody()
                    .jsonPath("$[0].versionId").exists()
                    .jsonPath("$[0].modelType").exists();
        }

        @Test
        @DisplayName("should report online learner state")
        void onlineLearning() {
            webTestClient.get()
                    .uri("/api/v1/models/online-learning")
                    .exchange()
                    .expectStatus().isOk()
                    .expectBody()
                    .jsonPath("$[0].loaded").isEqualTo(true);
        }
    }

    @Nested
    @DisplayName("drift and admin")
    class Admin {

        @Test
        @DisplayName("should report no content when drift data is unavailable")
        void driftNoData() {
            webTestClient.post()
                    .uri("/api/v1/drift/check")
                    .exchange()
                    .expectStatus().isNoContent();
        }

        @Test
        @DisplayName("should return an empty drift history")
        void driftHistory() {
            webTestClient.get()
                    .uri("/api/v1/drift/history?limit=5")
                    .exchange()
                    .expectStatus().isOk();
        }

        @Test
        @DisplayName("should reject an out-of-range history limit")
        void driftHistoryLimit() {
            webTestClient.get()
                    .uri("/api/v1/drift/history?limit=0")
                    .exchange()
                    .expectStatus().isBadRequest();
        }

        @Test
        @DisplayName("should return 404 when promoting an unknown version")
        void promoteUnknown() {
            webTestClient.post()
                    .uri("/api/v1/models/does-not-exist/promote")
                    .exchange()
                    .expectStatus().isNotFound();
        }

        @Test
        @DisplayName("should reject an A/B test between unknown versions")
        void invalidAbTest() {
            CreateAbTestRequest request = new CreateAbTestRequest();
            request.setChampionVersion("missing-champion");
            request.setCandidateVersion("missing-candidate");
            request.setTrafficSplit(0.2);

            webTestClient.post()
                    .uri("/api/v1/ab-tests")
                    .contentType(MediaType.APPLICATION_JSON)
                    .bodyValue(request)
                    .exchange()
                    .expectStatus().isBadRequest()
                    .expectBody()
                    .jsonPath("$.error").isEqualTo("Invalid A/B Test");
        }
    }
}
