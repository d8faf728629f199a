package com.z254.arbiter.store.memory;

import com.z254.arbiter.MutableClock;
import com.z254.arbiter.domain.model.Decision;
import com.z254.arbiter.domain.model.FeedbackRecord;
import com.z254.arbiter.domain.model.FeedbackType;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import reactor.test.StepVerifier;

import java.time.Duration;
import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;

class InMemoryFeedbackStoreTest {

    private static final Instant START = Instant.parse("2024-03-01T00:00:00Z");

    private MutableClock clock;
    private InMemoryFeedbackStore feedbackStore;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(START);
        feedbackStore = new InMemoryFeedbackStore(clock, Duration.ofDays(30), 10_000);
    }

    private FeedbackRecord record(String requestId, FeedbackType type) {
        return FeedbackRecord.builder()
                .requestId(requestId)
                .userId("reviewer-1")
                .feedbackType(type)
                .originalDecision(Decision.ALLOW)
                .modelVersion("rf-1")
                .receivedAt(clock.instant())
                .build();
    }

    @Test
    @DisplayName("should replace earlier feedback for the same request")
    void latestWins() {
        feedbackStore.save(record("req-1", FeedbackType.CORRECT)).block();
        feedbackStore.save(record("req-1", FeedbackType.INCORRECT)).block();

        StepVerifier.create(feedbackStore.find("req-1").map(FeedbackRecord::getFeedbackType))
                .expectNext(FeedbackType.INCORRECT)
                .verifyComplete();
    }

    @Test
    @DisplayName("should drop feedback older than the TTL")
    void dropsExpired() {
        for (int day = 0; day < 1_000; day++) {
            feedbackStore.save(record("req-" + day, FeedbackType.CORRECT)).block();
            clock.advance(Duration.ofDays(1));
        }

        StepVerifier.create(feedbackStore.find("req-0")).verifyComplete();
        StepVerifier.create(feedbackStore.find("req-999")).expectNextCount(1).verifyComplete();
        assertThat(feedbackStore.size()).isLessThanOrEqualTo(30);
    }
}
