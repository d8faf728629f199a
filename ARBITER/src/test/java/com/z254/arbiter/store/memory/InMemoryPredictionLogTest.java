package com.z254.arbiter.store.memory;

import com.z254.arbiter.MutableClock;
import com.z254.arbiter.domain.model.Decision;
import com.z254.arbiter.domain.model.PredictionRecord;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import reactor.test.StepVerifier;

import java.time.Duration;
import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;

class InMemoryPredictionLogTest {

    private static final Instant START = Instant.parse("2024-03-01T00:00:00Z");

    private MutableClock clock;
    private InMemoryPredictionLog predictionLog;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(START);
        predictionLog = new InMemoryPredictionLog(clock, Duration.ofHours(1), 1_000);
    }

    private static PredictionRecord record(String requestId, Decision decision, Instant timestamp) {
        return PredictionRecord.builder()
                .requestId(requestId)
                .decision(decision)
                .confidence(0.7)
                .modelVersion("rf-1")
                .timestamp(timestamp)
                .build();
    }

    @Test
    @DisplayName("should find an appended record by request id")
    void roundTrip() {
        PredictionRecord record = record("req-1", Decision.ALLOW, START);

        StepVerifier.create(predictionLog.append(record).then(predictionLog.find("req-1")))
                .expectNext(record)
                .verifyComplete();
        StepVerifier.create(predictionLog.find("req-2")).verifyComplete();
    }

    @Test
    @DisplayName("should keep the first record for a request id")
    void appendOnly() {
        predictionLog.append(record("req-1", Decision.ALLOW, START)).block();
        predictionLog.append(record("req-1", Decision.DENY, START)).block();

        assertThat(predictionLog.find("req-1").block().getDecision()).isEqualTo(Decision.ALLOW);
    }

    @Test
    @DisplayName("should forget records once the TTL has passed")
    void expires() {
        predictionLog.append(record("req-1", Decision.ALLOW, START)).block();

        clock.advance(Duration.ofMinutes(59));
        StepVerifier.create(predictionLog.find("req-1")).expectNextCount(1).verifyComplete();

        clock.advance(Duration.ofMinutes(1));
        StepVerifier.create(predictionLog.find("req-1")).verifyComplete();

        predictionLog.append(record("req-2", Decision.ALLOW, clock.instant())).block();
        assertThat(predictionLog.size()).isEqualTo(1);
    }

    @Test
    @DisplayName("should release expired records without further reads")
    void releasesExpired() {
        for (int i = 0; i < 500; i++) {
            predictionLog.append(record("req-" + i, Decision.ALLOW, clock.instant())).block();
            clock.advance(Duration.ofMinutes(5));
        }

        // twelve five-minute steps fit in the hour
        assertThat(predictionLog.size()).isLessThanOrEqualTo(12);
        StepVerifier.create(predictionLog.findBetween(START, clock.instant()))
                .expectNextCount(predictionLog.size())
                .verifyComplete();
    }

    @Test
    @DisplayName("should return records in a half-open window ordered by timestamp")
    void findBetween() {
        predictionLog.append(record("late", Decision.ALLOW, START.plusSeconds(30))).block();
        predictionLog.append(record("early", Decision.ALLOW, START.plusSeconds(10))).block();
        predictionLog.append(record("edge", Decision.ALLOW, START.plusSeconds(40))).block();
        predictionLog.append(record("before", Decision.ALLOW, START)).block();

        StepVerifier.create(predictionLog.findBetween(START.plusSeconds(5), START.plusSeconds(40))
                        .map(PredictionRecord::getRequestId))
                .expectNext("early", "late")
                .verifyComplete();
    }
}
