package com.z254.arbiter.store;

import com.z254.arbiter.observability.ArbiterMetrics;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import reactor.core.publisher.Mono;
import reactor.test.StepVerifier;

import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;

class BestEffortWriterTest {

    private ArbiterMetrics metrics;
    private BestEffortWriter writer;

    @BeforeEach
    void setUp() {
        metrics = new ArbiterMetrics(new SimpleMeterRegistry());
        writer = new BestEffortWriter(metrics);
    }

    @Test
    @DisplayName("should report a successful write")
    void success() {
        StepVerifier.create(writer.attempt(BestEffortWriter.FEEDBACK, "req-1", Mono::empty))
                .expectNext(true)
                .verifyComplete();

        assertThat(metrics.storeWriteFailures(BestEffortWriter.FEEDBACK)).isZero();
    }

    @Test
    @DisplayName("should count failed and throwing writes without propagating them")
    void failures() {
        StepVerifier.create(writer.attempt(BestEffortWriter.CORRECTIONS, "req-1",
                        () -> Mono.error(new IllegalStateException("broker unavailable"))))
                .expectNext(false)
                .verifyComplete();
        StepVerifier.create(writer.attempt(BestEffortWriter.CORRECTIONS, "req-2", () -> {
                    throw new IllegalStateException("serializer failed");
                }))
                .expectNext(false)
                .verifyComplete();

        assertThat(metrics.storeWriteFailures(BestEffortWriter.CORRECTIONS)).isEqualTo(2);
    }

    @Test
    @DisplayName("should run submitted writes in the background")
    void submit() throws InterruptedException {
        CountDownLatch written = new CountDownLatch(1);

        writer.submit(BestEffortWriter.PREDICTIONS, "req-1", () -> Mono.fromRunnable(written::countDown));

        assertThat(written.await(2, TimeUnit.SECONDS)).isTrue();
    }
}
