package com.z254.arbiter.routing;

import com.z254.arbiter.domain.model.ABTest;
import com.z254.arbiter.domain.model.ModelStatus;
import com.z254.arbiter.domain.model.ModelType;
import com.z254.arbiter.domain.model.ModelVersion;
import com.z254.arbiter.model.GovernanceModel;
import com.z254.arbiter.observability.ArbiterMetrics;
import com.z254.arbiter.observability.ArbiterStructuredLogger;
import com.z254.arbiter.registry.ABTestMetrics;
import com.z254.arbiter.registry.ModelRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.util.Random;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;
import static org.mockito.Mockito.mock;

/**
 * Unit tests for {@link ABRouter}.
 */
class ABRouterTest {

    private ModelRegistry registry;

    @BeforeEach
    void setUp() {
        registry = new ModelRegistry(Clock.systemUTC(), new ArbiterMetrics(new SimpleMeterRegistry()),
                new ArbiterStructuredLogger());
        register("champion", true);
        register("candidate", true);
        registry.promote("champion");
    }

    private void register(String versionId, boolean withArtifact) {
        registry.register(ModelVersion.builder()
                .versionId(versionId)
                .modelType(ModelType.RANDOM_FOREST)
                .status(ModelStatus.TRAINING)
                .build(), withArtifact ? mock(GovernanceModel.class) : null);
    }

    @Test
    @DisplayName("should route to the active version when no test is running")
    void noTestUsesActive() {
        ABRouter router = new ABRouter(registry, false, () -> 0.0);

        RoutingDecision decision = router.select(ModelType.RANDOM_FOREST, true, null);

        assertThat(decision.versionId()).isEqualTo("champion");
        assertThat(decision.usedAbTest()).isFalse();
    }

    @Test
    @DisplayName("should ignore an active test when A/B routing is not requested")
    void abNotRequested() {
        registry.createAbTest("champion", "candidate", 0.99);
        ABRouter router = new ABRouter(registry, false, () -> 0.0);

        RoutingDecision decision = router.select(ModelType.RANDOM_FOREST, false, null);

        assertThat(decision.versionId()).isEqualTo("champion");
        assertThat(decision.usedAbTest()).isFalse();
    }

    @Test
    @DisplayName("should send the configured share of 10,000 requests to the candidate")
    void splitConvergesToConfiguredShare() {
        ABTest test = registry.createAbTest("champion", "candidate", 0.2);
        Random random = new Random(20240301L);
        ABRouter router = new ABRouter(registry, false, random::nextDouble);

        int candidate = 0;
        for (int i = 0; i < 10_000; i++) {
            RoutingDecision decision = router.select(ModelType.RANDOM_FOREST, true, null);
            assertThat(decision.abTestId()).isEqualTo(test.getTestId());
            if (decision.arm() == RoutingDecision.Arm.CANDIDATE) {
                assertThat(decision.versionId()).isEqualTo("candidate");
                candidate++;
            }
        }

        assertThat(candidate / 10_000.0).isCloseTo(0.2, within(0.02));
        ABTestMetrics tally = registry.abTestMetrics(test.getTestId());
        assertThat(tally.requests()).isEqualTo(10_000);
        assertThat(tally.candidateRequests()).isEqualTo(candidate);
    }

    @Test
    @DisplayName("should fall back to the active version when the selected artifact is missing")
    void missingArtifactFallsBack() {
        registry.createAbTest("champion", "candidate", 0.5);
        registry.unloadArtifact("candidate");
        ABRouter router = new ABRouter(registry, false, () -> 0.1);

        RoutingDecision decision = router.select(ModelType.RANDOM_FOREST, true, null);

        assertThat(decision.versionId()).isEqualTo("champion");
        assertThat(decision.usedAbTest()).isFalse();
    }

    @Test
    @DisplayName("should return no version when nothing is active for the type")
    void nothingActive() {
        ABRouter router = new ABRouter(registry, false, () -> 0.5);

        RoutingDecision decision = router.select(ModelType.ONLINE_LEARNER, true, null);

        assertThat(decision.hasVersion()).isFalse();
    }

    @Test
    @DisplayName("should keep a sticky key on the same arm")
    void stickyAssignment() {
        registry.createAbTest("champion", "candidate", 0.5);
        ABRouter router = new ABRouter(registry, true, () -> {
            throw new AssertionError("sticky routing must not draw");
        });

        RoutingDecision first = router.select(ModelType.RANDOM_FOREST, true, "user-42");
        for (int i = 0; i < 20; i++) {
            assertThat(router.select(ModelType.RANDOM_FOREST, true, "user-42").arm()).isEqualTo(first.arm());
        }
        assertThat(ABRouter.stickyDraw("ab-1", "user-42")).isBetween(0.0, 1.0);
    }
}
