package com.z254.arbiter.routing;

import com.z254.arbiter.config.ArbiterProperties;
import com.z254.arbiter.domain.model.ABTest;
import com.z254.arbiter.domain.model.ModelType;
import com.z254.arbiter.registry.ABTestMetrics;
import com.z254.arbiter.registry.ModelRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.nio.charset.StandardCharsets;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ThreadLocalRandom;
import java.util.function.DoubleSupplier;

/**
 * Chooses the model version that serves a prediction.
 * <p>
 * With an active A/B test for the type, each request is an independent
 * weighted draw: below the traffic split goes to the candidate, otherwise
 * the champion. When sticky assignment is enabled and the caller supplies a
 * stable key, the draw is derived from the test id and that key instead.
 * A version whose artifact is not loaded is never returned.
 */
@Slf4j
@Component
public class ABRouter {

    private final ModelRegistry registry;
    private final boolean stickyAssignment;
    private final DoubleSupplier draw;

    @Autowired
    public ABRouter(ModelRegistry registry, ArbiterProperties properties) {
        this(registry, properties.getAbTesting().isStickyAssignment(),
                () -> ThreadLocalRandom.current().nextDouble());
    }

    ABRouter(ModelRegistry registry, boolean stickyAssignment, DoubleSupplier draw) {
        this.registry = registry;
        this.stickyAssignment = stickyAssignment;
        this.draw = draw;
    }

    public RoutingDecision select(ModelType type, boolean allowAb, String stickyKey) {
        if (allowAb) {
            Optional<ABTest> test = registry.activeAbTestFor(type);
            if (test.isPresent()) {
                RoutingDecision routed = route(test.get(), stickyKey);
                if (registry.findArtifact(routed.versionId()).isPresent()) {
                    ABTestMetrics tally = registry.abTestMetrics(routed.abTestId());
                    if (routed.arm() == RoutingDecision.Arm.CANDIDATE) {
                        tally.recordCandidate();
                    } else {
                        tally.recordChampion();
                    }
                    return routed;
                }
                log.warn("A/B test {} selected {} without a loaded artifact, using active {} version",
                        routed.abTestId(), routed.versionId(), type);
            }
        }
        return registry.getActive(type)
                .filter(versionId -> registry.findArtifact(versionId).isPresent())
                .map(RoutingDecision::direct)
                .orElseGet(RoutingDecision::none);
    }

    private RoutingDecision route(ABTest test, String stickyKey) {
        double p = stickyAssignment && stickyKey != null && !stickyKey.isBlank()
                ? stickyDraw(test.getTestId(), stickyKey)
                : draw.getAsDouble();
        return p < test.getTrafficSplit()
                ? new RoutingDecision(test.getCandidateVersion(), test.getTestId(), RoutingDecision.Arm.CANDIDATE)
                : new RoutingDecision(test.getChampionVersion(), test.getTestId(), RoutingDecision.Arm.CHAMPION);
    }

    /**
     * Stable value in [0,1) for a test id and key.
     */
    static double stickyDraw(String testId, String key) {
        long bits = UUID.nameUUIDFromBytes((testId + ":" + key).getBytes(StandardCharsets.UTF_8))
                .getMostSignificantBits();
        return (bits >>> 11) * 0x1.0p-53;
    }
}
