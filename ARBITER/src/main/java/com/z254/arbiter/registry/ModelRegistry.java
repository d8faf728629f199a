package com.z254.arbiter.registry;

import com.z254.arbiter.domain.exception.ABTestConfigurationException;
import com.z254.arbiter.domain.exception.InvalidModelStateException;
import com.z254.arbiter.domain.exception.ModelNotFoundException;
import com.z254.arbiter.domain.model.ABTest;
import com.z254.arbiter.domain.model.ABTestStatus;
import com.z254.arbiter.domain.model.ModelStatus;
import com.z254.arbiter.domain.model.ModelType;
import com.z254.arbiter.domain.model.ModelVersion;
import com.z254.arbiter.model.GovernanceModel;
import com.z254.arbiter.observability.ArbiterMetrics;
import com.z254.arbiter.observability.ArbiterStructuredLogger;
import com.z254.arbiter.observability.ArbiterStructuredLogger.ModelEventType;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Instant;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Source of truth for model versions, their artifacts, the active version
 * per {@link ModelType} and A/B test configurations.
 * <p>
 * Reads are lock-free against the current {@link RegistrySnapshot}. Writes
 * are serialized and each publishes a complete new snapshot, so promoting a
 * version retires the previous ACTIVE one in the same step.
 */
@Slf4j
@Component
public class ModelRegistry {

    private final AtomicReference<RegistrySnapshot> state = new AtomicReference<>(RegistrySnapshot.empty());
    private final Map<String, GovernanceModel> artifacts = new ConcurrentHashMap<>();
    private final Map<String, ABTestMetrics> abTestMetrics = new ConcurrentHashMap<>();
    private final Object writeLock = new Object();

    private final Clock clock;
    private final ArbiterMetrics metrics;
    private final ArbiterStructuredLogger structuredLogger;

    public ModelRegistry(Clock clock, ArbiterMetrics metrics, ArbiterStructuredLogger structuredLogger) {
        this.clock = clock;
        this.metrics = metrics;
        this.structuredLogger = structuredLogger;
    }

    // ========== Versions ==========

    public Optional<String> getActive(ModelType type) {
        return Optional.ofNullable(state.get().active().get(type));
    }

    public Map<ModelType, String> activeVersions() {
        return state.get().active();
    }

    public Optional<ModelVersion> getVersion(String versionId) {
        return Optional.ofNullable(state.get().versions().get(versionId));
    }

    public List<ModelVersion> listVersions() {
        return state.get().versions().values().stream()
                .sorted(Comparator.comparing(ModelVersion::getCreatedAt,
                        Comparator.nullsFirst(Comparator.naturalOrder())))
                .toList();
    }

    /**
     * Record a new version with its artifact. The version enters in its own
     * status, which must not be ACTIVE; activation goes through {@link #promote}.
     */
    public ModelVersion register(ModelVersion version, GovernanceModel artifact) {
        if (version.getStatus() == ModelStatus.ACTIVE || version.getStatus() == ModelStatus.RETIRED) {
            throw new InvalidModelStateException("Cannot register " + version.getVersionId()
                    + " as " + version.getStatus() + "; register then promote");
        }
        synchronized (writeLock) {
            RegistrySnapshot current = state.get();
            if (current.versions().containsKey(version.getVersionId())) {
                throw new InvalidModelStateException("Version already registered: " + version.getVersionId());
            }
            ModelVersion stored = version.getCreatedAt() != null
                    ? version
                    : version.toBuilder().createdAt(clock.instant()).build();
            if (artifact != null) {
                artifacts.put(stored.getVersionId(), artifact);
            }
            Map<String, ModelVersion> versions = new HashMap<>(current.versions());
            versions.put(stored.getVersionId(), stored);
            state.set(current.withVersions(versions, current.active()));

            structuredLogger.logModelEvent(stored.getVersionId(), ModelEventType.REGISTERED,
                    "Model version registered", Map.of(
                            "modelType", stored.getModelType().name(),
                            "status", stored.getStatus().name()));
            return stored;
        }
    }

    /**
     * Make {@code versionId} the ACTIVE version of its type, retiring the
     * previous ACTIVE version in the same snapshot.
     */
    public ModelVersion promote(String versionId) {
        synchronized (writeLock) {
            RegistrySnapshot current = state.get();
            ModelVersion target = current.versions().get(versionId);
            if (target == null) {
                throw new ModelNotFoundException(versionId);
            }
            if (target.isActive()) {
                return target;
            }
            if (!target.getStatus().canTransitionTo(ModelStatus.ACTIVE)) {
                throw new InvalidModelStateException("Cannot promote " + versionId + " from " + target.getStatus());
            }
            if (!artifacts.containsKey(versionId)) {
                throw new InvalidModelStateException("No artifact loaded for " + versionId);
            }

            Instant now = clock.instant();
            ModelType type = target.getModelType();
            Map<String, ModelVersion> versions = new HashMap<>(current.versions());
            String previousId = current.active().get(type);
            if (previousId != null) {
                ModelVersion previous = versions.get(previousId);
                versions.put(previousId, previous.toBuilder()
                        .status(ModelStatus.RETIRED)
                        .retiredAt(now)
                        .build());
            }
            ModelVersion promoted = target.toBuilder()
                    .status(ModelStatus.ACTIVE)
                    .deployedAt(now)
                    .retiredAt(null)
                    .build();
            versions.put(versionId, promoted);

            Map<ModelType, String> active = new EnumMap<>(ModelType.class);
            active.putAll(current.active());
            active.put(type, versionId);
            state.set(current.withVersions(versions, active));

            metrics.recordPromotion(type);
            Map<String, Object> details = new HashMap<>();
            details.put("modelType", type.name());
            details.put("retired", previousId);
            structuredLogger.logModelEvent(versionId, ModelEventType.PROMOTED, "Model version promoted", details);
            return promoted;
        }
    }

    /**
     * Re-activate the most recently retired version of {@code type}.
     */
    public ModelVersion rollback(ModelType type) {
        synchronized (writeLock) {
            ModelVersion previous = state.get().versions().values().stream()
                    .filter(v -> v.getModelType() == type)
                    .filter(v -> v.getStatus() == ModelStatus.RETIRED)
                    .filter(v -> v.getRetiredAt() != null && artifacts.containsKey(v.getVersionId()))
                    .max(Comparator.comparing(ModelVersion::getRetiredAt))
                    .orElseThrow(() -> new InvalidModelStateException("No retired " + type + " version to roll back to"));
            ModelVersion restored = promote(previous.getVersionId());
            structuredLogger.logModelEvent(restored.getVersionId(), ModelEventType.ROLLED_BACK,
                    "Model type rolled back", Map.of("modelType", type.name()));
            return restored;
        }
    }

    public GovernanceModel getArtifact(String versionId) {
        GovernanceModel artifact = artifacts.get(versionId);
        if (artifact == null) {
            throw new ModelNotFoundException(versionId);
        }
        return artifact;
    }

    public Optional<GovernanceModel> findArtifact(String versionId) {
        return versionId == null ? Optional.empty() : Optional.ofNullable(artifacts.get(versionId));
    }

    /**
     * Drop the in-memory artifact for a version, leaving its record in place.
     * Used when an artifact is known to be unusable.
     */
    public void unloadArtifact(String versionId) {
        if (artifacts.remove(versionId) != null) {
            log.warn("Unloaded artifact for {}", versionId);
        }
    }

    // ========== A/B tests ==========

    public ABTest createAbTest(String championVersion, String candidateVersion, double trafficSplit) {
        synchronized (writeLock) {
            RegistrySnapshot current = state.get();
            validateSplit(trafficSplit);
            ModelVersion champion = requireTestable(current, championVersion, "champion");
            ModelVersion candidate = requireTestable(current, candidateVersion, "candidate");
            if (championVersion.equals(candidateVersion)) {
                throw new ABTestConfigurationException("Champion and candidate must differ");
            }
            if (!champion.getModelType().isCompatibleWith(candidate.getModelType())) {
                throw new ABTestConfigurationException("Incompatible model types: "
                        + champion.getModelType() + " vs " + candidate.getModelType());
            }
            ModelType scope = champion.getModelType();
            boolean alreadyRunning = current.abTests().values().stream()
                    .anyMatch(t -> t.isActive() && t.getModelType() == scope);
            if (alreadyRunning) {
                throw new ABTestConfigurationException("An A/B test is already active for " + scope);
            }

            ABTest test = ABTest.builder()
                    .testId(newTestId())
                    .modelType(scope)
                    .championVersion(championVersion)
                    .candidateVersion(candidateVersion)
                    .trafficSplit(trafficSplit)
                    .status(ABTestStatus.ACTIVE)
                    .startedAt(clock.instant())
                    .build();
            putTest(current, test);
            structuredLogger.logModelEvent(candidateVersion, ModelEventType.AB_TEST_STARTED,
                    "A/B test started", Map.of(
                            "testId", test.getTestId(),
                            "champion", championVersion,
                            "trafficSplit", trafficSplit));
            return test;
        }
    }

    /**
     * Splits are fixed per test: the running test is superseded by a new one
     * with the same versions and the new split.
     */
    public ABTest updateTrafficSplit(String testId, double trafficSplit) {
        synchronized (writeLock) {
            RegistrySnapshot current = state.get();
            validateSplit(trafficSplit);
            ABTest existing = requireActiveTest(current, testId);
            Instant now = clock.instant();
            ABTest replacement = existing.toBuilder()
                    .testId(newTestId())
                    .trafficSplit(trafficSplit)
                    .status(ABTestStatus.ACTIVE)
                    .startedAt(now)
                    .endedAt(null)
                    .supersededBy(null)
                    .build();
            Map<String, ABTest> tests = new HashMap<>(current.abTests());
            tests.put(testId, existing.toBuilder()
                    .status(ABTestStatus.SUPERSEDED)
                    .endedAt(now)
                    .supersededBy(replacement.getTestId())
                    .build());
            tests.put(replacement.getTestId(), replacement);
            abTestMetrics.put(replacement.getTestId(), new ABTestMetrics());
            state.set(current.withAbTests(tests));

            structuredLogger.logModelEvent(existing.getCandidateVersion(), ModelEventType.AB_TEST_STARTED,
                    "A/B test traffic split changed", Map.of(
                            "testId", replacement.getTestId(),
                            "supersedes", testId,
                            "trafficSplit", trafficSplit));
            return replacement;
        }
    }

    /**
     * End a test, optionally promoting its candidate.
     */
    public ABTest completeAbTest(String testId, boolean promoteCandidate) {
        synchronized (writeLock) {
            ABTest ended = endTest(testId, ABTestStatus.COMPLETED);
            if (promoteCandidate) {
                promote(ended.getCandidateVersion());
            }
            return ended;
        }
    }

    public ABTest cancelAbTest(String testId) {
        synchronized (writeLock) {
            return endTest(testId, ABTestStatus.CANCELLED);
        }
    }

    public List<ABTest> getActiveAbTests() {
        return state.get().abTests().values().stream()
                .filter(ABTest::isActive)
                .sorted(Comparator.comparing(ABTest::getStartedAt))
                .toList();
    }

    public List<ABTest> listAbTests() {
        return state.get().abTests().values().stream()
                .sorted(Comparator.comparing(ABTest::getStartedAt))
                .toList();
    }

    public Optional<ABTest> getAbTest(String testId) {
        return Optional.ofNullable(state.get().abTests().get(testId));
    }

    public Optional<ABTest> activeAbTestFor(ModelType type) {
        return state.get().abTests().values().stream()
                .filter(t -> t.isActive() && t.getModelType() == type)
                .findFirst();
    }

    public ABTestMetrics abTestMetrics(String testId) {
        return abTestMetrics.computeIfAbsent(testId, id -> new ABTestMetrics());
    }

    private ABTest endTest(String testId, ABTestStatus status) {
        RegistrySnapshot current = state.get();
        ABTest existing = requireActiveTest(current, testId);
        ABTest ended = existing.toBuilder()
                .status(status)
                .endedAt(clock.instant())
                .build();
        Map<String, ABTest> tests = new HashMap<>(current.abTests());
        tests.put(testId, ended);
        state.set(current.withAbTests(tests));

        ABTestMetrics tally = abTestMetrics(testId);
        structuredLogger.logModelEvent(ended.getCandidateVersion(), ModelEventType.AB_TEST_ENDED,
                "A/B test ended", Map.of(
                        "testId", testId,
                        "status", status.name(),
                        "requests", tally.requests(),
                        "candidateShare", tally.candidateShare()));
        return ended;
    }

    private void putTest(RegistrySnapshot current, ABTest test) {
        Map<String, ABTest> tests = new HashMap<>(current.abTests());
        tests.put(test.getTestId(), test);
        abTestMetrics.put(test.getTestId(), new ABTestMetrics());
        state.set(current.withAbTests(tests));
    }

    private ModelVersion requireTestable(RegistrySnapshot current, String versionId, String role) {
        if (versionId == null) {
            throw new ABTestConfigurationException("Missing " + role + " version");
        }
        ModelVersion version = current.versions().get(versionId);
        if (version == null) {
            throw new ABTestConfigurationException("Unknown " + role + " version: " + versionId);
        }
        if (version.getStatus() == ModelStatus.FAILED || version.getStatus() == ModelStatus.RETIRED) {
            throw new ABTestConfigurationException(role + " version " + versionId + " is " + version.getStatus());
        }
        if (!artifacts.containsKey(versionId)) {
            throw new ABTestConfigurationException("No artifact loaded for " + role + " version " + versionId);
        }
        return version;
    }

    private static ABTest requireActiveTest(RegistrySnapshot current, String testId) {
        ABTest test = current.abTests().get(testId);
        if (test == null) {
            throw new ABTestConfigurationException("Unknown A/B test: " + testId);
        }
        if (!test.isActive()) {
            throw new ABTestConfigurationException("A/B test " + testId + " is " + test.getStatus());
        }
        return test;
    }

    private static void validateSplit(double trafficSplit) {
        if (!(trafficSplit > 0.0 && trafficSplit < 1.0)) {
            throw new ABTestConfigurationException("Traffic split must be in (0,1): " + trafficSplit);
        }
    }

    private static String newTestId() {
        return "ab-" + UUID.randomUUID().toString().substring(0, 8);
    }
}
