package com.z254.arbiter.config;

import com.z254.arbiter.domain.model.ModelType;
import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Positive;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * Configuration properties for the ARBITER service.
 * <p>
 * Provides centralized configuration for:
 * <ul>
 *     <li>Feature extraction lexicons, ranges and business hours</li>
 *     <li>Baseline and online model provisioning</li>
 *     <li>Inference timeout and A/B routing</li>
 *     <li>Prediction/feedback store retention</li>
 *     <li>Drift monitoring</li>
 * </ul>
 */
@Data
@Validated
@Configuration
@ConfigurationProperties(prefix = "arbiter")
public class ArbiterProperties {

    private final Features features = new Features();
    private final Models models = new Models();
    private final Prediction prediction = new Prediction();
    private final AbTesting abTesting = new AbTesting();
    private final Store store = new Store();
    private final Kafka kafka = new Kafka();
    private final Drift drift = new Drift();

    /**
     * Feature extraction configuration.
     */
    @Data
    public static class Features {
        /** Zone used to derive time-of-day and business hours */
        @NotBlank
        private String timezone = "UTC";

        /** First business hour (inclusive) */
        private int businessHoursStart = 9;

        /** Last business hour (exclusive) */
        private int businessHoursEnd = 17;

        /** Content length that maps to 1.0 */
        @Positive
        private int maxContentLength = 2000;

        /** Policy count that maps to 1.0 */
        @Positive
        private int maxPolicyCount = 10;

        /** Compliance flag count that maps to 1.0 */
        @Positive
        private int maxComplianceFlags = 5;

        /** Toxicity added per distinct toxic term found in content */
        private double toxicTermWeight = 0.4;

        private List<String> toxicTerms = new ArrayList<>(List.of(
                "kill", "hate", "idiot", "stupid", "moron", "die", "attack",
                "bomb", "racist", "abuse", "threat", "violent"));

        private List<String> harmfulTerms = new ArrayList<>(List.of(
                "exploit", "malware", "ransomware", "phishing", "steal",
                "bypass security", "weapon", "hack into", "credential dump"));

        private List<String> helpfulTerms = new ArrayList<>(List.of(
                "please help", "how do i", "how to", "explain", "thank",
                "could you", "summarize", "documentation"));
    }

    /**
     * Model provisioning configuration.
     */
    @Data
    public static class Models {
        /** Directory holding persisted artifacts and metadata records */
        @NotBlank
        private String artifactDir = System.getProperty("java.io.tmpdir") + "/arbiter-models";

        private final Baseline baseline = new Baseline();
        private final Online online = new Online();

        @Data
        public static class Baseline {
            private boolean enabled = true;
            private String versionId = "baseline-v1.0";
            @Positive
            private int syntheticSamples = 1000;
            private long seed = 42L;
            @Positive
            private int numTrees = 100;
            /** 0 means unlimited depth */
            private int maxDepth = 10;
            @DecimalMin("0.05")
            @DecimalMax("0.5")
            private double validationFraction = 0.2;
        }

        @Data
        public static class Online {
            private boolean enabled = true;
            private String versionId = "online-v1.0";
            /** Synthetic samples streamed into a fresh learner; 0 keeps it empty */
            private int warmStartSamples = 200;
            private long seed = 7L;
        }
    }

    /**
     * Prediction path configuration.
     */
    @Data
    public static class Prediction {
        /** Model type that serves predict calls */
        private ModelType defaultModelType = ModelType.RANDOM_FOREST;

        /** Upper bound on a single model invocation */
        private Duration inferenceTimeout = Duration.ofMillis(50);

        @Positive
        private int inferenceThreads = 4;
    }

    /**
     * A/B routing configuration.
     */
    @Data
    public static class AbTesting {
        /** Derive the arm from test id + user id instead of a fresh draw */
        private boolean stickyAssignment = false;
    }

    /**
     * Prediction log and feedback store configuration.
     */
    @Data
    public static class Store {
        private StoreType type = StoreType.REDIS;
        private String keyPrefix = "arbiter:";
        private Duration predictionTtl = Duration.ofDays(7);
        private Duration feedbackTtl = Duration.ofDays(30);
        private long memoryMaxEntries = 100_000;
        private int driftHistoryLimit = 100;
    }

    /**
     * Kafka topics for long-term records and alerts.
     */
    @Data
    public static class Kafka {
        private final Topics topics = new Topics();

        @Data
        public static class Topics {
            private String corrections = "arbiter.feedback.corrections";
            private String driftAlerts = "arbiter.drift.alerts";
        }
    }

    /**
     * Drift monitoring configuration.
     */
    @Data
    public static class Drift {
        private DriftMode mode = DriftMode.DISABLED;
        private double threshold = 0.1;
        private Duration currentWindow = Duration.ofHours(24);
        private Duration referenceWindow = Duration.ofDays(7);
        /** Rows required in each window before a check runs */
        @Positive
        private int minSamples = 50;
        private boolean scheduledCheckEnabled = false;
        private Duration checkInterval = Duration.ofHours(1);
    }

    public enum StoreType {
        /** Redis for TTL entries, Kafka for long-term records */
        REDIS,
        /** Process-local stores for development and tests */
        MEMORY
    }

    public enum DriftMode {
        /** Drift checks always report "no data" */
        DISABLED,
        /** Windows are read back from the prediction log */
        PREDICTION_LOG
    }
}
