package com.z254.arbiter.observability;

import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.stereotype.Component;

import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Structured logging utility for ARBITER service.
 * <p>
 * Provides consistent, machine-readable log output with:
 * <ul>
 *     <li>MDC context for request, model version and A/B test ids</li>
 *     <li>Domain-specific logging methods for decisions, feedback, models and drift</li>
 * </ul>
 */
@Slf4j
@Component
public class ArbiterStructuredLogger {

    // MDC keys
    public static final String MDC_REQUEST_ID = "requestId";
    public static final String MDC_MODEL_VERSION = "modelVersion";
    public static final String MDC_AB_TEST_ID = "abTestId";

    /**
     * Log a decision event.
     */
    public void logDecisionEvent(String requestId, String modelVersion, String abTestId,
                                 DecisionEventType eventType, String message, Map<String, Object> details) {
        Map<String, String> context = new HashMap<>();
        context.put(MDC_REQUEST_ID, nullToEmpty(requestId));
        context.put(MDC_MODEL_VERSION, nullToEmpty(modelVersion));
        if (abTestId != null) {
            context.put(MDC_AB_TEST_ID, abTestId);
        }
        try (var scope = withContext(context)) {
            Map<String, Object> logData = new LinkedHashMap<>();
            logData.put("event", eventType.name());
            logData.put("requestId", requestId);
            logData.put("modelVersion", modelVersion);
            if (details != null) {
                logData.putAll(details);
            }

            switch (eventType) {
                case DECIDED -> log.debug("{} | data={}", message, formatLogData(logData));
                case FALLBACK -> log.warn("{} | data={}", message, formatLogData(logData));
            }
        }
    }

    /**
     * Log a feedback event.
     */
    public void logFeedbackEvent(String requestId, FeedbackEventType eventType, String message,
                                 Map<String, Object> details) {
        try (var scope = withContext(Map.of(MDC_REQUEST_ID, nullToEmpty(requestId)))) {
            Map<String, Object> logData = new LinkedHashMap<>();
            logData.put("event", eventType.name());
            logData.put("requestId", requestId);
            if (details != null) {
                logData.putAll(details);
            }

            switch (eventType) {
                case RECEIVED, LEARNER_UPDATED, CORRECTION_RECORDED ->
                        log.info("{} | data={}", message, formatLogData(logData));
                case UNKNOWN_REQUEST -> log.info("{} | data={}", message, formatLogData(logData));
                case STORE_FAILED, LEARNER_FAILED, CORRECTION_FAILED ->
                        log.warn("{} | data={}", message, formatLogData(logData));
            }
        }
    }

    /**
     * Log a model lifecycle event.
     */
    public void logModelEvent(String versionId, ModelEventType eventType, String message,
                              Map<String, Object> details) {
        try (var scope = withContext(Map.of(MDC_MODEL_VERSION, nullToEmpty(versionId)))) {
            Map<String, Object> logData = new LinkedHashMap<>();
            logData.put("event", eventType.name());
            logData.put("versionId", versionId);
            if (details != null) {
                logData.putAll(details);
            }

            switch (eventType) {
                case REGISTERED, PROMOTED, RETIRED, ROLLED_BACK, LOADED, TRAINED,
                     AB_TEST_STARTED, AB_TEST_ENDED ->
                        log.info("{} | data={}", message, formatLogData(logData));
                case PROVISIONING_FAILED -> log.error("{} | data={}", message, formatLogData(logData));
            }
        }
    }

    /**
     * Log a drift check outcome.
     */
    public void logDriftEvent(String modelVersion, DriftEventType eventType, String message,
                              Map<String, Object> details) {
        try (var scope = withContext(Map.of(MDC_MODEL_VERSION, nullToEmpty(modelVersion)))) {
            Map<String, Object> logData = new LinkedHashMap<>();
            logData.put("event", eventType.name());
            logData.put("modelVersion", modelVersion);
            if (details != null) {
                logData.putAll(details);
            }

            switch (eventType) {
                case NO_DRIFT, NO_DATA -> log.info("{} | data={}", message, formatLogData(logData));
                case DRIFT_DETECTED, CHECK_FAILED -> log.warn("{} | data={}", message, formatLogData(logData));
            }
        }
    }

    /**
     * Set MDC context.
     */
    public MDCScope withContext(Map<String, String> context) {
        context.forEach(MDC::put);
        return new MDCScope(context.keySet().toArray(new String[0]));
    }

    String formatLogData(Map<String, Object> data) {
        StringBuilder sb = new StringBuilder("{");
        boolean first = true;
        for (Map.Entry<String, Object> entry : data.entrySet()) {
            if (!first) sb.append(", ");
            first = false;

            sb.append("\"").append(entry.getKey()).append("\": ");
            Object value = entry.getValue();
            if (value == null) {
                sb.append("null");
            } else if (value instanceof Number || value instanceof Boolean) {
                sb.append(value);
            } else {
                sb.append("\"").append(escapeJson(value.toString())).append("\"");
            }
        }
        sb.append("}");
        return sb.toString();
    }

    private String escapeJson(String value) {
        return value.replace("\\", "\\\\")
                .replace("\"", "\\\"")
                .replace("\n", "\\n")
                .replace("\r", "\\r")
                .replace("\t", "\\t");
    }

    private static String nullToEmpty(String value) {
        return value != null ? value : "";
    }

    // ========== Event Type Enums ==========

    public enum DecisionEventType {
        DECIDED, FALLBACK
    }

    public enum FeedbackEventType {
        RECEIVED, UNKNOWN_REQUEST, STORE_FAILED, LEARNER_UPDATED, LEARNER_FAILED,
        CORRECTION_RECORDED, CORRECTION_FAILED
    }

    public enum ModelEventType {
        LOADED, TRAINED, REGISTERED, PROMOTED, RETIRED, ROLLED_BACK, PROVISIONING_FAILED,
        AB_TEST_STARTED, AB_TEST_ENDED
    }

    public enum DriftEventType {
        NO_DATA, NO_DRIFT, DRIFT_DETECTED, CHECK_FAILED
    }

    /**
     * Auto-closeable MDC scope for cleanup.
     */
    public static class MDCScope implements AutoCloseable {
        private final String[] keys;

        public MDCScope(String... keys) {
            this.keys = keys;
        }

        @Override
        public void close() {
            for (String key : keys) {
                MDC.remove(key);
            }
        }
    }
}
