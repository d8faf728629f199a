package com.z254.arbiter.reasoning;

import com.z254.arbiter.domain.model.Decision;
import com.z254.arbiter.domain.model.FeatureVector;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Builds the human-readable explanation attached to every decision.
 * <p>
 * Rules are checked in a fixed order and every match contributes one reason:
 * harmful intent, confident helpful intent, high toxicity, outside business
 * hours, elevated risk level.
 */
@Component
public class ReasoningGenerator {

    public static final double HELPFUL_CONFIDENCE_THRESHOLD = 0.8;
    public static final double TOXICITY_THRESHOLD = 0.7;

    static final String HARMFUL = "Content classified as potentially harmful";
    static final String HELPFUL = "High-confidence helpful intent detected";
    static final String TOXIC = "High toxicity score detected";
    static final String OFF_HOURS = "Request made outside business hours";
    static final String NO_FACTORS = "Decision based on ML model analysis: no significant risk factors";

    public String explain(FeatureVector features, Decision decision, double confidence) {
        List<String> reasons = reasons(features);
        if (reasons.isEmpty()) {
            reasons.add(NO_FACTORS);
        }
        return String.format(Locale.ROOT, "%s decision with %.1f%% confidence. Reasons: %s",
                decision.displayName(), confidence * 100.0, String.join("; ", reasons));
    }

    List<String> reasons(FeatureVector features) {
        List<String> reasons = new ArrayList<>();
        if (features.isIntentIsHarmful()) {
            reasons.add(HARMFUL);
        } else if (features.isIntentIsHelpful() && features.getIntentConfidence() > HELPFUL_CONFIDENCE_THRESHOLD) {
            reasons.add(HELPFUL);
        }
        if (features.getContentToxicityScore() > TOXICITY_THRESHOLD) {
            reasons.add(TOXIC);
        }
        if (!features.isBusinessHours()) {
            reasons.add(OFF_HOURS);
        }
        switch (features.getRiskLevel()) {
            case HIGH -> reasons.add("High risk level assessment");
            case CRITICAL -> reasons.add("Critical risk level assessment");
            case LOW, MEDIUM -> {
            }
        }
        return reasons;
    }
}
