package com.z254.arbiter.model;

import com.z254.arbiter.domain.model.Decision;
import com.z254.arbiter.domain.model.FeatureVector;
import com.z254.arbiter.domain.model.IntentClass;
import com.z254.arbiter.domain.model.RiskLevel;
import org.apache.commons.math3.distribution.BetaDistribution;
import org.apache.commons.math3.distribution.PoissonDistribution;
import org.apache.commons.math3.random.RandomGenerator;
import org.apache.commons.math3.random.Well19937c;

import java.util.ArrayList;
import java.util.List;

/**
 * Seeded generator of labeled feature vectors for cold-start training.
 * <p>
 * Samples are drawn in the same normalized space {@code FeatureExtractor}
 * produces and labeled with a fixed rule set, so the same seed always yields
 * the same dataset.
 */
public class SyntheticDataGenerator {

    private static final double CONTENT_LENGTH_SCALE = 2000.0;
    private static final int MAX_POLICY_COUNT = 10;
    private static final int MAX_COMPLIANCE_FLAGS = 5;
    // share of non-harmful samples drawn from the toxic band, so the DENY-on-toxicity rule is learnable
    private static final double TOXIC_BAND_SHARE = 0.25;
    private static final double TOXIC_BAND_FLOOR = 0.4;

    public List<LabeledSample> generate(int count, long seed) {
        RandomGenerator rng = new Well19937c(seed);
        BetaDistribution confidence = new BetaDistribution(rng, 2, 2);
        BetaDistribution lowBias = new BetaDistribution(rng, 1, 3);
        BetaDistribution toxicBias = new BetaDistribution(rng, 5, 2);
        PoissonDistribution length = new PoissonDistribution(rng, 200,
                PoissonDistribution.DEFAULT_EPSILON, PoissonDistribution.DEFAULT_MAX_ITERATIONS);

        IntentClass[] intents = IntentClass.values();
        List<LabeledSample> samples = new ArrayList<>(count);
        for (int i = 0; i < count; i++) {
            IntentClass intent = intents[rng.nextInt(intents.length)];
            double intentConfidence = confidence.sample();
            double riskScore = lowBias.sample();
            double toxicity = intent == IntentClass.HARMFUL ? toxicBias.sample() : benignToxicity(rng, lowBias);
            int hour = rng.nextInt(24);
            int day = rng.nextInt(7);
            boolean businessHours = day < 5 && hour >= 9 && hour < 17;
            int policyDenies = rng.nextInt(2);

            FeatureVector vector = FeatureVector.builder()
                    .intentConfidence(intentConfidence)
                    .intentClass(intent)
                    .intentIsHelpful(intent == IntentClass.HELPFUL)
                    .intentIsHarmful(intent == IntentClass.HARMFUL)
                    .contentLength(Math.min(1.0, length.sample() / CONTENT_LENGTH_SCALE))
                    .contentHasUrls(rng.nextDouble() < 0.2)
                    .contentHasEmail(rng.nextDouble() < 0.1)
                    .contentHasCode(rng.nextDouble() < 0.15)
                    .contentToxicityScore(toxicity)
                    .userHistoryScore(0.5)
                    .timeOfDay(hour / 24.0)
                    .dayOfWeek(day / 7.0)
                    .businessHours(businessHours)
                    .policyMatchCount(rng.nextInt(5) / (double) MAX_POLICY_COUNT)
                    .policyDenyCount(policyDenies / (double) MAX_POLICY_COUNT)
                    .policyAllowCount((2 + rng.nextInt(6)) / (double) MAX_POLICY_COUNT)
                    .riskLevel(RiskLevel.fromScore(riskScore))
                    .complianceFlags(rng.nextInt(3) / (double) MAX_COMPLIANCE_FLAGS)
                    .sensitivityScore(riskScore)
                    .build();

            samples.add(new LabeledSample(vector.toArray(), label(vector, riskScore, policyDenies)));
        }
        return samples;
    }

    /**
     * Mostly low scores, with a band reaching up to 1.0 where toxicity alone
     * decides the label.
     */
    private static double benignToxicity(RandomGenerator rng, BetaDistribution lowBias) {
        if (rng.nextDouble() < TOXIC_BAND_SHARE) {
            return TOXIC_BAND_FLOOR + rng.nextDouble() * (1.0 - TOXIC_BAND_FLOOR);
        }
        return lowBias.sample() * 0.8;
    }

    /**
     * Labeling rules, first match wins.
     */
    static Decision label(FeatureVector v, double riskScore, int policyDenies) {
        if (v.isIntentIsHarmful() || riskScore > 0.8 || v.getContentToxicityScore() > 0.7) {
            return Decision.DENY;
        }
        if (v.getRiskLevel().isHighOrAbove() && policyDenies > 0) {
            return Decision.ESCALATE;
        }
        boolean helpful = v.isIntentIsHelpful() && v.getIntentConfidence() > 0.7;
        if (helpful && v.isBusinessHours() && riskScore < 0.3) {
            return Decision.ALLOW;
        }
        if (v.getIntentConfidence() > 0.8) {
            return Decision.ALLOW;
        }
        return Decision.MONITOR;
    }
}
