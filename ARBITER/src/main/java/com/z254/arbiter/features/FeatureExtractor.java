package com.z254.arbiter.features;

import com.z254.arbiter.config.ArbiterProperties;
import com.z254.arbiter.domain.model.FeatureVector;
import com.z254.arbiter.domain.model.GovernanceRequest;
import com.z254.arbiter.domain.model.IntentClass;
import com.z254.arbiter.domain.model.RiskLevel;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.DayOfWeek;
import java.time.Instant;
import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.util.List;
import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Turns a governance request into a normalized {@link FeatureVector}.
 * <p>
 * Extraction is pure: the same request (including its timestamp) always
 * yields the same vector. Time fields are taken from the request timestamp,
 * falling back to the injected clock only when the caller omitted one.
 */
@Component
public class FeatureExtractor {

    static final double INFERRED_HARMFUL_CONFIDENCE = 0.85;
    static final double INFERRED_HELPFUL_CONFIDENCE = 0.75;
    static final double DEFAULT_INTENT_CONFIDENCE = 0.5;

    private static final Pattern URL = Pattern.compile("(?i)\\bhttps?://|\\bwww\\.");
    private static final Pattern EMAIL = Pattern.compile("[\\w.+-]+@[\\w-]+\\.[\\w.-]+");
    private static final Pattern CODE = Pattern.compile(
            "```|\\bdef\\s|\\bfunction\\s|\\bclass\\s|\\bimport\\s|<script", Pattern.CASE_INSENSITIVE);

    private final ArbiterProperties.Features config;
    private final ZoneId zone;
    private final Clock clock;
    private final List<String> toxicTerms;
    private final List<String> harmfulTerms;
    private final List<String> helpfulTerms;

    public FeatureExtractor(ArbiterProperties properties, Clock clock) {
        this.config = properties.getFeatures();
        this.zone = ZoneId.of(config.getTimezone());
        this.clock = clock;
        this.toxicTerms = lowercase(config.getToxicTerms());
        this.harmfulTerms = lowercase(config.getHarmfulTerms());
        this.helpfulTerms = lowercase(config.getHelpfulTerms());
    }

    public FeatureVector extract(GovernanceRequest request) {
        String content = request.getContent() != null ? request.getContent() : "";
        String lower = content.toLowerCase(Locale.ROOT);
        GovernanceContext context = GovernanceContext.of(request.getContext());

        IntentClass intent = context.intentClass().orElseGet(() -> inferIntent(lower));
        double intentConfidence = context.intentConfidence().orElse(defaultConfidence(intent, context));

        double lexicalToxicity = lexicalToxicity(lower);
        double toxicity = Math.max(lexicalToxicity, context.toxicityScore().orElse(0.0));

        Instant timestamp = request.getTimestamp() != null ? request.getTimestamp() : clock.instant();
        ZonedDateTime local = timestamp.atZone(zone);
        RiskLevel riskLevel = context.riskLevel();

        return FeatureVector.builder()
                .intentConfidence(GovernanceContext.clip(intentConfidence))
                .intentClass(intent)
                .intentIsHelpful(intent == IntentClass.HELPFUL)
                .intentIsHarmful(intent == IntentClass.HARMFUL)
                .contentLength(ratio(content.length(), config.getMaxContentLength()))
                .contentHasUrls(URL.matcher(content).find())
                .contentHasEmail(EMAIL.matcher(content).find())
                .contentHasCode(CODE.matcher(content).find())
                .contentToxicityScore(toxicity)
                .userHistoryScore(context.userHistoryScore())
                .timeOfDay(local.getHour() / 24.0)
                .dayOfWeek((local.getDayOfWeek().getValue() - 1) / 7.0)
                .businessHours(isBusinessHours(local))
                .policyMatchCount(ratio(context.policyMatches(), config.getMaxPolicyCount()))
                .policyDenyCount(ratio(context.policyDenies(), config.getMaxPolicyCount()))
                .policyAllowCount(ratio(context.policyAllows(), config.getMaxPolicyCount()))
                .riskLevel(riskLevel)
                .complianceFlags(ratio(context.complianceFlags(), config.getMaxComplianceFlags()))
                .sensitivityScore(context.sensitivityScore())
                .build();
    }

    boolean isBusinessHours(ZonedDateTime local) {
        DayOfWeek day = local.getDayOfWeek();
        if (day == DayOfWeek.SATURDAY || day == DayOfWeek.SUNDAY) {
            return false;
        }
        int hour = local.getHour();
        return hour >= config.getBusinessHoursStart() && hour < config.getBusinessHoursEnd();
    }

    double lexicalToxicity(String lowerContent) {
        long hits = toxicTerms.stream().filter(term -> containsWord(lowerContent, term)).count();
        return Math.min(1.0, hits * config.getToxicTermWeight());
    }

    private IntentClass inferIntent(String lowerContent) {
        if (harmfulTerms.stream().anyMatch(term -> containsWord(lowerContent, term))
                || lexicalToxicity(lowerContent) > 0.7) {
            return IntentClass.HARMFUL;
        }
        if (helpfulTerms.stream().anyMatch(lowerContent::contains)) {
            return IntentClass.HELPFUL;
        }
        return IntentClass.NEUTRAL;
    }

    private static double defaultConfidence(IntentClass intent, GovernanceContext context) {
        if (context.intentClass().isPresent()) {
            return DEFAULT_INTENT_CONFIDENCE;
        }
        return switch (intent) {
            case HARMFUL -> INFERRED_HARMFUL_CONFIDENCE;
            case HELPFUL -> INFERRED_HELPFUL_CONFIDENCE;
            case NEUTRAL -> DEFAULT_INTENT_CONFIDENCE;
        };
    }

    private static boolean containsWord(String text, String term) {
        int from = 0;
        while (true) {
            int idx = text.indexOf(term, from);
            if (idx < 0) {
                return false;
            }
            int end = idx + term.length();
            boolean startOk = idx == 0 || !Character.isLetterOrDigit(text.charAt(idx - 1));
            boolean endOk = end >= text.length() || !Character.isLetter(text.charAt(end));
            if (startOk && endOk) {
                return true;
            }
            from = idx + 1;
        }
    }

    private static double ratio(int value, int max) {
        return GovernanceContext.clip(value / (double) max);
    }

    private static List<String> lowercase(List<String> terms) {
        return terms.stream().map(t -> t.toLowerCase(Locale.ROOT)).toList();
    }
}
