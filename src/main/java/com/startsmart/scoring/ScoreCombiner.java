package com.startsmart.scoring;

import com.startsmart.config.Config;
import com.startsmart.core.ConfigurationException;
import com.startsmart.model.CategoryScore;
import com.startsmart.model.ContextualAssessment;
import com.startsmart.model.ProcessingMode;
import com.startsmart.model.Suitability;
import com.startsmart.utils.Numbers;

import java.util.Locale;
import java.util.OptionalDouble;

/**
 * Blends a rule score with an external contextual probability.
 */
public final class ScoreCombiner {
    private static final double WEIGHT_SUM_TOLERANCE = 1e-6;

    private final double ruleWeight;
    private final double contextualWeight;

    public ScoreCombiner(Config config) {
        this(config.getDouble("scoring.weight_rule", 0.65), config.getDouble("scoring.weight_contextual", 0.35));
    }

    public ScoreCombiner(double ruleWeight, double contextualWeight) {
        if (ruleWeight < 0.0 || contextualWeight < 0.0) {
            throw new ConfigurationException("combiner weights must be non-negative");
        }
        if (Math.abs(ruleWeight + contextualWeight - 1.0) > WEIGHT_SUM_TOLERANCE) {
            throw new ConfigurationException(String.format(
                    Locale.ROOT, "combiner weights must sum to 1.0, got %.4f + %.4f", ruleWeight, contextualWeight));
        }
        this.ruleWeight = ruleWeight;
        this.contextualWeight = contextualWeight;
    }

    public double ruleWeight() {
        return ruleWeight;
    }

    public double contextualWeight() {
        return contextualWeight;
    }

    /**
     * Fast mode, or full mode without a usable probability for this category, returns the rule score unchanged
     * and marks it rule-only.
     */
    public CategoryScore combine(CategoryScore ruleScore, ContextualAssessment assessment, ProcessingMode mode) {
        if (mode == ProcessingMode.FAST || assessment == null) {
            return ruleOnly(ruleScore);
        }
        OptionalDouble probability = assessment.probabilityFor(ruleScore.category);
        if (probability.isEmpty()) {
            return ruleOnly(ruleScore);
        }
        double p = probability.getAsDouble();
        double combined = Numbers.clamp01(Numbers.round(ruleWeight * ruleScore.ruleScore + contextualWeight * p, 4));
        Suitability tier = Suitability.fromScore(combined);
        String contextualReasoning = assessment.reasoningFor(ruleScore.category);
        return ruleScore.toBuilder()
                .score(combined)
                .contextualProbability(p)
                .suitability(tier)
                .reasoning(contextualReasoning.isBlank() ? ruleScore.reasoning : contextualReasoning)
                .ruleOnly(false)
                .build();
    }

    private CategoryScore ruleOnly(CategoryScore ruleScore) {
        return ruleScore.toBuilder()
                .score(ruleScore.ruleScore)
                .contextualProbability(null)
                .suitability(Suitability.fromScore(ruleScore.ruleScore))
                .ruleOnly(true)
                .build();
    }

    public static String tierMessage(Suitability tier, String category) {
        String name = category == null ? "" : category.toUpperCase(Locale.ROOT);
        switch (tier) {
            case EXCELLENT:
                return "This location is EXCELLENT for a " + name + ". Strong recommendation to proceed.";
            case GOOD:
                return "This location is GOOD for a " + name + ". Recommended with minor considerations.";
            case MODERATE:
                return "This location has MODERATE potential for a " + name + ". Further analysis recommended.";
            case POOR:
                return "This location shows POOR potential for a " + name + ". Consider alternatives.";
            default:
                return "This location is NOT RECOMMENDED for a " + name + ". High risk.";
        }
    }
}
