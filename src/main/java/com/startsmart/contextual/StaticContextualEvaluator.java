package com.startsmart.contextual;

import com.startsmart.bev.BusinessEnvironmentVector;
import com.startsmart.model.ContextualAssessment;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Deterministic evaluator returning the same probabilities for every location.
 */
public final class StaticContextualEvaluator implements ContextualEvaluator {
    public static final double NEUTRAL_PROBABILITY = 0.5;

    private final Map<String, Double> probabilities;

    public StaticContextualEvaluator(Map<String, Double> probabilities) {
        this.probabilities = Map.copyOf(probabilities);
    }

    public static StaticContextualEvaluator neutral(List<String> categories) {
        Map<String, Double> out = new LinkedHashMap<>();
        for (String category : categories) {
            out.put(category, NEUTRAL_PROBABILITY);
        }
        return new StaticContextualEvaluator(out);
    }

    @Override
    public ContextualAssessment assess(BusinessEnvironmentVector bev) {
        Map<String, String> reasoning = new LinkedHashMap<>();
        for (String category : probabilities.keySet()) {
            reasoning.put(category, "");
        }
        return ContextualAssessment.builder()
                .probabilities(probabilities)
                .reasoning(reasoning)
                .recommendation("")
                .evaluator(name())
                .build();
    }

    @Override
    public String name() {
        return "static";
    }
}
