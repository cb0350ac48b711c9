package com.startsmart.model;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Value;

import java.util.List;
import java.util.Map;
import java.util.OptionalDouble;

/**
 * Opinion supplied by an external evaluator: one probability per category plus free text.
 */
@Value
@AllArgsConstructor(access = AccessLevel.PUBLIC)
@Builder(toBuilder = true)
public final class ContextualAssessment {
    @Builder.Default
    public final Map<String, Double> probabilities = Map.of();
    @Builder.Default
    public final Map<String, String> reasoning = Map.of();
    @Builder.Default
    public final List<String> keyFactors = List.of();
    @Builder.Default
    public final List<String> risks = List.of();
    public final String recommendation;
    public final String evaluator;

    public OptionalDouble probabilityFor(String category) {
        Double value = probabilities.get(category);
        if (value == null || value.isNaN()) {
            return OptionalDouble.empty();
        }
        return OptionalDouble.of(Math.max(0.0, Math.min(1.0, value)));
    }

    public String reasoningFor(String category) {
        return reasoning.getOrDefault(category, "");
    }
}
