package com.startsmart.model;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Value;

import java.util.List;

@Value
@AllArgsConstructor(access = AccessLevel.PUBLIC)
@Builder(toBuilder = true)
public final class CategoryScore {
    public final String category;
    /** Final score in [0,1]. Equal to ruleScore until combined. */
    public final double score;
    public final double ruleScore;
    /** Null in fast mode or when the contextual opinion was unavailable. */
    public final Double contextualProbability;
    public final Suitability suitability;
    public final String reasoning;
    @Builder.Default
    public final List<String> positiveFactors = List.of();
    @Builder.Default
    public final List<String> concerns = List.of();
    @Builder.Default
    public final List<RuleTraceEntry> ruleTrace = List.of();
    public final boolean ruleOnly;
}
