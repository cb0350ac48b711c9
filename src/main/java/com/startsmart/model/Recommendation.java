package com.startsmart.model;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Value;

import java.util.List;
import java.util.Map;

/**
 * Final output for one grid or point. Field names in the JSON view are a contract with the API layer.
 */
@Value
@AllArgsConstructor(access = AccessLevel.PUBLIC)
@Builder(toBuilder = true)
public final class Recommendation {
    public final String id;
    /** Null for a point that falls outside every known grid. */
    public final String gridId;
    public final double lat;
    public final double lon;
    @Builder.Default
    public final Map<String, CategoryScore> categoryScores = Map.of();
    public final String bestCategory;
    public final String rationale;
    /** Suitability tier summary for the best category, kept apart from the evidence rationale. */
    public final String message;
    @Builder.Default
    public final List<PostEvidence> topPosts = List.of();
    @Builder.Default
    public final List<CompetitorEvidence> competitors = List.of();
    public final ProcessingMode processingMode;
    @Builder.Default
    public final Map<String, Long> timing = Map.of();
    public final double confidence;
    public final boolean lowConfidence;
    public final boolean ruleOnly;
    @Builder.Default
    public final List<String> degradedReasons = List.of();
    /** Businesses of any category inside the query radius; zero for grid sweeps. */
    public final int totalBusinessesNearby;
    /** Evaluator that supplied the contextual opinion, null when none was used. */
    public final String modelUsed;
    @Builder.Default
    public final List<String> keyFactors = List.of();
    @Builder.Default
    public final List<String> risks = List.of();
    public final String contextualRecommendation;

    public double bestScore() {
        CategoryScore best = bestCategory == null ? null : categoryScores.get(bestCategory);
        return best == null ? 0.0 : best.score;
    }
}
