package com.startsmart.pipeline;

import com.startsmart.model.CategoryScore;
import com.startsmart.model.CompetitorEvidence;
import com.startsmart.model.PostEvidence;
import com.startsmart.model.ProcessingMode;
import com.startsmart.model.Recommendation;
import com.startsmart.model.RuleTraceEntry;
import com.startsmart.model.SignalType;
import com.startsmart.model.Suitability;
import org.json.JSONArray;
import org.json.JSONObject;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

class RecommendationJsonTest {

    @Test
    void toJson_shouldUseStableFieldNames() {
        Map<String, CategoryScore> scores = new LinkedHashMap<>();
        scores.put("gym", CategoryScore.builder()
                .category("gym")
                .score(0.9132)
                .ruleScore(0.9132)
                .suitability(Suitability.EXCELLENT)
                .reasoning("Strong demand")
                .positiveFactors(List.of("No competing gyms"))
                .ruleTrace(List.of(new RuleTraceEntry("competition_gap", 0.2, 0.2, "Few existing competitors")))
                .ruleOnly(true)
                .build());
        Recommendation r = Recommendation.builder()
                .id("DHA-Phase2-000-000")
                .gridId("DHA-Phase2-000-000")
                .lat(24.8237)
                .lon(67.0549)
                .categoryScores(scores)
                .bestCategory("gym")
                .rationale("High demand (75 posts), low competition (0 businesses)")
                .topPosts(List.of(new PostEvidence("p-1", "need a gym", SignalType.DEMAND, 12.0, Instant.parse("2026-10-01T00:00:00Z"))))
                .competitors(List.of(new CompetitorEvidence("b-1", "Iron Works", null, 0, 24.824, 67.055, 0.12)))
                .processingMode(ProcessingMode.FAST)
                .timing(Map.of("total_ms", 5L))
                .confidence(1.0)
                .ruleOnly(true)
                .build();

        JSONObject json = RecommendationJson.toJson(r);

        assertEquals(Set.of(
                "id", "grid_id", "lat", "lon", "category_scores", "best_category", "rationale", "message", "top_posts",
                "competitors", "processing_mode", "timing", "confidence", "low_confidence", "rule_only", "degraded_reasons",
                "analysis", "llm_meta"
        ), json.keySet());
        assertEquals("fast", json.getString("processing_mode"));
        JSONObject gym = json.getJSONObject("category_scores").getJSONObject("gym");
        assertEquals("excellent", gym.getString("suitability"));
        assertTrue(gym.isNull("contextual_probability"));
        assertEquals("competition_gap", gym.getJSONArray("rule_trace").getJSONObject(0).getString("rule_name"));
        JSONObject post = json.getJSONArray("top_posts").getJSONObject(0);
        assertEquals("demand", post.getString("type"));
        assertEquals("2026-10-01T00:00:00Z", post.getString("timestamp"));
        JSONObject competitor = json.getJSONArray("competitors").getJSONObject(0);
        assertTrue(competitor.isNull("rating"));
        assertEquals(0.12, competitor.getDouble("distance_km"), 1e-9);
        assertEquals(0, json.getJSONArray("degraded_reasons").length());
    }

    @Test
    void toJson_pointOutsideGrids_shouldWriteNullGridId() {
        Recommendation r = Recommendation.builder()
                .id("point-24.90000-67.10000")
                .processingMode(ProcessingMode.FULL)
                .degradedReasons(List.of("no_demand_signals"))
                .lowConfidence(true)
                .build();

        JSONArray array = RecommendationJson.toJson(List.of(r));

        JSONObject json = array.getJSONObject(0);
        assertTrue(json.isNull("grid_id"));
        assertTrue(json.isNull("best_category"));
        assertEquals("", json.getString("rationale"));
        assertEquals("full", json.getString("processing_mode"));
        assertTrue(json.getBoolean("low_confidence"));
        assertEquals("no_demand_signals", json.getJSONArray("degraded_reasons").getString(0));
        assertTrue(json.isNull("message"));
        assertTrue(json.getJSONObject("analysis").isNull("model_used"));
        assertEquals(0, json.getJSONObject("analysis").getJSONArray("key_factors").length());
        assertTrue(json.getJSONObject("llm_meta").isNull("recommendation"));
    }

    @Test
    void toJson_shouldWriteContextualAnalysisBlocks() {
        Recommendation r = Recommendation.builder()
                .id("point-24.82450-67.05600")
                .bestCategory("cafe")
                .rationale("Moderate demand (4 posts), low competition (1 businesses)")
                .message("Good location for a CAFE")
                .processingMode(ProcessingMode.FULL)
                .totalBusinessesNearby(7)
                .modelUsed("ollama:llama3.1:latest")
                .keyFactors(List.of("office towers", "university"))
                .risks(List.of("parking"))
                .contextualRecommendation("Open a cafe with early hours")
                .build();

        JSONObject json = RecommendationJson.toJson(r);

        assertEquals("Good location for a CAFE", json.getString("message"));
        JSONObject analysis = json.getJSONObject("analysis");
        assertEquals("ollama:llama3.1:latest", analysis.getString("model_used"));
        assertEquals(7, analysis.getInt("total_businesses_nearby"));
        assertEquals(List.of("office towers", "university"), analysis.getJSONArray("key_factors").toList());
        JSONObject llmMeta = json.getJSONObject("llm_meta");
        assertEquals(List.of("parking"), llmMeta.getJSONArray("risks").toList());
        assertEquals("Open a cafe with early hours", llmMeta.getString("recommendation"));
    }
}
