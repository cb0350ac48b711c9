package com.startsmart.pipeline;

import com.startsmart.model.CategoryScore;
import com.startsmart.model.CompetitorEvidence;
import com.startsmart.model.Explanation;
import com.startsmart.model.PostEvidence;
import com.startsmart.model.Recommendation;
import com.startsmart.model.RuleTraceEntry;
import org.json.JSONArray;
import org.json.JSONObject;

import java.util.List;
import java.util.Map;

/**
 * JSON view of pipeline results. Field names are consumed by the API layer and must stay stable.
 */
public final class RecommendationJson {
    private RecommendationJson() {
    }

    public static JSONArray toJson(List<Recommendation> recommendations) {
        JSONArray out = new JSONArray();
        for (Recommendation r : recommendations) {
            out.put(toJson(r));
        }
        return out;
    }

    public static JSONObject toJson(Recommendation r) {
        JSONObject root = new JSONObject();
        root.put("id", r.id);
        root.put("grid_id", r.gridId == null ? JSONObject.NULL : r.gridId);
        root.put("lat", r.lat);
        root.put("lon", r.lon);
        JSONObject scores = new JSONObject();
        for (Map.Entry<String, CategoryScore> entry : r.categoryScores.entrySet()) {
            scores.put(entry.getKey(), toJson(entry.getValue()));
        }
        root.put("category_scores", scores);
        root.put("best_category", r.bestCategory == null ? JSONObject.NULL : r.bestCategory);
        root.put("rationale", r.rationale == null ? "" : r.rationale);
        root.put("message", r.message == null ? JSONObject.NULL : r.message);
        root.put("top_posts", posts(r.topPosts));
        root.put("competitors", competitors(r.competitors));
        root.put("processing_mode", r.processingMode.wireName());
        root.put("timing", new JSONObject(r.timing));
        root.put("confidence", r.confidence);
        root.put("low_confidence", r.lowConfidence);
        root.put("rule_only", r.ruleOnly);
        root.put("degraded_reasons", new JSONArray(r.degradedReasons));
        JSONObject analysis = new JSONObject();
        analysis.put("model_used", r.modelUsed == null ? JSONObject.NULL : r.modelUsed);
        analysis.put("total_businesses_nearby", r.totalBusinessesNearby);
        analysis.put("key_factors", new JSONArray(r.keyFactors));
        root.put("analysis", analysis);
        JSONObject llmMeta = new JSONObject();
        llmMeta.put("risks", new JSONArray(r.risks));
        llmMeta.put("recommendation", r.contextualRecommendation == null ? JSONObject.NULL : r.contextualRecommendation);
        root.put("llm_meta", llmMeta);
        return root;
    }

    public static JSONObject toJson(Explanation e) {
        JSONObject root = new JSONObject();
        root.put("top_posts", posts(e.topPosts));
        root.put("competitors", competitors(e.competitors));
        root.put("rationale", e.rationale == null ? "" : e.rationale);
        return root;
    }

    static JSONObject toJson(CategoryScore s) {
        JSONObject o = new JSONObject();
        o.put("score", s.score);
        o.put("rule_score", s.ruleScore);
        o.put("contextual_probability", s.contextualProbability == null ? JSONObject.NULL : s.contextualProbability);
        o.put("suitability", s.suitability.wireName());
        o.put("reasoning", s.reasoning == null ? "" : s.reasoning);
        o.put("positive_factors", new JSONArray(s.positiveFactors));
        o.put("concerns", new JSONArray(s.concerns));
        JSONArray trace = new JSONArray();
        for (RuleTraceEntry entry : s.ruleTrace) {
            JSONObject t = new JSONObject();
            t.put("rule_name", entry.ruleName());
            t.put("delta", entry.delta());
            t.put("applied_delta", entry.appliedDelta());
            t.put("reason", entry.reason());
            trace.put(t);
        }
        o.put("rule_trace", trace);
        o.put("rule_only", s.ruleOnly);
        return o;
    }

    private static JSONArray posts(List<PostEvidence> posts) {
        JSONArray out = new JSONArray();
        for (PostEvidence p : posts) {
            JSONObject o = new JSONObject();
            o.put("id", p.id());
            o.put("text", p.text());
            o.put("type", p.type().wireName());
            o.put("engagement", p.engagement());
            o.put("timestamp", p.timestamp() == null ? JSONObject.NULL : p.timestamp().toString());
            out.put(o);
        }
        return out;
    }

    private static JSONArray competitors(List<CompetitorEvidence> competitors) {
        JSONArray out = new JSONArray();
        for (CompetitorEvidence c : competitors) {
            JSONObject o = new JSONObject();
            o.put("id", c.id());
            o.put("name", c.name());
            o.put("rating", c.rating() == null ? JSONObject.NULL : c.rating());
            o.put("review_count", c.reviewCount());
            o.put("lat", c.lat());
            o.put("lon", c.lon());
            o.put("distance_km", c.distanceKm());
            out.put(o);
        }
        return out;
    }
}
