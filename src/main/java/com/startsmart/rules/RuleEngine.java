package com.startsmart.rules;

import com.startsmart.model.CategoryScore;
import com.startsmart.model.FeatureSource;
import com.startsmart.model.RuleTraceEntry;
import com.startsmart.model.Suitability;
import com.startsmart.utils.Numbers;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Generic interpreter for rule tables. Starts from the table's base score, adds every firing rule's delta
 * in table order and clamps to [0,1] after each step. Once the score saturates, further rules in the same
 * direction are still traced but have an applied delta of 0.
 */
public final class RuleEngine {

    public CategoryScore evaluate(RuleTable table, FeatureSource features, String category) {
        double score = Numbers.clamp01(table.baseScore);
        List<RuleTraceEntry> trace = new ArrayList<>();
        List<String> positives = new ArrayList<>();
        List<String> concerns = new ArrayList<>();

        for (Rule rule : table.rules) {
            if (!rule.condition.test(features)) {
                continue;
            }
            double delta = rule.effectiveDelta(features);
            double next = Numbers.clamp01(score + delta);
            String reason = rule.reasonFor(delta);
            trace.add(new RuleTraceEntry(rule.name, delta, next - score, reason));
            if (delta > 0) {
                positives.add(reason);
            } else if (delta < 0) {
                concerns.add(reason);
            }
            score = next;
        }

        return CategoryScore.builder()
                .category(category)
                .score(score)
                .ruleScore(score)
                .suitability(Suitability.fromScore(score))
                .reasoning(String.format(Locale.US, "Rule score %.3f from %d applied rules (base %.2f)", score, trace.size(), table.baseScore))
                .positiveFactors(List.copyOf(positives))
                .concerns(List.copyOf(concerns))
                .ruleTrace(List.copyOf(trace))
                .ruleOnly(true)
                .build();
    }
}
