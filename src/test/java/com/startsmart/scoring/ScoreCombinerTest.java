package com.startsmart.scoring;

import com.startsmart.config.Config;
import com.startsmart.core.ConfigurationException;
import com.startsmart.model.CategoryScore;
import com.startsmart.model.ContextualAssessment;
import com.startsmart.model.ProcessingMode;
import com.startsmart.model.Suitability;
import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ScoreCombinerTest {
    private final ScoreCombiner combiner = new ScoreCombiner(0.65, 0.35);

    private static CategoryScore rule(double score) {
        return CategoryScore.builder()
                .category("gym")
                .score(score)
                .ruleScore(score)
                .suitability(Suitability.fromScore(score))
                .reasoning("rules")
                .ruleOnly(true)
                .build();
    }

    private static ContextualAssessment opinion(double gym) {
        return ContextualAssessment.builder()
                .probabilities(Map.of("gym", gym))
                .reasoning(Map.of("gym", "busy office district"))
                .evaluator("test")
                .build();
    }

    @Test
    void combine_shouldReturnExactRuleScoreInFastMode() {
        CategoryScore out = combiner.combine(rule(0.71326), opinion(0.9), ProcessingMode.FAST);

        assertEquals(0.71326, out.score, 0.0);
        assertTrue(out.ruleOnly);
        assertNull(out.contextualProbability);
        assertEquals("rules", out.reasoning);
    }

    @Test
    void combine_shouldBlendAndRoundInFullMode() {
        CategoryScore out = combiner.combine(rule(0.6), opinion(0.8), ProcessingMode.FULL);

        assertEquals(0.67, out.score, 1e-12);
        assertEquals(0.6, out.ruleScore, 0.0);
        assertEquals(0.8, out.contextualProbability, 0.0);
        assertEquals(Suitability.GOOD, out.suitability);
        assertEquals("busy office district", out.reasoning);
        assertFalse(out.ruleOnly);
    }

    @Test
    void combine_shouldFallBackToRuleOnlyWhenCategoryMissing() {
        ContextualAssessment cafeOnly = ContextualAssessment.builder().probabilities(Map.of("cafe", 0.9)).build();

        CategoryScore out = combiner.combine(rule(0.55), cafeOnly, ProcessingMode.FULL);
        CategoryScore none = combiner.combine(rule(0.55), null, ProcessingMode.FULL);

        assertEquals(0.55, out.score, 0.0);
        assertTrue(out.ruleOnly);
        assertTrue(none.ruleOnly);
    }

    @Test
    void combine_shouldBeMonotonicInBothInputs() {
        double previous = -1.0;
        for (int i = 0; i <= 20; i++) {
            double score = combiner.combine(rule(0.5), opinion(i / 20.0), ProcessingMode.FULL).score;
            assertTrue(score >= previous, "probability step " + i);
            previous = score;
        }
        previous = -1.0;
        for (int i = 0; i <= 20; i++) {
            double score = combiner.combine(rule(i / 20.0), opinion(0.5), ProcessingMode.FULL).score;
            assertTrue(score >= previous, "rule step " + i);
            previous = score;
        }
    }

    @Test
    void suitability_shouldUseClosedLowerBounds() {
        assertEquals(Suitability.EXCELLENT, combiner.combine(rule(0.80), null, ProcessingMode.FAST).suitability);
        assertEquals(Suitability.GOOD, combiner.combine(rule(0.65), null, ProcessingMode.FAST).suitability);
        assertEquals(Suitability.MODERATE, combiner.combine(rule(0.45), null, ProcessingMode.FAST).suitability);
        assertEquals(Suitability.POOR, combiner.combine(rule(0.25), null, ProcessingMode.FAST).suitability);
        assertEquals(Suitability.NOT_RECOMMENDED, combiner.combine(rule(0.2499), null, ProcessingMode.FAST).suitability);
    }

    @Test
    void constructor_shouldRejectWeightsThatDoNotSumToOne() {
        assertThrows(ConfigurationException.class, () -> new ScoreCombiner(0.7, 0.35));
        assertThrows(ConfigurationException.class, () -> new ScoreCombiner(-0.1, 1.1));
        assertThrows(ConfigurationException.class, () -> new ScoreCombiner(Config.ofDefaults(Map.of(
                "scoring.weight_rule", "0.5",
                "scoring.weight_contextual", "0.4"
        ))));
        assertEquals(0.35, new ScoreCombiner(Config.ofDefaults(Map.of())).contextualWeight(), 0.0);
    }

    @Test
    void tierMessage_shouldNameCategory() {
        assertEquals("This location is GOOD for a GYM. Recommended with minor considerations.",
                ScoreCombiner.tierMessage(Suitability.GOOD, "gym"));
        assertTrue(ScoreCombiner.tierMessage(Suitability.NOT_RECOMMENDED, "cafe").contains("NOT RECOMMENDED"));
    }
}
