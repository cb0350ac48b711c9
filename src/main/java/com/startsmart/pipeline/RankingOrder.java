package com.startsmart.pipeline;

import com.startsmart.model.Recommendation;

import java.util.Comparator;
import java.util.function.Function;
import java.util.function.ToDoubleFunction;

/**
 * Score descending, then confidence descending, then grid id ascending.
 */
public final class RankingOrder {
    public static final Comparator<Recommendation> RECOMMENDATIONS = of(
            Recommendation::bestScore,
            r -> r.confidence,
            r -> r.gridId == null ? r.id : r.gridId
    );

    private RankingOrder() {
    }

    static <T> Comparator<T> of(ToDoubleFunction<T> score, ToDoubleFunction<T> confidence, Function<T, String> id) {
        Comparator<T> byScore = Comparator.comparingDouble(score);
        Comparator<T> byConfidence = Comparator.comparingDouble(confidence);
        return byScore.reversed()
                .thenComparing(byConfidence.reversed())
                .thenComparing(id, Comparator.naturalOrder());
    }
}
