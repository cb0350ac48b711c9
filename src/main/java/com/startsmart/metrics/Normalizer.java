package com.startsmart.metrics;

import com.startsmart.model.GridMetrics;

import java.util.List;

/**
 * Run-relative rescaling of raw counts into [0,1].
 */
public final class Normalizer {

    /**
     * Per-field maxima over one run. A field whose maximum is zero, or an empty run, reports 1.0.
     */
    public record MaxValues(double businessCount, double instagramVolume, double redditMentions) {
        public static final MaxValues UNIT = new MaxValues(1.0, 1.0, 1.0);
    }

    public MaxValues computeMax(List<GridMetrics> metrics) {
        if (metrics == null || metrics.isEmpty()) {
            return MaxValues.UNIT;
        }
        double business = 0.0;
        double instagram = 0.0;
        double reddit = 0.0;
        for (GridMetrics m : metrics) {
            if (m == null) {
                continue;
            }
            business = Math.max(business, m.businessCount);
            instagram = Math.max(instagram, m.instagramVolume);
            reddit = Math.max(reddit, m.redditMentions);
        }
        return new MaxValues(orOne(business), orOne(instagram), orOne(reddit));
    }

    public GridMetrics normalize(GridMetrics metrics, MaxValues max) {
        return metrics.toBuilder()
                .supplyNorm(ratio(metrics.businessCount, max.businessCount()))
                .demandInstagramNorm(ratio(metrics.instagramVolume, max.instagramVolume()))
                .demandRedditNorm(ratio(metrics.redditMentions, max.redditMentions()))
                .build();
    }

    public List<GridMetrics> normalizeAll(List<GridMetrics> metrics) {
        MaxValues max = computeMax(metrics);
        return metrics.stream().map(m -> normalize(m, max)).toList();
    }

    private static double orOne(double max) {
        return max > 0.0 ? max : 1.0;
    }

    private static double ratio(double value, double max) {
        if (value <= 0.0) {
            return 0.0;
        }
        double divisor = max > 0.0 ? max : 1.0;
        return Math.min(1.0, value / divisor);
    }
}
