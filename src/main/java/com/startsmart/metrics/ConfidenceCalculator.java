package com.startsmart.metrics;

import com.startsmart.model.GridMetrics;
import com.startsmart.utils.Numbers;

/**
 * How much demand evidence backs a grid score. Grows logarithmically with post volume;
 * a bonus applies when both channels agree.
 */
public final class ConfidenceCalculator {
    private static final double INSTAGRAM_DIVISOR = 5.0;
    private static final double REDDIT_DIVISOR = 3.0;
    private static final double CROSS_CHANNEL_BONUS = 0.2;

    private ConfidenceCalculator() {
    }

    public static double confidence(GridMetrics metrics) {
        return confidence(metrics.instagramVolume, metrics.redditMentions);
    }

    public static double confidence(int instagramVolume, int redditMentions) {
        int ig = Math.max(0, instagramVolume);
        int reddit = Math.max(0, redditMentions);
        double value = Math.log1p(ig) / INSTAGRAM_DIVISOR + Math.log1p(reddit) / REDDIT_DIVISOR;
        if (ig > 0 && reddit > 0) {
            value += CROSS_CHANNEL_BONUS;
        }
        return Numbers.round(Math.min(1.0, value), 3);
    }
}
