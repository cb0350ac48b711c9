package com.startsmart.model;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Value;

/**
 * Raw counts and run-relative normalized magnitudes for one (grid, category).
 */
@Value
@AllArgsConstructor(access = AccessLevel.PUBLIC)
@Builder(toBuilder = true)
public final class GridMetrics implements FeatureSource {
    public static final String BUSINESS_COUNT = "business_count";
    public static final String INSTAGRAM_VOLUME = "instagram_volume";
    public static final String REDDIT_MENTIONS = "reddit_mentions";
    public static final String SUPPLY_NORM = "supply_norm";
    public static final String DEMAND_INSTAGRAM_NORM = "demand_instagram_norm";
    public static final String DEMAND_REDDIT_NORM = "demand_reddit_norm";

    public final String gridId;
    public final String category;
    public final int businessCount;
    public final int instagramVolume;
    public final int redditMentions;
    public final Double avgRating;
    public final int totalReviews;
    public final double supplyNorm;
    public final double demandInstagramNorm;
    public final double demandRedditNorm;

    public int totalDemandSignals() {
        return instagramVolume + redditMentions;
    }

    @Override
    public Object feature(String name) {
        if (name == null) {
            return null;
        }
        switch (name) {
            case BUSINESS_COUNT:
                return businessCount;
            case INSTAGRAM_VOLUME:
                return instagramVolume;
            case REDDIT_MENTIONS:
                return redditMentions;
            case SUPPLY_NORM:
                return supplyNorm;
            case DEMAND_INSTAGRAM_NORM:
                return demandInstagramNorm;
            case DEMAND_REDDIT_NORM:
                return demandRedditNorm;
            case "avg_rating":
                return avgRating;
            case "total_reviews":
                return totalReviews;
            default:
                return null;
        }
    }
}
