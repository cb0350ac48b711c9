package com.startsmart.bev;

import com.startsmart.model.FeatureSource;
import com.startsmart.model.GeoPoint;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Value;

import java.util.Locale;
import java.util.Map;

/**
 * Feature snapshot of a point's surroundings. Distances are in metres and are absent, not zero,
 * when no landmark of that kind was found.
 */
@Value
@AllArgsConstructor(access = AccessLevel.PUBLIC)
@Builder(toBuilder = true)
public final class BusinessEnvironmentVector implements FeatureSource {
    public final GeoPoint center;
    public final double radiusM;
    @Builder.Default
    public final Map<String, Integer> densities = Map.of();
    @Builder.Default
    public final Map<String, Double> distancesM = Map.of();
    public final Double avgBusinessRating;
    public final Double avgReviewCount;
    public final int totalBusinesses;
    public final int premiumCount;
    public final int economyCount;
    public final double premiumRatio;
    public final double competitionDensity;
    public final String incomeProxy;
    @Builder.Default
    public final Map<String, Boolean> flags = Map.of();

    public int density(String category) {
        return densities.getOrDefault(category, 0);
    }

    public Double distance(String feature) {
        return distancesM.get(feature);
    }

    @Override
    public Object feature(String name) {
        if (name == null) {
            return null;
        }
        if (densities.containsKey(name)) {
            return densities.get(name);
        }
        if (name.startsWith("dist_")) {
            return distancesM.get(name);
        }
        if (flags.containsKey(name)) {
            return flags.get(name);
        }
        switch (name) {
            case "avg_business_rating":
                return avgBusinessRating;
            case "avg_review_count":
                return avgReviewCount;
            case "total_businesses":
                return totalBusinesses;
            case "premium_count":
                return premiumCount;
            case "economy_count":
                return economyCount;
            case "premium_ratio":
                return premiumRatio;
            case "competition_density":
                return competitionDensity;
            case "income_proxy":
                return incomeProxy;
            default:
                return null;
        }
    }

    /**
     * Compact text block for the contextual evaluator prompt.
     */
    public String toPromptText() {
        StringBuilder sb = new StringBuilder(1024);
        sb.append(String.format(Locale.US, "Location: %.6f, %.6f (radius %.0fm)%n", center.lat(), center.lon(), radiusM));
        sb.append("Business density:\n");
        for (Map.Entry<String, Integer> entry : densities.entrySet()) {
            sb.append("- ").append(entry.getKey()).append(": ").append(entry.getValue()).append('\n');
        }
        sb.append("Distances to landmarks (m):\n");
        for (String key : PoiTaxonomy.DISTANCE_TAGS.keySet()) {
            appendDistance(sb, key);
        }
        appendDistance(sb, "dist_main_road");
        sb.append("Economic indicators:\n");
        sb.append("- avg_business_rating: ").append(avgBusinessRating == null ? "n/a" : String.format(Locale.US, "%.2f", avgBusinessRating)).append('\n');
        sb.append("- avg_review_count: ").append(avgReviewCount == null ? "n/a" : String.format(Locale.US, "%.1f", avgReviewCount)).append('\n');
        sb.append("- total_businesses: ").append(totalBusinesses).append('\n');
        sb.append(String.format(Locale.US, "- premium_ratio: %.2f%n", premiumRatio));
        sb.append(String.format(Locale.US, "- competition_density: %.4f%n", competitionDensity));
        sb.append("- income_proxy: ").append(incomeProxy).append('\n');
        sb.append("Flags:\n");
        for (Map.Entry<String, Boolean> entry : flags.entrySet()) {
            sb.append("- ").append(entry.getKey()).append(": ").append(entry.getValue()).append('\n');
        }
        return sb.toString();
    }

    private void appendDistance(StringBuilder sb, String key) {
        Double value = distancesM.get(key);
        sb.append("- ").append(key).append(": ").append(value == null ? "none found" : String.format(Locale.US, "%.0f", value)).append('\n');
    }
}
