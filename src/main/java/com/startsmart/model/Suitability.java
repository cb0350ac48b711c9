package com.startsmart.model;

/**
 * Tiers are closed below: a score equal to a threshold takes the higher tier.
 */
public enum Suitability {
    EXCELLENT("excellent", 0.80),
    GOOD("good", 0.65),
    MODERATE("moderate", 0.45),
    POOR("poor", 0.25),
    NOT_RECOMMENDED("not_recommended", Double.NEGATIVE_INFINITY);

    private final String wireName;
    private final double threshold;

    Suitability(String wireName, double threshold) {
        this.wireName = wireName;
        this.threshold = threshold;
    }

    public String wireName() {
        return wireName;
    }

    public double threshold() {
        return threshold;
    }

    public static Suitability fromScore(double score) {
        for (Suitability tier : values()) {
            if (score >= tier.threshold) {
                return tier;
            }
        }
        return NOT_RECOMMENDED;
    }
}
