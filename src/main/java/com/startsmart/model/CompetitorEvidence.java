package com.startsmart.model;

public record CompetitorEvidence(
        String id,
        String name,
        Double rating,
        int reviewCount,
        double lat,
        double lon,
        double distanceKm
) {
}
