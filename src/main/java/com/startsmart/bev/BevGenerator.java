package com.startsmart.bev;

import com.startsmart.config.Config;
import com.startsmart.data.BusinessSource;
import com.startsmart.grid.GeoMath;
import com.startsmart.model.BusinessRecord;
import com.startsmart.model.GeoPoint;
import com.startsmart.utils.Numbers;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Builds a {@link BusinessEnvironmentVector} for a point. Densities and economic proxies use the search radius;
 * landmark distances look further out (at least {@code bev.distance_radius_m}).
 */
public final class BevGenerator {
    private static final Logger LOG = LogManager.getLogger(BevGenerator.class);

    static final double HIGH_INCOME_RATING = 4.3;
    static final double HIGH_INCOME_PREMIUM_RATIO = 0.4;
    static final double MID_INCOME_RATING = 3.8;
    static final double MID_INCOME_PREMIUM_RATIO = 0.2;
    static final double ALL_PREMIUM_RATIO = 2.0;

    private final BusinessSource businessSource;
    private final double distanceRadiusM;

    public BevGenerator(BusinessSource businessSource, Config config) {
        this(businessSource, config.getDouble("bev.distance_radius_m", 1000.0));
    }

    public BevGenerator(BusinessSource businessSource, double distanceRadiusM) {
        this.businessSource = businessSource;
        this.distanceRadiusM = distanceRadiusM;
    }

    /**
     * @throws com.startsmart.core.UpstreamUnavailableException when the directory cannot be read
     */
    public BusinessEnvironmentVector generate(GeoPoint center, double radiusM) {
        double searchRadius = Math.max(radiusM, distanceRadiusM);
        List<BusinessRecord> nearby = businessSource.fetchNear(null, center, searchRadius);
        BusinessEnvironmentVector bev = fromRecords(center, radiusM, nearby);
        LOG.debug("bev at {},{} r={}m: {} businesses in radius, {} fetched", center.lat(), center.lon(), radiusM, bev.totalBusinesses, nearby.size());
        return bev;
    }

    /**
     * Pure derivation from an already-fetched record list.
     */
    public static BusinessEnvironmentVector fromRecords(GeoPoint center, double radiusM, List<BusinessRecord> records) {
        List<BusinessRecord> inRadius = new ArrayList<>();
        Map<String, Double> distances = new LinkedHashMap<>();
        for (BusinessRecord record : records) {
            double d = GeoMath.haversineMeters(center.lat(), center.lon(), record.lat, record.lon);
            if (d <= radiusM) {
                inRadius.add(record);
            }
            Set<String> tags = PoiTaxonomy.tagsOf(record);
            for (Map.Entry<String, List<String>> entry : PoiTaxonomy.DISTANCE_TAGS.entrySet()) {
                if (PoiTaxonomy.matchesAny(tags, entry.getValue())) {
                    distances.merge(entry.getKey(), Numbers.round(d, 1), Math::min);
                }
            }
        }
        Double transit = distances.get("dist_transit");
        if (transit != null) {
            distances.put("dist_main_road", Math.max(50.0, transit - 50.0));
        }

        Map<String, Integer> densities = new LinkedHashMap<>();
        for (String category : PoiTaxonomy.DENSITY_TAGS.keySet()) {
            densities.put(category, 0);
        }
        double ratingSum = 0.0;
        int rated = 0;
        double reviewSum = 0.0;
        int reviewed = 0;
        int premium = 0;
        int economy = 0;
        for (BusinessRecord record : inRadius) {
            Set<String> tags = PoiTaxonomy.tagsOf(record);
            for (Map.Entry<String, List<String>> entry : PoiTaxonomy.DENSITY_TAGS.entrySet()) {
                if (PoiTaxonomy.matchesAny(tags, entry.getValue())) {
                    densities.merge(entry.getKey(), 1, Integer::sum);
                }
            }
            if (record.rating != null && record.rating > 0) {
                ratingSum += record.rating;
                rated++;
            }
            if (record.reviewCount > 0) {
                reviewSum += record.reviewCount;
                reviewed++;
            }
            if (record.priceLevel != null) {
                if (record.priceLevel >= 3) {
                    premium++;
                } else {
                    economy++;
                }
            }
        }

        Double avgRating = rated == 0 ? null : Numbers.round(ratingSum / rated, 2);
        Double avgReviews = reviewed == 0 ? null : Numbers.round(reviewSum / reviewed, 1);
        double premiumRatio;
        if (economy > 0) {
            premiumRatio = Numbers.round((double) premium / economy, 2);
        } else {
            premiumRatio = premium > 0 ? ALL_PREMIUM_RATIO : 0.0;
        }
        double area100m2 = Math.PI * radiusM * radiusM / 100.0;
        double competitionDensity = area100m2 > 0 ? Numbers.round(inRadius.size() / area100m2, 4) : 0.0;

        Map<String, Boolean> flags = new LinkedHashMap<>();
        flags.put("mall_within_1km", within(distances, "dist_mall", 1000.0));
        flags.put("university_within_1km", within(distances, "dist_university", 1000.0));
        flags.put("transit_within_300m", within(distances, "dist_transit", 300.0));
        flags.put("park_within_500m", within(distances, "dist_park", 500.0));

        return BusinessEnvironmentVector.builder()
                .center(center)
                .radiusM(radiusM)
                .densities(Collections.unmodifiableMap(densities))
                .distancesM(Collections.unmodifiableMap(distances))
                .avgBusinessRating(avgRating)
                .avgReviewCount(avgReviews)
                .totalBusinesses(inRadius.size())
                .premiumCount(premium)
                .economyCount(economy)
                .premiumRatio(premiumRatio)
                .competitionDensity(competitionDensity)
                .incomeProxy(incomeProxy(avgRating, premiumRatio))
                .flags(Collections.unmodifiableMap(flags))
                .build();
    }

    static String incomeProxy(Double avgRating, double premiumRatio) {
        double rating = avgRating == null ? 0.0 : avgRating;
        if (rating >= HIGH_INCOME_RATING && premiumRatio >= HIGH_INCOME_PREMIUM_RATIO) {
            return "high";
        }
        if (rating >= MID_INCOME_RATING && premiumRatio >= MID_INCOME_PREMIUM_RATIO) {
            return "mid";
        }
        return "low";
    }

    private static boolean within(Map<String, Double> distances, String key, double limit) {
        Double value = distances.get(key);
        return value != null && value <= limit;
    }

    /**
     * Empty snapshot used when the directory is unreachable.
     */
    public static BusinessEnvironmentVector empty(GeoPoint center, double radiusM) {
        return fromRecords(center, radiusM, List.of());
    }
}
