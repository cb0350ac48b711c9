package com.startsmart.bev;

import com.startsmart.model.BusinessRecord;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Maps directory tags to density categories and landmark distance features.
 */
public final class PoiTaxonomy {
    public static final Map<String, List<String>> DENSITY_TAGS = buildDensityTags();
    public static final Map<String, List<String>> DISTANCE_TAGS = buildDistanceTags();

    private PoiTaxonomy() {
    }

    /**
     * Lower-cased category plus raw types of a record.
     */
    public static Set<String> tagsOf(BusinessRecord record) {
        Set<String> tags = new LinkedHashSet<>();
        if (record.category != null && !record.category.isBlank()) {
            tags.add(record.category.trim().toLowerCase(Locale.ROOT));
        }
        if (record.types != null) {
            for (String type : record.types) {
                if (type != null && !type.isBlank()) {
                    tags.add(type.trim().toLowerCase(Locale.ROOT));
                }
            }
        }
        return tags;
    }

    public static boolean matchesAny(Set<String> tags, List<String> wanted) {
        for (String tag : wanted) {
            if (tags.contains(tag)) {
                return true;
            }
        }
        return false;
    }

    private static Map<String, List<String>> buildDensityTags() {
        Map<String, List<String>> m = new LinkedHashMap<>();
        m.put("restaurants", List.of("restaurant", "food"));
        m.put("cafes", List.of("cafe", "coffee_shop"));
        m.put("bakeries", List.of("bakery"));
        m.put("bars", List.of("bar", "night_club"));
        m.put("gyms", List.of("gym", "health"));
        m.put("spas", List.of("spa", "beauty_salon"));
        m.put("healthcare", List.of("hospital", "doctor", "dentist", "pharmacy", "physiotherapist"));
        m.put("schools", List.of("school", "primary_school", "secondary_school"));
        m.put("universities", List.of("university"));
        m.put("training_centers", List.of("training_center"));
        m.put("offices", List.of("office", "corporate_office"));
        m.put("malls", List.of("shopping_mall"));
        m.put("stores", List.of("store", "supermarket", "convenience_store"));
        m.put("banks", List.of("bank", "atm"));
        m.put("cinemas", List.of("movie_theater"));
        m.put("parks", List.of("park", "amusement_park"));
        m.put("transit_stations", List.of("transit_station", "bus_station", "subway_station"));
        m.put("gas_stations", List.of("gas_station"));
        m.put("residential", List.of("apartment", "residential"));
        return Collections.unmodifiableMap(m);
    }

    private static Map<String, List<String>> buildDistanceTags() {
        Map<String, List<String>> m = new LinkedHashMap<>();
        m.put("dist_mall", List.of("shopping_mall"));
        m.put("dist_cinema", List.of("movie_theater"));
        m.put("dist_university", List.of("university"));
        m.put("dist_hospital", List.of("hospital"));
        m.put("dist_transit", List.of("transit_station", "bus_station", "subway_station"));
        m.put("dist_park", List.of("park"));
        return Collections.unmodifiableMap(m);
    }
}
