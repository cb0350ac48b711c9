package com.startsmart.data;

import com.startsmart.core.UpstreamUnavailableException;
import com.startsmart.model.BusinessRecord;
import com.startsmart.model.SignalType;
import com.startsmart.model.SocialSignal;
import org.json.JSONArray;
import org.json.JSONException;
import org.json.JSONObject;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.List;

/**
 * org.json mapping for the directory and post dumps.
 */
final class JsonRecords {
    private JsonRecords() {
    }

    static JSONArray readArray(Path path) {
        try {
            String text = Files.readString(path, StandardCharsets.UTF_8);
            return new JSONArray(text);
        } catch (IOException e) {
            throw new UpstreamUnavailableException("cannot read " + path + ": " + e.getMessage(), e);
        } catch (JSONException e) {
            throw new UpstreamUnavailableException("malformed json in " + path + ": " + e.getMessage(), e);
        }
    }

    static BusinessRecord business(JSONObject o) {
        List<String> types = new ArrayList<>();
        JSONArray rawTypes = o.optJSONArray("types");
        if (rawTypes != null) {
            for (int i = 0; i < rawTypes.length(); i++) {
                String t = rawTypes.optString(i, "").trim();
                if (!t.isEmpty()) {
                    types.add(t);
                }
            }
        }
        return BusinessRecord.builder()
                .id(o.optString("id", ""))
                .name(o.optString("name", ""))
                .category(o.optString("category", ""))
                .lat(o.getDouble("lat"))
                .lon(o.getDouble("lon"))
                .rating(optDouble(o, "rating"))
                .reviewCount(o.optInt("review_count", 0))
                .priceLevel(o.has("price_level") && !o.isNull("price_level") ? o.getInt("price_level") : null)
                .types(List.copyOf(types))
                .gridId(optText(o, "grid_id"))
                .build();
    }

    static SocialSignal signal(JSONObject o) {
        return SocialSignal.builder()
                .id(o.optString("id", ""))
                .category(o.optString("category", ""))
                .text(o.optString("text", ""))
                .timestamp(parseInstant(optText(o, "timestamp")))
                .lat(optDouble(o, "lat"))
                .lon(optDouble(o, "lon"))
                .type(SignalType.fromWire(o.optString("type", "")))
                .engagement(o.optDouble("engagement", 0.0))
                .gridId(optText(o, "grid_id"))
                .build();
    }

    private static Double optDouble(JSONObject o, String key) {
        if (!o.has(key) || o.isNull(key)) {
            return null;
        }
        double value = o.optDouble(key, Double.NaN);
        return Double.isNaN(value) ? null : value;
    }

    private static String optText(JSONObject o, String key) {
        if (!o.has(key) || o.isNull(key)) {
            return null;
        }
        String value = o.optString(key, "").trim();
        return value.isEmpty() ? null : value;
    }

    private static Instant parseInstant(String raw) {
        if (raw == null) {
            return null;
        }
        try {
            return Instant.parse(raw);
        } catch (DateTimeParseException e) {
            throw new JSONException("bad timestamp: " + raw);
        }
    }
}
