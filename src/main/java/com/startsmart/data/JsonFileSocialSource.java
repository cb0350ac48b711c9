package com.startsmart.data;

import com.startsmart.model.BoundingBox;
import com.startsmart.model.SocialSignal;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.json.JSONArray;
import org.json.JSONException;
import org.json.JSONObject;

import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Reads a JSON array of social posts. Posts without coordinates are kept when they carry a grid id.
 * Posts with an unknown type are dropped.
 */
public final class JsonFileSocialSource implements SocialSource {
    private static final Logger LOG = LogManager.getLogger(JsonFileSocialSource.class);

    private final Path path;
    private final Clock clock;

    public JsonFileSocialSource(Path path) {
        this(path, Clock.systemUTC());
    }

    public JsonFileSocialSource(Path path, Clock clock) {
        this.path = path;
        this.clock = clock;
    }

    @Override
    public List<SocialSignal> fetch(String category, BoundingBox bounds, int windowDays) {
        Instant cutoff = windowDays > 0 ? clock.instant().minus(Duration.ofDays(windowDays)) : null;
        JSONArray rows = JsonRecords.readArray(path);
        List<SocialSignal> out = new ArrayList<>();
        int dropped = 0;
        int malformed = 0;
        for (int i = 0; i < rows.length(); i++) {
            JSONObject row = rows.optJSONObject(i);
            if (row == null) {
                continue;
            }
            SocialSignal signal;
            try {
                signal = JsonRecords.signal(row);
            } catch (JSONException e) {
                malformed++;
                LOG.debug("skipping social row {} in {}: {}", i, path.getFileName(), e.getMessage());
                continue;
            }
            if (signal.type == null) {
                dropped++;
                continue;
            }
            if (category != null && !category.equalsIgnoreCase(signal.category)) {
                continue;
            }
            if (cutoff != null && signal.timestamp != null && signal.timestamp.isBefore(cutoff)) {
                continue;
            }
            if (signal.hasLocation()) {
                if (bounds != null && !bounds.containsClosed(signal.lat, signal.lon)) {
                    continue;
                }
            } else if (signal.gridId == null) {
                dropped++;
                continue;
            }
            out.add(signal);
        }
        if (malformed > 0) {
            LOG.warn("social source {} skipped {} malformed rows", path.getFileName(), malformed);
        }
        if (dropped > 0) {
            LOG.debug("social source {} dropped {} posts without type or location", path.getFileName(), dropped);
        }
        return out;
    }
}
