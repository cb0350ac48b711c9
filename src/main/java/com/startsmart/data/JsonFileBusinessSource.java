package com.startsmart.data;

import com.startsmart.grid.GeoMath;
import com.startsmart.model.BoundingBox;
import com.startsmart.model.BusinessRecord;
import com.startsmart.model.GeoPoint;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.json.JSONArray;
import org.json.JSONException;
import org.json.JSONObject;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.function.Predicate;

/**
 * Reads a JSON array of business records from disk on every call. Malformed rows are skipped;
 * an unreadable file or a document that is not an array raises {@link com.startsmart.core.UpstreamUnavailableException}.
 */
public final class JsonFileBusinessSource implements BusinessSource {
    private static final Logger LOG = LogManager.getLogger(JsonFileBusinessSource.class);

    private final Path path;

    public JsonFileBusinessSource(Path path) {
        this.path = path;
    }

    @Override
    public List<BusinessRecord> fetch(String category, BoundingBox bounds) {
        return select(category, b -> bounds.containsClosed(b.lat, b.lon));
    }

    @Override
    public List<BusinessRecord> fetchNear(String category, GeoPoint point, double radiusM) {
        return select(category, b -> GeoMath.haversineMeters(point.lat(), point.lon(), b.lat, b.lon) <= radiusM);
    }

    private List<BusinessRecord> select(String category, Predicate<BusinessRecord> where) {
        JSONArray rows = JsonRecords.readArray(path);
        List<BusinessRecord> out = new ArrayList<>();
        int malformed = 0;
        for (int i = 0; i < rows.length(); i++) {
            JSONObject row = rows.optJSONObject(i);
            if (row == null) {
                continue;
            }
            BusinessRecord record;
            try {
                record = JsonRecords.business(row);
            } catch (JSONException e) {
                malformed++;
                LOG.debug("skipping business row {} in {}: {}", i, path.getFileName(), e.getMessage());
                continue;
            }
            if (category != null && !category.equalsIgnoreCase(record.category)) {
                continue;
            }
            if (where.test(record)) {
                out.add(record);
            }
        }
        if (malformed > 0) {
            LOG.warn("business source {} skipped {} malformed rows", path.getFileName(), malformed);
        }
        LOG.debug("business source {} category={} -> {} records", path.getFileName(), category, out.size());
        return out;
    }
}
