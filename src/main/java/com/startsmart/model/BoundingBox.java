package com.startsmart.model;

import com.startsmart.core.ConfigurationException;

/**
 * Lat/lon rectangle. Containment is half-open: south/west inclusive, north/east exclusive.
 */
public record BoundingBox(double north, double south, double east, double west) {

    public static BoundingBox validated(double north, double south, double east, double west) {
        if (!Double.isFinite(north) || !Double.isFinite(south) || !Double.isFinite(east) || !Double.isFinite(west)) {
            throw new ConfigurationException("bounding box has non-finite coordinates");
        }
        if (north <= south || east <= west) {
            throw new ConfigurationException(String.format(
                    "degenerate bounding box north=%s south=%s east=%s west=%s", north, south, east, west));
        }
        return new BoundingBox(north, south, east, west);
    }

    public boolean contains(double lat, double lon) {
        return lat >= south && lat < north && lon >= west && lon < east;
    }

    /**
     * Closed containment, used for region-level filtering where the outer edge belongs to the region.
     */
    public boolean containsClosed(double lat, double lon) {
        return lat >= south && lat <= north && lon >= west && lon <= east;
    }

    public double latSpan() {
        return north - south;
    }

    public double lonSpan() {
        return east - west;
    }

    public GeoPoint center() {
        return new GeoPoint((north + south) / 2.0, (east + west) / 2.0);
    }

    public boolean overlaps(BoundingBox other) {
        return south < other.north && other.south < north && west < other.east && other.west < east;
    }
}
