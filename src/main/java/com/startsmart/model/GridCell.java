package com.startsmart.model;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Value;

@Value
@AllArgsConstructor(access = AccessLevel.PUBLIC)
@Builder(toBuilder = true)
public final class GridCell {
    public final String id;
    public final String region;
    public final int row;
    public final int col;
    public final BoundingBox bounds;
    public final GeoPoint center;
    public final double areaM2;

    public boolean contains(double lat, double lon) {
        return bounds.contains(lat, lon);
    }
}
