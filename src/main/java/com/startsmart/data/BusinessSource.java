package com.startsmart.data;

import com.startsmart.model.BoundingBox;
import com.startsmart.model.BusinessRecord;
import com.startsmart.model.GeoPoint;

import java.util.List;

/**
 * Business-directory collaborator. An empty list means "no businesses", never an error.
 * Implementations throw {@link com.startsmart.core.UpstreamUnavailableException} when the directory cannot be read.
 */
public interface BusinessSource {

    /**
     * @param category category to match, or null for every category
     */
    List<BusinessRecord> fetch(String category, BoundingBox bounds);

    /**
     * @param category category to match, or null for every category
     */
    List<BusinessRecord> fetchNear(String category, GeoPoint point, double radiusM);
}
