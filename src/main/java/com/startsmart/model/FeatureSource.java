package com.startsmart.model;

/**
 * Named feature lookup consumed by rule conditions. Returns a Number, String or Boolean,
 * or null when the feature is undefined for this subject.
 */
public interface FeatureSource {
    Object feature(String name);
}
