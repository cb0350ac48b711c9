package com.startsmart.model;

public record GeoPoint(double lat, double lon) {
}
