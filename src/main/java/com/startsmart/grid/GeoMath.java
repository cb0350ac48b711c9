package com.startsmart.grid;

public final class GeoMath {
    public static final double EARTH_RADIUS_KM = 6371.0;
    public static final double METERS_PER_DEGREE_LAT = 111_111.0;
    public static final double METERS_PER_DEGREE_LON_EQUATOR = 111_320.0;

    private GeoMath() {
    }

    /**
     * Great-circle distance in kilometres.
     */
    public static double haversineKm(double lat1, double lon1, double lat2, double lon2) {
        double phi1 = Math.toRadians(lat1);
        double phi2 = Math.toRadians(lat2);
        double dPhi = Math.toRadians(lat2 - lat1);
        double dLambda = Math.toRadians(lon2 - lon1);
        double a = Math.sin(dPhi / 2) * Math.sin(dPhi / 2)
                + Math.cos(phi1) * Math.cos(phi2) * Math.sin(dLambda / 2) * Math.sin(dLambda / 2);
        double c = 2 * Math.atan2(Math.sqrt(a), Math.sqrt(1 - a));
        return EARTH_RADIUS_KM * c;
    }

    public static double haversineMeters(double lat1, double lon1, double lat2, double lon2) {
        return haversineKm(lat1, lon1, lat2, lon2) * 1000.0;
    }

    public static double metersToLatDegrees(double meters) {
        return meters / METERS_PER_DEGREE_LAT;
    }

    public static double metersToLonDegrees(double meters, double atLat) {
        return meters / (METERS_PER_DEGREE_LON_EQUATOR * Math.cos(Math.toRadians(atLat)));
    }

    public static double latDegreesToMeters(double degrees) {
        return degrees * METERS_PER_DEGREE_LAT;
    }

    public static double lonDegreesToMeters(double degrees, double atLat) {
        return degrees * METERS_PER_DEGREE_LON_EQUATOR * Math.cos(Math.toRadians(atLat));
    }
}
