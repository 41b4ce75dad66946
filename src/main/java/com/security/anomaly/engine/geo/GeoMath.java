package com.security.anomaly.engine.geo;

public final class GeoMath {

    public static final double EARTH_RADIUS_KM = 6371.0;

    private GeoMath() {}

    /**
     * Great-circle distance in kilometres (haversine formula).
     */
    public static double haversineKm(double lat1, double lon1, double lat2, double lon2) {
        double lat1Rad = Math.toRadians(lat1);
        double lat2Rad = Math.toRadians(lat2);
        double dLat = lat2Rad - lat1Rad;
        double dLon = Math.toRadians(lon2) - Math.toRadians(lon1);

        double a = Math.pow(Math.sin(dLat / 2), 2)
                + Math.cos(lat1Rad) * Math.cos(lat2Rad) * Math.pow(Math.sin(dLon / 2), 2);
        double c = 2 * Math.asin(Math.sqrt(a));
        return c * EARTH_RADIUS_KM;
    }

    /**
     * Speed in km/h, infinite when no time has passed.
     */
    public static double speedKmh(double distanceKm, double hours) {
        if (hours <= 0) {
            return Double.POSITIVE_INFINITY;
        }
        return distanceKm / hours;
    }

    public static double round2(double value) {
        return Math.round(value * 100.0) / 100.0;
    }
}
