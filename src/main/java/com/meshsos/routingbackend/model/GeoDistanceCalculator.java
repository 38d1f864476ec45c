package com.meshsos.routingbackend.model;

/**
 * Haversine great-circle distance on a spherical Earth.
 * Accurate enough for regional routing; ellipsoidal shape is ignored.
 */
public final class GeoDistanceCalculator {

    public static final double EARTH_RADIUS_KM = 6371.0;

    private GeoDistanceCalculator() {
    }

    public static double distanceKm(Location from, Location to) {
        return distanceKm(from.getLat(), from.getLon(), to.getLat(), to.getLon());
    }

    public static double distanceKm(double lat1, double lon1, double lat2, double lon2) {
        double dLat = Math.toRadians(lat2 - lat1);
        double dLon = Math.toRadians(lon2 - lon1);
        double a = Math.sin(dLat / 2) * Math.sin(dLat / 2)
                + Math.cos(Math.toRadians(lat1)) * Math.cos(Math.toRadians(lat2)) * Math.sin(dLon / 2) * Math.sin(dLon / 2);
        // rounding can push a just outside [0, 1] near antipodes
        a = Math.max(0.0, Math.min(1.0, a));
        double c = 2 * Math.atan2(Math.sqrt(a), Math.sqrt(1 - a));
        return EARTH_RADIUS_KM * c;
    }
}
