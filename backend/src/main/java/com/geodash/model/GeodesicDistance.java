package com.geodash.model;

/**
 * Great-circle distance on a spherical Earth.
 */
public final class GeodesicDistance {

    public static final double EARTH_RADIUS_KM = 6371.0;

    private GeodesicDistance() {
    }

    /**
     * Haversine distance between two latitude/longitude pairs given in degrees.
     *
     * @return distance in kilometers, never negative
     */
    public static double haversineKm(double startLatitude, double startLongitude,
                                     double endLatitude, double endLongitude) {
        double lat1 = Math.toRadians(startLatitude);
        double lat2 = Math.toRadians(endLatitude);
        double deltaLat = Math.toRadians(endLatitude - startLatitude);
        double deltaLng = Math.toRadians(endLongitude - startLongitude);

        double a = Math.sin(deltaLat / 2) * Math.sin(deltaLat / 2)
                + Math.cos(lat1) * Math.cos(lat2) * Math.sin(deltaLng / 2) * Math.sin(deltaLng / 2);
        double c = 2 * Math.atan2(Math.sqrt(a), Math.sqrt(1 - a));
        return EARTH_RADIUS_KM * c;
    }
}
