package com.geoledger.core.geo;

import com.geoledger.core.model.Coordinates;

public final class GeoDistance {
    public static final double EARTH_RADIUS_KM = 6371.0;

    private GeoDistance() {
    }

    /** Great-circle distance in kilometers (haversine). */
    public static double kilometersBetween(Coordinates from, Coordinates to) {
        double lat1 = Math.toRadians(from.latitude());
        double lat2 = Math.toRadians(to.latitude());
        double dLat = lat2 - lat1;
        double dLon = Math.toRadians(to.longitude() - from.longitude());
        double a = Math.sin(dLat / 2) * Math.sin(dLat / 2)
                + Math.cos(lat1) * Math.cos(lat2) * Math.sin(dLon / 2) * Math.sin(dLon / 2);
        double c = 2 * Math.atan2(Math.sqrt(a), Math.sqrt(1 - a));
        return EARTH_RADIUS_KM * c;
    }
}
