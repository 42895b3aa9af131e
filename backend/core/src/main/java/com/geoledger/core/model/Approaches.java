package com.geoledger.core.model;

/**
 * Approach identifiers that carry meaning outside the technique that produced them.
 */
public final class Approaches {
    /** Neither location input resolved; the city centroid is the only answer. */
    public static final String CITY_CENTROID_FALLBACK = "city_centroid_fallback";

    /** One of the two location inputs was unavailable; city plus the other road was used. */
    public static final String CITY_PRIMARY = "city_primary";

    private Approaches() {
    }

    public static boolean isFallback(String approach) {
        return CITY_CENTROID_FALLBACK.equals(approach);
    }

    public static boolean isPartialData(String approach) {
        return CITY_PRIMARY.equals(approach);
    }
}
