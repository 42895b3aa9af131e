package com.geoledger.core.model;

import com.geoledger.core.util.HashingUtils;

import java.util.Locale;

/**
 * Location part of a ticket as submitted: the street the work is on, the cross-reference
 * street (intersection), and the city/county pair.
 */
public record LocationFields(String street, String crossStreet, String city, String county) {
    public static LocationFields empty() {
        return new LocationFields(null, null, null, null);
    }

    public boolean hasStreet() {
        return street != null && !street.isBlank();
    }

    public boolean hasCrossStreet() {
        return crossStreet != null && !crossStreet.isBlank();
    }

    /**
     * Deterministic key over the normalized location, equal for tickets that describe the same place.
     */
    public String recordKey() {
        String joined = String.join("|", normalize(street), normalize(crossStreet), normalize(city), normalize(county));
        return HashingUtils.sha256(joined);
    }

    private static String normalize(String value) {
        return value == null ? "" : value.trim().toUpperCase(Locale.ROOT);
    }
}
