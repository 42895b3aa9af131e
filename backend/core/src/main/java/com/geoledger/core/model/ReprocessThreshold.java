package com.geoledger.core.model;

import com.fasterxml.jackson.annotation.JsonCreator;

import java.util.Locale;

/**
 * How much improvement a stage must be able to offer before it reprocesses an existing result.
 */
public enum ReprocessThreshold {
    /** Reprocess regardless of tier. */
    ALWAYS,
    /** Reprocess ACCEPTABLE and below. */
    MINOR_ENHANCEMENT,
    /** Reprocess GOOD and below. */
    MAJOR_ENHANCEMENT;

    @JsonCreator
    public static ReprocessThreshold fromValue(String value) {
        if (value == null || value.isBlank()) {
            return null;
        }
        try {
            return valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Unknown reprocess threshold: " + value, e);
        }
    }
}
