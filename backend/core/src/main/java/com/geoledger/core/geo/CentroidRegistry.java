package com.geoledger.core.geo;

import com.geoledger.core.model.Coordinates;

import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * Known (city, county) centers. Lookups are case-insensitive; entries are immutable once built.
 */
public final class CentroidRegistry {
    private final Map<String, Coordinates> centroids;

    private CentroidRegistry(Map<String, Coordinates> centroids) {
        this.centroids = Map.copyOf(centroids);
    }

    public static CentroidRegistry empty() {
        return new CentroidRegistry(Map.of());
    }

    public static CentroidRegistry defaults() {
        Map<String, Coordinates> values = new LinkedHashMap<>();
        values.put(key("KERMIT", "WINKLER"), Coordinates.of(31.8576, -103.0930));
        values.put(key("PYOTE", "WARD"), Coordinates.of(31.5401, -103.1293));
        values.put(key("BARSTOW", "WARD"), Coordinates.of(31.4596, -103.3954));
        values.put(key("MONAHANS", "WARD"), Coordinates.of(31.5943, -102.8929));
        values.put(key("ANDREWS", "ANDREWS"), Coordinates.of(32.3185, -102.5457));
        values.put(key("GARDENDALE", "ANDREWS"), Coordinates.of(32.0165, -102.3779));
        values.put(key("COYANOSA", "WARD"), Coordinates.of(31.2693, -103.0324));
        values.put(key("WICKETT", "WARD"), Coordinates.of(31.5768, -103.0010));
        values.put(key("THORNTONVILLE", "WARD"), Coordinates.of(31.4446, -103.1079));
        return new CentroidRegistry(values);
    }

    /** Returns a registry holding these entries plus the extra ones; extras replace existing keys. */
    public CentroidRegistry extendedWith(Collection<Centroid> extra) {
        Map<String, Coordinates> merged = new LinkedHashMap<>(centroids);
        for (Centroid centroid : extra) {
            merged.put(key(centroid.city(), centroid.county()), Coordinates.of(centroid.latitude(), centroid.longitude()));
        }
        return new CentroidRegistry(merged);
    }

    public Optional<Coordinates> lookup(String city, String county) {
        if (city == null || county == null || city.isBlank() || county.isBlank()) {
            return Optional.empty();
        }
        return Optional.ofNullable(centroids.get(key(city, county)));
    }

    public int size() {
        return centroids.size();
    }

    private static String key(String city, String county) {
        return city.trim().toUpperCase(Locale.ROOT) + "|" + county.trim().toUpperCase(Locale.ROOT);
    }

    public record Centroid(String city, String county, double latitude, double longitude) {
        public Centroid {
            if (city == null || city.isBlank()) {
                throw new IllegalArgumentException("Centroid city is required");
            }
            if (county == null || county.isBlank()) {
                throw new IllegalArgumentException("Centroid county is required");
            }
        }
    }
}
