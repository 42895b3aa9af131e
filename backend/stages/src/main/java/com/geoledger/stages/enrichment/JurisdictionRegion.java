package com.geoledger.stages.enrichment;

import com.geoledger.core.model.Coordinates;

import java.util.Map;
import java.util.Objects;

/**
 * A permitting authority and the bounding box it covers.
 */
public record JurisdictionRegion(
        String name,
        String type,
        double minLatitude,
        double maxLatitude,
        double minLongitude,
        double maxLongitude,
        Map<String, Object> attributes
) {
    public JurisdictionRegion {
        Objects.requireNonNull(name, "name is required");
        if (minLatitude > maxLatitude || minLongitude > maxLongitude) {
            throw new IllegalArgumentException("Invalid bounding box for jurisdiction " + name);
        }
        attributes = attributes == null ? Map.of() : Map.copyOf(attributes);
    }

    public boolean contains(Coordinates point) {
        return point.latitude() >= minLatitude && point.latitude() <= maxLatitude
                && point.longitude() >= minLongitude && point.longitude() <= maxLongitude;
    }
}
