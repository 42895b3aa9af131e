package com.geoledger.core.validation;

import com.geoledger.core.geo.CentroidRegistry;
import com.geoledger.core.geo.GeoDistance;
import com.geoledger.core.model.Coordinates;
import com.geoledger.core.model.LocationFields;
import com.geoledger.core.model.Severity;
import com.geoledger.core.model.ValidationFlag;

import java.util.Locale;
import java.util.Objects;
import java.util.Optional;

/**
 * Flags results that land far from the registered center of the ticket's city. Silent when the
 * city is not registered.
 */
public final class CentroidDistanceRule implements ValidationRule {
    public static final String CODE = "distance_from_city";
    public static final double DEFAULT_MAX_KM = 50.0;

    private final CentroidRegistry centroids;
    private final double maxKm;

    public CentroidDistanceRule(CentroidRegistry centroids) {
        this(centroids, DEFAULT_MAX_KM);
    }

    public CentroidDistanceRule(CentroidRegistry centroids, double maxKm) {
        this.centroids = Objects.requireNonNull(centroids, "centroids is required");
        this.maxKm = maxKm;
    }

    @Override
    public String code() {
        return CODE;
    }

    @Override
    public Optional<ValidationFlag> evaluate(ValidationSubject subject) {
        Coordinates coordinates = subject.coordinates();
        LocationFields location = subject.location();
        if (coordinates == null) {
            return Optional.empty();
        }
        Optional<Coordinates> center = centroids.lookup(location.city(), location.county());
        if (center.isEmpty()) {
            return Optional.empty();
        }
        double distance = GeoDistance.kilometersBetween(coordinates, center.get());
        if (distance <= maxKm) {
            return Optional.empty();
        }
        return Optional.of(new ValidationFlag(
                CODE,
                Severity.WARNING,
                String.format(Locale.ROOT, "Location %.1fkm from %s center (max: %.0fkm)", distance, location.city(), maxKm),
                "Verify location is correct for this city"
        ));
    }
}
