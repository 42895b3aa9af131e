package com.geoledger.stages.fallback;

import com.geoledger.core.geo.CentroidRegistry;
import com.geoledger.core.model.Approaches;
import com.geoledger.core.model.Coordinates;
import com.geoledger.core.model.LocationFields;
import com.geoledger.core.model.Ticket;
import com.geoledger.stages.api.Stage;
import com.geoledger.stages.api.StageAttempt;
import com.geoledger.stages.api.StageContext;
import com.geoledger.stages.api.StageFailureException;
import com.geoledger.stages.api.StageSettings;

import java.util.Map;
import java.util.Objects;

/**
 * Last resort: places the ticket at the center of its city. Low confidence by construction.
 */
public class CentroidFallbackStage implements Stage {
    public static final String DEFAULT_ID = "stage_4_fallback";
    public static final String TECHNIQUE = "CITY_CENTROID";
    public static final double DEFAULT_CONFIDENCE = 0.35;

    private final StageSettings settings;
    private final CentroidRegistry centroids;
    private final double confidence;

    public CentroidFallbackStage(StageSettings settings, CentroidRegistry centroids) {
        this.settings = Objects.requireNonNull(settings, "settings is required");
        this.centroids = Objects.requireNonNull(centroids, "centroids is required");
        this.confidence = settings.doubleParam("confidence", DEFAULT_CONFIDENCE);
        if (confidence <= 0.0 || confidence > 1.0) {
            throw new IllegalArgumentException("Fallback confidence out of range (0, 1]: " + confidence);
        }
    }

    @Override
    public String id() {
        return settings.id();
    }

    @Override
    public StageSettings settings() {
        return settings;
    }

    @Override
    public StageAttempt process(Ticket ticket, StageContext context) throws StageFailureException {
        LocationFields location = ticket.location();
        Coordinates center = centroids.lookup(location.city(), location.county())
                .orElseThrow(() -> new StageFailureException(
                        "No centroid registered for " + location.city() + ", " + location.county()));
        return new StageAttempt(
                center,
                confidence,
                TECHNIQUE,
                Approaches.CITY_CENTROID_FALLBACK,
                "City centroid for " + location.city() + ", " + location.county(),
                Map.of("city", location.city(), "county", location.county())
        );
    }
}
