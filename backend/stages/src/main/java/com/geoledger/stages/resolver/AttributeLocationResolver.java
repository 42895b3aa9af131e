package com.geoledger.stages.resolver;

import com.geoledger.core.model.Coordinates;
import com.geoledger.core.model.Ticket;
import com.geoledger.stages.api.StageAttempt;

import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Reads a result that an upstream tool already attached to the ticket as {@code latitude},
 * {@code longitude} and {@code confidence} fields, with optional {@code approach} and {@code rationale}.
 */
public class AttributeLocationResolver implements LocationResolver {
    public static final double DEFAULT_CONFIDENCE = 0.5;

    private final String technique;

    public AttributeLocationResolver(String technique) {
        this.technique = Objects.requireNonNull(technique, "technique is required");
    }

    @Override
    public Optional<StageAttempt> resolve(Ticket ticket) {
        Map<String, String> attributes = ticket.attributes();
        String latitude = attributes.get("latitude");
        String longitude = attributes.get("longitude");
        if (isBlank(latitude) || isBlank(longitude)) {
            return Optional.empty();
        }
        String confidence = attributes.get("confidence");
        StageAttempt attempt = new StageAttempt(
                Coordinates.of(Double.parseDouble(latitude.trim()), Double.parseDouble(longitude.trim())),
                isBlank(confidence) ? DEFAULT_CONFIDENCE : Double.parseDouble(confidence.trim()),
                technique,
                attributes.get("approach"),
                attributes.get("rationale"),
                Map.of()
        );
        return Optional.of(attempt);
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
