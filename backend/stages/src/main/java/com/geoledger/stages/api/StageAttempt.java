package com.geoledger.stages.api;

import com.geoledger.core.model.Coordinates;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

public record StageAttempt(
        Coordinates coordinates,
        Double confidence,
        String technique,
        String approach,
        String rationale,
        Map<String, Object> metadata
) {
    public StageAttempt {
        Objects.requireNonNull(coordinates, "coordinates is required");
        Objects.requireNonNull(technique, "technique is required");
        if (confidence != null && (confidence.isNaN() || confidence < 0.0 || confidence > 1.0)) {
            throw new IllegalArgumentException("Confidence out of range [0, 1]: " + confidence);
        }
        metadata = metadata == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(metadata));
    }

    public static StageAttempt of(Coordinates coordinates, double confidence, String technique) {
        return new StageAttempt(coordinates, confidence, technique, null, null, Map.of());
    }

    public StageAttempt withApproach(String value) {
        return new StageAttempt(coordinates, confidence, technique, value, rationale, metadata);
    }

    public StageAttempt withRationale(String value) {
        return new StageAttempt(coordinates, confidence, technique, approach, value, metadata);
    }

    public StageAttempt withMetadata(Map<String, Object> value) {
        return new StageAttempt(coordinates, confidence, technique, approach, rationale, value);
    }
}
