package com.geoledger.stages.api;

import com.geoledger.core.model.GeocodeRecord;
import com.geoledger.core.model.QualityTier;
import com.geoledger.core.model.ReviewPriority;

import java.util.Set;

/**
 * Filter over current records. Empty sets and null bounds match everything; a record without
 * confidence never satisfies a confidence bound.
 */
public record RecordQuery(
        Set<QualityTier> tiers,
        Set<ReviewPriority> priorities,
        Double minConfidence,
        Double maxConfidence,
        Boolean locked,
        Integer limit
) {
    public RecordQuery {
        tiers = tiers == null ? Set.of() : Set.copyOf(tiers);
        priorities = priorities == null ? Set.of() : Set.copyOf(priorities);
        if (limit != null && limit < 0) {
            throw new IllegalArgumentException("limit must not be negative: " + limit);
        }
    }

    public static RecordQuery all() {
        return new RecordQuery(Set.of(), Set.of(), null, null, null, null);
    }

    public RecordQuery withTiers(Set<QualityTier> value) {
        return new RecordQuery(value, priorities, minConfidence, maxConfidence, locked, limit);
    }

    public RecordQuery withPriorities(Set<ReviewPriority> value) {
        return new RecordQuery(tiers, value, minConfidence, maxConfidence, locked, limit);
    }

    public RecordQuery withConfidenceRange(Double min, Double max) {
        return new RecordQuery(tiers, priorities, min, max, locked, limit);
    }

    public RecordQuery withLocked(Boolean value) {
        return new RecordQuery(tiers, priorities, minConfidence, maxConfidence, value, limit);
    }

    public RecordQuery withLimit(Integer value) {
        return new RecordQuery(tiers, priorities, minConfidence, maxConfidence, locked, value);
    }

    public boolean matches(GeocodeRecord record) {
        if (!tiers.isEmpty() && !tiers.contains(record.qualityTier())) {
            return false;
        }
        if (!priorities.isEmpty() && !priorities.contains(record.reviewPriority())) {
            return false;
        }
        if (minConfidence != null && (record.confidence() == null || record.confidence() < minConfidence)) {
            return false;
        }
        if (maxConfidence != null && (record.confidence() == null || record.confidence() > maxConfidence)) {
            return false;
        }
        return locked == null || locked == record.locked();
    }
}
