package com.geoledger.stages.api;

import com.geoledger.core.model.GeocodeRecord;
import com.geoledger.core.model.QualityTier;

import java.util.Collection;
import java.util.EnumMap;
import java.util.Map;

public record StoreStatistics(
        long totalRecords,
        Map<QualityTier, Long> countsByTier,
        Map<QualityTier, Double> averageConfidenceByTier,
        long lockedRecords,
        long totalVersions
) {
    public StoreStatistics {
        countsByTier = Map.copyOf(countsByTier);
        averageConfidenceByTier = Map.copyOf(averageConfidenceByTier);
    }

    /**
     * Aggregates over current records. Averages only count records that carry a confidence.
     */
    public static StoreStatistics of(Collection<GeocodeRecord> currentRecords, long totalVersions) {
        Map<QualityTier, Long> counts = new EnumMap<>(QualityTier.class);
        Map<QualityTier, Double> sums = new EnumMap<>(QualityTier.class);
        Map<QualityTier, Long> withConfidence = new EnumMap<>(QualityTier.class);
        long locked = 0;
        for (GeocodeRecord record : currentRecords) {
            counts.merge(record.qualityTier(), 1L, Long::sum);
            if (record.confidence() != null) {
                sums.merge(record.qualityTier(), record.confidence(), Double::sum);
                withConfidence.merge(record.qualityTier(), 1L, Long::sum);
            }
            if (record.locked()) {
                locked++;
            }
        }
        Map<QualityTier, Double> averages = new EnumMap<>(QualityTier.class);
        sums.forEach((tier, sum) -> averages.put(tier, sum / withConfidence.get(tier)));
        return new StoreStatistics(currentRecords.size(), counts, averages, locked, totalVersions);
    }

    public long count(QualityTier tier) {
        return countsByTier.getOrDefault(tier, 0L);
    }
}
