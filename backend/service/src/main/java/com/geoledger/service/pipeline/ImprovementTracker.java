package com.geoledger.service.pipeline;

import com.geoledger.core.model.GeocodeRecord;
import com.geoledger.core.model.QualityTier;
import com.geoledger.stages.api.RecordLookup;

import java.util.Collection;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Compares a ticket's current version with the version it superseded.
 */
public class ImprovementTracker {
    public enum Kind {
        FAILURE_RESOLVED,
        QUALITY_IMPROVED,
        NO_IMPROVEMENT
    }

    public record Improvement(
            String ticketKey,
            int fromVersion,
            int toVersion,
            QualityTier fromTier,
            QualityTier toTier,
            Kind kind,
            Double confidenceDelta,
            String improvedByStage
    ) {
    }

    private final RecordLookup records;

    public ImprovementTracker(RecordLookup records) {
        this.records = Objects.requireNonNull(records, "records is required");
    }

    public static Kind classify(QualityTier before, QualityTier after) {
        if (before == QualityTier.FAILED && after != QualityTier.FAILED) {
            return Kind.FAILURE_RESOLVED;
        }
        if (after.isBetterThan(before)) {
            return Kind.QUALITY_IMPROVED;
        }
        return Kind.NO_IMPROVEMENT;
    }

    /** Empty when the ticket has fewer than two versions. */
    public Optional<Improvement> track(String ticketKey) {
        List<GeocodeRecord> history = records.getHistory(ticketKey);
        if (history.size() < 2) {
            return Optional.empty();
        }
        GeocodeRecord current = history.get(0);
        GeocodeRecord previous = history.get(1);
        Double delta = current.confidence() == null || previous.confidence() == null
                ? null
                : current.confidence() - previous.confidence();
        return Optional.of(new Improvement(
                ticketKey,
                previous.version(),
                current.version(),
                previous.qualityTier(),
                current.qualityTier(),
                classify(previous.qualityTier(), current.qualityTier()),
                delta,
                current.createdByStage()
        ));
    }

    public Map<Kind, Long> summarize(Collection<String> ticketKeys) {
        Map<Kind, Long> counts = new EnumMap<>(Kind.class);
        for (String ticketKey : ticketKeys) {
            track(ticketKey).ifPresent(improvement -> counts.merge(improvement.kind(), 1L, Long::sum));
        }
        return counts;
    }
}
