package com.geoledger.core.decision;

import com.geoledger.core.model.GeocodeRecord;
import com.geoledger.core.model.ReprocessThreshold;
import com.geoledger.core.model.SkipRules;
import com.geoledger.core.quality.QualityAssessor;

import java.util.Objects;
import java.util.Optional;

/**
 * Decides whether a stage should run for a ticket given the ticket's current record.
 * Rules are checked in a fixed order and the first match wins.
 */
public final class ReprocessingDecider {
    private final QualityAssessor assessor;

    public ReprocessingDecider(QualityAssessor assessor) {
        this.assessor = Objects.requireNonNull(assessor, "assessor is required");
    }

    public SkipDecision decide(Optional<GeocodeRecord> current, String stageId, SkipRules rules, ReprocessThreshold threshold) {
        if (current.isEmpty()) {
            return SkipDecision.run(SkipReason.NO_CURRENT_RECORD, "no cached result");
        }
        GeocodeRecord record = current.get();
        SkipRules effective = rules == null ? SkipRules.defaults() : rules;

        if (effective.skipIfLocked() && record.locked()) {
            return SkipDecision.skip(SkipReason.LOCKED, "locked: " + record.lockReason());
        }
        if (effective.skipTiers().contains(record.qualityTier())) {
            return SkipDecision.skip(SkipReason.QUALITY_TIER, "quality tier " + record.qualityTier() + " in skip list");
        }
        Double skipConfidence = effective.skipConfidence();
        if (skipConfidence != null && record.confidence() != null && record.confidence() >= skipConfidence) {
            return SkipDecision.skip(
                    SkipReason.CONFIDENCE,
                    "confidence " + record.confidence() + " >= threshold " + skipConfidence
            );
        }
        if (record.technique() != null && effective.skipTechniques().contains(record.technique())) {
            return SkipDecision.skip(SkipReason.TECHNIQUE, "technique " + record.technique() + " in skip list");
        }
        if (record.approach() != null && effective.skipApproaches().contains(record.approach())) {
            return SkipDecision.skip(SkipReason.APPROACH, "approach " + record.approach() + " in skip list");
        }
        if (threshold != null && !assessor.shouldReprocess(record.qualityTier(), threshold, record.locked())) {
            return SkipDecision.skip(
                    SkipReason.QUALITY_THRESHOLD,
                    "tier " + record.qualityTier() + " not eligible under " + threshold
            );
        }
        if (stageId.equals(record.createdByStage())) {
            return SkipDecision.skip(SkipReason.SAME_STAGE, "already processed by this stage");
        }
        if (threshold != null) {
            return SkipDecision.run(
                    SkipReason.REPROCESS_THRESHOLD,
                    "tier " + record.qualityTier() + " eligible under " + threshold
            );
        }
        return SkipDecision.run(SkipReason.NO_RULE_MATCHED, "no skip rule matched");
    }
}
