package com.geoledger.core.decision;

import com.geoledger.core.model.Coordinates;
import com.geoledger.core.model.GeocodeRecord;
import com.geoledger.core.model.QualityTier;
import com.geoledger.core.model.ReprocessThreshold;
import com.geoledger.core.model.SkipRules;
import com.geoledger.core.quality.QualityAssessor;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.Optional;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ReprocessingDeciderTest {
    private static final String STAGE = "stage_3_proximity";

    private final ReprocessingDecider decider = new ReprocessingDecider(new QualityAssessor());

    @Test
    void runsWhenNoCurrentRecord() {
        SkipDecision decision = decider.decide(Optional.empty(), STAGE, SkipRules.defaults(), null);

        assertFalse(decision.skip());
        assertEquals(SkipReason.NO_CURRENT_RECORD, decision.reason());
    }

    @Test
    void emptyRulesStillSkipLockedAndSameStage() {
        GeocodeRecord locked = record(QualityTier.ACCEPTABLE, 0.7, "other_stage").toBuilder()
                .lock("verified", Instant.EPOCH, "analyst").build();
        assertEquals(SkipReason.LOCKED, decider.decide(Optional.of(locked), STAGE, SkipRules.defaults(), null).reason());

        GeocodeRecord mine = record(QualityTier.ACCEPTABLE, 0.7, STAGE);
        SkipDecision decision = decider.decide(Optional.of(mine), STAGE, SkipRules.defaults(), null);
        assertTrue(decision.skip());
        assertEquals(SkipReason.SAME_STAGE, decision.reason());

        SkipDecision other = decider.decide(Optional.of(mine), "stage_4_fallback", SkipRules.defaults(), null);
        assertFalse(other.skip());
        assertEquals(SkipReason.NO_RULE_MATCHED, other.reason());
    }

    @Test
    void lockedRecordFallsThroughWhenSkipIfLockedDisabled() {
        GeocodeRecord locked = record(QualityTier.GOOD, 0.85, "other_stage").toBuilder()
                .lock("verified", Instant.EPOCH, "analyst").build();

        SkipDecision decision = decider.decide(Optional.of(locked), STAGE, SkipRules.defaults().withSkipIfLocked(false), null);

        assertFalse(decision.skip());
        assertEquals(SkipReason.NO_RULE_MATCHED, decision.reason());
    }

    @Test
    void skipRulesApplyInOrder() {
        GeocodeRecord good = record(QualityTier.GOOD, 0.85, "stage_1_api");

        assertEquals(SkipReason.QUALITY_TIER, decider.decide(Optional.of(good), STAGE,
                SkipRules.skipTiers(Set.of(QualityTier.GOOD, QualityTier.EXCELLENT)), null).reason());
        assertEquals(SkipReason.CONFIDENCE, decider.decide(Optional.of(good), STAGE,
                SkipRules.defaults().withSkipConfidence(0.85), null).reason());
        assertFalse(decider.decide(Optional.of(good), STAGE,
                SkipRules.defaults().withSkipConfidence(0.86), null).skip());
        assertEquals(SkipReason.TECHNIQUE, decider.decide(Optional.of(good), STAGE,
                SkipRules.defaults().withSkipTechniques(Set.of("API")), null).reason());
        assertEquals(SkipReason.APPROACH, decider.decide(Optional.of(good), STAGE,
                SkipRules.defaults().withSkipApproaches(Set.of("intersection")), null).reason());
    }

    @Test
    void thresholdOnlyAddsSkipsAndNeverOverridesSameStageRule() {
        GeocodeRecord ownAcceptable = record(QualityTier.ACCEPTABLE, 0.7, STAGE);
        GeocodeRecord otherAcceptable = record(QualityTier.ACCEPTABLE, 0.7, "stage_1_api");
        GeocodeRecord otherGood = record(QualityTier.GOOD, 0.85, "stage_1_api");

        SkipDecision own = decider.decide(Optional.of(ownAcceptable), STAGE, SkipRules.defaults(), ReprocessThreshold.MINOR_ENHANCEMENT);
        assertTrue(own.skip());
        assertEquals(SkipReason.SAME_STAGE, own.reason());

        SkipDecision rerun = decider.decide(Optional.of(otherAcceptable), STAGE, SkipRules.defaults(), ReprocessThreshold.MINOR_ENHANCEMENT);
        assertFalse(rerun.skip());
        assertEquals(SkipReason.REPROCESS_THRESHOLD, rerun.reason());

        SkipDecision hold = decider.decide(Optional.of(otherGood), STAGE, SkipRules.defaults(), ReprocessThreshold.MINOR_ENHANCEMENT);
        assertTrue(hold.skip());
        assertEquals(SkipReason.QUALITY_THRESHOLD, hold.reason());
    }

    private static GeocodeRecord record(QualityTier tier, double confidence, String stage) {
        return GeocodeRecord.builder("T-1")
                .recordId(1L)
                .coordinates(Coordinates.of(31.5, -103.0))
                .confidence(confidence)
                .technique("API")
                .approach("intersection")
                .qualityTier(tier)
                .version(1)
                .current(true)
                .createdByStage(stage)
                .build();
    }
}
