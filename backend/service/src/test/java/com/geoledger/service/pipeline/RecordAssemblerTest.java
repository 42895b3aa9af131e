package com.geoledger.service.pipeline;

import com.geoledger.core.geo.CentroidRegistry;
import com.geoledger.core.model.Approaches;
import com.geoledger.core.model.Coordinates;
import com.geoledger.core.model.GeocodeRecord;
import com.geoledger.core.model.LocationFields;
import com.geoledger.core.model.QualityTier;
import com.geoledger.core.model.ReviewPriority;
import com.geoledger.core.model.Ticket;
import com.geoledger.core.model.TicketClass;
import com.geoledger.core.quality.QualityAssessor;
import com.geoledger.core.validation.CentroidDistanceRule;
import com.geoledger.core.validation.ElevatedPriorityConfidenceRule;
import com.geoledger.core.validation.FallbackApproachRule;
import com.geoledger.core.validation.LowConfidenceRule;
import com.geoledger.core.validation.ValidationEngine;
import com.geoledger.stages.api.StageAttempt;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

class RecordAssemblerTest {
    private static final Coordinates KERMIT = Coordinates.of(31.8576, -103.0930);

    private final RecordAssembler assembler = new RecordAssembler(
            ValidationEngine.defaults(CentroidRegistry.defaults()),
            new QualityAssessor()
    );

    @Test
    void cleanHighConfidenceAttemptIsExcellentWithoutReview() {
        GeocodeRecord record = assembler.fromAttempt(ticket("Normal"),
                StageAttempt.of(KERMIT, 0.95, "API").withApproach("intersection").withMetadata(Map.of("source", "api")));

        assertEquals(QualityTier.EXCELLENT, record.qualityTier());
        assertEquals(ReviewPriority.NONE, record.reviewPriority());
        assertTrue(record.validationFlags().isEmpty());
        assertEquals(KERMIT, record.coordinates());
        assertEquals("api", record.metadata().get("source"));
        assertEquals("T-1", record.ticketKey());
        assertEquals(ticket("Normal").recordKey(), record.recordKey());
        assertEquals("KERMIT", record.location().city());
    }

    @Test
    void tierIsComputedFromTheFreshFlags() {
        Coordinates farAway = Coordinates.of(32.8, -101.0);
        GeocodeRecord record = assembler.fromAttempt(ticket("Normal"), StageAttempt.of(farAway, 0.85, "API"));

        assertEquals(List.of(CentroidDistanceRule.CODE), record.validationFlags());
        assertEquals(QualityTier.GOOD, record.qualityTier());
    }

    @Test
    void elevatedTicketBelowFloorIsHighPriority() {
        GeocodeRecord record = assembler.fromAttempt(ticket("EMERGENCY"), StageAttempt.of(KERMIT, 0.7, "API"));

        assertEquals(List.of(ElevatedPriorityConfidenceRule.CODE), record.validationFlags());
        assertEquals(QualityTier.ACCEPTABLE, record.qualityTier());
        assertEquals(ReviewPriority.HIGH, record.reviewPriority());
    }

    @Test
    void attemptBelowReviewFloorIsStoredFailedWithRejectedCoordinates() {
        StageAttempt fallback = new StageAttempt(KERMIT, 0.35, "CITY_CENTROID", Approaches.CITY_CENTROID_FALLBACK, null, Map.of());

        GeocodeRecord record = assembler.fromAttempt(ticket("Normal"), fallback);

        assertEquals(QualityTier.FAILED, record.qualityTier());
        assertFalse(record.hasCoordinates());
        assertEquals(KERMIT.latitude(), record.metadata().get(RecordAssembler.REJECTED_LATITUDE));
        assertEquals(KERMIT.longitude(), record.metadata().get(RecordAssembler.REJECTED_LONGITUDE));
        assertEquals(List.of(LowConfidenceRule.CODE, FallbackApproachRule.CODE), record.validationFlags());
        assertEquals(ReviewPriority.HIGH, record.reviewPriority());
        assertTrue(record.errorMessage().contains("REVIEW_NEEDED"));
        assertEquals(0.35, record.confidence());
    }

    @Test
    void stageFailureIsCriticalAndKeepsTheError() {
        GeocodeRecord record = assembler.fromFailure(ticket("Normal"), "stage_1_api", "No location found for ticket T-1");

        assertEquals(QualityTier.FAILED, record.qualityTier());
        assertEquals(ReviewPriority.CRITICAL, record.reviewPriority());
        assertEquals("stage_1_api", record.technique());
        assertEquals("No location found for ticket T-1", record.errorMessage());
        assertNull(record.coordinates());
        assertNull(record.confidence());
    }

    private static Ticket ticket(String type) {
        return new Ticket("T-1", new LocationFields("MAIN ST", "2ND ST", "KERMIT", "WINKLER"), TicketClass.ofType(type));
    }
}
