package com.geoledger.stages.validation;

import com.geoledger.core.model.Coordinates;
import com.geoledger.core.model.GeocodeRecord;
import com.geoledger.core.model.QualityTier;
import com.geoledger.core.model.Ticket;
import com.geoledger.stages.api.StageAttempt;
import com.geoledger.stages.api.StageFailureException;
import com.geoledger.stages.support.InMemoryRecordLookup;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class RevalidationStageTest {
    private final RevalidationStage stage = new RevalidationStage(RevalidationStage.defaultSettings());

    @Test
    void defaultsSkipFailedRecords() {
        assertEquals("stage_5_validation", stage.id());
        assertTrue(stage.settings().skipRules().skipTiers().contains(QualityTier.FAILED));
    }

    @Test
    void resubmitsCurrentResult() throws Exception {
        GeocodeRecord current = GeocodeRecord.builder("T-1")
                .coordinates(Coordinates.of(31.5, -103.1))
                .confidence(0.7)
                .technique("PROXIMITY")
                .approach("city_primary")
                .qualityTier(QualityTier.ACCEPTABLE)
                .validationFlags(List.of("one_road_missing"))
                .version(3)
                .metadata(Map.of("source", "roads"))
                .build();
        InMemoryRecordLookup records = new InMemoryRecordLookup().put(current);

        StageAttempt attempt = stage.process(new Ticket("T-1", null, null), records.context());

        assertEquals(current.coordinates(), attempt.coordinates());
        assertEquals(0.7, attempt.confidence());
        assertEquals("city_primary", attempt.approach());
        assertEquals(3, attempt.metadata().get("revalidatedVersion"));
        assertEquals("roads", attempt.metadata().get("source"));
    }

    @Test
    void failsWithoutUsableCurrentRecord() {
        InMemoryRecordLookup empty = new InMemoryRecordLookup();
        assertThrows(StageFailureException.class, () -> stage.process(new Ticket("T-9", null, null), empty.context()));

        GeocodeRecord failed = GeocodeRecord.builder("T-9").qualityTier(QualityTier.FAILED).errorMessage("x").version(1).build();
        InMemoryRecordLookup withFailed = new InMemoryRecordLookup().put(failed);
        assertThrows(StageFailureException.class, () -> stage.process(new Ticket("T-9", null, null), withFailed.context()));
    }
}
