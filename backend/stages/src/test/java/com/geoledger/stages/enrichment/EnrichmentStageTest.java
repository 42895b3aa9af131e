package com.geoledger.stages.enrichment;

import com.geoledger.core.config.ConfigurationException;
import com.geoledger.core.model.Coordinates;
import com.geoledger.core.model.GeocodeRecord;
import com.geoledger.core.model.QualityTier;
import com.geoledger.core.model.Ticket;
import com.geoledger.stages.api.StageAttempt;
import com.geoledger.stages.api.StageFailureException;
import com.geoledger.stages.api.StageSettings;
import com.geoledger.stages.support.FixtureUtils;
import com.geoledger.stages.support.InMemoryRecordLookup;
import org.junit.jupiter.api.Test;

import java.nio.file.Path;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class EnrichmentStageTest {
    private static final Path FIXTURES = FixtureUtils.fixturePath("fixtures/jurisdictions.json").getParent();

    @Test
    void mergesJurisdictionIntoCurrentMetadata() throws Exception {
        StageSettings settings = EnrichmentStage.defaultSettings()
                .withParams(Map.of(EnrichmentStage.JURISDICTION_FILE_PARAM, "jurisdictions.json"));
        EnrichmentStage stage = EnrichmentStage.withJurisdictions(settings, FIXTURES);
        InMemoryRecordLookup records = new InMemoryRecordLookup().put(current("T-1", Coordinates.of(31.8576, -103.0930)));

        StageAttempt attempt = stage.process(new Ticket("T-1", null, null), records.context());

        assertEquals("Winkler County", attempt.metadata().get("jurisdiction"));
        assertEquals(true, attempt.metadata().get("permitRequired"));
        assertEquals("roads", attempt.metadata().get("source"));
        assertEquals(0.9, attempt.confidence());
        assertEquals("PROXIMITY", attempt.technique());
    }

    @Test
    void pointOutsideEveryRegionIsMarkedNotFound() throws Exception {
        JurisdictionEnricher enricher = JurisdictionEnricher.load(FIXTURES.resolve("jurisdictions.json"));
        EnrichmentStage stage = new EnrichmentStage(EnrichmentStage.defaultSettings(), enricher);
        InMemoryRecordLookup records = new InMemoryRecordLookup().put(current("T-2", Coordinates.of(30.0, -97.7)));

        StageAttempt attempt = stage.process(new Ticket("T-2", null, null), records.context());

        assertEquals(2, enricher.size());
        assertEquals(false, attempt.metadata().get("jurisdictionFound"));
    }

    @Test
    void missingJurisdictionFileParamNamesTheKey() {
        ConfigurationException error = assertThrows(ConfigurationException.class, () ->
                EnrichmentStage.withJurisdictions(EnrichmentStage.defaultSettings(), FIXTURES));

        assertTrue(error.getMessage().contains("jurisdictionFile"));
    }

    @Test
    void failsWithoutCurrentRecord() {
        EnrichmentStage stage = new EnrichmentStage(EnrichmentStage.defaultSettings(), (ticket, point) -> Map.of());

        assertThrows(StageFailureException.class, () ->
                stage.process(new Ticket("T-3", null, null), new InMemoryRecordLookup().context()));
    }

    private static GeocodeRecord current(String key, Coordinates coordinates) {
        return GeocodeRecord.builder(key)
                .coordinates(coordinates)
                .confidence(0.9)
                .technique("PROXIMITY")
                .qualityTier(QualityTier.EXCELLENT)
                .version(1)
                .current(true)
                .metadata(Map.of("source", "roads"))
                .build();
    }
}
