package com.geoledger.stages.fallback;

import com.geoledger.core.config.ConfigurationException;
import com.geoledger.core.geo.CentroidRegistry;
import com.geoledger.core.model.Approaches;
import com.geoledger.core.model.Coordinates;
import com.geoledger.core.model.LocationFields;
import com.geoledger.core.model.Ticket;
import com.geoledger.core.model.TicketClass;
import com.geoledger.stages.api.StageAttempt;
import com.geoledger.stages.api.StageFailureException;
import com.geoledger.stages.api.StageSettings;
import com.geoledger.stages.support.InMemoryRecordLookup;
import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class CentroidFallbackStageTest {
    private final InMemoryRecordLookup records = new InMemoryRecordLookup();

    @Test
    void usesRegisteredCityCenter() throws Exception {
        CentroidFallbackStage stage = new CentroidFallbackStage(StageSettings.of(CentroidFallbackStage.DEFAULT_ID), CentroidRegistry.defaults());
        Ticket ticket = new Ticket("T-1", new LocationFields("UNKNOWN RD", null, "Kermit", "Winkler"), TicketClass.unclassified());

        StageAttempt attempt = stage.process(ticket, records.context());

        assertEquals(Coordinates.of(31.8576, -103.0930), attempt.coordinates());
        assertEquals(0.35, attempt.confidence());
        assertEquals(Approaches.CITY_CENTROID_FALLBACK, attempt.approach());
        assertEquals(CentroidFallbackStage.TECHNIQUE, attempt.technique());
    }

    @Test
    void confidenceIsConfigurable() throws Exception {
        StageSettings settings = StageSettings.of("fallback").withParams(Map.of("confidence", 0.3));
        CentroidFallbackStage stage = new CentroidFallbackStage(settings, CentroidRegistry.defaults());
        Ticket ticket = new Ticket("T-1", new LocationFields(null, null, "PYOTE", "WARD"), TicketClass.unclassified());

        assertEquals(0.3, stage.process(ticket, records.context()).confidence());
    }

    @Test
    void nonNumericConfidenceIsConfigurationError() {
        StageSettings settings = StageSettings.of("fallback").withParams(Map.of("confidence", "high"));

        ConfigurationException error = assertThrows(ConfigurationException.class, () ->
                new CentroidFallbackStage(settings, CentroidRegistry.defaults()));
        assertEquals("stages.fallback.params.confidence", error.setting());
    }

    @Test
    void unknownCityFails() {
        CentroidFallbackStage stage = new CentroidFallbackStage(StageSettings.of(CentroidFallbackStage.DEFAULT_ID), CentroidRegistry.defaults());
        Ticket ticket = new Ticket("T-2", new LocationFields("MAIN", null, "ODESSA", "ECTOR"), TicketClass.unclassified());

        StageFailureException error = assertThrows(StageFailureException.class, () -> stage.process(ticket, records.context()));
        assertTrue(error.getMessage().contains("ODESSA"));
    }
}
