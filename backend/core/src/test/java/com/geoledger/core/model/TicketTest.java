package com.geoledger.core.model;

import org.junit.jupiter.api.Test;

import java.util.LinkedHashMap;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class TicketTest {
    @Test
    void fromFieldsMapsLocationClassAndAttributes() {
        Map<String, String> fields = new LinkedHashMap<>();
        fields.put("Ticket Number", "2026-0001");
        fields.put("County", "WARD");
        fields.put("City", "PYOTE");
        fields.put("Street", "CR 432");
        fields.put("Intersection", "FM 1927");
        fields.put("Ticket Type", "emergency");
        fields.put("Work Type", "Pipeline");
        fields.put("Dig Depth", "4ft");

        Ticket ticket = Ticket.fromFields(fields);

        assertEquals("2026-0001", ticket.ticketKey());
        assertEquals(new LocationFields("CR 432", "FM 1927", "PYOTE", "WARD"), ticket.location());
        assertEquals("Pipeline", ticket.ticketClass().workType());
        assertTrue(ticket.ticketClass().isElevatedPriority());
        assertEquals(Map.of("dig_depth", "4ft"), ticket.attributes());
    }

    @Test
    void crossStreetAliasIsAccepted() {
        Ticket ticket = Ticket.fromFields(Map.of("ticket_key", "K-9", "cross_street", "SH 18"));

        assertEquals("SH 18", ticket.location().crossStreet());
        assertFalse(ticket.ticketClass().isElevatedPriority());
    }

    @Test
    void missingKeyIsRejected() {
        IllegalArgumentException error = assertThrows(IllegalArgumentException.class, () ->
                Ticket.fromFields(Map.of("city", "KERMIT")));

        assertTrue(error.getMessage().contains("ticket_key"));
    }
}
