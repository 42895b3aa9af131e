package com.geoledger.core.model;

import com.fasterxml.jackson.annotation.JsonIgnore;

/**
 * Classification fields copied from the ticket so audits never need the source data again.
 */
public record TicketClass(String ticketType, String duration, String workType, String excavator) {
    public static final String ELEVATED_TICKET_TYPE = "Emergency";

    public static TicketClass unclassified() {
        return new TicketClass(null, null, null, null);
    }

    public static TicketClass ofType(String ticketType) {
        return new TicketClass(ticketType, null, null, null);
    }

    @JsonIgnore
    public boolean isElevatedPriority() {
        return ticketType != null && ELEVATED_TICKET_TYPE.equalsIgnoreCase(ticketType.trim());
    }
}
