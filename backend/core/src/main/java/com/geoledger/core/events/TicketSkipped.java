package com.geoledger.core.events;

import java.time.Instant;

public record TicketSkipped(
        Instant timestamp,
        String runId,
        String stageId,
        String ticketKey,
        String reason,
        String detail
) implements Event {
    @Override
    public String type() {
        return "TicketSkipped";
    }
}
