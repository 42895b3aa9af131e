package com.geoledger.core.events;

import java.time.Instant;

public record RunCompleted(
        Instant timestamp,
        String runId,
        String pipelineName,
        String state,
        int ticketCount,
        long durationMillis
) implements Event {
    @Override
    public String type() {
        return "RunCompleted";
    }
}
