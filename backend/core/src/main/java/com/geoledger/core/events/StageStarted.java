package com.geoledger.core.events;

import java.time.Instant;

public record StageStarted(
        Instant timestamp,
        String runId,
        String stageId,
        int stageIndex,
        int stageCount,
        int ticketCount
) implements Event {
    @Override
    public String type() {
        return "StageStarted";
    }
}
