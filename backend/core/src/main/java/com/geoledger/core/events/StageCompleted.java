package com.geoledger.core.events;

import java.time.Instant;

public record StageCompleted(
        Instant timestamp,
        String runId,
        String stageId,
        long processed,
        long skipped,
        long succeeded,
        long failed,
        long improved,
        long durationMillis
) implements Event {
    @Override
    public String type() {
        return "StageCompleted";
    }
}
