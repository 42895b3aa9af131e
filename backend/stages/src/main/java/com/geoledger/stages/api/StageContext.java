package com.geoledger.stages.api;

import java.time.Clock;
import java.util.Objects;

public record StageContext(String runId, RecordLookup records, Clock clock) {
    public StageContext {
        Objects.requireNonNull(runId, "runId is required");
        Objects.requireNonNull(records, "records is required");
        Objects.requireNonNull(clock, "clock is required");
    }
}
