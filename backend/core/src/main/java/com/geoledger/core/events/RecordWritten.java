package com.geoledger.core.events;

import com.geoledger.core.model.QualityTier;
import com.geoledger.core.model.ReviewPriority;

import java.time.Instant;

public record RecordWritten(
        Instant timestamp,
        String runId,
        String stageId,
        String ticketKey,
        long recordId,
        int version,
        QualityTier qualityTier,
        ReviewPriority reviewPriority
) implements Event {
    @Override
    public String type() {
        return "RecordWritten";
    }
}
