package com.geoledger.service.pipeline;

public record StageSummary(
        String stageId,
        long total,
        long processed,
        long skipped,
        long succeeded,
        long failed,
        long improved,
        long totalTimeMillis,
        double averageTimeMillis
) {
}
