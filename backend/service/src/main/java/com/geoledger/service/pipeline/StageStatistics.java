package com.geoledger.service.pipeline;

import java.util.concurrent.atomic.LongAdder;

/**
 * Counters for one stage of one run. Safe to update from several workers.
 */
final class StageStatistics {
    private final String stageId;
    private final LongAdder total = new LongAdder();
    private final LongAdder skipped = new LongAdder();
    private final LongAdder succeeded = new LongAdder();
    private final LongAdder failed = new LongAdder();
    private final LongAdder improved = new LongAdder();
    private final LongAdder totalTimeMillis = new LongAdder();

    StageStatistics(String stageId) {
        this.stageId = stageId;
    }

    void considered() {
        total.increment();
    }

    void skipped() {
        skipped.increment();
    }

    void succeeded(long millis, boolean improvedTier) {
        succeeded.increment();
        totalTimeMillis.add(millis);
        if (improvedTier) {
            improved.increment();
        }
    }

    void failed(long millis) {
        failed.increment();
        totalTimeMillis.add(millis);
    }

    long failedCount() {
        return failed.sum();
    }

    StageSummary summary() {
        long succeededCount = succeeded.sum();
        long failedCount = failed.sum();
        long processed = succeededCount + failedCount;
        long time = totalTimeMillis.sum();
        return new StageSummary(
                stageId,
                total.sum(),
                processed,
                skipped.sum(),
                succeededCount,
                failedCount,
                improved.sum(),
                time,
                processed == 0 ? 0.0 : (double) time / processed
        );
    }
}
