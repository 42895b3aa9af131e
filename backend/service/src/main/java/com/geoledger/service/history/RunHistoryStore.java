package com.geoledger.service.history;

import com.geoledger.service.pipeline.PipelineRunSummary;

import java.time.Instant;
import java.util.List;

public interface RunHistoryStore {
    void append(PipelineRunSummary summary);

    /** Runs started at or after {@code since}, oldest first, at most the last {@code limit}. */
    List<PipelineRunSummary> recent(Instant since, int limit);
}
