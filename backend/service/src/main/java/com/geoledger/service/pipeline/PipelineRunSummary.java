package com.geoledger.service.pipeline;

import com.geoledger.core.model.QualityTier;

import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * Outcome of one pipeline run. The final tallies are read back from the store after the last
 * stage, so they describe each ticket's current record rather than the last attempt.
 */
public record PipelineRunSummary(
        String runId,
        String pipelineName,
        PipelineState state,
        int ticketCount,
        List<StageSummary> stages,
        Map<QualityTier, Long> finalTiers,
        long resolved,
        long failed,
        long unresolved,
        long needsReview,
        Instant startedAt,
        Instant finishedAt,
        String abortReason
) {
    public PipelineRunSummary {
        stages = stages == null ? List.of() : List.copyOf(stages);
        finalTiers = finalTiers == null ? Map.of() : Map.copyOf(finalTiers);
    }

    public StageSummary stage(String stageId) {
        return stages.stream()
                .filter(summary -> summary.stageId().equals(stageId))
                .findFirst()
                .orElseThrow(() -> new IllegalArgumentException("No stage " + stageId + " in run " + runId));
    }
}
