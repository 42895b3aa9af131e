package com.geoledger.service.history;

import com.geoledger.core.model.QualityTier;
import com.geoledger.service.pipeline.PipelineRunSummary;
import com.geoledger.service.pipeline.PipelineState;
import com.geoledger.service.pipeline.StageSummary;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class JsonlRunHistoryStoreTest {
    @Test
    void appendedRunsReadBackWithStageStatistics() throws Exception {
        Path file = Files.createTempDirectory("run-history-").resolve("logs/runs.jsonl");
        JsonlRunHistoryStore store = new JsonlRunHistoryStore(file);
        PipelineRunSummary run = summary("run-1", Instant.parse("2026-03-01T10:00:00Z"));

        store.append(run);

        List<PipelineRunSummary> runs = new JsonlRunHistoryStore(file).recent(Instant.EPOCH, 10);
        assertEquals(1, runs.size());
        PipelineRunSummary loaded = runs.get(0);
        assertEquals(run, loaded);
        assertEquals(2L, loaded.finalTiers().get(QualityTier.GOOD));
        assertEquals(3, loaded.stage("stage_1").succeeded());
    }

    @Test
    void recentFiltersBySinceAndKeepsTheLatest() throws Exception {
        Path file = Files.createTempDirectory("run-history-recent-").resolve("runs.jsonl");
        JsonlRunHistoryStore store = new JsonlRunHistoryStore(file);
        for (int i = 0; i < 5; i++) {
            store.append(summary("run-" + i, Instant.parse("2026-03-01T10:00:00Z").plusSeconds(60L * i)));
        }

        List<PipelineRunSummary> sinceThird = store.recent(Instant.parse("2026-03-01T10:02:00Z"), 10);
        assertEquals(List.of("run-2", "run-3", "run-4"), sinceThird.stream().map(PipelineRunSummary::runId).toList());

        List<PipelineRunSummary> lastTwo = store.recent(Instant.EPOCH, 2);
        assertEquals(List.of("run-3", "run-4"), lastTwo.stream().map(PipelineRunSummary::runId).toList());
        assertEquals(5, Files.readAllLines(file, StandardCharsets.UTF_8).size());
    }

    @Test
    void missingFileReadsAsEmpty() throws Exception {
        JsonlRunHistoryStore store = new JsonlRunHistoryStore(Files.createTempDirectory("run-history-missing-").resolve("none.jsonl"));
        assertTrue(store.recent(Instant.EPOCH, 10).isEmpty());
    }

    @Test
    void invalidLineNamesItsPosition() throws Exception {
        Path file = Files.createTempDirectory("run-history-invalid-").resolve("runs.jsonl");
        Files.writeString(file, "{broken\n", StandardCharsets.UTF_8);

        IllegalStateException error = assertThrows(IllegalStateException.class,
                () -> new JsonlRunHistoryStore(file).recent(Instant.EPOCH, 10));
        assertTrue(error.getMessage().contains("line 1"));
    }

    private static PipelineRunSummary summary(String runId, Instant startedAt) {
        return new PipelineRunSummary(
                runId,
                "nightly",
                PipelineState.COMPLETED,
                3,
                List.of(new StageSummary("stage_1", 3, 3, 0, 3, 0, 1, 30, 10.0)),
                Map.of(QualityTier.GOOD, 2L, QualityTier.FAILED, 1L),
                2,
                1,
                0,
                1,
                startedAt,
                startedAt.plusSeconds(5),
                null
        );
    }
}
