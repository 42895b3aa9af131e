package com.geoledger.service.history;

import com.geoledger.core.util.JsonUtils;
import com.geoledger.service.pipeline.PipelineRunSummary;

import java.io.BufferedWriter;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.locks.ReentrantLock;

public class JsonlRunHistoryStore implements RunHistoryStore {
    private final Path file;
    private final ReentrantLock lock = new ReentrantLock();

    public JsonlRunHistoryStore(Path file) {
        this.file = file;
    }

    @Override
    public void append(PipelineRunSummary summary) {
        lock.lock();
        try {
            if (file.getParent() != null) {
                Files.createDirectories(file.getParent());
            }
            try (BufferedWriter writer = Files.newBufferedWriter(
                    file,
                    StandardCharsets.UTF_8,
                    StandardOpenOption.CREATE,
                    StandardOpenOption.APPEND
            )) {
                writer.write(JsonUtils.toJson(summary));
                writer.newLine();
            }
        } catch (IOException e) {
            throw new IllegalStateException("Failed appending run history to " + file, e);
        } finally {
            lock.unlock();
        }
    }

    @Override
    public List<PipelineRunSummary> recent(Instant since, int limit) {
        lock.lock();
        try {
            if (!Files.exists(file)) {
                return List.of();
            }
            List<PipelineRunSummary> runs = new ArrayList<>();
            int lineNumber = 0;
            for (String line : Files.readAllLines(file, StandardCharsets.UTF_8)) {
                lineNumber++;
                if (line.isBlank()) {
                    continue;
                }
                PipelineRunSummary run;
                try {
                    run = JsonUtils.objectMapper().readValue(line, PipelineRunSummary.class);
                } catch (IOException decodeError) {
                    throw new IllegalStateException("Invalid run history entry at line " + lineNumber, decodeError);
                }
                if (run.startedAt().isBefore(since)) {
                    continue;
                }
                runs.add(run);
            }
            if (runs.size() <= limit) {
                return runs;
            }
            return runs.subList(runs.size() - limit, runs.size());
        } catch (IOException e) {
            throw new IllegalStateException("Failed reading run history " + file, e);
        } finally {
            lock.unlock();
        }
    }
}
