package com.geoledger.service;

import com.fasterxml.jackson.core.type.TypeReference;
import com.geoledger.core.bus.EventBus;
import com.geoledger.core.events.AlertRaised;
import com.geoledger.core.geo.CentroidRegistry;
import com.geoledger.core.model.QualityTier;
import com.geoledger.core.model.ReviewPriority;
import com.geoledger.core.model.Ticket;
import com.geoledger.core.quality.QualityAssessor;
import com.geoledger.core.util.JsonUtils;
import com.geoledger.core.validation.ValidationEngine;
import com.geoledger.service.admin.RecordAdministration;
import com.geoledger.service.config.ConfigLoader;
import com.geoledger.service.config.PipelineConfig;
import com.geoledger.service.config.StageFactory;
import com.geoledger.service.history.JsonlRunHistoryStore;
import com.geoledger.service.history.RunHistoryStore;
import com.geoledger.service.pipeline.PipelineOrchestrator;
import com.geoledger.service.pipeline.PipelineRunSummary;
import com.geoledger.service.pipeline.PipelineSettings;
import com.geoledger.service.pipeline.StageSummary;
import com.geoledger.service.store.InMemoryRecordStore;
import com.geoledger.service.store.JournalRecordStore;
import com.geoledger.stages.api.RecordStore;
import com.geoledger.stages.api.StoreStatistics;

import java.io.IOException;
import java.io.PrintStream;
import java.nio.file.Path;
import java.time.Clock;
import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.logging.Logger;

public final class Main {
    private static final Logger LOGGER = Logger.getLogger(Main.class.getName());

    static final String USAGE = String.join(System.lineSeparator(),
            "Usage: Main <command> [args]",
            "  run <tickets.json>",
            "  stats",
            "  export <csv>",
            "  export-history <csv>",
            "  import <csv>",
            "  review-queue <csv> [CRITICAL,HIGH,...]",
            "  lock <ticket> <reason> [actor]",
            "  unlock <ticket>",
            "  clear yes");

    private Main() {
    }

    public static void main(String[] args) {
        Path configDir = Path.of(System.getenv().getOrDefault("GEOLEDGER_CONFIG_DIR", "config"));
        int code = run(args, configDir, System.out, System.err);
        if (code != 0) {
            System.exit(code);
        }
    }

    static int run(String[] args, Path configDir, PrintStream out, PrintStream err) {
        if (args.length == 0) {
            out.println(USAGE);
            return 1;
        }
        try {
            PipelineConfig config = ConfigLoader.loadPipeline(configDir);
            RecordStore store = openStore(configDir, config);
            RecordAdministration admin = new RecordAdministration(store);
            String command = args[0];
            switch (command) {
                case "run" -> {
                    requireArgs(args, 2);
                    runPipeline(configDir, config, store, Path.of(args[1]), out, err);
                }
                case "stats" -> printStatistics(admin.statistics(), out);
                case "export" -> {
                    requireArgs(args, 2);
                    out.println("Exported " + admin.exportCurrent(Path.of(args[1])) + " records");
                }
                case "export-history" -> {
                    requireArgs(args, 2);
                    out.println("Exported " + admin.exportAllVersions(Path.of(args[1])) + " record versions");
                }
                case "import" -> {
                    requireArgs(args, 2);
                    out.println("Imported " + admin.importCsv(Path.of(args[1])) + " record versions");
                }
                case "review-queue" -> {
                    requireArgs(args, 2);
                    Set<ReviewPriority> priorities = args.length > 2 ? parsePriorities(args[2]) : Set.of();
                    out.println("Wrote " + admin.writeReviewQueue(Path.of(args[1]), priorities) + " review entries");
                }
                case "lock" -> {
                    requireArgs(args, 3);
                    String actor = args.length > 3 ? args[3] : "cli";
                    out.println(store.lock(args[1], args[2], actor) ? "Locked " + args[1] : "No current record for " + args[1]);
                }
                case "unlock" -> {
                    requireArgs(args, 2);
                    out.println(store.unlock(args[1]) ? "Unlocked " + args[1] : "No current record for " + args[1]);
                }
                case "clear" -> {
                    requireArgs(args, 2);
                    out.println("Cleared " + admin.clear(args[1]) + " record versions");
                }
                default -> {
                    out.println(USAGE);
                    return 1;
                }
            }
            return 0;
        } catch (UsageException e) {
            out.println(USAGE);
            return 1;
        } catch (RuntimeException e) {
            LOGGER.warning("Command " + args[0] + " failed: " + e);
            err.println("Error: " + e.getMessage());
            return 2;
        }
    }

    static RecordStore openStore(Path configDir, PipelineConfig config) {
        String journalFile = config.storage().journalFile();
        if (journalFile == null || journalFile.isBlank()) {
            LOGGER.info("No journal file configured; records are kept in memory only");
            return new InMemoryRecordStore();
        }
        return new JournalRecordStore(configDir.resolve(journalFile));
    }

    private static void runPipeline(
            Path configDir,
            PipelineConfig config,
            RecordStore store,
            Path ticketsFile,
            PrintStream out,
            PrintStream err
    ) {
        CentroidRegistry centroids = ConfigLoader.loadCentroids(configDir, config);
        EventBus eventBus = new EventBus();
        eventBus.subscribe(AlertRaised.class, alert -> err.println("ALERT [" + alert.category() + "] " + alert.message()));

        String historyFile = config.storage().historyFile();
        RunHistoryStore history = historyFile == null || historyFile.isBlank()
                ? null
                : new JsonlRunHistoryStore(configDir.resolve(historyFile));

        PipelineOrchestrator orchestrator = new PipelineOrchestrator(
                new PipelineSettings(config.name(), config.failFast(), config.workers()),
                new StageFactory(configDir, centroids).createAll(config.stages()),
                store,
                ValidationEngine.defaults(centroids),
                new QualityAssessor(),
                eventBus,
                Clock.systemUTC(),
                history
        );
        PipelineRunSummary summary = orchestrator.run(readTickets(ticketsFile));
        printRunSummary(summary, out);
    }

    static List<Ticket> readTickets(Path file) {
        List<Map<String, String>> rows;
        try {
            rows = JsonUtils.objectMapper().readValue(file.toFile(), new TypeReference<>() {
            });
        } catch (IOException e) {
            throw new IllegalStateException("Failed reading tickets " + file, e);
        }
        List<Ticket> tickets = new ArrayList<>();
        for (Map<String, String> row : rows) {
            tickets.add(Ticket.fromFields(row));
        }
        return tickets;
    }

    static Set<ReviewPriority> parsePriorities(String csv) {
        Set<ReviewPriority> priorities = EnumSet.noneOf(ReviewPriority.class);
        for (String part : csv.split(",")) {
            if (!part.isBlank()) {
                priorities.add(ReviewPriority.valueOf(part.trim().toUpperCase(Locale.ROOT)));
            }
        }
        return priorities;
    }

    private static void printRunSummary(PipelineRunSummary summary, PrintStream out) {
        out.println("Run " + summary.runId() + " (" + summary.pipelineName() + ") " + summary.state()
                + ": " + summary.ticketCount() + " tickets");
        for (StageSummary stage : summary.stages()) {
            out.printf(Locale.ROOT, "  %-24s processed=%d skipped=%d succeeded=%d failed=%d improved=%d avg=%.1fms%n",
                    stage.stageId(), stage.processed(), stage.skipped(), stage.succeeded(),
                    stage.failed(), stage.improved(), stage.averageTimeMillis());
        }
        out.println("  resolved=" + summary.resolved() + " failed=" + summary.failed()
                + " unresolved=" + summary.unresolved() + " needsReview=" + summary.needsReview());
        if (summary.abortReason() != null) {
            out.println("  aborted: " + summary.abortReason());
        }
    }

    private static void printStatistics(StoreStatistics statistics, PrintStream out) {
        out.println("Current records: " + statistics.totalRecords());
        out.println("Total versions: " + statistics.totalVersions());
        out.println("Locked: " + statistics.lockedRecords());
        for (QualityTier tier : QualityTier.values()) {
            long count = statistics.count(tier);
            if (count == 0) {
                continue;
            }
            Double average = statistics.averageConfidenceByTier().get(tier);
            out.println("  " + tier + ": " + count
                    + (average == null ? "" : String.format(Locale.ROOT, " (avg confidence %.2f)", average)));
        }
    }

    private static void requireArgs(String[] args, int count) {
        if (args.length < count) {
            throw new UsageException();
        }
    }

    private static final class UsageException extends RuntimeException {
    }
}
