package com.geoledger.service.pipeline;

import com.geoledger.core.bus.EventBus;
import com.geoledger.core.decision.ReprocessingDecider;
import com.geoledger.core.decision.SkipDecision;
import com.geoledger.core.decision.SkipReason;
import com.geoledger.core.events.AlertRaised;
import com.geoledger.core.events.RecordWritten;
import com.geoledger.core.events.RunCompleted;
import com.geoledger.core.events.StageCompleted;
import com.geoledger.core.events.StageStarted;
import com.geoledger.core.events.TicketSkipped;
import com.geoledger.core.model.GeocodeRecord;
import com.geoledger.core.model.QualityTier;
import com.geoledger.core.model.ReviewPriority;
import com.geoledger.core.model.Ticket;
import com.geoledger.core.quality.QualityAssessor;
import com.geoledger.core.validation.ValidationEngine;
import com.geoledger.service.history.RunHistoryStore;
import com.geoledger.stages.api.RecordLockedException;
import com.geoledger.stages.api.RecordStore;
import com.geoledger.stages.api.Stage;
import com.geoledger.stages.api.StageAttempt;
import com.geoledger.stages.api.StageContext;
import com.geoledger.stages.api.StageFailureException;
import com.geoledger.stages.api.StageSettings;
import com.geoledger.stages.api.StorageException;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Runs the configured stages in order over a batch of tickets. For every (ticket, stage) pair it
 * asks the decider whether to run, records the outcome as a new version, and keeps per-stage
 * counters. Tickets within a stage may run on several workers; stages never overlap.
 */
public class PipelineOrchestrator {
    private static final Logger LOGGER = Logger.getLogger(PipelineOrchestrator.class.getName());

    private final PipelineSettings settings;
    private final List<Stage> stages;
    private final RecordStore store;
    private final RecordAssembler assembler;
    private final ReprocessingDecider decider;
    private final EventBus eventBus;
    private final Clock clock;
    private final RunHistoryStore history;

    private volatile PipelineState state = PipelineState.IDLE;
    private volatile boolean stopRequested;

    public PipelineOrchestrator(
            PipelineSettings settings,
            List<Stage> stages,
            RecordStore store,
            ValidationEngine validation,
            QualityAssessor assessor,
            EventBus eventBus,
            Clock clock
    ) {
        this(settings, stages, store, validation, assessor, eventBus, clock, null);
    }

    public PipelineOrchestrator(
            PipelineSettings settings,
            List<Stage> stages,
            RecordStore store,
            ValidationEngine validation,
            QualityAssessor assessor,
            EventBus eventBus,
            Clock clock,
            RunHistoryStore history
    ) {
        this.settings = Objects.requireNonNull(settings, "settings is required");
        this.stages = List.copyOf(stages);
        this.store = Objects.requireNonNull(store, "store is required");
        this.assembler = new RecordAssembler(validation, assessor);
        this.decider = new ReprocessingDecider(assessor);
        this.eventBus = Objects.requireNonNull(eventBus, "eventBus is required");
        this.clock = Objects.requireNonNull(clock, "clock is required");
        this.history = history;
    }

    public PipelineState state() {
        return state;
    }

    public List<Stage> stages() {
        return stages;
    }

    /**
     * Stops scheduling further tickets and stages. Tickets already being processed finish; the run
     * ends ABORTED.
     */
    public void requestStop() {
        stopRequested = true;
    }

    public PipelineRunSummary run(List<Ticket> tickets) {
        synchronized (this) {
            if (state == PipelineState.RUNNING) {
                throw new IllegalStateException("Pipeline " + settings.name() + " is already running");
            }
            state = PipelineState.RUNNING;
            stopRequested = false;
        }
        String runId = UUID.randomUUID().toString();
        Instant startedAt = clock.instant();
        List<Ticket> batch = distinct(tickets);
        List<Stage> enabled = stages.stream().filter(stage -> stage.settings().enabled()).toList();
        LOGGER.info("Run " + runId + " of " + settings.name() + " started: "
                + batch.size() + " tickets, " + enabled.size() + " stages, " + settings.workers() + " workers");

        List<StageSummary> summaries = new ArrayList<>();
        String abortReason = null;
        ExecutorService workers = settings.workers() > 1 ? newWorkerPool(settings.workers()) : null;
        try {
            StageContext context = new StageContext(runId, store, clock);
            for (int i = 0; i < enabled.size(); i++) {
                if (stopRequested) {
                    abortReason = "stop requested";
                    break;
                }
                Stage stage = enabled.get(i);
                StageSummary summary = runStage(runId, stage, i, enabled.size(), batch, context, workers);
                summaries.add(summary);
                if (stopRequested) {
                    abortReason = "stop requested";
                    break;
                }
                if (settings.failFast() && summary.failed() > 0) {
                    abortReason = "fail-fast: " + summary.failed() + " failures in " + stage.id();
                    LOGGER.warning("Stopping run " + runId + ": " + abortReason);
                    break;
                }
            }
        } catch (RuntimeException e) {
            state = PipelineState.ABORTED;
            throw e;
        } finally {
            if (workers != null) {
                workers.shutdownNow();
            }
        }

        PipelineState finalState = abortReason == null ? PipelineState.COMPLETED : PipelineState.ABORTED;
        PipelineRunSummary summary = summarize(runId, batch, summaries, finalState, startedAt, abortReason);
        recordHistory(summary);
        eventBus.publish(new RunCompleted(
                summary.finishedAt(),
                runId,
                settings.name(),
                finalState.name(),
                batch.size(),
                Duration.between(startedAt, summary.finishedAt()).toMillis()
        ));
        LOGGER.info("Run " + runId + " " + finalState + ": resolved=" + summary.resolved()
                + " failed=" + summary.failed() + " unresolved=" + summary.unresolved()
                + " needsReview=" + summary.needsReview());
        state = finalState;
        return summary;
    }

    private StageSummary runStage(
            String runId,
            Stage stage,
            int index,
            int stageCount,
            List<Ticket> batch,
            StageContext context,
            ExecutorService workers
    ) {
        eventBus.publish(new StageStarted(clock.instant(), runId, stage.id(), index, stageCount, batch.size()));
        LOGGER.info("Stage " + (index + 1) + "/" + stageCount + " " + stage.id() + " started");
        long started = System.nanoTime();
        StageStatistics statistics = new StageStatistics(stage.id());

        if (workers == null) {
            for (Ticket ticket : batch) {
                if (stopRequested) {
                    break;
                }
                processTicket(runId, stage, ticket, context, statistics);
            }
        } else {
            List<Future<?>> pending = new ArrayList<>();
            for (Ticket ticket : batch) {
                pending.add(workers.submit(() -> {
                    if (!stopRequested) {
                        processTicket(runId, stage, ticket, context, statistics);
                    }
                }));
            }
            awaitAll(stage, pending);
        }

        StageSummary summary = statistics.summary();
        long durationMillis = Duration.ofNanos(System.nanoTime() - started).toMillis();
        eventBus.publish(new StageCompleted(
                clock.instant(),
                runId,
                stage.id(),
                summary.processed(),
                summary.skipped(),
                summary.succeeded(),
                summary.failed(),
                summary.improved(),
                durationMillis
        ));
        LOGGER.info("Stage " + stage.id() + " completed: total=" + summary.total()
                + " processed=" + summary.processed() + " skipped=" + summary.skipped()
                + " succeeded=" + summary.succeeded() + " failed=" + summary.failed()
                + " improved=" + summary.improved() + " in " + durationMillis + "ms");
        return summary;
    }

    private void processTicket(String runId, Stage stage, Ticket ticket, StageContext context, StageStatistics statistics) {
        statistics.considered();
        StageSettings stageSettings = stage.settings();
        Optional<GeocodeRecord> current = store.getCurrent(ticket.ticketKey());
        SkipDecision decision = decider.decide(current, stage.id(), stageSettings.skipRules(), stageSettings.reprocessThreshold());
        if (decision.skip()) {
            skip(runId, stage, ticket, statistics, decision.reason(), decision.detail());
            return;
        }

        long started = System.nanoTime();
        GeocodeRecord record;
        boolean stageFailed = false;
        try {
            StageAttempt attempt = stage.process(ticket, context);
            record = assembler.fromAttempt(ticket, attempt);
        } catch (StageFailureException e) {
            stageFailed = true;
            record = assembler.fromFailure(ticket, stage.id(), e.getMessage());
            LOGGER.warning("Stage " + stage.id() + " failed for " + ticket.ticketKey() + ": " + e.getMessage());
        } catch (RuntimeException e) {
            stageFailed = true;
            record = assembler.fromFailure(ticket, stage.id(), "Unexpected error: " + e.getMessage());
            LOGGER.log(Level.WARNING, "Stage " + stage.id() + " threw for " + ticket.ticketKey(), e);
        }
        long millis = Duration.ofNanos(System.nanoTime() - started).toMillis();
        record = record.toBuilder().processingDurationMs(millis).build();

        long recordId;
        try {
            recordId = store.append(record, stage.id());
        } catch (RecordLockedException e) {
            skip(runId, stage, ticket, statistics, SkipReason.LOCKED_AT_WRITE, e.getMessage());
            return;
        } catch (StorageException e) {
            statistics.failed(millis);
            LOGGER.log(Level.WARNING, "Storage failure for " + ticket.ticketKey() + " in " + stage.id(), e);
            Map<String, Object> details = new LinkedHashMap<>();
            details.put("runId", runId);
            details.put("stageId", stage.id());
            details.put("ticketKey", ticket.ticketKey());
            eventBus.publish(new AlertRaised(clock.instant(), "storage", "Storage failure: " + e.getMessage(), details));
            return;
        }

        if (stageFailed) {
            statistics.failed(millis);
        } else {
            boolean improved = current.isPresent()
                    && ImprovementTracker.classify(current.get().qualityTier(), record.qualityTier()) != ImprovementTracker.Kind.NO_IMPROVEMENT;
            statistics.succeeded(millis, improved);
        }
        int version = current.map(previous -> previous.version() + 1).orElse(1);
        eventBus.publish(new RecordWritten(
                clock.instant(),
                runId,
                stage.id(),
                ticket.ticketKey(),
                recordId,
                version,
                record.qualityTier(),
                record.reviewPriority()
        ));
    }

    private void skip(String runId, Stage stage, Ticket ticket, StageStatistics statistics, SkipReason reason, String detail) {
        statistics.skipped();
        LOGGER.fine("Skipping " + ticket.ticketKey() + " in " + stage.id() + ": " + reason + " (" + detail + ")");
        eventBus.publish(new TicketSkipped(clock.instant(), runId, stage.id(), ticket.ticketKey(), reason.name(), detail));
    }

    private PipelineRunSummary summarize(
            String runId,
            List<Ticket> batch,
            List<StageSummary> summaries,
            PipelineState finalState,
            Instant startedAt,
            String abortReason
    ) {
        Map<QualityTier, Long> tiers = new EnumMap<>(QualityTier.class);
        long resolved = 0;
        long failed = 0;
        long unresolved = 0;
        long needsReview = 0;
        for (Ticket ticket : batch) {
            Optional<GeocodeRecord> current = store.getCurrent(ticket.ticketKey());
            if (current.isEmpty()) {
                unresolved++;
                continue;
            }
            GeocodeRecord record = current.get();
            tiers.merge(record.qualityTier(), 1L, Long::sum);
            if (record.qualityTier() == QualityTier.FAILED) {
                failed++;
            } else {
                resolved++;
            }
            if (record.reviewPriority() != ReviewPriority.NONE) {
                needsReview++;
            }
        }
        return new PipelineRunSummary(
                runId,
                settings.name(),
                finalState,
                batch.size(),
                summaries,
                tiers,
                resolved,
                failed,
                unresolved,
                needsReview,
                startedAt,
                clock.instant(),
                abortReason
        );
    }

    private void recordHistory(PipelineRunSummary summary) {
        if (history == null) {
            return;
        }
        try {
            history.append(summary);
        } catch (RuntimeException e) {
            LOGGER.log(Level.WARNING, "Failed to record run history for " + summary.runId(), e);
        }
    }

    private void awaitAll(Stage stage, List<Future<?>> pending) {
        for (Future<?> future : pending) {
            try {
                future.get();
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                stopRequested = true;
                throw new IllegalStateException("Interrupted while running stage " + stage.id(), e);
            } catch (ExecutionException e) {
                throw new IllegalStateException("Worker failed in stage " + stage.id(), e.getCause());
            }
        }
    }

    private static List<Ticket> distinct(List<Ticket> tickets) {
        Map<String, Ticket> byKey = new LinkedHashMap<>();
        for (Ticket ticket : tickets) {
            if (byKey.putIfAbsent(ticket.ticketKey(), ticket) != null) {
                LOGGER.warning("Ignoring duplicate ticket " + ticket.ticketKey() + " in batch");
            }
        }
        return List.copyOf(byKey.values());
    }

    private static ExecutorService newWorkerPool(int size) {
        AtomicInteger counter = new AtomicInteger();
        return Executors.newFixedThreadPool(size, runnable -> {
            Thread thread = new Thread(runnable, "pipeline-worker-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        });
    }
}
