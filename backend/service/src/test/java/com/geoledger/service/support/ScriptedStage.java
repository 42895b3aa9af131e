package com.geoledger.service.support;

import com.geoledger.core.model.Coordinates;
import com.geoledger.core.model.Ticket;
import com.geoledger.stages.api.Stage;
import com.geoledger.stages.api.StageAttempt;
import com.geoledger.stages.api.StageContext;
import com.geoledger.stages.api.StageFailureException;
import com.geoledger.stages.api.StageSettings;

import java.util.List;
import java.util.Locale;
import java.util.concurrent.CopyOnWriteArrayList;

/** Stage whose outcome per ticket is supplied by the test. Records every ticket it processed. */
public class ScriptedStage implements Stage {
    public static final Coordinates KERMIT = Coordinates.of(31.8576, -103.0930);

    @FunctionalInterface
    public interface Step {
        StageAttempt apply(Ticket ticket) throws StageFailureException;
    }

    private final StageSettings settings;
    private final Step step;
    private final List<String> processed = new CopyOnWriteArrayList<>();

    public ScriptedStage(StageSettings settings, Step step) {
        this.settings = settings;
        this.step = step;
    }

    public static ScriptedStage constant(String id, double confidence) {
        return new ScriptedStage(StageSettings.of(id), ticket -> StageAttempt.of(KERMIT, confidence, id.toUpperCase(Locale.ROOT)));
    }

    @Override
    public String id() {
        return settings.id();
    }

    @Override
    public StageSettings settings() {
        return settings;
    }

    @Override
    public StageAttempt process(Ticket ticket, StageContext context) throws StageFailureException {
        processed.add(ticket.ticketKey());
        return step.apply(ticket);
    }

    public List<String> processed() {
        return List.copyOf(processed);
    }
}
