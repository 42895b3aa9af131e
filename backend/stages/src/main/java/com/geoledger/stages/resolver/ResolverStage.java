package com.geoledger.stages.resolver;

import com.geoledger.core.model.Ticket;
import com.geoledger.stages.api.Stage;
import com.geoledger.stages.api.StageAttempt;
import com.geoledger.stages.api.StageContext;
import com.geoledger.stages.api.StageFailureException;
import com.geoledger.stages.api.StageSettings;

import java.io.IOException;
import java.util.Objects;
import java.util.Optional;

public class ResolverStage implements Stage {
    private final StageSettings settings;
    private final LocationResolver resolver;

    public ResolverStage(StageSettings settings, LocationResolver resolver) {
        this.settings = Objects.requireNonNull(settings, "settings is required");
        this.resolver = Objects.requireNonNull(resolver, "resolver is required");
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
        Optional<StageAttempt> attempt;
        try {
            attempt = resolver.resolve(ticket);
        } catch (IOException e) {
            throw new StageFailureException("Resolver I/O failure: " + e.getMessage(), e);
        } catch (RuntimeException e) {
            throw new StageFailureException("Resolver error: " + e.getMessage(), e);
        }
        return attempt.orElseThrow(() -> new StageFailureException("No location found for ticket " + ticket.ticketKey()));
    }
}
