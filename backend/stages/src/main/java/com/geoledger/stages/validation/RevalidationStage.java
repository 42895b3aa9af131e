package com.geoledger.stages.validation;

import com.geoledger.core.model.GeocodeRecord;
import com.geoledger.core.model.QualityTier;
import com.geoledger.core.model.SkipRules;
import com.geoledger.core.model.Ticket;
import com.geoledger.stages.api.Stage;
import com.geoledger.stages.api.StageAttempt;
import com.geoledger.stages.api.StageContext;
import com.geoledger.stages.api.StageFailureException;
import com.geoledger.stages.api.StageSettings;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Re-submits the current result unchanged so it is validated and assessed again under the
 * current rules.
 */
public class RevalidationStage implements Stage {
    public static final String DEFAULT_ID = "stage_5_validation";

    private final StageSettings settings;

    public RevalidationStage(StageSettings settings) {
        this.settings = Objects.requireNonNull(settings, "settings is required");
    }

    public static StageSettings defaultSettings() {
        return StageSettings.of(DEFAULT_ID).withSkipRules(SkipRules.skipTiers(Set.of(QualityTier.FAILED)));
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
        GeocodeRecord current = context.records().getCurrent(ticket.ticketKey())
                .orElseThrow(() -> new StageFailureException("No current record for ticket " + ticket.ticketKey()));
        if (!current.hasCoordinates()) {
            throw new StageFailureException("Current record v" + current.version() + " has no coordinates to validate");
        }
        Map<String, Object> metadata = new LinkedHashMap<>(current.metadata());
        metadata.put("revalidatedVersion", current.version());
        metadata.put("previousFlags", String.join(",", current.validationFlags()));
        return new StageAttempt(
                current.coordinates(),
                current.confidence(),
                current.technique(),
                current.approach(),
                current.rationale(),
                metadata
        );
    }
}
