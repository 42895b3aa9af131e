package com.geoledger.stages.enrichment;

import com.geoledger.core.model.GeocodeRecord;
import com.geoledger.core.model.QualityTier;
import com.geoledger.core.model.SkipRules;
import com.geoledger.core.model.Ticket;
import com.geoledger.stages.api.Stage;
import com.geoledger.stages.api.StageAttempt;
import com.geoledger.stages.api.StageContext;
import com.geoledger.stages.api.StageFailureException;
import com.geoledger.stages.api.StageSettings;

import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Carries the current result forward with extra metadata merged in. Existing keys are overwritten
 * by the enricher's values.
 */
public class EnrichmentStage implements Stage {
    public static final String DEFAULT_ID = "stage_6_enrichment";
    public static final String JURISDICTION_FILE_PARAM = "jurisdictionFile";

    private final StageSettings settings;
    private final MetadataEnricher enricher;

    public EnrichmentStage(StageSettings settings, MetadataEnricher enricher) {
        this.settings = Objects.requireNonNull(settings, "settings is required");
        this.enricher = Objects.requireNonNull(enricher, "enricher is required");
    }

    /**
     * Jurisdiction enrichment from the file named by the {@code jurisdictionFile} param.
     */
    public static EnrichmentStage withJurisdictions(StageSettings settings, Path baseDir) {
        String file = settings.requiredParam(JURISDICTION_FILE_PARAM, String.class);
        return new EnrichmentStage(settings, JurisdictionEnricher.load(baseDir.resolve(file)));
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
            throw new StageFailureException("Current record v" + current.version() + " has no coordinates to enrich");
        }
        Map<String, Object> metadata = new LinkedHashMap<>(current.metadata());
        metadata.putAll(enricher.enrich(ticket, current.coordinates()));
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
