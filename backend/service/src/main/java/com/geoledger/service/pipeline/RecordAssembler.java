package com.geoledger.service.pipeline;

import com.geoledger.core.model.GeocodeRecord;
import com.geoledger.core.model.QualityTier;
import com.geoledger.core.model.ReviewPriority;
import com.geoledger.core.model.Ticket;
import com.geoledger.core.model.ValidationFlag;
import com.geoledger.core.quality.QualityAssessor;
import com.geoledger.core.validation.ValidationEngine;
import com.geoledger.core.validation.ValidationSubject;
import com.geoledger.stages.api.StageAttempt;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Builds the record to store from a stage outcome: validate first, then tier on the fresh flags,
 * then priority. Version fields are left to the store.
 */
public class RecordAssembler {
    static final String REJECTED_LATITUDE = "rejectedLatitude";
    static final String REJECTED_LONGITUDE = "rejectedLongitude";

    private final ValidationEngine validation;
    private final QualityAssessor assessor;

    public RecordAssembler(ValidationEngine validation, QualityAssessor assessor) {
        this.validation = Objects.requireNonNull(validation, "validation is required");
        this.assessor = Objects.requireNonNull(assessor, "assessor is required");
    }

    public GeocodeRecord fromAttempt(Ticket ticket, StageAttempt attempt) {
        List<ValidationFlag> flags = validation.validate(new ValidationSubject(
                attempt.coordinates(),
                attempt.confidence(),
                attempt.technique(),
                attempt.approach(),
                ticket.location(),
                ticket.ticketClass()
        ));
        QualityTier tier = assessor.tier(attempt.confidence(), attempt.approach(), flags.size());
        ReviewPriority priority = assessor.priority(tier, attempt.confidence(), attempt.approach(), ticket.ticketClass(), flags.size());

        GeocodeRecord.Builder builder = GeocodeRecord.builder(ticket.ticketKey())
                .ticket(ticket)
                .confidence(attempt.confidence())
                .technique(attempt.technique())
                .approach(attempt.approach())
                .rationale(attempt.rationale())
                .qualityTier(tier)
                .reviewPriority(priority)
                .validationFlags(flags.stream().map(ValidationFlag::code).toList());
        if (tier == QualityTier.FAILED) {
            Map<String, Object> metadata = new LinkedHashMap<>(attempt.metadata());
            metadata.put(REJECTED_LATITUDE, attempt.coordinates().latitude());
            metadata.put(REJECTED_LONGITUDE, attempt.coordinates().longitude());
            return builder
                    .metadata(metadata)
                    .errorMessage("Confidence below the " + QualityTier.REVIEW_NEEDED + " floor after adjustment")
                    .build();
        }
        return builder.coordinates(attempt.coordinates()).metadata(attempt.metadata()).build();
    }

    public GeocodeRecord fromFailure(Ticket ticket, String stageId, String errorMessage) {
        ReviewPriority priority = assessor.priority(QualityTier.FAILED, null, null, ticket.ticketClass(), 0);
        return GeocodeRecord.builder(ticket.ticketKey())
                .ticket(ticket)
                .technique(stageId)
                .qualityTier(QualityTier.FAILED)
                .reviewPriority(priority)
                .errorMessage(errorMessage == null ? "Stage failed without a message" : errorMessage)
                .build();
    }
}
