package com.geoledger.core.model;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * One immutable version of a ticket's resolution state. Versions are only ever created through a
 * record store append; a new attempt supersedes the previous version instead of updating it.
 *
 * <p>A FAILED record never carries coordinates and every other tier always does.
 */
public record GeocodeRecord(
        Long recordId,
        String ticketKey,
        String recordKey,
        LocationFields location,
        TicketClass ticketClass,
        Coordinates coordinates,
        Double confidence,
        String technique,
        String approach,
        String rationale,
        String errorMessage,
        QualityTier qualityTier,
        ReviewPriority reviewPriority,
        List<String> validationFlags,
        int version,
        Long supersedesRecordId,
        boolean current,
        Instant createdAt,
        String createdByStage,
        boolean locked,
        String lockReason,
        Instant lockedAt,
        String lockedBy,
        Map<String, Object> metadata,
        Long processingDurationMs
) {
    public GeocodeRecord {
        Objects.requireNonNull(ticketKey, "ticketKey is required");
        Objects.requireNonNull(qualityTier, "qualityTier is required");
        if (confidence != null && (confidence.isNaN() || confidence < 0.0 || confidence > 1.0)) {
            throw new IllegalArgumentException("Confidence out of range [0, 1]: " + confidence);
        }
        if (qualityTier == QualityTier.FAILED && coordinates != null) {
            throw new IllegalArgumentException("FAILED record for " + ticketKey + " must not carry coordinates");
        }
        if (qualityTier != QualityTier.FAILED && coordinates == null) {
            throw new IllegalArgumentException(qualityTier + " record for " + ticketKey + " requires coordinates");
        }
        if (version < 0) {
            throw new IllegalArgumentException("Version must not be negative: " + version);
        }
        location = location == null ? LocationFields.empty() : location;
        ticketClass = ticketClass == null ? TicketClass.unclassified() : ticketClass;
        reviewPriority = reviewPriority == null ? ReviewPriority.NONE : reviewPriority;
        validationFlags = validationFlags == null ? List.of() : List.copyOf(validationFlags);
        metadata = metadata == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(metadata));
    }

    public static Builder builder(String ticketKey) {
        return new Builder(ticketKey);
    }

    public Builder toBuilder() {
        return new Builder(this);
    }

    public boolean hasCoordinates() {
        return coordinates != null;
    }

    public static final class Builder {
        private Long recordId;
        private String ticketKey;
        private String recordKey;
        private LocationFields location;
        private TicketClass ticketClass;
        private Coordinates coordinates;
        private Double confidence;
        private String technique;
        private String approach;
        private String rationale;
        private String errorMessage;
        private QualityTier qualityTier;
        private ReviewPriority reviewPriority;
        private List<String> validationFlags;
        private int version;
        private Long supersedesRecordId;
        private boolean current;
        private Instant createdAt;
        private String createdByStage;
        private boolean locked;
        private String lockReason;
        private Instant lockedAt;
        private String lockedBy;
        private Map<String, Object> metadata;
        private Long processingDurationMs;

        private Builder(String ticketKey) {
            this.ticketKey = ticketKey;
        }

        private Builder(GeocodeRecord source) {
            this.recordId = source.recordId;
            this.ticketKey = source.ticketKey;
            this.recordKey = source.recordKey;
            this.location = source.location;
            this.ticketClass = source.ticketClass;
            this.coordinates = source.coordinates;
            this.confidence = source.confidence;
            this.technique = source.technique;
            this.approach = source.approach;
            this.rationale = source.rationale;
            this.errorMessage = source.errorMessage;
            this.qualityTier = source.qualityTier;
            this.reviewPriority = source.reviewPriority;
            this.validationFlags = source.validationFlags;
            this.version = source.version;
            this.supersedesRecordId = source.supersedesRecordId;
            this.current = source.current;
            this.createdAt = source.createdAt;
            this.createdByStage = source.createdByStage;
            this.locked = source.locked;
            this.lockReason = source.lockReason;
            this.lockedAt = source.lockedAt;
            this.lockedBy = source.lockedBy;
            this.metadata = source.metadata;
            this.processingDurationMs = source.processingDurationMs;
        }

        public Builder recordId(Long recordId) {
            this.recordId = recordId;
            return this;
        }

        public Builder recordKey(String recordKey) {
            this.recordKey = recordKey;
            return this;
        }

        public Builder location(LocationFields location) {
            this.location = location;
            return this;
        }

        public Builder ticketClass(TicketClass ticketClass) {
            this.ticketClass = ticketClass;
            return this;
        }

        /** Copies key, record key, location and classification from the ticket. */
        public Builder ticket(Ticket ticket) {
            this.ticketKey = ticket.ticketKey();
            this.recordKey = ticket.recordKey();
            this.location = ticket.location();
            this.ticketClass = ticket.ticketClass();
            return this;
        }

        public Builder coordinates(Coordinates coordinates) {
            this.coordinates = coordinates;
            return this;
        }

        public Builder confidence(Double confidence) {
            this.confidence = confidence;
            return this;
        }

        public Builder technique(String technique) {
            this.technique = technique;
            return this;
        }

        public Builder approach(String approach) {
            this.approach = approach;
            return this;
        }

        public Builder rationale(String rationale) {
            this.rationale = rationale;
            return this;
        }

        public Builder errorMessage(String errorMessage) {
            this.errorMessage = errorMessage;
            return this;
        }

        public Builder qualityTier(QualityTier qualityTier) {
            this.qualityTier = qualityTier;
            return this;
        }

        public Builder reviewPriority(ReviewPriority reviewPriority) {
            this.reviewPriority = reviewPriority;
            return this;
        }

        public Builder validationFlags(List<String> validationFlags) {
            this.validationFlags = validationFlags;
            return this;
        }

        public Builder version(int version) {
            this.version = version;
            return this;
        }

        public Builder supersedesRecordId(Long supersedesRecordId) {
            this.supersedesRecordId = supersedesRecordId;
            return this;
        }

        public Builder current(boolean current) {
            this.current = current;
            return this;
        }

        public Builder createdAt(Instant createdAt) {
            this.createdAt = createdAt;
            return this;
        }

        public Builder createdByStage(String createdByStage) {
            this.createdByStage = createdByStage;
            return this;
        }

        public Builder lock(String reason, Instant at, String by) {
            this.locked = true;
            this.lockReason = reason;
            this.lockedAt = at;
            this.lockedBy = by;
            return this;
        }

        public Builder unlocked() {
            this.locked = false;
            this.lockReason = null;
            this.lockedAt = null;
            this.lockedBy = null;
            return this;
        }

        public Builder metadata(Map<String, Object> metadata) {
            this.metadata = metadata;
            return this;
        }

        public Builder processingDurationMs(Long processingDurationMs) {
            this.processingDurationMs = processingDurationMs;
            return this;
        }

        public GeocodeRecord build() {
            return new GeocodeRecord(
                    recordId,
                    ticketKey,
                    recordKey,
                    location,
                    ticketClass,
                    coordinates,
                    confidence,
                    technique,
                    approach,
                    rationale,
                    errorMessage,
                    qualityTier,
                    reviewPriority,
                    validationFlags,
                    version,
                    supersedesRecordId,
                    current,
                    createdAt,
                    createdByStage,
                    locked,
                    lockReason,
                    lockedAt,
                    lockedBy,
                    metadata,
                    processingDurationMs
            );
        }
    }
}
