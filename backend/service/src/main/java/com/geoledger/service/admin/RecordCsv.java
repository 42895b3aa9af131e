package com.geoledger.service.admin;

import com.fasterxml.jackson.core.type.TypeReference;
import com.geoledger.core.model.Coordinates;
import com.geoledger.core.model.GeocodeRecord;
import com.geoledger.core.model.LocationFields;
import com.geoledger.core.model.QualityTier;
import com.geoledger.core.model.ReviewPriority;
import com.geoledger.core.model.TicketClass;
import com.geoledger.core.util.JsonUtils;

import java.io.IOException;
import java.time.Instant;
import java.util.Arrays;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Flat row layout of a record. Every field is carried so an exported history can be imported
 * back; lists are comma-joined and metadata is a JSON cell. Empty cells read back as null.
 */
final class RecordCsv {
    static final String[] HEADERS = {
            "record_id", "ticket_key", "record_key",
            "street", "cross_street", "city", "county",
            "ticket_type", "duration", "work_type", "excavator",
            "latitude", "longitude", "confidence",
            "technique", "approach", "rationale", "error_message",
            "quality_tier", "review_priority", "validation_flags",
            "version", "supersedes_record_id", "current", "created_at", "created_by_stage",
            "locked", "lock_reason", "locked_at", "locked_by",
            "metadata", "processing_duration_ms"
    };

    private RecordCsv() {
    }

    static String[] toRow(GeocodeRecord r) {
        LocationFields location = r.location();
        TicketClass ticketClass = r.ticketClass();
        Coordinates coordinates = r.coordinates();
        return new String[]{
                str(r.recordId()),
                str(r.ticketKey()),
                str(r.recordKey()),
                str(location.street()),
                str(location.crossStreet()),
                str(location.city()),
                str(location.county()),
                str(ticketClass.ticketType()),
                str(ticketClass.duration()),
                str(ticketClass.workType()),
                str(ticketClass.excavator()),
                coordinates == null ? "" : str(coordinates.latitude()),
                coordinates == null ? "" : str(coordinates.longitude()),
                str(r.confidence()),
                str(r.technique()),
                str(r.approach()),
                str(r.rationale()),
                str(r.errorMessage()),
                r.qualityTier().name(),
                r.reviewPriority().name(),
                String.join(",", r.validationFlags()),
                str(r.version()),
                str(r.supersedesRecordId()),
                str(r.current()),
                str(r.createdAt()),
                str(r.createdByStage()),
                str(r.locked()),
                str(r.lockReason()),
                str(r.lockedAt()),
                str(r.lockedBy()),
                r.metadata().isEmpty() ? "" : JsonUtils.toJson(r.metadata()),
                str(r.processingDurationMs())
        };
    }

    static Map<String, Integer> columnIndex(String[] header) {
        Map<String, Integer> index = new HashMap<>();
        for (int i = 0; i < header.length; i++) {
            index.put(header[i].trim().toLowerCase(Locale.ROOT), i);
        }
        for (String required : List.of("record_id", "ticket_key", "quality_tier", "version")) {
            if (!index.containsKey(required)) {
                throw new IllegalArgumentException("CSV header is missing column " + required + ": " + Arrays.toString(header));
            }
        }
        return index;
    }

    static GeocodeRecord fromRow(String[] row, Map<String, Integer> index) {
        Row cells = new Row(row, index);
        String latitude = cells.get("latitude");
        String longitude = cells.get("longitude");
        String flags = cells.get("validation_flags");
        GeocodeRecord.Builder builder = GeocodeRecord.builder(cells.get("ticket_key"))
                .recordId(cells.getLong("record_id"))
                .recordKey(cells.get("record_key"))
                .location(new LocationFields(cells.get("street"), cells.get("cross_street"), cells.get("city"), cells.get("county")))
                .ticketClass(new TicketClass(cells.get("ticket_type"), cells.get("duration"), cells.get("work_type"), cells.get("excavator")))
                .coordinates(latitude == null || longitude == null
                        ? null
                        : Coordinates.of(Double.parseDouble(latitude), Double.parseDouble(longitude)))
                .confidence(cells.getDouble("confidence"))
                .technique(cells.get("technique"))
                .approach(cells.get("approach"))
                .rationale(cells.get("rationale"))
                .errorMessage(cells.get("error_message"))
                .qualityTier(QualityTier.valueOf(cells.get("quality_tier")))
                .reviewPriority(cells.get("review_priority") == null ? null : ReviewPriority.valueOf(cells.get("review_priority")))
                .validationFlags(flags == null ? List.of() : List.of(flags.split(",")))
                .version(Integer.parseInt(cells.get("version")))
                .supersedesRecordId(cells.getLong("supersedes_record_id"))
                .current(Boolean.parseBoolean(cells.get("current")))
                .createdAt(cells.getInstant("created_at"))
                .createdByStage(cells.get("created_by_stage"))
                .metadata(parseMetadata(cells.get("metadata")))
                .processingDurationMs(cells.getLong("processing_duration_ms"));
        if (Boolean.parseBoolean(cells.get("locked"))) {
            builder.lock(cells.get("lock_reason"), cells.getInstant("locked_at"), cells.get("locked_by"));
        }
        return builder.build();
    }

    private static Map<String, Object> parseMetadata(String json) {
        if (json == null) {
            return Map.of();
        }
        try {
            return JsonUtils.objectMapper().readValue(json, new TypeReference<Map<String, Object>>() {
            });
        } catch (IOException e) {
            throw new IllegalArgumentException("Invalid metadata JSON: " + json, e);
        }
    }

    private static String str(Object val) {
        return val == null ? "" : val.toString();
    }

    private record Row(String[] cells, Map<String, Integer> index) {
        String get(String column) {
            Integer position = index.get(column);
            if (position == null || position >= cells.length) {
                return null;
            }
            String value = cells[position];
            return value == null || value.isEmpty() ? null : value;
        }

        Long getLong(String column) {
            String value = get(column);
            return value == null ? null : Long.parseLong(value);
        }

        Double getDouble(String column) {
            String value = get(column);
            return value == null ? null : Double.parseDouble(value);
        }

        Instant getInstant(String column) {
            String value = get(column);
            return value == null ? null : Instant.parse(value);
        }
    }
}
