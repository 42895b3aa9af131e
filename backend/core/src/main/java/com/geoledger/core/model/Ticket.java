package com.geoledger.core.model;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;

/**
 * One location-lookup request. Stages receive tickets; only the orchestrator turns them into records.
 */
public record Ticket(String ticketKey, LocationFields location, TicketClass ticketClass, Map<String, String> attributes) {
    private static final List<String> KEY_FIELDS = List.of("ticket_key", "ticket_number", "number");
    private static final List<String> CROSS_FIELDS = List.of("intersection", "cross_street");

    public Ticket {
        Objects.requireNonNull(ticketKey, "ticketKey is required");
        if (ticketKey.isBlank()) {
            throw new IllegalArgumentException("ticketKey must not be blank");
        }
        location = location == null ? LocationFields.empty() : location;
        ticketClass = ticketClass == null ? TicketClass.unclassified() : ticketClass;
        attributes = attributes == null ? Map.of() : Map.copyOf(attributes);
    }

    public Ticket(String ticketKey, LocationFields location, TicketClass ticketClass) {
        this(ticketKey, location, ticketClass, Map.of());
    }

    /**
     * Builds a ticket from a flat record of named fields. Field names are matched case-insensitively;
     * fields that are not part of the location or classification are kept as attributes.
     */
    public static Ticket fromFields(Map<String, String> fields) {
        Map<String, String> normalized = new LinkedHashMap<>();
        for (Map.Entry<String, String> entry : fields.entrySet()) {
            if (entry.getKey() != null && entry.getValue() != null) {
                normalized.put(entry.getKey().trim().toLowerCase(Locale.ROOT).replace(' ', '_'), entry.getValue());
            }
        }
        String key = first(normalized, KEY_FIELDS);
        if (key == null || key.isBlank()) {
            throw new IllegalArgumentException("Ticket is missing a key field (one of " + KEY_FIELDS + ")");
        }
        LocationFields location = new LocationFields(
                normalized.remove("street"),
                first(normalized, CROSS_FIELDS),
                normalized.remove("city"),
                normalized.remove("county")
        );
        TicketClass ticketClass = new TicketClass(
                normalized.remove("ticket_type"),
                normalized.remove("duration"),
                normalized.remove("work_type"),
                normalized.remove("excavator")
        );
        return new Ticket(key.trim(), location, ticketClass, normalized);
    }

    public String recordKey() {
        return location.recordKey();
    }

    private static String first(Map<String, String> fields, List<String> names) {
        String found = null;
        for (String name : names) {
            String value = fields.remove(name);
            if (found == null && value != null) {
                found = value;
            }
        }
        return found;
    }
}
