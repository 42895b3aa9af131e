package com.geoledger.service.store;

import com.geoledger.core.model.GeocodeRecord;

import java.time.Instant;
import java.util.Objects;

/**
 * One committed store change. PUT carries a complete version; LOCK and UNLOCK carry the lock
 * fields applied to the ticket's current version.
 */
public record JournalEntry(
        Operation operation,
        String ticketKey,
        GeocodeRecord record,
        String reason,
        String actor,
        Instant at
) {
    public enum Operation {
        PUT,
        LOCK,
        UNLOCK,
        CLEAR
    }

    public JournalEntry {
        Objects.requireNonNull(operation, "operation is required");
        if (operation == Operation.PUT) {
            Objects.requireNonNull(record, "record is required for PUT");
            ticketKey = record.ticketKey();
        } else if (operation != Operation.CLEAR) {
            Objects.requireNonNull(ticketKey, "ticketKey is required for " + operation);
        }
    }

    public static JournalEntry put(GeocodeRecord record) {
        return new JournalEntry(Operation.PUT, record.ticketKey(), record, null, null, record.createdAt());
    }

    public static JournalEntry lock(String ticketKey, String reason, String actor, Instant at) {
        return new JournalEntry(Operation.LOCK, ticketKey, null, reason, actor, at);
    }

    public static JournalEntry unlock(String ticketKey, Instant at) {
        return new JournalEntry(Operation.UNLOCK, ticketKey, null, null, null, at);
    }

    public static JournalEntry clear(Instant at) {
        return new JournalEntry(Operation.CLEAR, null, null, null, null, at);
    }
}
