package com.geoledger.stages.api;

/**
 * An append was rejected because the ticket's current record is locked.
 */
public class RecordLockedException extends RuntimeException {
    private final String ticketKey;

    public RecordLockedException(String ticketKey, String lockReason) {
        super("Current record for " + ticketKey + " is locked: " + lockReason);
        this.ticketKey = ticketKey;
    }

    public String ticketKey() {
        return ticketKey;
    }
}
