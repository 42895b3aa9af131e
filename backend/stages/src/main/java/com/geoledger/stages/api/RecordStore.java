package com.geoledger.stages.api;

import com.geoledger.core.model.GeocodeRecord;

import java.util.List;

/**
 * Versioned record storage. Each ticket key has a chain of versions 1..N of which exactly one is
 * current; writes for one key are serialized, writes for different keys are independent.
 */
public interface RecordStore extends RecordLookup {
    /**
     * Stores the record as the ticket's new current version and returns the assigned record id.
     * Version, supersedes link, creation stage and timestamp are assigned here; lock fields are reset.
     *
     * @throws RecordLockedException if the ticket's current record is locked
     * @throws StorageException if the write could not be committed; the previous current stays current
     */
    long append(GeocodeRecord record, String stageId);

    /** Locks the current record in place. Returns false when the ticket has no current record. */
    boolean lock(String ticketKey, String reason, String actor);

    boolean unlock(String ticketKey);

    List<GeocodeRecord> query(RecordQuery query);

    StoreStatistics statistics();

    /** Every stored version of every ticket, ordered by record id. */
    List<GeocodeRecord> allVersions();

    /**
     * Re-inserts an exported version verbatim. The version must extend the ticket's chain by exactly one.
     */
    void restore(GeocodeRecord record);

    void clear();
}
