package com.geoledger.stages.api;

import com.geoledger.core.model.GeocodeRecord;

import java.util.List;
import java.util.Optional;

/**
 * Read side of the record store, the only view of it stages get.
 */
public interface RecordLookup {
    Optional<GeocodeRecord> getCurrent(String ticketKey);

    /** Every version of the ticket, newest first. */
    List<GeocodeRecord> getHistory(String ticketKey);

    /**
     * Current records of every ticket at the same normalized location, ordered by record id.
     * Returns an empty list for a null key.
     */
    List<GeocodeRecord> findCurrentByRecordKey(String recordKey);
}
