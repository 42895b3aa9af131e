package com.geoledger.stages.support;

import com.geoledger.core.model.GeocodeRecord;
import com.geoledger.stages.api.RecordLookup;
import com.geoledger.stages.api.StageContext;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

public class InMemoryRecordLookup implements RecordLookup {
    private final Map<String, GeocodeRecord> current = new ConcurrentHashMap<>();

    public InMemoryRecordLookup put(GeocodeRecord record) {
        current.put(record.ticketKey(), record);
        return this;
    }

    @Override
    public Optional<GeocodeRecord> getCurrent(String ticketKey) {
        return Optional.ofNullable(current.get(ticketKey));
    }

    @Override
    public List<GeocodeRecord> getHistory(String ticketKey) {
        return getCurrent(ticketKey).map(List::of).orElse(List.of());
    }

    @Override
    public List<GeocodeRecord> findCurrentByRecordKey(String recordKey) {
        return current.values().stream()
                .filter(record -> recordKey != null && recordKey.equals(record.recordKey()))
                .toList();
    }

    public StageContext context() {
        return new StageContext("run-test", this, Clock.fixed(Instant.parse("2026-03-01T00:00:00Z"), ZoneOffset.UTC));
    }
}
