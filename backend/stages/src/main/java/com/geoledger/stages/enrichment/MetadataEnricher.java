package com.geoledger.stages.enrichment;

import com.geoledger.core.model.Coordinates;
import com.geoledger.core.model.Ticket;

import java.util.Map;

@FunctionalInterface
public interface MetadataEnricher {
    Map<String, Object> enrich(Ticket ticket, Coordinates coordinates);
}
