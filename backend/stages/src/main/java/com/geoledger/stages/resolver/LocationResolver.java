package com.geoledger.stages.resolver;

import com.geoledger.core.model.Ticket;
import com.geoledger.stages.api.StageAttempt;

import java.io.IOException;
import java.util.Optional;

/**
 * An external resolution technique (geocoding API, road-network proximity, geometric intersection).
 * Returns empty when the technique has no answer for the ticket.
 */
@FunctionalInterface
public interface LocationResolver {
    Optional<StageAttempt> resolve(Ticket ticket) throws IOException;
}
