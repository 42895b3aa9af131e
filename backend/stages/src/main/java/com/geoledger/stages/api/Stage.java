package com.geoledger.stages.api;

import com.geoledger.core.model.Ticket;

/**
 * One resolution technique. A stage only resolves; whether it runs for a ticket and what gets
 * stored is decided by the orchestrator.
 */
public interface Stage {
    String id();

    StageSettings settings();

    StageAttempt process(Ticket ticket, StageContext context) throws StageFailureException;
}
