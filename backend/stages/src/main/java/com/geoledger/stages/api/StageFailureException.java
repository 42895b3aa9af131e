package com.geoledger.stages.api;

/**
 * A stage could not produce a result for a ticket. The message is stored on the FAILED record.
 */
public class StageFailureException extends Exception {
    public StageFailureException(String message) {
        super(message);
    }

    public StageFailureException(String message, Throwable cause) {
        super(message, cause);
    }
}
