package com.govcomms.collector.exception;

/**
 * Ends the cycle of a single source. Other sources keep running.
 */
public class SourceCycleFailedException extends CollectorException {

    public SourceCycleFailedException(String message) {
        super("SOURCE_CYCLE_FAILED", message);
    }

    public SourceCycleFailedException(String message, Throwable cause) {
        super("SOURCE_CYCLE_FAILED", message, cause);
    }
}
