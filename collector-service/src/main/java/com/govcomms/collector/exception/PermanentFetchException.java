package com.govcomms.collector.exception;

/**
 * Non-retryable HTTP response, e.g. 404 or 401.
 */
public class PermanentFetchException extends SourceCycleFailedException {

    private final int statusCode;

    public PermanentFetchException(int statusCode, String message) {
        super(message);
        this.statusCode = statusCode;
    }

    public PermanentFetchException(int statusCode, String message, Throwable cause) {
        super(message, cause);
        this.statusCode = statusCode;
    }

    public int getStatusCode() {
        return statusCode;
    }

    public boolean isNotFound() {
        return statusCode == 404;
    }
}
