package com.govcomms.collector.exception;

/**
 * Network error, timeout or retryable HTTP status (429, 5xx). Retried under the retry policy.
 */
public class TransientFetchException extends CollectorException {

    private final Integer statusCode;

    public TransientFetchException(String message) {
        super("TRANSIENT_FETCH", message);
        this.statusCode = null;
    }

    public TransientFetchException(String message, Throwable cause) {
        super("TRANSIENT_FETCH", message, cause);
        this.statusCode = null;
    }

    public TransientFetchException(int statusCode, String message) {
        super("TRANSIENT_FETCH", message);
        this.statusCode = statusCode;
    }

    public Integer getStatusCode() {
        return statusCode;
    }
}
