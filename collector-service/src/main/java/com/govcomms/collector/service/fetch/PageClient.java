package com.govcomms.collector.service.fetch;

/**
 * Blocking HTTP GET used by the fetchers.
 *
 * Implementations throw {@link com.govcomms.collector.exception.TransientFetchException} for
 * retryable failures and {@link com.govcomms.collector.exception.PermanentFetchException} for
 * non-retryable HTTP statuses.
 */
public interface PageClient {

    /**
     * @return the response body, empty string when the body is empty
     */
    String get(String url);
}
