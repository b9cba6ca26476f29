package com.govcomms.collector.service.fetch;

import lombok.Builder;
import lombok.Value;

import java.time.LocalDate;
import java.util.function.Predicate;

/**
 * Per-cycle inputs of a fetcher.
 */
@Value
@Builder
public class FetchContext {

    /**
     * Read-only view of the item store for this source.
     */
    Predicate<String> isKnown;

    LocalDate since;

    /**
     * 0 = unlimited
     */
    int maxItems;

    RetryPolicy retryPolicy;

    // blog only
    String startUrl;

    // video only
    boolean uploadsOnly;

    public boolean isKnown(String externalId) {
        return isKnown != null && isKnown.test(externalId);
    }

    public boolean limitReached(int emitted) {
        return maxItems > 0 && emitted >= maxItems;
    }
}
