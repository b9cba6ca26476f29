package com.govcomms.collector.service.fetch;

import java.time.Duration;
import java.util.concurrent.ThreadLocalRandom;

/**
 * Retry and pacing settings for page requests.
 *
 * @param maxAttempts       attempts per request, the first one included
 * @param backoff           base delay, multiplied by the attempt number
 * @param jitter            upper bound of the random delay added to each backoff
 * @param interRequestDelay pause between successive requests of one source
 */
public record RetryPolicy(int maxAttempts, Duration backoff, Duration jitter, Duration interRequestDelay) {

    public RetryPolicy {
        if (maxAttempts < 1) {
            throw new IllegalArgumentException("maxAttempts must be >= 1");
        }
        backoff = backoff != null ? backoff : Duration.ZERO;
        jitter = jitter != null ? jitter : Duration.ZERO;
        interRequestDelay = interRequestDelay != null ? interRequestDelay : Duration.ZERO;
    }

    /**
     * No waiting at all. Used in tests.
     */
    public static RetryPolicy immediate(int maxAttempts) {
        return new RetryPolicy(maxAttempts, Duration.ZERO, Duration.ZERO, Duration.ZERO);
    }

    public Duration delayBeforeRetry(int failedAttempt) {
        Duration delay = backoff.multipliedBy(failedAttempt);
        long jitterMs = jitter.toMillis();
        if (jitterMs > 0) {
            delay = delay.plusMillis(ThreadLocalRandom.current().nextLong(jitterMs + 1));
        }
        return delay;
    }
}
