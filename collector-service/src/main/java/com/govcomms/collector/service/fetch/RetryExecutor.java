package com.govcomms.collector.service.fetch;

import com.govcomms.collector.exception.SourceCycleFailedException;
import com.govcomms.collector.exception.TransientFetchException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.function.Supplier;

/**
 * Runs page requests under a {@link RetryPolicy}.
 *
 * Only {@link TransientFetchException} is retried. Every other exception propagates on the first
 * attempt. Once the attempts are used up the source's cycle fails.
 */
@Component
@Slf4j
public class RetryExecutor {

    private final Sleeper sleeper;

    public RetryExecutor() {
        this(Sleeper.THREAD);
    }

    public RetryExecutor(Sleeper sleeper) {
        this.sleeper = sleeper;
    }

    public <T> T call(String description, RetryPolicy policy, Supplier<T> request) {
        TransientFetchException last = null;
        for (int attempt = 1; attempt <= policy.maxAttempts(); attempt++) {
            try {
                return request.get();
            } catch (TransientFetchException e) {
                last = e;
                if (attempt < policy.maxAttempts()) {
                    Duration delay = policy.delayBeforeRetry(attempt);
                    log.warn("Transient failure on {} (attempt {}/{}), retrying in {}ms: {}",
                            description, attempt, policy.maxAttempts(), delay.toMillis(), e.getMessage());
                    sleep(delay);
                }
            }
        }
        throw new SourceCycleFailedException(
                "Giving up on " + description + " after " + policy.maxAttempts() + " attempts", last);
    }

    /**
     * Inter-request pacing between successive pages of one source.
     */
    public void pause(RetryPolicy policy) {
        sleep(policy.interRequestDelay());
    }

    private void sleep(Duration delay) {
        if (delay.isZero() || delay.isNegative()) {
            return;
        }
        try {
            sleeper.sleep(delay);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new SourceCycleFailedException("Interrupted while waiting between requests", e);
        }
    }

    @FunctionalInterface
    public interface Sleeper {

        Sleeper THREAD = delay -> Thread.sleep(delay.toMillis());

        void sleep(Duration delay) throws InterruptedException;
    }
}
