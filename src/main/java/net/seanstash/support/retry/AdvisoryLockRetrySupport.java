package net.seanstash.support.retry;

import java.util.function.Supplier;
import org.slf4j.Logger;

/**
 * Runs advisory-lock-sensitive work with bounded retry and linear backoff.
 */
public final class AdvisoryLockRetrySupport {

    /**
     * Retry parameters fixed per call site.
     */
    public record RetryConfig(Logger logger, int maxAttempts, long baseBackoffMillis) {

        /** Retry settings for enhanced snippet creation. */
        public static RetryConfig forSnippetInsert(Logger logger) {
            return new RetryConfig(logger, 3, 100L);
        }
    }

    private AdvisoryLockRetrySupport() {
    }

    /**
     * Retries only on {@link AdvisoryLockAcquisitionException}; anything else propagates at once.
     * The wait before attempt {@code n + 1} is {@code baseBackoffMillis * n}.
     */
    public static <T> T execute(RetryConfig config, String operationLabel, Supplier<T> action) {
        int maxAttempts = config.maxAttempts();
        if (maxAttempts < 1) {
            throw new IllegalArgumentException(
                "maxAttempts must be at least 1 for operation '" + operationLabel + "' but was " + maxAttempts
            );
        }
        AdvisoryLockAcquisitionException lastException = null;
        for (int attempt = 1; attempt <= maxAttempts; attempt++) {
            try {
                return action.get();
            } catch (AdvisoryLockAcquisitionException exception) {
                lastException = exception;
                if (attempt < maxAttempts) {
                    long backoff = Math.max(config.baseBackoffMillis(), 1L) * attempt;
                    config.logger().warn("Advisory lock contention during {} (attempt {}/{}). Retrying in {}ms",
                        operationLabel, attempt, maxAttempts, backoff);
                    sleepUnchecked(backoff);
                }
            }
        }
        throw lastException;
    }

    private static void sleepUnchecked(long durationMillis) {
        try {
            Thread.sleep(durationMillis);
        } catch (InterruptedException interruptedException) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("Interrupted while waiting to retry advisory lock", interruptedException);
        }
    }
}
