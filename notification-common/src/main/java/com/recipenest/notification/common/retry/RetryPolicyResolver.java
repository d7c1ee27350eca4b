package com.recipenest.notification.common.retry;

import java.time.Duration;

/**
 * Resolves the retry policy for a failure classification.
 *
 * PERMANENT failures get {@link RetryPolicy#noRetry()}; TRANSIENT and RATE_LIMIT failures
 * share the configured exponential backoff so the retry budget on the delivery row
 * stays the single bound on attempts.
 */
public interface RetryPolicyResolver {

    RetryPolicy resolve(FailureClassification classification);

    /**
     * Exponential backoff policy.
     *
     * <p>Retry counts are 1-based: after the n-th failed attempt the next attempt is delayed by
     * {@code initialDelay * backoffMultiplier^(n-1)}, capped at {@code maxDelay}. A row whose
     * retry count has reached {@code maxRetries} is exhausted and gets no further attempt.
     */
    record RetryPolicy(
        boolean shouldRetry,
        long initialDelayMs,
        long maxDelayMs,
        double backoffMultiplier,
        int maxRetries
    ) {
        public RetryPolicy {
            if (initialDelayMs < 0 || maxDelayMs < 0) {
                throw new IllegalArgumentException("Retry delays must not be negative");
            }
            if (backoffMultiplier < 1.0) {
                throw new IllegalArgumentException("Backoff multiplier must be >= 1.0, got " + backoffMultiplier);
            }
            if (maxRetries < 0) {
                throw new IllegalArgumentException("Max retries must not be negative, got " + maxRetries);
            }
        }

        public static RetryPolicy noRetry() {
            return new RetryPolicy(false, 0, 0, 1.0, 0);
        }

        /**
         * 5, 10, 20 minutes... capped at 24 hours, three attempts in total.
         */
        public static RetryPolicy standard() {
            return new RetryPolicy(true, Duration.ofMinutes(5).toMillis(), Duration.ofHours(24).toMillis(), 2.0, 3);
        }

        /**
         * Delay before the attempt that follows the {@code retryCount}-th failure.
         *
         * @param retryCount number of failed attempts so far (>= 1)
         * @return backoff delay
         */
        public Duration delayForRetry(int retryCount) {
            if (retryCount < 1) {
                throw new IllegalArgumentException("Retry count must be >= 1, got " + retryCount);
            }
            double delay = initialDelayMs * Math.pow(backoffMultiplier, retryCount - 1);
            long capped = (long) Math.min(delay, (double) maxDelayMs);
            return Duration.ofMillis(capped);
        }

        public boolean isExhausted(int retryCount) {
            return !shouldRetry || retryCount >= maxRetries;
        }
    }
}
