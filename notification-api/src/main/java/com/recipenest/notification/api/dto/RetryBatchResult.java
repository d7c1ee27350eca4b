package com.recipenest.notification.api.dto;

/**
 * Outcome of a batch retry.
 *
 * @param queuedCount rows moved to QUEUED by this call
 * @param remainingEligible retryable rows not queued by this call
 * @param totalEligible retryable rows before this call
 */
public record RetryBatchResult(
    int queuedCount,
    long remainingEligible,
    long totalEligible
) {
}
