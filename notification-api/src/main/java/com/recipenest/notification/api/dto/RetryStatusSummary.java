package com.recipenest.notification.api.dto;

/**
 * Snapshot of retry backlog across all channels.
 *
 * @param safeToRetry true when nothing is QUEUED, so a batch retry cannot overlap in-flight jobs
 */
public record RetryStatusSummary(
    long failedRetryable,
    long failedExhausted,
    long currentlyQueued,
    boolean safeToRetry
) {
}
