package com.recipenest.notification.api.dto;

/**
 * Aggregate retry behaviour across all delivery rows with at least one failed attempt.
 */
public record RetryStatistics(
    long totalRetried,
    long currentlyRetrying,
    long exhausted,
    long succeededAfterRetry,
    double averageRetriesBeforeSuccess,
    double retrySuccessRate
) {
}
