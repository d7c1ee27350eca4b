package com.recipenest.notification.common.retry;

/**
 * Classification of delivery failures.
 *
 * <ul>
 *   <li>PERMANENT - retrying cannot help (invalid API key, revoked access)</li>
 *   <li>TRANSIENT - network errors, 5xx, temporary unavailability</li>
 *   <li>RATE_LIMIT - provider asked us to slow down (429)</li>
 * </ul>
 */
public enum FailureClassification {
    PERMANENT,
    TRANSIENT,
    RATE_LIMIT
}
