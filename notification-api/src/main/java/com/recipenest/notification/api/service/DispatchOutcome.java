package com.recipenest.notification.api.service;

/**
 * What the dispatch worker did with a job.
 */
public enum DispatchOutcome {
    SENT,
    RETRY_SCHEDULED,
    FAILED,
    ABORTED,
    /** Row was not QUEUED (already sent, aborted, or never claimed) */
    SKIPPED
}
