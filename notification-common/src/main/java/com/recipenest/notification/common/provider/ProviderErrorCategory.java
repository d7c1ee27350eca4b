package com.recipenest.notification.common.provider;

/**
 * Provider error category, used by the dispatch worker to pick between
 * "retry with backoff" and "abort and alert an operator".
 */
public enum ProviderErrorCategory {
    /**
     * Rate limits, timeouts, 5xx responses, I/O errors. Retried with exponential backoff.
     */
    TEMPORARY,

    /**
     * The provider rejected this particular message (malformed address, bad payload).
     * Counts as a failed attempt like TEMPORARY; the retry budget bounds it.
     */
    PERMANENT,

    /**
     * Invalid or revoked credentials. No retry will succeed until an operator fixes them.
     */
    AUTH,

    /**
     * Missing required configuration (API key, sender address).
     */
    CONFIG;

    /**
     * @return true when the failure needs operator intervention rather than another attempt
     */
    public boolean requiresOperator() {
        return this == AUTH || this == CONFIG;
    }
}
