package com.recipenest.notification.common.provider;

/**
 * Base contract for provider send results.
 */
public interface MessageResult {

    boolean isSuccess();

    /**
     * @return error message, or null if successful
     */
    String getErrorMessage();

    /**
     * @return error category, or null if successful
     */
    default ProviderErrorCategory getErrorCategory() {
        return null;
    }

    /**
     * @return HTTP status returned by the provider, or null when no response was received
     */
    default Integer getStatusCode() {
        return null;
    }
}
