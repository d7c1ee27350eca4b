package com.recipenest.notification.common.provider;

/**
 * Identifies the provider behind a channel transport.
 */
public enum ProviderName {
    /**
     * SendGrid email provider
     */
    SENDGRID,

    /**
     * The notifications table itself, read by the in-app inbox
     */
    INBOX;

    /**
     * @return lowercase name for configuration and log fields (e.g. "sendgrid")
     */
    public String toConfigValue() {
        return name().toLowerCase();
    }
}
