package com.recipenest.notification.common.provider;

/**
 * Email sending provider (SendGrid today).
 *
 * Implementations never throw for provider-side failures; they categorize them in the
 * returned {@link EmailResult} so the caller can decide between retrying and aborting.
 * API keys must never be logged.
 */
public interface EmailProvider {

    EmailResult sendEmail(EmailMessage message);

    ProviderName getProviderName();

    /**
     * @return true if credentials and sender identity are configured
     */
    default boolean isConfigured() {
        return true;
    }
}
