package com.recipenest.notification.common.provider;

/**
 * Rendered email ready to hand to a provider.
 *
 * @param to recipient address
 * @param subject rendered subject line
 * @param body rendered body
 * @param html whether {@code body} is HTML
 */
public record EmailMessage(
    String to,
    String subject,
    String body,
    boolean html
) {
}
