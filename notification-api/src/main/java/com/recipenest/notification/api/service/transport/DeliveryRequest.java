package com.recipenest.notification.api.service.transport;

import com.recipenest.notification.common.NotificationChannel;

import java.util.UUID;

/**
 * Everything a transport needs for one attempt.
 */
public record DeliveryRequest(
    UUID notificationId,
    NotificationChannel channel,
    String contactAddress,
    String subject,
    String body
) {
}
