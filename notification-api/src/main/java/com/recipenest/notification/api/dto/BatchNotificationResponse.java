package com.recipenest.notification.api.dto;

import com.recipenest.notification.common.DeliveryState;

import java.util.List;
import java.util.UUID;

/**
 * @param notifications created notification per recipient, in request order
 * @param queuedCount notifications with at least one channel queued for delivery
 */
public record BatchNotificationResponse(
    List<RecipientNotification> notifications,
    int queuedCount
) {
    public record RecipientNotification(UUID notificationId, UUID recipientId) {
    }

    public static BatchNotificationResponse from(List<CreatedNotification> created) {
        List<RecipientNotification> notifications = created.stream()
            .map(c -> new RecipientNotification(c.notification().getId(), c.notification().getRecipientId()))
            .toList();
        int queued = (int) created.stream()
            .filter(c -> c.statuses().stream().anyMatch(status -> status.getStatus() == DeliveryState.QUEUED))
            .count();
        return new BatchNotificationResponse(notifications, queued);
    }
}
