package com.recipenest.notification.api.dto;

import com.recipenest.notification.api.enums.NotificationCategory;

import java.util.List;
import java.util.UUID;

public record NotificationResponse(
    UUID notificationId,
    UUID recipientId,
    NotificationCategory category,
    String subject,
    List<DeliveryStatusResponse> deliveries
) {
    public static NotificationResponse from(CreatedNotification created) {
        return new NotificationResponse(
            created.notification().getId(),
            created.notification().getRecipientId(),
            created.notification().getCategory(),
            created.notification().getSubject(),
            created.statuses().stream().map(DeliveryStatusResponse::from).toList()
        );
    }
}
