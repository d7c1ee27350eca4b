package com.recipenest.notification.api.dto;

import com.recipenest.notification.api.entity.Notification;
import com.recipenest.notification.api.enums.NotificationCategory;

import java.time.LocalDateTime;
import java.util.Map;
import java.util.UUID;

/**
 * In-app view of a notification with rendered title and message.
 */
public record InboxItem(
    UUID notificationId,
    NotificationCategory category,
    String title,
    String message,
    Map<String, Object> payload,
    boolean read,
    LocalDateTime createdAt
) {
    public static InboxItem from(Notification notification) {
        NotificationCategory category = notification.getCategory();
        return new InboxItem(
            notification.getId(),
            category,
            category.renderTitle(notification.getPayload()),
            category.renderMessage(notification.getPayload()),
            notification.getPayload(),
            notification.isRead(),
            notification.getCreatedAt()
        );
    }
}
