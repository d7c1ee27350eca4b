package com.recipenest.notification.api.dto;

import com.recipenest.notification.api.entity.DeliveryStatus;
import com.recipenest.notification.common.DeliveryState;
import com.recipenest.notification.common.NotificationChannel;

import java.time.LocalDateTime;

public record DeliveryStatusResponse(
    NotificationChannel channel,
    DeliveryState status,
    int retryCount,
    int maxRetries,
    String errorMessage,
    LocalDateTime queuedAt,
    LocalDateTime sentAt,
    LocalDateTime failedAt
) {
    public static DeliveryStatusResponse from(DeliveryStatus status) {
        return new DeliveryStatusResponse(
            status.getChannel(),
            status.getStatus(),
            status.getRetryCount(),
            status.getMaxRetries(),
            status.getErrorMessage(),
            status.getQueuedAt(),
            status.getSentAt(),
            status.getFailedAt()
        );
    }
}
