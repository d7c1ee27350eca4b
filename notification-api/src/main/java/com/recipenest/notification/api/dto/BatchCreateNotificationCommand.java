package com.recipenest.notification.api.dto;

import com.recipenest.notification.api.enums.NotificationCategory;

import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * Input of {@code DeliveryOrchestrator.createBatch}: the same category and payload for every
 * recipient. Contact addresses come from the recipient directory.
 */
public record BatchCreateNotificationCommand(
    List<UUID> recipientIds,
    NotificationCategory category,
    Map<String, Object> payload,
    boolean autoDispatch
) {
}
