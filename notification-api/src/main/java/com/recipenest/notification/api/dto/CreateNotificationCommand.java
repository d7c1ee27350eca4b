package com.recipenest.notification.api.dto;

import com.recipenest.notification.api.enums.NotificationCategory;

import java.util.Map;
import java.util.UUID;

/**
 * Input of {@code DeliveryOrchestrator.create}.
 *
 * @param recipientId owning user, null for system-wide notices
 * @param category template category
 * @param payload template values, iteration order preserved
 * @param contactAddress email address; looked up from the recipient directory when blank
 * @param autoDispatch queue transport channels immediately
 */
public record CreateNotificationCommand(
    UUID recipientId,
    NotificationCategory category,
    Map<String, Object> payload,
    String contactAddress,
    boolean autoDispatch
) {
}
