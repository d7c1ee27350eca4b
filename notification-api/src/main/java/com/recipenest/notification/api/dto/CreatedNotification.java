package com.recipenest.notification.api.dto;

import com.recipenest.notification.api.entity.DeliveryStatus;
import com.recipenest.notification.api.entity.Notification;

import java.util.List;

public record CreatedNotification(
    Notification notification,
    List<DeliveryStatus> statuses
) {
}
