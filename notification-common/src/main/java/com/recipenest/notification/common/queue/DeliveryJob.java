package com.recipenest.notification.common.queue;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.recipenest.notification.common.NotificationChannel;

import java.util.Objects;
import java.util.UUID;

/**
 * Message placed on the delivery queue.
 *
 * Carries references only; the worker always reloads the notification and its delivery
 * status from the database so a stale job can never resurrect a terminal row.
 *
 * @param notificationId notification to deliver
 * @param channel channel to deliver on
 * @param attempt 1-based attempt number, informational (retry_count on the row is authoritative)
 */
public record DeliveryJob(
    UUID notificationId,
    NotificationChannel channel,
    int attempt
) {
    public DeliveryJob {
        Objects.requireNonNull(notificationId, "notificationId");
        Objects.requireNonNull(channel, "channel");
        if (attempt < 1) {
            attempt = 1;
        }
    }

    public static DeliveryJob firstAttempt(UUID notificationId, NotificationChannel channel) {
        return new DeliveryJob(notificationId, channel, 1);
    }

    public DeliveryJob nextAttempt() {
        return new DeliveryJob(notificationId, channel, attempt + 1);
    }

    /**
     * Partition key: keeps every attempt for one (notification, channel) pair on the same partition.
     */
    @JsonIgnore
    public String messageKey() {
        return notificationId + ":" + channel.name();
    }
}
