package com.recipenest.notification.common;

/**
 * Delivery mechanisms a notification can travel through.
 *
 * A channel that does not require a transport is considered delivered by the act of
 * persisting the notification (the in-app inbox reads straight from the notifications table).
 */
public enum NotificationChannel {
    EMAIL(true),
    IN_APP(false);

    private final boolean requiresTransport;

    NotificationChannel(boolean requiresTransport) {
        this.requiresTransport = requiresTransport;
    }

    public boolean requiresTransport() {
        return requiresTransport;
    }

    /**
     * Parse a channel from a request parameter (case-insensitive).
     *
     * @param value channel name, e.g. "email" or "IN_APP"
     * @return matching channel
     * @throws IllegalArgumentException if the value does not name a channel
     */
    public static NotificationChannel fromString(String value) {
        if (value == null || value.trim().isEmpty()) {
            throw new IllegalArgumentException("Channel cannot be null or empty");
        }
        try {
            return valueOf(value.trim().toUpperCase());
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException(
                "Unknown channel: " + value + ". Available: " + java.util.Arrays.toString(values()), e);
        }
    }
}
