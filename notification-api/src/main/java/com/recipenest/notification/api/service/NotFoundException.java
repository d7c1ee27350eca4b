package com.recipenest.notification.api.service;

/**
 * Thrown when a notification, delivery status or recipient does not exist.
 * Mapped to HTTP 404 Not Found.
 */
public class NotFoundException extends RuntimeException {

    public NotFoundException(String message) {
        super(message);
    }

    public NotFoundException(String message, Throwable cause) {
        super(message, cause);
    }
}
