package com.recipenest.notification.api.service;

/**
 * Thrown when the caller is neither the owner of a notification nor an administrator.
 * Mapped to HTTP 403 Forbidden.
 */
public class ForbiddenException extends RuntimeException {

    public ForbiddenException(String message) {
        super(message);
    }
}
