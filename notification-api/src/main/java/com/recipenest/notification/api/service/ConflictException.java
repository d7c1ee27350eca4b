package com.recipenest.notification.api.service;

/**
 * Thrown when the current delivery state forbids the requested operation, e.g. retrying
 * a notification that was already sent or deleting one with a job in flight.
 * Mapped to HTTP 409 Conflict.
 */
public class ConflictException extends RuntimeException {

    public ConflictException(String message) {
        super(message);
    }
}
