package com.recipenest.notification.api.service;

/**
 * Thrown for invalid caller input (unknown category, missing payload keys, bad address).
 * Mapped to HTTP 400 Bad Request.
 *
 * <pre>
 * if (!missing.isEmpty()) {
 *     throw new BadRequestException("Payload is missing required keys: " + missing);
 * }
 * </pre>
 */
public class BadRequestException extends RuntimeException {

    public BadRequestException(String message) {
        super(message);
    }

    public BadRequestException(String message, Throwable cause) {
        super(message, cause);
    }
}
