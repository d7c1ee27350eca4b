package com.recipenest.notification.api.service;

/**
 * Thrown when a downstream collaborator (recipient directory) is unreachable.
 * Mapped to HTTP 503 Service Unavailable.
 */
public class ServiceUnavailableException extends RuntimeException {

    public ServiceUnavailableException(String message) {
        super(message);
    }

    public ServiceUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}
