package com.recipenest.notification.api.service.transport;

import com.recipenest.notification.common.retry.FailureClassification;
import lombok.Getter;

/**
 * A delivery attempt failed. Counted against the retry budget of the delivery row.
 */
@Getter
public class TransportException extends RuntimeException {

    private final FailureClassification classification;

    public TransportException(String message) {
        this(message, FailureClassification.TRANSIENT, null);
    }

    public TransportException(String message, FailureClassification classification) {
        this(message, classification, null);
    }

    public TransportException(String message, FailureClassification classification, Throwable cause) {
        super(message, cause);
        this.classification = classification;
    }
}
