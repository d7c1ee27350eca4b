package com.recipenest.notification.api.service.transport;

import com.recipenest.notification.common.retry.FailureClassification;

/**
 * The transport is misconfigured (missing API key, rejected credentials). Retrying cannot
 * succeed, so the delivery is aborted and an operator has to step in.
 */
public class TransportConfigurationException extends TransportException {

    public TransportConfigurationException(String message) {
        super(message, FailureClassification.PERMANENT);
    }

    public TransportConfigurationException(String message, Throwable cause) {
        super(message, FailureClassification.PERMANENT, cause);
    }
}
