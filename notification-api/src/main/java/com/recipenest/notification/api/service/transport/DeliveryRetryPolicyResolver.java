package com.recipenest.notification.api.service.transport;

import com.recipenest.notification.api.config.DeliveryProperties;
import com.recipenest.notification.common.retry.FailureClassification;
import com.recipenest.notification.common.retry.RetryPolicyResolver;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;

/**
 * PERMANENT failures are not retried. TRANSIENT and RATE_LIMIT failures share the configured
 * exponential backoff.
 */
@Service
@RequiredArgsConstructor
public class DeliveryRetryPolicyResolver implements RetryPolicyResolver {

    private final DeliveryProperties deliveryProperties;

    @Override
    public RetryPolicy resolve(FailureClassification classification) {
        return switch (classification) {
            case PERMANENT -> RetryPolicy.noRetry();
            case TRANSIENT, RATE_LIMIT -> deliveryProperties.toRetryPolicy();
        };
    }
}
