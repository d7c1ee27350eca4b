package com.recipenest.notification.api.config;

import com.recipenest.notification.common.retry.RetryPolicyResolver.RetryPolicy;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;

/**
 * Delivery and retry policy.
 *
 * Maps to:
 * notification:
 *   delivery:
 *     max-retries: 3
 *     base-delay: 5m
 *     backoff-multiplier: 2.0
 *     max-delay: 24h
 *     in-app-sent-on-create: true
 */
@Configuration
@ConfigurationProperties(prefix = "notification.delivery")
@Data
public class DeliveryProperties {

    /**
     * Failed attempts allowed per channel before the row is exhausted.
     */
    private int maxRetries = 3;

    /**
     * Delay after the first failed attempt.
     */
    private Duration baseDelay = Duration.ofMinutes(5);

    private double backoffMultiplier = 2.0;

    private Duration maxDelay = Duration.ofHours(24);

    /**
     * When true, channels without a transport (in-app) are written SENT at creation.
     * When false they start PENDING and go through the worker like any other channel.
     */
    private boolean inAppSentOnCreate = true;

    public RetryPolicy toRetryPolicy() {
        return new RetryPolicy(true, baseDelay.toMillis(), maxDelay.toMillis(), backoffMultiplier, maxRetries);
    }
}
