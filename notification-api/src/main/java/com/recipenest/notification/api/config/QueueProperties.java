package com.recipenest.notification.api.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

/**
 * Delivery queue settings.
 *
 * Maps to:
 * notification:
 *   queue:
 *     topic: notification-delivery
 *     relay-batch-size: 100
 *     relay-interval-ms: 15000
 *     publish-timeout-ms: 10000
 */
@Configuration
@ConfigurationProperties(prefix = "notification.queue")
@Data
public class QueueProperties {

    private String topic = "notification-delivery";

    /**
     * Delayed jobs published per relay run.
     */
    private int relayBatchSize = 100;

    private long relayIntervalMs = 15000;

    /**
     * How long the relay waits for the broker to acknowledge a batch.
     */
    private long publishTimeoutMs = 10000;
}
