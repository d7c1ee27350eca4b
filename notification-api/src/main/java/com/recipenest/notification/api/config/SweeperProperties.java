package com.recipenest.notification.api.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

/**
 * Optional periodic retry of FAILED rows and dispatch of PENDING rows.
 *
 * Maps to:
 * notification:
 *   sweeper:
 *     enabled: false
 *     batch-size: 100
 *     interval-ms: 300000
 */
@Configuration
@ConfigurationProperties(prefix = "notification.sweeper")
@Data
public class SweeperProperties {

    private boolean enabled = false;

    private int batchSize = 100;

    private long intervalMs = 300000;
}
