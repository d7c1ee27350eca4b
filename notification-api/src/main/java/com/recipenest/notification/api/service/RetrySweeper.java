package com.recipenest.notification.api.service;

import com.recipenest.notification.api.dto.RetryBatchResult;
import com.recipenest.notification.api.config.SweeperProperties;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * Periodically requeues retryable FAILED rows and dispatches PENDING rows.
 * Enabled with {@code notification.sweeper.enabled=true}.
 */
@Component
@ConditionalOnProperty(prefix = "notification.sweeper", name = "enabled", havingValue = "true")
@RequiredArgsConstructor
@Slf4j
public class RetrySweeper {

    private final DeliveryOrchestrator deliveryOrchestrator;
    private final SweeperProperties sweeperProperties;

    @Scheduled(fixedDelayString = "${notification.sweeper.interval-ms:300000}")
    public void sweep() {
        try {
            int dispatched = deliveryOrchestrator.dispatchPending(sweeperProperties.getBatchSize());
            RetryBatchResult retried = deliveryOrchestrator.retryFailed(sweeperProperties.getBatchSize());
            if (dispatched > 0 || retried.queuedCount() > 0) {
                log.info("Sweep dispatched {} pending and requeued {} failed deliveries ({} still eligible)",
                    dispatched, retried.queuedCount(), retried.remainingEligible());
            }
        } catch (RuntimeException e) {
            log.error("Delivery sweep failed", e);
        }
    }
}
