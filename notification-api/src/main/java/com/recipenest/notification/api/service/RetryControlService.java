package com.recipenest.notification.api.service;

import com.recipenest.notification.api.dto.RetryBatchResult;
import com.recipenest.notification.api.dto.RetryStatistics;
import com.recipenest.notification.api.dto.RetryStatusSummary;
import com.recipenest.notification.api.entity.DeliveryStatus;
import com.recipenest.notification.api.repository.DeliveryStatusRepository;
import com.recipenest.notification.common.DeliveryState;
import com.recipenest.notification.common.NotificationChannel;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.LocalDateTime;
import java.util.UUID;

/**
 * Operator retry controls.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class RetryControlService {

    private final DeliveryStatusRepository deliveryStatusRepository;
    private final DeliveryOrchestrator deliveryOrchestrator;
    private final StatusTransitionValidator transitionValidator;
    private final NotificationMetricsService metricsService;

    /**
     * Requeue one FAILED delivery with retry budget left.
     *
     * @return true if the row was queued; false if a concurrent trigger queued it first
     * @throws NotFoundException if the delivery row does not exist
     * @throws ConflictException if the row is SENT, exhausted, or not FAILED
     */
    @Transactional
    public boolean retrySingle(UUID notificationId, NotificationChannel channel) {
        DeliveryStatus status = findStatus(notificationId, channel);
        switch (status.getStatus()) {
            case SENT -> throw new ConflictException("Cannot retry notification - already sent");
            case FAILED -> {
                if (status.isExhausted()) {
                    throw new ConflictException("Cannot retry notification - retries exhausted ("
                        + status.getRetryCount() + "/" + status.getMaxRetries() + ")");
                }
            }
            default -> throw new ConflictException(
                "Cannot retry notification that is not in failed status (status: " + status.getStatus() + ")");
        }

        log.info("Manual retry requested for notification {} channel {} (retry count {})",
            notificationId, channel, status.getRetryCount());
        return deliveryOrchestrator.queueForDelivery(notificationId, channel);
    }

    public RetryBatchResult retryFailed(int maxBatch) {
        return deliveryOrchestrator.retryFailed(maxBatch);
    }

    public RetryStatusSummary retryStatus() {
        return deliveryOrchestrator.retryStatus();
    }

    /**
     * Archive an exhausted FAILED delivery as ABORTED.
     *
     * @throws ConflictException if the row is not FAILED or still has retry budget
     */
    @Transactional
    public void abort(UUID notificationId, NotificationChannel channel, String reason) {
        DeliveryStatus status = findStatus(notificationId, channel);
        if (status.getStatus() != DeliveryState.FAILED) {
            throw new ConflictException("Only failed deliveries can be aborted (status: " + status.getStatus() + ")");
        }
        if (!status.isExhausted()) {
            throw new ConflictException("Delivery still has retries left; retry it or wait for exhaustion");
        }
        transitionValidator.assertValidTransition(status.getStatus(), DeliveryState.ABORTED);
        String previousError = status.getErrorMessage();
        String detail = reason != null && !reason.isBlank() ? reason : previousError;
        status.markAborted("Aborted by operator: " + detail, LocalDateTime.now());
        deliveryStatusRepository.save(status);
        metricsService.recordAborted(channel);
        log.info("Operator aborted notification {} channel {}", notificationId, channel);
    }

    @Transactional(readOnly = true)
    public RetryStatistics retryStatistics() {
        long totalRetried = deliveryStatusRepository.countRetried();
        long currentlyRetrying = deliveryStatusRepository.countRetriedByStatus(DeliveryState.QUEUED);
        long exhausted = deliveryStatusRepository.countExhausted();
        long succeeded = deliveryStatusRepository.countRetriedByStatus(DeliveryState.SENT);
        Double average = deliveryStatusRepository.averageRetriesBeforeSuccess();
        double successRate = totalRetried == 0 ? 0.0 : round((double) succeeded * 100.0 / totalRetried);
        return new RetryStatistics(
            totalRetried,
            currentlyRetrying,
            exhausted,
            succeeded,
            average != null ? round(average) : 0.0,
            successRate
        );
    }

    private DeliveryStatus findStatus(UUID notificationId, NotificationChannel channel) {
        return deliveryStatusRepository.findByNotificationIdAndChannel(notificationId, channel)
            .orElseThrow(() -> new NotFoundException(
                "Notification " + notificationId + " has no " + channel + " delivery"));
    }

    private static double round(double value) {
        return Math.round(value * 100.0) / 100.0;
    }
}
