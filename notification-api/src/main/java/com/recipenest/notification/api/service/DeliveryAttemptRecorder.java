package com.recipenest.notification.api.service;

import com.recipenest.notification.api.entity.DeliveryStatus;
import com.recipenest.notification.api.entity.Notification;
import com.recipenest.notification.api.repository.DeliveryStatusRepository;
import com.recipenest.notification.api.service.queue.DeliveryQueue;
import com.recipenest.notification.api.service.transport.DeliveryRequest;
import com.recipenest.notification.api.service.transport.TransportException;
import com.recipenest.notification.common.DeliveryState;
import com.recipenest.notification.common.NotificationChannel;
import com.recipenest.notification.common.queue.DeliveryJob;
import com.recipenest.notification.common.retry.RetryPolicyResolver;
import com.recipenest.notification.common.retry.RetryPolicyResolver.RetryPolicy;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Duration;
import java.time.LocalDateTime;
import java.util.Optional;

/**
 * Database side of a delivery attempt: reads the row before the transport call and records
 * the outcome after it, each in its own short transaction.
 *
 * A job is current only while its row is QUEUED and {@code job.attempt() == retryCount + 1}.
 * Redelivered or duplicated jobs of an earlier attempt are skipped, so they cannot shorten a
 * backoff delay or consume retry budget. Outcome metrics are recorded once the outcome commits.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class DeliveryAttemptRecorder {

    private final DeliveryStatusRepository deliveryStatusRepository;
    private final DeliveryQueue deliveryQueue;
    private final RetryPolicyResolver retryPolicyResolver;
    private final StatusTransitionValidator transitionValidator;
    private final NotificationMetricsService metricsService;

    /**
     * @return the request to send, or empty when the job is not current
     * @throws NotFoundException if the delivery row no longer exists
     */
    @Transactional(readOnly = true)
    public Optional<DeliveryRequest> prepare(DeliveryJob job) {
        DeliveryStatus status = load(job);
        if (!isCurrent(status, job)) {
            return Optional.empty();
        }
        Notification notification = status.getNotification();
        return Optional.of(new DeliveryRequest(
            notification.getId(),
            job.channel(),
            notification.getContactAddress(),
            notification.getSubject(),
            notification.getBody()
        ));
    }

    @Transactional
    public DispatchOutcome recordSuccess(DeliveryJob job) {
        DeliveryStatus status = load(job);
        if (!isCurrent(status, job)) {
            return DispatchOutcome.SKIPPED;
        }
        transitionValidator.assertValidTransition(status.getStatus(), DeliveryState.SENT);
        status.markSent(LocalDateTime.now());
        deliveryStatusRepository.save(status);
        int failedAttempts = status.getRetryCount();
        AfterCommit.run(() -> metricsService.recordSent(job.channel(), failedAttempts));
        log.info("Delivered notification {} on {} after {} failed attempts",
            job.notificationId(), job.channel(), status.getRetryCount());
        return DispatchOutcome.SENT;
    }

    /**
     * Apply the retry state machine to a failed attempt.
     */
    @Transactional
    public DispatchOutcome recordFailure(DeliveryJob job, TransportException failure) {
        DeliveryStatus status = load(job);
        if (!isCurrent(status, job)) {
            return DispatchOutcome.SKIPPED;
        }
        NotificationChannel channel = job.channel();
        String cause = failure.getMessage() != null ? failure.getMessage() : failure.getClass().getSimpleName();
        RetryPolicy policy = retryPolicyResolver.resolve(failure.getClassification());

        if (!policy.shouldRetry()) {
            transitionValidator.assertValidTransition(status.getStatus(), DeliveryState.ABORTED);
            status.markAborted("Transport misconfigured: " + cause, LocalDateTime.now());
            deliveryStatusRepository.save(status);
            AfterCommit.run(() -> metricsService.recordAborted(channel));
            log.error("Delivery of notification {} on {} aborted, operator action required: {}",
                job.notificationId(), channel, cause);
            return DispatchOutcome.ABORTED;
        }

        int retryCount = status.recordFailedAttempt(cause);
        if (!status.isExhausted()) {
            Duration delay = policy.delayForRetry(retryCount);
            deliveryQueue.enqueueAfter(delay, job.nextAttempt());
            deliveryStatusRepository.save(status);
            AfterCommit.run(() -> metricsService.recordRetryScheduled(channel));
            log.warn("Attempt {} of {} for notification {} on {} failed: {}. Retrying in {} minutes",
                retryCount, status.getMaxRetries(), job.notificationId(), channel, cause, delay.toMinutes());
            return DispatchOutcome.RETRY_SCHEDULED;
        }

        transitionValidator.assertValidTransition(status.getStatus(), DeliveryState.FAILED);
        status.markFailed(String.format("Failed after %d attempts: %s", retryCount, cause), LocalDateTime.now());
        deliveryStatusRepository.save(status);
        AfterCommit.run(() -> metricsService.recordFailed(channel, retryCount));
        log.error("Delivery of notification {} on {} failed permanently after {} attempts: {}",
            job.notificationId(), channel, retryCount, cause);
        return DispatchOutcome.FAILED;
    }

    private DeliveryStatus load(DeliveryJob job) {
        return deliveryStatusRepository.findByNotificationIdAndChannel(job.notificationId(), job.channel())
            .orElseThrow(() -> new NotFoundException(
                "Delivery status not found for notification " + job.notificationId() + " channel " + job.channel()));
    }

    private boolean isCurrent(DeliveryStatus status, DeliveryJob job) {
        if (status.getStatus() == DeliveryState.SENT) {
            log.info("Notification {} channel {} already sent, skipping job", job.notificationId(), job.channel());
            return false;
        }
        if (status.getStatus() != DeliveryState.QUEUED) {
            log.warn("Notification {} channel {} is {}, not QUEUED; skipping job attempt {}",
                job.notificationId(), job.channel(), status.getStatus(), job.attempt());
            return false;
        }
        int expectedAttempt = status.getRetryCount() + 1;
        if (job.attempt() != expectedAttempt) {
            log.warn("Skipping stale job attempt {} for notification {} channel {}, current attempt is {}",
                job.attempt(), job.notificationId(), job.channel(), expectedAttempt);
            return false;
        }
        return true;
    }
}
