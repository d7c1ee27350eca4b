package com.recipenest.notification.api.service;

import com.recipenest.notification.api.config.DeliveryProperties;
import com.recipenest.notification.api.dto.BatchCreateNotificationCommand;
import com.recipenest.notification.api.dto.CreateNotificationCommand;
import com.recipenest.notification.api.dto.CreatedNotification;
import com.recipenest.notification.api.dto.RetryBatchResult;
import com.recipenest.notification.api.dto.RetryStatusSummary;
import com.recipenest.notification.api.entity.DeliveryStatus;
import com.recipenest.notification.api.entity.Notification;
import com.recipenest.notification.api.enums.NotificationCategory;
import com.recipenest.notification.api.repository.DeliveryStatusRepository;
import com.recipenest.notification.api.repository.NotificationRepository;
import com.recipenest.notification.api.service.directory.RecipientDirectory;
import com.recipenest.notification.api.service.queue.DeliveryQueue;
import com.recipenest.notification.common.DeliveryState;
import com.recipenest.notification.common.NotificationChannel;
import com.recipenest.notification.common.queue.DeliveryJob;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.regex.Pattern;

/**
 * Creates notifications with their per-channel delivery rows and hands delivery jobs to the queue.
 *
 * Every transition into QUEUED goes through {@link #queueForDelivery(UUID, NotificationChannel)},
 * whatever triggered it (auto-dispatch, manual retry, batch retry, sweeper), so at most one job is
 * in flight per (notification, channel). Jobs are published only after the surrounding
 * transaction commits; a publish failure moves the row back to FAILED so it stays retryable.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class DeliveryOrchestrator {

    private static final Pattern EMAIL_ADDRESS = Pattern.compile("^[^@\\s]+@[^@\\s]+\\.[^@\\s]+$");

    private final NotificationRepository notificationRepository;
    private final DeliveryStatusRepository deliveryStatusRepository;
    private final DeliveryQueue deliveryQueue;
    private final RecipientDirectory recipientDirectory;
    private final DeliveryProperties deliveryProperties;
    private final NotificationMetricsService metricsService;

    /**
     * Create a notification and one delivery row per channel of its category, in one transaction.
     *
     * @throws BadRequestException if the category is missing, the payload lacks template keys,
     *         or no valid contact address is available
     */
    @Transactional
    public CreatedNotification create(CreateNotificationCommand command) {
        NotificationCategory category = command.category();
        if (category == null) {
            throw new BadRequestException("Notification category is required");
        }
        List<String> missing = category.missingKeys(command.payload());
        if (!missing.isEmpty()) {
            throw new BadRequestException("Payload for " + category + " is missing required keys: " + missing);
        }
        String contactAddress = resolveContactAddress(command);

        Notification notification = notificationRepository.save(new Notification(
            command.recipientId(),
            contactAddress,
            category,
            command.payload(),
            category.renderSubject(command.payload()),
            category.renderMessage(command.payload())
        ));

        LocalDateTime now = LocalDateTime.now();
        List<DeliveryStatus> statuses = new ArrayList<>();
        for (NotificationChannel channel : category.channels()) {
            DeliveryStatus status = new DeliveryStatus(notification, channel, deliveryProperties.getMaxRetries());
            boolean sentOnCreate = !channel.requiresTransport() && deliveryProperties.isInAppSentOnCreate();
            if (sentOnCreate) {
                status.markSent(now);
            }
            statuses.add(status);
            AfterCommit.run(() -> {
                metricsService.recordCreated(channel);
                if (sentOnCreate) {
                    metricsService.recordSent(channel, 0);
                }
            });
        }
        statuses = deliveryStatusRepository.saveAll(statuses);
        log.info("Created notification {} ({}) for recipient {} on channels {}",
            notification.getId(), category, command.recipientId(), category.channels());

        if (command.autoDispatch()) {
            for (DeliveryStatus status : statuses) {
                if (status.getStatus() == DeliveryState.PENDING) {
                    queueForDelivery(notification.getId(), status.getChannel());
                }
            }
            statuses = deliveryStatusRepository.findByNotificationId(notification.getId());
        }
        return new CreatedNotification(notification, statuses);
    }

    /**
     * Create one notification per distinct recipient, all or nothing. Contact addresses are
     * looked up in the recipient directory; a failed lookup rolls back the whole batch.
     *
     * @throws BadRequestException if no recipient is given or a single creation would be rejected
     */
    @Transactional
    public List<CreatedNotification> createBatch(BatchCreateNotificationCommand command) {
        if (command.recipientIds() == null || command.recipientIds().isEmpty()) {
            throw new BadRequestException("At least one recipient is required");
        }
        Set<UUID> recipients = new LinkedHashSet<>(command.recipientIds());
        if (recipients.contains(null)) {
            throw new BadRequestException("Recipient ids must not be null");
        }

        List<CreatedNotification> created = new ArrayList<>(recipients.size());
        for (UUID recipientId : recipients) {
            created.add(create(new CreateNotificationCommand(
                recipientId, command.category(), command.payload(), null, command.autoDispatch())));
        }
        log.info("Created {} {} notifications in one batch", created.size(), command.category());
        return created;
    }

    /**
     * Move a PENDING or FAILED row to QUEUED and publish one immediate job.
     *
     * SENT, QUEUED and ABORTED rows are left alone. The transition is a conditional update, so of
     * several concurrent callers only the one that wins the update publishes.
     *
     * @return true if this call queued the row
     * @throws NotFoundException if no delivery row exists for the pair
     */
    @Transactional
    public boolean queueForDelivery(UUID notificationId, NotificationChannel channel) {
        DeliveryStatus status = deliveryStatusRepository.findByNotificationIdAndChannel(notificationId, channel)
            .orElseThrow(() -> new NotFoundException(
                "Delivery status not found for notification " + notificationId + " channel " + channel));

        if (!status.getStatus().isQueueable()) {
            log.info("Not queueing notification {} channel {}: status is {}",
                notificationId, channel, status.getStatus());
            return false;
        }

        int attempt = status.getRetryCount() + 1;
        int updated = deliveryStatusRepository.transitionToQueued(
            notificationId, channel, DeliveryState.queueableStates(), LocalDateTime.now());
        if (updated == 0) {
            log.info("Notification {} channel {} was queued concurrently, skipping publish", notificationId, channel);
            return false;
        }

        DeliveryJob job = new DeliveryJob(notificationId, channel, attempt);
        AfterCommit.run(() -> {
            metricsService.recordQueued(channel);
            publish(job);
        });
        log.info("Queued notification {} channel {} (attempt {})", notificationId, channel, attempt);
        return true;
    }

    /**
     * Requeue FAILED rows that still have retry budget, oldest first.
     *
     * @param maxBatch upper bound on rows queued by this call
     */
    @Transactional
    public RetryBatchResult retryFailed(int maxBatch) {
        if (maxBatch < 1) {
            throw new BadRequestException("maxBatch must be at least 1");
        }
        long totalEligible = deliveryStatusRepository.countRetryable();
        List<DeliveryStatus> candidates = deliveryStatusRepository.findRetryCandidates(PageRequest.of(0, maxBatch));

        int queued = 0;
        for (QueueTarget target : targetsOf(candidates)) {
            if (queueForDelivery(target.notificationId(), target.channel())) {
                queued++;
            }
        }
        log.info("Batch retry queued {} of {} eligible deliveries (batch limit {})", queued, totalEligible, maxBatch);
        return new RetryBatchResult(queued, totalEligible - queued, totalEligible);
    }

    @Transactional(readOnly = true)
    public RetryStatusSummary retryStatus() {
        long failedRetryable = deliveryStatusRepository.countRetryable();
        long failedExhausted = deliveryStatusRepository.countExhausted();
        long currentlyQueued = deliveryStatusRepository.countByStatus(DeliveryState.QUEUED);
        return new RetryStatusSummary(failedRetryable, failedExhausted, currentlyQueued, currentlyQueued == 0);
    }

    /**
     * Queue PENDING rows left behind by creations without auto-dispatch, oldest first.
     *
     * @return number of rows queued
     */
    @Transactional
    public int dispatchPending(int maxBatch) {
        if (maxBatch < 1) {
            throw new BadRequestException("maxBatch must be at least 1");
        }
        List<DeliveryStatus> pending = deliveryStatusRepository.findByStatusOldestFirst(
            DeliveryState.PENDING, PageRequest.of(0, maxBatch));
        int queued = 0;
        for (QueueTarget target : targetsOf(pending)) {
            if (queueForDelivery(target.notificationId(), target.channel())) {
                queued++;
            }
        }
        if (queued > 0) {
            log.info("Dispatched {} pending deliveries", queued);
        }
        return queued;
    }

    private String resolveContactAddress(CreateNotificationCommand command) {
        String contactAddress = command.contactAddress();
        if ((contactAddress == null || contactAddress.isBlank()) && command.recipientId() != null) {
            contactAddress = recipientDirectory.lookupContactAddress(command.recipientId());
        }
        if (contactAddress == null || contactAddress.isBlank()) {
            throw new BadRequestException("Contact address is required when no recipient is given");
        }
        contactAddress = contactAddress.trim();
        if (!EMAIL_ADDRESS.matcher(contactAddress).matches()) {
            throw new BadRequestException("Invalid contact address: " + contactAddress);
        }
        return contactAddress;
    }

    // Read ids before queueing: each conditional update clears the persistence context
    private List<QueueTarget> targetsOf(List<DeliveryStatus> statuses) {
        return statuses.stream()
            .map(status -> new QueueTarget(status.getNotificationId(), status.getChannel()))
            .toList();
    }

    private void publish(DeliveryJob job) {
        CompletableFuture<Void> future;
        try {
            future = deliveryQueue.enqueue(job);
        } catch (RuntimeException e) {
            future = CompletableFuture.failedFuture(e);
        }
        future.whenComplete((result, ex) -> {
            if (ex != null) {
                handlePublishFailure(job, ex);
            } else {
                log.debug("Delivery job {} published", job.messageKey());
            }
        });
    }

    private void handlePublishFailure(DeliveryJob job, Throwable ex) {
        Throwable cause = ex instanceof CompletionException && ex.getCause() != null ? ex.getCause() : ex;
        String reason = cause.getMessage() != null ? cause.getMessage() : cause.getClass().getSimpleName();
        log.error("Failed to publish delivery job {}, marking FAILED", job.messageKey(), cause);
        metricsService.recordPublishFailed(job.channel());
        try {
            int reverted = deliveryStatusRepository.revertQueuedToFailed(
                job.notificationId(), job.channel(), "Queue publish failed: " + reason, LocalDateTime.now());
            if (reverted == 1) {
                metricsService.recordFailed(job.channel(), job.attempt() - 1);
            }
        } catch (RuntimeException e) {
            log.error("Could not mark notification {} channel {} FAILED after publish failure; row stays QUEUED",
                job.notificationId(), job.channel(), e);
        }
    }

    private record QueueTarget(UUID notificationId, NotificationChannel channel) {
    }
}
