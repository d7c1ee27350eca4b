package com.recipenest.notification.api.service.queue;

import com.recipenest.notification.api.repository.DeliveryStatusRepository;
import com.recipenest.notification.api.service.NotificationMetricsService;
import com.recipenest.notification.common.queue.DeliveryJob;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.apache.kafka.clients.consumer.ConsumerRecord;
import org.springframework.kafka.listener.ConsumerRecordRecoverer;
import org.springframework.stereotype.Component;

import java.time.LocalDateTime;

/**
 * Last step for a delivery job the listener kept failing on: moves its row from QUEUED back to
 * FAILED so batch or manual retry can pick it up again. retry_count is untouched since the
 * transport outcome was never recorded.
 *
 * If the update itself fails the exception propagates and the container redelivers the record.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class DeliveryJobRecoverer implements ConsumerRecordRecoverer {

    private final DeliveryJobCodec codec;
    private final DeliveryStatusRepository deliveryStatusRepository;
    private final NotificationMetricsService metricsService;

    @Override
    public void accept(ConsumerRecord<?, ?> record, Exception exception) {
        DeliveryJob job;
        try {
            job = codec.decode(String.valueOf(record.value()));
        } catch (IllegalArgumentException e) {
            log.error("Dropping undecodable delivery job at {}-{}@{}: {}",
                record.topic(), record.partition(), record.offset(), e.getMessage());
            return;
        }

        Throwable cause = exception.getCause() != null ? exception.getCause() : exception;
        String reason = cause.getMessage() != null ? cause.getMessage() : cause.getClass().getSimpleName();
        int reverted = deliveryStatusRepository.revertAttemptToFailed(
            job.notificationId(), job.channel(), job.attempt() - 1, "Dispatch failed: " + reason, LocalDateTime.now());
        if (reverted == 1) {
            metricsService.recordFailed(job.channel(), job.attempt() - 1);
            log.error("Delivery job {} attempt {} failed repeatedly, marked FAILED for retry",
                job.messageKey(), job.attempt(), cause);
        } else {
            log.warn("Delivery job {} attempt {} failed repeatedly but its row is no longer at that attempt",
                job.messageKey(), job.attempt());
        }
    }
}
