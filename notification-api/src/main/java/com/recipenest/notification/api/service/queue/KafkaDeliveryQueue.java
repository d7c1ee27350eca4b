package com.recipenest.notification.api.service.queue;

import com.recipenest.notification.api.config.QueueProperties;
import com.recipenest.notification.api.entity.ScheduledDeliveryJob;
import com.recipenest.notification.api.repository.ScheduledDeliveryJobRepository;
import com.recipenest.notification.common.queue.DeliveryJob;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Duration;
import java.time.LocalDateTime;
import java.util.concurrent.CompletableFuture;

/**
 * Kafka-backed delivery queue.
 *
 * Immediate jobs go straight to the delivery topic keyed by notification and channel.
 * Delayed jobs are written to {@code scheduled_delivery_jobs} and published by
 * {@link ScheduledDeliveryRelay} when due, so no consumer thread ever sleeps.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class KafkaDeliveryQueue implements DeliveryQueue {

    private final KafkaTemplate<String, String> kafkaTemplate;
    private final DeliveryJobCodec codec;
    private final ScheduledDeliveryJobRepository scheduledJobRepository;
    private final QueueProperties queueProperties;

    @Override
    public CompletableFuture<Void> enqueue(DeliveryJob job) {
        String payload;
        try {
            payload = codec.encode(job);
        } catch (IllegalStateException e) {
            return CompletableFuture.failedFuture(e);
        }
        return kafkaTemplate.send(queueProperties.getTopic(), job.messageKey(), payload)
            .thenAccept(result -> log.debug("Published delivery job {} attempt {} to partition {}",
                job.messageKey(), job.attempt(), result.getRecordMetadata().partition()));
    }

    @Override
    @Transactional
    public void enqueueAfter(Duration delay, DeliveryJob job) {
        if (delay.isNegative()) {
            throw new IllegalArgumentException("Delay must not be negative: " + delay);
        }
        LocalDateTime dueAt = LocalDateTime.now().plus(delay);
        scheduledJobRepository.save(new ScheduledDeliveryJob(job, dueAt));
        log.info("Scheduled delivery job {} attempt {} for {}", job.messageKey(), job.attempt(), dueAt);
    }
}
