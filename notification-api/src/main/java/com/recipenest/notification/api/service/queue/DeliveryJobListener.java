package com.recipenest.notification.api.service.queue;

import com.recipenest.notification.api.service.DispatchOutcome;
import com.recipenest.notification.api.service.DispatchWorker;
import com.recipenest.notification.api.service.NotFoundException;
import com.recipenest.notification.common.queue.DeliveryJob;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.kafka.annotation.KafkaListener;
import org.springframework.kafka.support.Acknowledgment;
import org.springframework.kafka.support.KafkaHeaders;
import org.springframework.messaging.handler.annotation.Header;
import org.springframework.messaging.handler.annotation.Payload;
import org.springframework.orm.ObjectOptimisticLockingFailureException;
import org.springframework.stereotype.Component;

/**
 * Consumes delivery jobs and runs them through the {@link DispatchWorker}.
 *
 * Malformed jobs, jobs for deleted notifications and jobs that lost a race with a concurrent
 * update are acknowledged and dropped. Any other error is rethrown without acknowledging so
 * the container's error handler redelivers the record, handing it to {@link DeliveryJobRecoverer}
 * once redeliveries run out.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class DeliveryJobListener {

    private final DispatchWorker dispatchWorker;
    private final DeliveryJobCodec codec;

    @KafkaListener(
        topics = "${notification.queue.topic:notification-delivery}",
        autoStartup = "${kafka.consumer.auto-startup:true}"
    )
    public void onDeliveryJob(
            @Payload String payload,
            @Header(name = KafkaHeaders.RECEIVED_KEY, required = false) String key,
            Acknowledgment acknowledgment) {
        DeliveryJob job;
        try {
            job = codec.decode(payload);
        } catch (IllegalArgumentException e) {
            log.error("Discarding malformed delivery job {}: {}", key, e.getMessage());
            acknowledgment.acknowledge();
            return;
        }

        try {
            DispatchOutcome outcome = dispatchWorker.process(job);
            log.debug("Delivery job {} attempt {} finished with {}", job.messageKey(), job.attempt(), outcome);
        } catch (NotFoundException e) {
            log.warn("Discarding delivery job {}: {}", job.messageKey(), e.getMessage());
        } catch (ObjectOptimisticLockingFailureException e) {
            log.warn("Delivery job {} lost a race with a concurrent update, discarding duplicate", job.messageKey());
        }
        acknowledgment.acknowledge();
    }
}
