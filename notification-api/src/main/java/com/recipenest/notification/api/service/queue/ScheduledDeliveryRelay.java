package com.recipenest.notification.api.service.queue;

import com.recipenest.notification.api.config.QueueProperties;
import com.recipenest.notification.api.entity.ScheduledDeliveryJob;
import com.recipenest.notification.api.repository.ScheduledDeliveryJobRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.domain.PageRequest;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Publishes delayed delivery jobs once they are due.
 *
 * A row is deleted only after the broker acknowledged its job; rows whose publish failed stay
 * and are picked up again on the next run. Several instances may publish the same row; the
 * worker ignores jobs whose delivery row is no longer QUEUED at the job's attempt.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class ScheduledDeliveryRelay {

    private final ScheduledDeliveryJobRepository scheduledJobRepository;
    private final DeliveryQueue deliveryQueue;
    private final QueueProperties queueProperties;

    @Scheduled(fixedDelayString = "${notification.queue.relay-interval-ms:15000}")
    public void relayScheduledJobs() {
        relayDueJobs(LocalDateTime.now());
    }

    /**
     * Runs without a surrounding transaction so no database connection is held while waiting
     * for broker acknowledgements.
     *
     * @return number of jobs published and removed
     */
    public int relayDueJobs(LocalDateTime now) {
        List<ScheduledDeliveryJob> due = scheduledJobRepository.findDue(
            now, PageRequest.of(0, queueProperties.getRelayBatchSize()));
        if (due.isEmpty()) {
            log.debug("No scheduled delivery jobs due");
            return 0;
        }

        List<CompletableFuture<Void>> futures = new ArrayList<>(due.size());
        for (ScheduledDeliveryJob scheduled : due) {
            futures.add(deliveryQueue.enqueue(scheduled.toJob()));
        }

        List<ScheduledDeliveryJob> published = new ArrayList<>(due.size());
        for (int i = 0; i < due.size(); i++) {
            ScheduledDeliveryJob scheduled = due.get(i);
            try {
                futures.get(i).get(queueProperties.getPublishTimeoutMs(), TimeUnit.MILLISECONDS);
                published.add(scheduled);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                log.warn("Interrupted while relaying scheduled delivery jobs");
                break;
            } catch (ExecutionException | TimeoutException e) {
                log.error("Failed to publish scheduled delivery job for notification {} channel {}, will retry next run",
                    scheduled.getNotificationId(), scheduled.getChannel(), e);
            }
        }

        scheduledJobRepository.deleteAll(published);
        log.info("Relayed {} of {} due delivery jobs", published.size(), due.size());
        return published.size();
    }
}
