package com.recipenest.notification.api.service.queue;

import com.recipenest.notification.common.queue.DeliveryJob;

import java.time.Duration;
import java.util.concurrent.CompletableFuture;

/**
 * Delivery job queue. At-least-once, no ordering across jobs.
 */
public interface DeliveryQueue {

    /**
     * Publish a job for immediate processing.
     *
     * @return future completed when the broker acknowledged the job, or completed
     *         exceptionally when publishing failed
     */
    CompletableFuture<Void> enqueue(DeliveryJob job);

    /**
     * Publish a job once {@code delay} has elapsed. Must be called inside the transaction that
     * records the failed attempt so the delayed job and the retry bookkeeping commit together.
     */
    void enqueueAfter(Duration delay, DeliveryJob job);
}
