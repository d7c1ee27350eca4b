package com.recipenest.notification.api.repository;

import com.recipenest.notification.api.entity.DeliveryStatus;
import com.recipenest.notification.common.DeliveryState;
import com.recipenest.notification.common.NotificationChannel;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

import java.time.LocalDateTime;
import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

@Repository
public interface DeliveryStatusRepository extends JpaRepository<DeliveryStatus, UUID> {

    @Query("SELECT d FROM DeliveryStatus d WHERE d.notification.id = :notificationId AND d.channel = :channel")
    Optional<DeliveryStatus> findByNotificationIdAndChannel(
        @Param("notificationId") UUID notificationId,
        @Param("channel") NotificationChannel channel
    );

    @Query("SELECT d FROM DeliveryStatus d WHERE d.notification.id = :notificationId ORDER BY d.channel")
    List<DeliveryStatus> findByNotificationId(@Param("notificationId") UUID notificationId);

    @Query("SELECT COUNT(d) FROM DeliveryStatus d " +
           "WHERE d.notification.id = :notificationId AND d.status = :status")
    long countByNotificationIdAndStatus(
        @Param("notificationId") UUID notificationId,
        @Param("status") DeliveryState status
    );

    default boolean hasChannelInState(UUID notificationId, DeliveryState status) {
        return countByNotificationIdAndStatus(notificationId, status) > 0;
    }

    /**
     * Compare-and-swap into QUEUED, clearing the previous error detail.
     *
     * Only one of several concurrent callers observes a return value of 1; the others see 0
     * and must not publish a job.
     *
     * @return number of rows updated (0 or 1)
     */
    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("UPDATE DeliveryStatus d SET d.status = com.recipenest.notification.common.DeliveryState.QUEUED, " +
           "d.errorMessage = NULL, d.queuedAt = :now, d.updatedAt = :now, d.version = d.version + 1 " +
           "WHERE d.notification.id = :notificationId AND d.channel = :channel AND d.status IN :expected")
    int transitionToQueued(
        @Param("notificationId") UUID notificationId,
        @Param("channel") NotificationChannel channel,
        @Param("expected") Collection<DeliveryState> expected,
        @Param("now") LocalDateTime now
    );

    /**
     * Move a QUEUED row back to FAILED when its job never reached the queue.
     * retry_count is untouched since no delivery attempt was made. Always runs in its own
     * transaction: callers are after-commit hooks and producer callbacks.
     */
    @Transactional(propagation = Propagation.REQUIRES_NEW)
    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("UPDATE DeliveryStatus d SET d.status = com.recipenest.notification.common.DeliveryState.FAILED, " +
           "d.errorMessage = :error, d.failedAt = :now, d.updatedAt = :now, d.version = d.version + 1 " +
           "WHERE d.notification.id = :notificationId AND d.channel = :channel " +
           "AND d.status = com.recipenest.notification.common.DeliveryState.QUEUED")
    int revertQueuedToFailed(
        @Param("notificationId") UUID notificationId,
        @Param("channel") NotificationChannel channel,
        @Param("error") String error,
        @Param("now") LocalDateTime now
    );

    /**
     * Move a QUEUED row back to FAILED when the worker could not finish attempt
     * {@code expectedRetryCount + 1}. A row already past that attempt is left alone.
     */
    @Transactional(propagation = Propagation.REQUIRES_NEW)
    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("UPDATE DeliveryStatus d SET d.status = com.recipenest.notification.common.DeliveryState.FAILED, " +
           "d.errorMessage = :error, d.failedAt = :now, d.updatedAt = :now, d.version = d.version + 1 " +
           "WHERE d.notification.id = :notificationId AND d.channel = :channel " +
           "AND d.status = com.recipenest.notification.common.DeliveryState.QUEUED " +
           "AND d.retryCount = :expectedRetryCount")
    int revertAttemptToFailed(
        @Param("notificationId") UUID notificationId,
        @Param("channel") NotificationChannel channel,
        @Param("expectedRetryCount") int expectedRetryCount,
        @Param("error") String error,
        @Param("now") LocalDateTime now
    );

    /**
     * FAILED rows with retry budget left, oldest first.
     * Use PageRequest.of(0, batchSize) to cap the batch.
     */
    @Query("SELECT d FROM DeliveryStatus d " +
           "WHERE d.status = com.recipenest.notification.common.DeliveryState.FAILED " +
           "AND d.retryCount < d.maxRetries " +
           "ORDER BY d.createdAt ASC, d.id ASC")
    List<DeliveryStatus> findRetryCandidates(Pageable pageable);

    @Query("SELECT COUNT(d) FROM DeliveryStatus d " +
           "WHERE d.status = com.recipenest.notification.common.DeliveryState.FAILED " +
           "AND d.retryCount < d.maxRetries")
    long countRetryable();

    @Query("SELECT COUNT(d) FROM DeliveryStatus d " +
           "WHERE d.status = com.recipenest.notification.common.DeliveryState.FAILED " +
           "AND d.retryCount >= d.maxRetries")
    long countExhausted();

    long countByStatus(DeliveryState status);

    @Query("SELECT d FROM DeliveryStatus d WHERE d.status = :status ORDER BY d.createdAt ASC, d.id ASC")
    List<DeliveryStatus> findByStatusOldestFirst(@Param("status") DeliveryState status, Pageable pageable);

    // Retry statistics

    @Query("SELECT COUNT(d) FROM DeliveryStatus d WHERE d.retryCount > 0")
    long countRetried();

    @Query("SELECT COUNT(d) FROM DeliveryStatus d WHERE d.retryCount > 0 AND d.status = :status")
    long countRetriedByStatus(@Param("status") DeliveryState status);

    @Query("SELECT AVG(d.retryCount) FROM DeliveryStatus d " +
           "WHERE d.retryCount > 0 AND d.status = com.recipenest.notification.common.DeliveryState.SENT")
    Double averageRetriesBeforeSuccess();
}
