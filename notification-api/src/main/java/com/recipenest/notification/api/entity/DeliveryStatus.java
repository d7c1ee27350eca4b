package com.recipenest.notification.api.entity;

import com.recipenest.notification.common.DeliveryState;
import com.recipenest.notification.common.NotificationChannel;
import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.FetchType;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Index;
import jakarta.persistence.JoinColumn;
import jakarta.persistence.ManyToOne;
import jakarta.persistence.Table;
import jakarta.persistence.UniqueConstraint;
import jakarta.persistence.Version;
import lombok.AccessLevel;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;
import java.util.UUID;

/**
 * Delivery state of one notification on one channel.
 *
 * retry_count counts failed attempts. A row with {@code retryCount >= maxRetries} is exhausted
 * and is never requeued automatically.
 */
@Entity
@Table(name = "delivery_statuses",
    uniqueConstraints = @UniqueConstraint(name = "uq_delivery_status_notification_channel",
        columnNames = {"notification_id", "channel"}),
    indexes = {
        @Index(name = "idx_delivery_status_status", columnList = "status, retry_count"),
        @Index(name = "idx_delivery_status_created_at", columnList = "created_at")
    })
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
public class DeliveryStatus extends BaseAuditableEntity {

    public static final int ERROR_MESSAGE_MAX_LENGTH = 2000;

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    @Column(name = "id")
    private UUID id;

    @ManyToOne(fetch = FetchType.LAZY, optional = false)
    @JoinColumn(name = "notification_id", nullable = false)
    private Notification notification;

    @Enumerated(EnumType.STRING)
    @Column(name = "channel", nullable = false, length = 20)
    private NotificationChannel channel;

    @Enumerated(EnumType.STRING)
    @Column(name = "status", nullable = false, length = 20)
    private DeliveryState status = DeliveryState.PENDING;

    @Column(name = "retry_count", nullable = false)
    private int retryCount = 0;

    @Column(name = "max_retries", nullable = false)
    private int maxRetries;

    @Column(name = "error_message", length = ERROR_MESSAGE_MAX_LENGTH)
    private String errorMessage;

    @Column(name = "queued_at")
    private LocalDateTime queuedAt;

    @Column(name = "sent_at")
    private LocalDateTime sentAt;

    @Column(name = "failed_at")
    private LocalDateTime failedAt;

    @Version
    @Column(name = "version", nullable = false)
    private long version;

    public DeliveryStatus(Notification notification, NotificationChannel channel, int maxRetries) {
        this.notification = notification;
        this.channel = channel;
        this.maxRetries = maxRetries;
    }

    public UUID getNotificationId() {
        return notification.getId();
    }

    public boolean isExhausted() {
        return retryCount >= maxRetries;
    }

    /**
     * Eligible for a manual or batch retry: FAILED with budget left.
     */
    public boolean canRetry() {
        return status == DeliveryState.FAILED && !isExhausted();
    }

    /**
     * @return false if the row was already SENT (no change made)
     */
    public boolean markSent(LocalDateTime now) {
        if (status == DeliveryState.SENT) {
            return false;
        }
        this.status = DeliveryState.SENT;
        this.sentAt = now;
        this.errorMessage = null;
        return true;
    }

    public void markFailed(String error, LocalDateTime now) {
        this.status = DeliveryState.FAILED;
        this.failedAt = now;
        this.errorMessage = truncate(error);
    }

    public void markAborted(String error, LocalDateTime now) {
        this.status = DeliveryState.ABORTED;
        this.failedAt = now;
        this.errorMessage = truncate(error);
    }

    /**
     * Count one failed attempt and remember its cause. Status is left unchanged so a row
     * waiting for its delayed retry stays QUEUED.
     *
     * @return the new retry count
     */
    public int recordFailedAttempt(String error) {
        this.retryCount++;
        this.errorMessage = truncate(error);
        return retryCount;
    }

    public void clearError() {
        this.errorMessage = null;
    }

    static String truncate(String error) {
        if (error == null || error.length() <= ERROR_MESSAGE_MAX_LENGTH) {
            return error;
        }
        return error.substring(0, ERROR_MESSAGE_MAX_LENGTH);
    }
}
