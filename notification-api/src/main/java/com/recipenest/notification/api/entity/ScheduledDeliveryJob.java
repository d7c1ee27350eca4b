package com.recipenest.notification.api.entity;

import com.recipenest.notification.common.NotificationChannel;
import com.recipenest.notification.common.queue.DeliveryJob;
import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Index;
import jakarta.persistence.Table;
import lombok.AccessLevel;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;
import java.util.UUID;

/**
 * A delivery job waiting for its due time. Rows are published by
 * {@code ScheduledDeliveryRelay} and deleted once the publish is acknowledged.
 */
@Entity
@Table(name = "scheduled_delivery_jobs", indexes = {
    @Index(name = "idx_scheduled_delivery_jobs_due_at", columnList = "due_at")
})
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
public class ScheduledDeliveryJob extends BaseAuditableEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    @Column(name = "id")
    private UUID id;

    @Column(name = "notification_id", nullable = false)
    private UUID notificationId;

    @Enumerated(EnumType.STRING)
    @Column(name = "channel", nullable = false, length = 20)
    private NotificationChannel channel;

    @Column(name = "attempt", nullable = false)
    private int attempt;

    @Column(name = "due_at", nullable = false)
    private LocalDateTime dueAt;

    public ScheduledDeliveryJob(DeliveryJob job, LocalDateTime dueAt) {
        this.notificationId = job.notificationId();
        this.channel = job.channel();
        this.attempt = job.attempt();
        this.dueAt = dueAt;
    }

    public DeliveryJob toJob() {
        return new DeliveryJob(notificationId, channel, attempt);
    }
}
