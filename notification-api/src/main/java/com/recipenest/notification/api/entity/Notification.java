package com.recipenest.notification.api.entity;

import com.recipenest.notification.api.config.PayloadJsonConverter;
import com.recipenest.notification.api.enums.NotificationCategory;
import jakarta.persistence.CascadeType;
import jakarta.persistence.Column;
import jakarta.persistence.Convert;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Index;
import jakarta.persistence.OneToMany;
import jakarta.persistence.Table;
import lombok.AccessLevel;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * A rendered notification.
 *
 * Immutable after creation apart from the read/deleted flags.
 */
@Entity
@Table(name = "notifications", indexes = {
    @Index(name = "idx_notifications_recipient", columnList = "recipient_id, is_deleted, created_at"),
    @Index(name = "idx_notifications_category", columnList = "category")
})
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
public class Notification extends BaseAuditableEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    @Column(name = "id")
    private UUID id;

    /**
     * Null for system-wide notices.
     */
    @Column(name = "recipient_id")
    private UUID recipientId;

    @Column(name = "contact_address", nullable = false, length = 320)
    private String contactAddress;

    @Column(name = "subject", nullable = false, length = 500)
    private String subject;

    @Column(name = "body", nullable = false, length = 4000)
    private String body;

    @Enumerated(EnumType.STRING)
    @Column(name = "category", nullable = false, length = 50)
    private NotificationCategory category;

    @Convert(converter = PayloadJsonConverter.class)
    @Column(name = "payload", nullable = false, length = 8000)
    private Map<String, Object> payload = new LinkedHashMap<>();

    @Setter
    @Column(name = "is_read", nullable = false)
    private boolean read = false;

    @Setter
    @Column(name = "is_deleted", nullable = false)
    private boolean deleted = false;

    @OneToMany(mappedBy = "notification", cascade = CascadeType.ALL, orphanRemoval = true)
    private List<DeliveryStatus> deliveryStatuses = new ArrayList<>();

    public Notification(UUID recipientId, String contactAddress, NotificationCategory category,
                        Map<String, ?> payload, String subject, String body) {
        this.recipientId = recipientId;
        this.contactAddress = contactAddress;
        this.category = category;
        this.payload = payload != null ? new LinkedHashMap<>(payload) : new LinkedHashMap<>();
        this.subject = subject;
        this.body = body;
    }

    public Map<String, Object> getPayload() {
        return Collections.unmodifiableMap(payload);
    }

    public boolean isOwnedBy(UUID callerId) {
        return recipientId != null && recipientId.equals(callerId);
    }
}
