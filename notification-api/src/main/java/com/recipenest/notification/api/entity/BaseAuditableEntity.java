package com.recipenest.notification.api.entity;

import jakarta.persistence.Column;
import jakarta.persistence.MappedSuperclass;
import lombok.Getter;
import org.hibernate.annotations.CreationTimestamp;
import org.hibernate.annotations.UpdateTimestamp;

import java.time.LocalDateTime;

/**
 * Creation and last-modification timestamps shared by all tables.
 *
 * Bulk JPQL updates bypass {@link UpdateTimestamp}; repository update queries set
 * {@code updatedAt} themselves.
 */
@MappedSuperclass
@Getter
public abstract class BaseAuditableEntity {

    @CreationTimestamp
    @Column(name = "created_at", nullable = false, updatable = false)
    private LocalDateTime createdAt;

    @UpdateTimestamp
    @Column(name = "updated_at")
    private LocalDateTime updatedAt;
}
