package com.recipenest.notification.api.repository;

import com.recipenest.notification.api.entity.Notification;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.LocalDateTime;
import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

@Repository
public interface NotificationRepository extends JpaRepository<Notification, UUID> {

    Page<Notification> findByRecipientIdAndDeletedFalse(UUID recipientId, Pageable pageable);

    long countByRecipientIdAndDeletedFalse(UUID recipientId);

    long countByRecipientIdAndDeletedFalseAndReadFalse(UUID recipientId);

    Optional<Notification> findByIdAndRecipientIdAndDeletedFalse(UUID id, UUID recipientId);

    @Query("SELECT n.id FROM Notification n WHERE n.recipientId = :recipientId " +
           "AND n.deleted = false AND n.read = false")
    List<UUID> findUnreadIds(@Param("recipientId") UUID recipientId);

    @Query("SELECT n.id FROM Notification n WHERE n.recipientId = :recipientId " +
           "AND n.deleted = false AND n.id IN :ids")
    List<UUID> findOwnedActiveIds(@Param("recipientId") UUID recipientId, @Param("ids") Collection<UUID> ids);

    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("UPDATE Notification n SET n.read = true, n.updatedAt = :now WHERE n.id IN :ids")
    int markRead(@Param("ids") Collection<UUID> ids, @Param("now") LocalDateTime now);

    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("UPDATE Notification n SET n.deleted = true, n.updatedAt = :now WHERE n.id IN :ids")
    int markDeleted(@Param("ids") Collection<UUID> ids, @Param("now") LocalDateTime now);
}
