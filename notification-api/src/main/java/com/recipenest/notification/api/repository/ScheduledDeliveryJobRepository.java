package com.recipenest.notification.api.repository;

import com.recipenest.notification.api.entity.ScheduledDeliveryJob;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.LocalDateTime;
import java.util.List;
import java.util.UUID;

@Repository
public interface ScheduledDeliveryJobRepository extends JpaRepository<ScheduledDeliveryJob, UUID> {

    @Query("SELECT j FROM ScheduledDeliveryJob j WHERE j.dueAt <= :now ORDER BY j.dueAt ASC")
    List<ScheduledDeliveryJob> findDue(@Param("now") LocalDateTime now, Pageable pageable);

    @Modifying
    @Query("DELETE FROM ScheduledDeliveryJob j WHERE j.notificationId = :notificationId")
    int deleteByNotificationId(@Param("notificationId") UUID notificationId);
}
