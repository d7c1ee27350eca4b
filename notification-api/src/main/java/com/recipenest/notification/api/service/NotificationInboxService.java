package com.recipenest.notification.api.service;

import com.recipenest.notification.api.dto.InboxItem;
import com.recipenest.notification.api.dto.InboxPage;
import com.recipenest.notification.api.entity.Notification;
import com.recipenest.notification.api.repository.DeliveryStatusRepository;
import com.recipenest.notification.api.repository.NotificationRepository;
import com.recipenest.notification.api.repository.OffsetLimitRequest;
import com.recipenest.notification.api.repository.ScheduledDeliveryJobRepository;
import com.recipenest.notification.common.DeliveryState;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Sort;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.LocalDateTime;
import java.util.Collection;
import java.util.List;
import java.util.UUID;

/**
 * The caller's in-app inbox: listing, read flags, soft and hard deletion.
 *
 * The caller is always passed in explicitly; nothing here reads identity from ambient state.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class NotificationInboxService {

    static final int MAX_LIMIT = 100;

    private final NotificationRepository notificationRepository;
    private final DeliveryStatusRepository deliveryStatusRepository;
    private final ScheduledDeliveryJobRepository scheduledJobRepository;

    @Transactional(readOnly = true)
    public InboxPage listForCaller(CallerContext caller, int limit, long offset) {
        UUID callerId = caller.requireCallerId();
        if (offset < 0 || limit < 1 || limit > MAX_LIMIT) {
            throw new BadRequestException("offset must be >= 0 and limit between 1 and " + MAX_LIMIT);
        }
        Page<Notification> notifications = notificationRepository.findByRecipientIdAndDeletedFalse(
            callerId, new OffsetLimitRequest(offset, limit, Sort.by(Sort.Direction.DESC, "createdAt", "id")));
        List<InboxItem> items = notifications.getContent().stream().map(InboxItem::from).toList();
        long unread = notificationRepository.countByRecipientIdAndDeletedFalseAndReadFalse(callerId);
        return new InboxPage(items, notifications.getTotalElements(), unread, limit, offset);
    }

    @Transactional(readOnly = true)
    public long countForCaller(CallerContext caller) {
        return notificationRepository.countByRecipientIdAndDeletedFalse(caller.requireCallerId());
    }

    /**
     * @throws NotFoundException if the notification does not exist, is deleted, or belongs to someone else
     */
    @Transactional
    public void markAsRead(CallerContext caller, UUID notificationId) {
        Notification notification = notificationRepository
            .findByIdAndRecipientIdAndDeletedFalse(notificationId, caller.requireCallerId())
            .orElseThrow(() -> new NotFoundException("Notification not found: " + notificationId));
        if (!notification.isRead()) {
            notification.setRead(true);
            notificationRepository.save(notification);
        }
    }

    /**
     * @return ids that were unread before the call
     */
    @Transactional
    public List<UUID> markAllAsRead(CallerContext caller) {
        List<UUID> unread = notificationRepository.findUnreadIds(caller.requireCallerId());
        if (!unread.isEmpty()) {
            notificationRepository.markRead(unread, LocalDateTime.now());
        }
        log.info("Marked {} notifications read for {}", unread.size(), caller.callerId());
        return unread;
    }

    /**
     * Soft-delete the caller's notifications among {@code notificationIds}. Ids that are unknown,
     * already deleted or owned by someone else are ignored.
     *
     * @return ids actually deleted
     */
    @Transactional
    public List<UUID> softDelete(CallerContext caller, Collection<UUID> notificationIds) {
        if (notificationIds == null || notificationIds.isEmpty()) {
            throw new BadRequestException("At least one notification id is required");
        }
        List<UUID> owned = notificationRepository.findOwnedActiveIds(caller.requireCallerId(), notificationIds);
        if (!owned.isEmpty()) {
            notificationRepository.markDeleted(owned, LocalDateTime.now());
        }
        log.info("Soft-deleted {} of {} requested notifications for {}",
            owned.size(), notificationIds.size(), caller.callerId());
        return owned;
    }

    /**
     * Permanently delete a notification and its delivery rows.
     *
     * @throws NotFoundException if it does not exist
     * @throws ForbiddenException unless the caller owns it or holds the admin scope
     * @throws ConflictException while any channel is QUEUED
     */
    @Transactional
    public void delete(CallerContext caller, UUID notificationId) {
        Notification notification = notificationRepository.findById(notificationId)
            .orElseThrow(() -> new NotFoundException("Notification not found: " + notificationId));
        if (!caller.isAdmin() && !notification.isOwnedBy(caller.callerId())) {
            throw new ForbiddenException("Not allowed to delete notification " + notificationId);
        }
        if (deliveryStatusRepository.hasChannelInState(notificationId, DeliveryState.QUEUED)) {
            throw new ConflictException("Cannot delete notification " + notificationId
                + " while a delivery is queued");
        }
        scheduledJobRepository.deleteByNotificationId(notificationId);
        notificationRepository.delete(notification);
        log.info("Deleted notification {} (requested by {})", notificationId, caller.callerId());
    }
}
