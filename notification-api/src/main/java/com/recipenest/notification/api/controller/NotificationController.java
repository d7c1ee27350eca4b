package com.recipenest.notification.api.controller;

import com.recipenest.notification.api.dto.ApiResponse;
import com.recipenest.notification.api.dto.BatchCreateNotificationRequest;
import com.recipenest.notification.api.dto.BatchNotificationResponse;
import com.recipenest.notification.api.dto.BulkDeleteRequest;
import com.recipenest.notification.api.dto.CreateNotificationRequest;
import com.recipenest.notification.api.dto.InboxPage;
import com.recipenest.notification.api.dto.NotificationResponse;
import com.recipenest.notification.api.service.CallerContext;
import com.recipenest.notification.api.service.DeliveryOrchestrator;
import com.recipenest.notification.api.service.NotificationInboxService;
import com.recipenest.notification.common.NotificationChannel;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.Map;
import java.util.UUID;

@RestController
@RequestMapping("/api/v1/notifications")
@RequiredArgsConstructor
public class NotificationController {

    private final DeliveryOrchestrator deliveryOrchestrator;
    private final NotificationInboxService inboxService;

    @PostMapping
    public ResponseEntity<ApiResponse<NotificationResponse>> createNotification(
            @Valid @RequestBody CreateNotificationRequest request) {
        NotificationResponse response = NotificationResponse.from(deliveryOrchestrator.create(request.toCommand()));
        return ResponseEntity.status(HttpStatus.ACCEPTED).body(ApiResponse.success(response));
    }

    @PostMapping("/batch")
    public ResponseEntity<ApiResponse<BatchNotificationResponse>> createNotifications(
            @Valid @RequestBody BatchCreateNotificationRequest request) {
        BatchNotificationResponse response =
            BatchNotificationResponse.from(deliveryOrchestrator.createBatch(request.toCommand()));
        return ResponseEntity.status(HttpStatus.ACCEPTED).body(ApiResponse.success(response));
    }

    @PostMapping("/{notificationId}/queue")
    public ResponseEntity<ApiResponse<Map<String, Object>>> queueNotification(
            @PathVariable UUID notificationId,
            @RequestParam(defaultValue = "EMAIL") NotificationChannel channel) {
        boolean queued = deliveryOrchestrator.queueForDelivery(notificationId, channel);
        return ResponseEntity.status(HttpStatus.ACCEPTED)
            .body(ApiResponse.success(Map.of("notificationId", notificationId, "channel", channel, "queued", queued)));
    }

    @GetMapping("/me")
    public ResponseEntity<ApiResponse<?>> listMyNotifications(
            CallerContext caller,
            @RequestParam(defaultValue = "20") int limit,
            @RequestParam(defaultValue = "0") long offset,
            @RequestParam(defaultValue = "false") boolean countOnly) {
        if (countOnly) {
            return ResponseEntity.ok(ApiResponse.success(Map.of("count", inboxService.countForCaller(caller))));
        }
        InboxPage page = inboxService.listForCaller(caller, limit, offset);
        return ResponseEntity.ok(ApiResponse.success(page));
    }

    @PatchMapping("/{notificationId}/read")
    public ResponseEntity<ApiResponse<Void>> markAsRead(CallerContext caller, @PathVariable UUID notificationId) {
        inboxService.markAsRead(caller, notificationId);
        return ResponseEntity.ok(ApiResponse.successEmpty());
    }

    @PatchMapping("/me/read-all")
    public ResponseEntity<ApiResponse<List<UUID>>> markAllAsRead(CallerContext caller) {
        return ResponseEntity.ok(ApiResponse.success(inboxService.markAllAsRead(caller)));
    }

    @DeleteMapping("/{notificationId}")
    public ResponseEntity<Void> deleteNotification(CallerContext caller, @PathVariable UUID notificationId) {
        inboxService.delete(caller, notificationId);
        return ResponseEntity.noContent().build();
    }

    @PostMapping("/me/delete")
    public ResponseEntity<ApiResponse<List<UUID>>> deleteMyNotifications(
            CallerContext caller,
            @Valid @RequestBody BulkDeleteRequest request) {
        return ResponseEntity.ok(ApiResponse.success(inboxService.softDelete(caller, request.getNotificationIds())));
    }
}
