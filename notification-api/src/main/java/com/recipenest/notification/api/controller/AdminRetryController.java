package com.recipenest.notification.api.controller;

import com.recipenest.notification.api.dto.AbortRequest;
import com.recipenest.notification.api.dto.ApiResponse;
import com.recipenest.notification.api.dto.RetryBatchResult;
import com.recipenest.notification.api.dto.RetryStatistics;
import com.recipenest.notification.api.dto.RetryStatusSummary;
import com.recipenest.notification.api.dto.TemplateInfo;
import com.recipenest.notification.api.enums.NotificationCategory;
import com.recipenest.notification.api.service.DeliveryOrchestrator;
import com.recipenest.notification.api.service.RetryControlService;
import com.recipenest.notification.common.NotificationChannel;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.Arrays;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * Operator endpoints. Guarded by {@code AdminScopeInterceptor}.
 */
@RestController
@RequestMapping("/admin/api/notifications")
@RequiredArgsConstructor
@Slf4j
public class AdminRetryController {

    private final RetryControlService retryControlService;
    private final DeliveryOrchestrator deliveryOrchestrator;

    @PostMapping("/retry-failed")
    public ResponseEntity<ApiResponse<RetryBatchResult>> retryFailed(
            @RequestParam(defaultValue = "100") int maxBatch) {
        return ResponseEntity.status(HttpStatus.ACCEPTED)
            .body(ApiResponse.success(retryControlService.retryFailed(maxBatch)));
    }

    @GetMapping("/retry-status")
    public ResponseEntity<ApiResponse<RetryStatusSummary>> retryStatus() {
        return ResponseEntity.ok(ApiResponse.success(retryControlService.retryStatus()));
    }

    @GetMapping("/retry-statistics")
    public ResponseEntity<ApiResponse<RetryStatistics>> retryStatistics() {
        return ResponseEntity.ok(ApiResponse.success(retryControlService.retryStatistics()));
    }

    @GetMapping("/templates")
    public ResponseEntity<ApiResponse<List<TemplateInfo>>> templates() {
        List<TemplateInfo> templates = Arrays.stream(NotificationCategory.values()).map(TemplateInfo::from).toList();
        return ResponseEntity.ok(ApiResponse.success(templates));
    }

    @PostMapping("/{notificationId}/retry")
    public ResponseEntity<ApiResponse<Map<String, Object>>> retryNotification(
            @PathVariable UUID notificationId,
            @RequestParam(defaultValue = "EMAIL") NotificationChannel channel) {
        boolean queued = retryControlService.retrySingle(notificationId, channel);
        return ResponseEntity.status(HttpStatus.ACCEPTED)
            .body(ApiResponse.success(Map.of("notificationId", notificationId, "channel", channel, "queued", queued)));
    }

    @PostMapping("/{notificationId}/abort")
    public ResponseEntity<ApiResponse<Void>> abortNotification(
            @PathVariable UUID notificationId,
            @RequestParam(defaultValue = "EMAIL") NotificationChannel channel,
            @Valid @RequestBody(required = false) AbortRequest request) {
        retryControlService.abort(notificationId, channel, request != null ? request.getReason() : null);
        return ResponseEntity.ok(ApiResponse.successEmpty());
    }

    @PostMapping("/dispatch-pending")
    public ResponseEntity<ApiResponse<Map<String, Integer>>> dispatchPending(
            @RequestParam(defaultValue = "100") int maxBatch) {
        int queued = deliveryOrchestrator.dispatchPending(maxBatch);
        return ResponseEntity.status(HttpStatus.ACCEPTED).body(ApiResponse.success(Map.of("queuedCount", queued)));
    }
}
