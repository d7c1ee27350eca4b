package com.recipenest.notification.api.dto;

import com.recipenest.notification.api.enums.NotificationCategory;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;
import lombok.Data;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;

@Data
public class BatchCreateNotificationRequest {

    @NotEmpty(message = "At least one recipient id is required")
    @Size(max = 500, message = "At most 500 recipients per request")
    private List<@NotNull(message = "Recipient ids must not be null") UUID> recipientIds;

    @NotNull(message = "Category is required")
    private NotificationCategory category;

    private Map<String, Object> payload = new LinkedHashMap<>();

    private boolean autoDispatch = true;

    public BatchCreateNotificationCommand toCommand() {
        return new BatchCreateNotificationCommand(recipientIds, category, payload, autoDispatch);
    }
}
