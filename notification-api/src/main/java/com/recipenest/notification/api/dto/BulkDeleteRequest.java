package com.recipenest.notification.api.dto;

import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.Size;
import lombok.Data;

import java.util.List;
import java.util.UUID;

@Data
public class BulkDeleteRequest {

    @NotEmpty(message = "At least one notification id is required")
    @Size(max = 500, message = "At most 500 notifications per request")
    private List<UUID> notificationIds;
}
