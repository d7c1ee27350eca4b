package com.recipenest.notification.api.dto;

import com.recipenest.notification.api.enums.NotificationCategory;
import jakarta.validation.constraints.Email;
import jakarta.validation.constraints.NotNull;
import lombok.Data;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.UUID;

@Data
public class CreateNotificationRequest {

    private UUID recipientId;

    @NotNull(message = "Category is required")
    private NotificationCategory category;

    private Map<String, Object> payload = new LinkedHashMap<>();

    // Looked up from the recipient directory when omitted
    @Email(message = "Contact address must be a valid email")
    private String contactAddress;

    private boolean autoDispatch = true;

    public CreateNotificationCommand toCommand() {
        return new CreateNotificationCommand(recipientId, category, payload, contactAddress, autoDispatch);
    }
}
