package com.recipenest.notification.api.dto;

import jakarta.validation.constraints.Size;
import lombok.Data;

@Data
public class AbortRequest {

    @Size(max = 500)
    private String reason;
}
