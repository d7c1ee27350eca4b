package com.recipenest.notification.api.dto;

import com.fasterxml.jackson.annotation.JsonInclude;

/**
 * Response wrapper shared by all endpoints.
 *
 * @param <T> Type of the data payload
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ApiResponse<T>(
    boolean success,
    T data,
    String error
) {
    public static <T> ApiResponse<T> success(T data) {
        return new ApiResponse<>(true, data, null);
    }

    public static ApiResponse<Void> successEmpty() {
        return new ApiResponse<>(true, null, null);
    }
}
