package com.sporehub.backend.common.web;

import com.fasterxml.jackson.annotation.JsonInclude;

/**
 * Success envelope. {@code data} is always serialized, as {@code null} when there is no payload.
 */
@JsonInclude(JsonInclude.Include.ALWAYS)
public record ApiResponse<T>(
        boolean success,
        String message,
        T data
) {
    public static <T> ApiResponse<T> ok(String message, T data) {
        return new ApiResponse<>(true, message, data);
    }

    public static ApiResponse<Void> ok(String message) {
        return new ApiResponse<>(true, message, null);
    }
}
