package com.flagship.game_economy.api;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.Value;

import java.util.Map;

/**
 * Envelope for every API response: {@code {success, data, error:{code, message}}}.
 */
@Value
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ApiResponse<T> {
    boolean success;
    T data;
    ApiError error;

    public static <T> ApiResponse<T> ok(T data) {
        return new ApiResponse<>(true, data, null);
    }

    public static <T> ApiResponse<T> failure(String code, String message) {
        return new ApiResponse<>(false, null, new ApiError(code, message, null));
    }

    public static <T> ApiResponse<T> failure(String code, String message, Map<String, String> details) {
        return new ApiResponse<>(false, null, new ApiError(code, message, details));
    }

    @Value
    @JsonInclude(JsonInclude.Include.NON_NULL)
    public static class ApiError {
        String code;
        String message;
        Map<String, String> details;
    }
}
