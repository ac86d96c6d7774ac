package com.health.booking.dto;

import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;

/**
 * JSON envelope of every API response.
 */
@Getter
@NoArgsConstructor
@AllArgsConstructor
public class ApiResponse<T> {

    private boolean success;
    private String message;
    private String errorCode;
    private T data;

    public static <T> ApiResponse<T> ok(T data) {
        return new ApiResponse<>(true, null, null, data);
    }

    public static <T> ApiResponse<T> ok(String message, T data) {
        return new ApiResponse<>(true, message, null, data);
    }

    public static <T> ApiResponse<T> error(BookingError error, String message) {
        return new ApiResponse<>(false, message, error.name(), null);
    }

    public static <T> ApiResponse<T> error(BookingError error, String message, T data) {
        return new ApiResponse<>(false, message, error.name(), data);
    }
}
