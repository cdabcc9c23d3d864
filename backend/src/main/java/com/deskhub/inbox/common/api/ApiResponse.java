package com.deskhub.inbox.common.api;

import java.util.Optional;

/**
 * Envelope for every endpoint: {@code {"ok":true,"data":...}} or {@code {"ok":false,"error":"code"}}.
 */
public record ApiResponse<T>(boolean ok, T data, String error) {

    public static <T> ApiResponse<T> ok(T data) {
        return new ApiResponse<>(true, data, null);
    }

    public static <T> ApiResponse<T> found(Optional<T> data, String notFoundCode) {
        return ok(data.orElseThrow(() -> new IllegalArgumentException(notFoundCode)));
    }

    public static <T> ApiResponse<T> error(String error) {
        return new ApiResponse<>(false, null, error);
    }
}
