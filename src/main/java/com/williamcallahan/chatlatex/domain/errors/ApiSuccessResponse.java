package com.williamcallahan.chatlatex.domain.errors;

import java.util.Objects;

/**
 * Success body for operations that return no payload of their own, such as clearing a cache.
 *
 * @param status always "success"
 * @param message what was done
 */
public record ApiSuccessResponse(String status, String message) implements ApiResponse {
    private static final String STATUS_SUCCESS = "success";

    public ApiSuccessResponse {
        Objects.requireNonNull(status, "Status is required");
        Objects.requireNonNull(message, "Success message is required");
    }

    public static ApiSuccessResponse success(String message) {
        return new ApiSuccessResponse(STATUS_SUCCESS, message);
    }
}
