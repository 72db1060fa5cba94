package com.williamcallahan.chatlatex.domain.errors;

import java.util.Objects;

/**
 * Error body shared by all endpoints.
 *
 * @param status always "error"
 * @param message user-facing error message
 * @param details diagnostic detail: the retained LaTeX source of a failed export, the literal
 *                expression of a failed formula, or the exception summary; may be null
 */
public record ApiErrorResponse(String status, String message, String details) implements ApiResponse {
    private static final String STATUS_ERROR = "error";

    public ApiErrorResponse {
        Objects.requireNonNull(status, "Status is required");
        Objects.requireNonNull(message, "Error message is required");
    }

    public static ApiErrorResponse error(String message) {
        return new ApiErrorResponse(STATUS_ERROR, message, null);
    }

    /**
     * Creates an error body carrying diagnostic detail.
     *
     * @param message user-facing error message
     * @param details detail the caller can act on
     * @return error body
     */
    public static ApiErrorResponse error(String message, String details) {
        return new ApiErrorResponse(STATUS_ERROR, message, details);
    }
}
