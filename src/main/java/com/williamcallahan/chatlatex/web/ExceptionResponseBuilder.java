package com.williamcallahan.chatlatex.web;

import com.williamcallahan.chatlatex.domain.errors.ApiErrorResponse;
import com.williamcallahan.chatlatex.domain.errors.ApiResponse;
import com.williamcallahan.chatlatex.domain.errors.ApiSuccessResponse;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.stereotype.Component;

/**
 * Builds the uniform {@code {status, message, details}} bodies used by every controller.
 */
@Component
public class ExceptionResponseBuilder {

    /**
     * Builds an error response with status and message.
     *
     * @param status The HTTP status code
     * @param message The error message
     * @return ResponseEntity with error details
     */
    public ResponseEntity<ApiResponse> buildErrorResponse(HttpStatus status, String message) {
        return ResponseEntity.status(status).body(ApiErrorResponse.error(message));
    }

    /**
     * Builds an error response carrying diagnostic detail, such as a retained source path.
     *
     * @param status The HTTP status code
     * @param message The error message
     * @param details detail the client can show or act on
     * @return ResponseEntity with error details
     */
    public ResponseEntity<ApiResponse> buildErrorResponse(HttpStatus status, String message, String details) {
        return ResponseEntity.status(status).body(ApiErrorResponse.error(message, details));
    }

    /**
     * Builds an error response describing the exception that caused it.
     *
     * @param status The HTTP status code
     * @param message The error message
     * @param exception The exception that occurred
     * @return ResponseEntity with error details
     */
    public ResponseEntity<ApiResponse> buildErrorResponse(HttpStatus status, String message, Exception exception) {
        return buildErrorResponse(status, message, describeException(exception));
    }

    /**
     * Builds a success response with a simple message.
     *
     * @param message The success message
     * @return ResponseEntity with success details
     */
    public ResponseEntity<ApiResponse> buildSuccessResponse(String message) {
        return ResponseEntity.ok(ApiSuccessResponse.success(message));
    }

    /**
     * Describes an exception and its root cause in one line.
     *
     * @param exception exception to describe
     * @return description, or null when no exception is given
     */
    public String describeException(Exception exception) {
        if (exception == null) {
            return null;
        }
        StringBuilder description = new StringBuilder(exception.getClass().getSimpleName());
        if (exception.getMessage() != null && !exception.getMessage().isBlank()) {
            description.append(": ").append(exception.getMessage());
        }
        Throwable rootCause = exception;
        while (rootCause.getCause() != null && rootCause.getCause() != rootCause) {
            rootCause = rootCause.getCause();
        }
        if (rootCause != exception) {
            description.append(" (cause=").append(rootCause.getClass().getSimpleName());
            if (rootCause.getMessage() != null) {
                description.append(": ").append(rootCause.getMessage());
            }
            description.append(')');
        }
        return description.toString();
    }
}
