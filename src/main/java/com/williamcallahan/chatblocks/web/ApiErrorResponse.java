package com.williamcallahan.chatblocks.web;

import java.util.Objects;

/**
 * Represents a standardized JSON error payload returned by API endpoints.
 *
 * @param status fixed status indicator (typically "error")
 * @param message user-facing error message
 * @param details optional diagnostic details suitable for clients
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

    public static ApiErrorResponse error(String message, String details) {
        return new ApiErrorResponse(STATUS_ERROR, message, details);
    }
}
