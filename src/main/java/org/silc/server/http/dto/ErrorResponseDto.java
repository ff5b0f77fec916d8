package org.silc.server.http.dto;

import java.time.Instant;

/**
 * Response DTO for error responses.
 * <p>
 * Provides a consistent error response format across all API endpoints.
 *
 * @param timestamp ISO-8601 timestamp when the error occurred
 * @param status    HTTP status code
 * @param error     HTTP status message (e.g., "Bad Request")
 * @param message   Human-readable error message
 * @param code      Machine-readable error code, e.g. {@code UNSUPPORTED_CONSTRUCT} or {@code EMPTY_SOURCE}
 */
public record ErrorResponseDto(
    String timestamp,
    int status,
    String error,
    String message,
    String code
) {
    /**
     * Creates an ErrorResponseDto with the current timestamp.
     *
     * @param status  HTTP status code
     * @param error   HTTP status message
     * @param message Human-readable error message
     * @param code    Machine-readable error code
     * @return A new ErrorResponseDto instance
     */
    public static ErrorResponseDto of(final int status, final String error, final String message, final String code) {
        return new ErrorResponseDto(
            Instant.now().toString(),
            status,
            error,
            message,
            code
        );
    }
}
