package com.example.hrportal.common.dto;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.time.Instant;
import java.util.Map;

/**
 * Error body returned by every endpoint.
 *
 * <pre>{@code
 * {
 *   "error": "not_found",
 *   "code": "LIST_VIEW_SESSION_NOT_FOUND",
 *   "message": "List view session not found",
 *   "correlationId": "550e8400-e29b-41d4-a716-446655440000",
 *   "timestamp": "2024-12-19T10:30:00.000Z",
 *   "path": "/api/1.0.0/list-views/sessions/..."
 * }
 * }</pre>
 *
 * @param error         stable error category
 * @param code          specific error code
 * @param message       human-readable message for UI display
 * @param correlationId request correlation ID
 * @param timestamp     when the error occurred
 * @param path          request path that triggered the error
 * @param details       extra context such as field errors
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ErrorResponse(
        String error,
        String code,
        String message,
        String correlationId,
        Instant timestamp,
        String path,
        Map<String, Object> details
) {
    public static ErrorResponse of(String error, String code, String message, String correlationId, String path) {
        return new ErrorResponse(error, code, message, correlationId, Instant.now(), path, null);
    }

    public ErrorResponse withDetails(Map<String, Object> newDetails) {
        return new ErrorResponse(error, code, message, correlationId, timestamp, path, newDetails);
    }

    public static final class Categories {
        public static final String NOT_FOUND = "not_found";
        public static final String VALIDATION_ERROR = "validation_error";
        public static final String INVALID_ARGUMENT = "invalid_argument";
        public static final String INTERNAL_ERROR = "internal_error";

        private Categories() {
        }
    }

    public static final class Codes {
        public static final String LIST_VIEW_SESSION_NOT_FOUND = "LIST_VIEW_SESSION_NOT_FOUND";
        public static final String INVALID_REQUEST = "INVALID_REQUEST";
        public static final String UNEXPECTED = "UNEXPECTED";

        private Codes() {
        }
    }
}
