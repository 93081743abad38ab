package com.example.hrportal.common.exception;

import com.example.hrportal.common.dto.ErrorResponse;
import com.example.hrportal.common.util.StringSanitizer;
import com.example.hrportal.observability.filter.CorrelationIdFilter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.lang.NonNull;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.bind.support.WebExchangeBindException;
import org.springframework.web.server.ServerWebExchange;
import org.springframework.web.server.ServerWebInputException;

import java.util.List;
import java.util.Map;

/**
 * Maps exceptions from the REST controllers to {@link ErrorResponse} bodies.
 * Messages from exceptions are logged, never echoed back verbatim except for
 * bean-validation field messages.
 */
@RestControllerAdvice
public class GlobalExceptionHandler {

    private static final Logger LOG = LoggerFactory.getLogger(GlobalExceptionHandler.class);

    private static final int MAX_LOG_MESSAGE_LENGTH = 200;

    @ExceptionHandler(ListViewSessionNotFoundException.class)
    @NonNull
    public ResponseEntity<ErrorResponse> handleSessionNotFound(
            @NonNull ListViewSessionNotFoundException ex, @NonNull ServerWebExchange exchange) {
        LOG.debug("Unknown list view session: {}", StringSanitizer.forLog(ex.getSessionId()));
        return respond(HttpStatus.NOT_FOUND, ErrorResponse.Categories.NOT_FOUND,
                ErrorResponse.Codes.LIST_VIEW_SESSION_NOT_FOUND, "List view session not found", exchange);
    }

    @ExceptionHandler(WebExchangeBindException.class)
    @NonNull
    public ResponseEntity<ErrorResponse> handleValidationErrors(
            @NonNull WebExchangeBindException ex, @NonNull ServerWebExchange exchange) {
        LOG.warn("Validation error: {} field errors", ex.getBindingResult().getFieldErrorCount());

        List<Map<String, String>> fieldErrors = ex.getBindingResult().getFieldErrors().stream()
                .map(error -> Map.of(
                        "field", error.getField(),
                        "message", error.getDefaultMessage() != null ? error.getDefaultMessage() : "Invalid value"))
                .toList();

        ErrorResponse body = ErrorResponse.of(
                        ErrorResponse.Categories.VALIDATION_ERROR,
                        ErrorResponse.Codes.INVALID_REQUEST,
                        "Request validation failed",
                        CorrelationIdFilter.fromExchange(exchange),
                        exchange.getRequest().getPath().value())
                .withDetails(Map.of("fields", fieldErrors));
        return ResponseEntity.status(HttpStatus.BAD_REQUEST).body(body);
    }

    @ExceptionHandler(ServerWebInputException.class)
    @NonNull
    public ResponseEntity<ErrorResponse> handleInputException(
            @NonNull ServerWebInputException ex, @NonNull ServerWebExchange exchange) {
        LOG.warn("Input error: {}", sanitizeForLog(ex.getReason()));
        return respond(HttpStatus.BAD_REQUEST, ErrorResponse.Categories.VALIDATION_ERROR,
                ErrorResponse.Codes.INVALID_REQUEST, "Invalid request format", exchange);
    }

    @ExceptionHandler(IllegalArgumentException.class)
    @NonNull
    public ResponseEntity<ErrorResponse> handleIllegalArgument(
            @NonNull IllegalArgumentException ex, @NonNull ServerWebExchange exchange) {
        LOG.warn("Illegal argument: {}", sanitizeForLog(ex.getMessage()));
        return respond(HttpStatus.BAD_REQUEST, ErrorResponse.Categories.INVALID_ARGUMENT,
                ErrorResponse.Codes.INVALID_REQUEST, "Invalid request parameter", exchange);
    }

    @ExceptionHandler(Exception.class)
    @NonNull
    public ResponseEntity<ErrorResponse> handleGeneral(@NonNull Exception ex, @NonNull ServerWebExchange exchange) {
        LOG.error("Unhandled exception: {}", sanitizeForLog(ex.getMessage()), ex);
        return respond(HttpStatus.INTERNAL_SERVER_ERROR, ErrorResponse.Categories.INTERNAL_ERROR,
                ErrorResponse.Codes.UNEXPECTED, "An unexpected error occurred", exchange);
    }

    private ResponseEntity<ErrorResponse> respond(
            HttpStatus status, String error, String code, String message, ServerWebExchange exchange) {
        ErrorResponse body = ErrorResponse.of(error, code, message,
                CorrelationIdFilter.fromExchange(exchange),
                exchange.getRequest().getPath().value());
        return ResponseEntity.status(status).body(body);
    }

    @NonNull
    private String sanitizeForLog(String value) {
        if (value == null) {
            return "null";
        }
        return StringSanitizer.forLog(value, MAX_LOG_MESSAGE_LENGTH);
    }
}
