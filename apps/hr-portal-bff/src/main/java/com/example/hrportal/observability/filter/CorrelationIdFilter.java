package com.example.hrportal.observability.filter;

import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.core.Ordered;
import org.springframework.core.annotation.Order;
import org.springframework.http.server.reactive.ServerHttpRequest;
import org.springframework.stereotype.Component;
import org.springframework.web.server.ServerWebExchange;
import org.springframework.web.server.WebFilter;
import org.springframework.web.server.WebFilterChain;
import reactor.core.publisher.Mono;
import reactor.util.context.Context;

import java.util.UUID;

/**
 * Gives every request a correlation ID: taken from {@code X-Correlation-Id}
 * or {@code X-Request-Id} when the caller sent one, generated otherwise.
 * The ID is echoed in the response, stored as an exchange attribute, put in
 * the Reactor context and in the MDC for log lines.
 */
@Slf4j
@Component
@Order(Ordered.HIGHEST_PRECEDENCE)
public class CorrelationIdFilter implements WebFilter {

    public static final String CORRELATION_ID_HEADER = "X-Correlation-Id";
    public static final String REQUEST_ID_HEADER = "X-Request-Id";
    public static final String CORRELATION_ID_KEY = "correlationId";

    private static final int MAX_ID_LENGTH = 128;

    @Override
    public Mono<Void> filter(ServerWebExchange exchange, WebFilterChain chain) {
        String correlationId = extractOrGenerateCorrelationId(exchange.getRequest());
        String requestPath = exchange.getRequest().getPath().value();
        String requestMethod = exchange.getRequest().getMethod().name();

        exchange.getResponse().getHeaders().add(CORRELATION_ID_HEADER, correlationId);
        exchange.getAttributes().put(CORRELATION_ID_KEY, correlationId);

        return chain.filter(exchange)
                .contextWrite(Context.of(CORRELATION_ID_KEY, correlationId))
                .doFirst(() -> {
                    MDC.put(CORRELATION_ID_KEY, correlationId);
                    log.debug("Request started: {} {}", requestMethod, requestPath);
                })
                .doFinally(signalType -> {
                    log.debug("Request completed: {} {} - {}", requestMethod, requestPath, signalType);
                    MDC.remove(CORRELATION_ID_KEY);
                });
    }

    private String extractOrGenerateCorrelationId(ServerHttpRequest request) {
        String correlationId = request.getHeaders().getFirst(CORRELATION_ID_HEADER);
        if (correlationId != null && !correlationId.isBlank()) {
            return truncate(correlationId.trim());
        }

        String requestId = request.getHeaders().getFirst(REQUEST_ID_HEADER);
        if (requestId != null && !requestId.isBlank()) {
            return truncate(requestId.trim());
        }

        return UUID.randomUUID().toString();
    }

    private String truncate(String id) {
        return id.length() > MAX_ID_LENGTH ? id.substring(0, MAX_ID_LENGTH) : id;
    }

    /**
     * Correlation ID of the current request, or {@code "unknown"} outside one.
     */
    public static String fromExchange(ServerWebExchange exchange) {
        Object id = exchange.getAttribute(CORRELATION_ID_KEY);
        return id != null ? id.toString() : "unknown";
    }
}
