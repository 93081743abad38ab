package com.example.hrportal.client;

import com.example.hrportal.listview.ListQuery;
import com.example.hrportal.listview.ListViewType;
import com.example.hrportal.listview.PagedResult;
import com.fasterxml.jackson.databind.JavaType;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpHeaders;
import org.springframework.lang.NonNull;
import org.springframework.lang.Nullable;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientRequestException;
import reactor.core.publisher.Mono;

import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * GETs one page from a list endpoint shaped like
 * {@code {total, page, page_size, total_pages, <items>: [...]}}.
 *
 * <p>Every failure surfaces as {@link HrApiException}: transport errors,
 * non-2xx answers (with the server's message when the body has one) and
 * bodies missing {@code total} or the items array.</p>
 */
@Slf4j
public class PagedListClient<T> {

    private final WebClient webClient;
    private final ObjectMapper objectMapper;
    private final ListViewType view;
    private final JavaType itemsType;

    public PagedListClient(WebClient webClient, ObjectMapper objectMapper, ListViewType view, Class<T> itemType) {
        this.webClient = webClient;
        this.objectMapper = objectMapper;
        this.view = view;
        this.itemsType = objectMapper.getTypeFactory().constructCollectionType(List.class, itemType);
    }

    @NonNull
    public Mono<PagedResult<T>> fetchPage(@NonNull ListQuery query, @Nullable String authorization) {
        String path = view.path();

        return webClient.get()
                .uri(builder -> {
                    Map<String, Object> variables = new HashMap<>();
                    builder.path(path);
                    query.toQueryParams().forEach((name, values) -> {
                        builder.queryParam(name, "{" + name + "}");
                        variables.put(name, values.get(0));
                    });
                    return builder.build(variables);
                })
                .headers(headers -> {
                    if (authorization != null && !authorization.isBlank()) {
                        headers.set(HttpHeaders.AUTHORIZATION, authorization);
                    }
                })
                .retrieve()
                .onStatus(status -> !status.is2xxSuccessful(),
                        response -> response.bodyToMono(String.class)
                                .defaultIfEmpty("")
                                .flatMap(body -> Mono.error(new HrApiException(
                                        path,
                                        response.statusCode(),
                                        "HR API error listing " + view.noun(),
                                        body,
                                        ErrorPayloads.extractMessage(objectMapper, body)))))
                .bodyToMono(JsonNode.class)
                .switchIfEmpty(Mono.error(() -> new HrApiException(path, "Empty response listing " + view.noun(), null)))
                .map(body -> parse(body, query))
                .onErrorMap(WebClientRequestException.class,
                        e -> new HrApiException(path, "Could not reach HR API listing " + view.noun(), e))
                .doOnNext(result -> log.debug("Received {} of {} {} for page {}",
                        result.items().size(), result.total(), view.noun(), result.page()))
                .doOnError(e -> {
                    if (e instanceof HrApiException apiError && apiError.getStatusCode() != null) {
                        log.warn("HR API returned {} for {}", apiError.getStatusCode(), path);
                    } else {
                        log.error("Listing {} failed", view.noun(), e);
                    }
                });
    }

    private PagedResult<T> parse(JsonNode body, ListQuery query) {
        JsonNode total = body.path("total");
        JsonNode items = body.path(view.itemsField());
        if (!total.isIntegralNumber() || total.asLong() < 0 || !items.isArray()) {
            throw new HrApiException(view.path(),
                    "Malformed " + view.noun() + " response: expected 'total' and '" + view.itemsField() + "'",
                    null);
        }

        List<T> rows;
        try {
            rows = objectMapper.convertValue(items, itemsType);
        } catch (IllegalArgumentException e) {
            throw new HrApiException(view.path(), "Failed to parse " + view.noun() + " rows", e);
        }

        JsonNode totalPages = body.path("total_pages");
        return new PagedResult<>(
                total.asLong(),
                body.path("page").asInt(query.page()),
                body.path("page_size").asInt(query.pageSize()),
                totalPages.isIntegralNumber() ? totalPages.asInt() : null,
                rows);
    }
}
