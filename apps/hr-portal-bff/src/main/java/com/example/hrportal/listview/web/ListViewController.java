package com.example.hrportal.listview.web;

import com.example.hrportal.common.util.StringSanitizer;
import com.example.hrportal.listview.ListEvent;
import com.example.hrportal.listview.ListState;
import com.example.hrportal.listview.ListViewType;
import com.example.hrportal.listview.session.ListViewSession;
import com.example.hrportal.listview.session.ListViewSessionRegistry;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.http.codec.ServerSentEvent;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.*;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.net.URI;
import java.util.Locale;

/**
 * List views driven from the browser: open one, push user input, read or
 * stream the result, close it when the page unmounts.
 */
@Slf4j
@RestController
@RequestMapping("/api/1.0.0/list-views")
@Validated
@RequiredArgsConstructor
public class ListViewController {

    static final String STATE_EVENT = "state";
    static final String NOTIFICATION_EVENT = "notification";

    private final ListViewSessionRegistry registry;

    @PostMapping("/{view}")
    public Mono<ResponseEntity<ListViewSnapshot>> open(
            @PathVariable("view") String view,
            @RequestParam(value = "pageSize", required = false) Integer pageSize,
            @RequestHeader(value = HttpHeaders.AUTHORIZATION, required = false) String authorization) {

        return Mono.fromSupplier(() -> {
            ListViewType type = ListViewType.fromPathSegment(view);
            ListViewSession session = registry.open(type, pageSize, authorization);
            log.debug("Opened {} session {}", type.noun(), session.id());
            return ResponseEntity
                    .created(URI.create("/api/1.0.0/list-views/sessions/" + session.id()))
                    .body(ListViewSnapshot.of(session.id(), session.current()));
        });
    }

    @PostMapping("/sessions/{sessionId}/events")
    public Mono<ListViewSnapshot> applyEvent(
            @PathVariable("sessionId") String sessionId,
            @Valid @RequestBody ListEventRequest request) {

        return Mono.fromSupplier(() -> {
            ListViewSession session = registry.get(sessionId);
            ListEvent event = request.toEvent(registry::resolvePageSize);
            log.debug("Session {} event {}", StringSanitizer.forLog(sessionId), event.getClass().getSimpleName());
            return ListViewSnapshot.of(session.id(), session.dispatch(event));
        });
    }

    @GetMapping("/sessions/{sessionId}")
    public Mono<ListViewSnapshot> snapshot(@PathVariable("sessionId") String sessionId) {
        return Mono.fromSupplier(() -> {
            ListViewSession session = registry.get(sessionId);
            return ListViewSnapshot.of(session.id(), session.current());
        });
    }

    /**
     * Server-sent events: {@code state} for every state change (the current
     * one first, id from {@link #stateEventId}) and {@code notification} for
     * fetch errors. Completes when the session is closed or evicted.
     */
    @GetMapping(value = "/sessions/{sessionId}/stream", produces = MediaType.TEXT_EVENT_STREAM_VALUE)
    public Flux<ServerSentEvent<Object>> stream(@PathVariable("sessionId") String sessionId) {
        return Mono.fromSupplier(() -> registry.get(sessionId))
                .flatMapMany(session -> Flux.merge(
                        // Notifications subscribe first so no failure falls between the two subscriptions.
                        session.notifications().map(notification -> ServerSentEvent.<Object>builder()
                                .event(NOTIFICATION_EVENT)
                                .data(notification)
                                .build()),
                        session.states().map(state -> ServerSentEvent.<Object>builder()
                                .event(STATE_EVENT)
                                .id(stateEventId(state))
                                .data(ListViewSnapshot.of(session.id(), state))
                                .build())));
    }

    /**
     * {@code <requestSequence>-<status>}: each request passes through LOADING
     * once and settles once, so the pair is unique within a session.
     */
    static String stateEventId(ListState<?> state) {
        return state.requestSequence() + "-" + state.status().name().toLowerCase(Locale.ROOT);
    }

    @DeleteMapping("/sessions/{sessionId}")
    public Mono<ResponseEntity<Void>> close(@PathVariable("sessionId") String sessionId) {
        return Mono.fromRunnable(() -> registry.close(sessionId))
                .thenReturn(ResponseEntity.noContent().<Void>build());
    }
}
