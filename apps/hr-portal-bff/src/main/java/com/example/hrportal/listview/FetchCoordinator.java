package com.example.hrportal.listview;

import com.example.hrportal.common.util.StringSanitizer;
import com.example.hrportal.observability.metrics.ListViewMetrics;
import lombok.extern.slf4j.Slf4j;
import org.springframework.lang.NonNull;
import org.springframework.lang.Nullable;
import reactor.core.Disposable;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.core.publisher.Sinks;

import java.time.Duration;

/**
 * Owns one list view's state and keeps it in step with its data source.
 *
 * <p>Events are reduced one at a time under this object's lock. Whenever a
 * transition issues a new request sequence, the matching query is sent and
 * the previous in-flight fetch is cancelled. Results come back as
 * {@link ListEvent.FetchSucceeded} or {@link ListEvent.FetchFailed} tagged
 * with the sequence they were issued under; anything older than the latest
 * sequence is dropped. After {@link #close()} every result is ignored
 * silently.</p>
 *
 * @param <T> row type of the list
 */
@Slf4j
public class FetchCoordinator<T> {

    private final ListViewType view;
    private final ListDataSource<T> dataSource;
    private final int unboundedPageSize;
    private final ListViewMetrics metrics;

    private final Sinks.Many<ListState<T>> states = Sinks.many().replay().latest();
    private final Sinks.Many<ListNotification> notifications = Sinks.many().multicast().directBestEffort();

    private ListState<T> state;
    @Nullable
    private Disposable inFlight;
    private boolean closed;

    public FetchCoordinator(
            @NonNull FilterState initialFilters,
            @NonNull ListDataSource<T> dataSource,
            int unboundedPageSize,
            @NonNull ListViewMetrics metrics) {
        if (unboundedPageSize < 1) {
            throw new IllegalArgumentException("Unbounded page size must be positive: " + unboundedPageSize);
        }
        this.view = initialFilters.view();
        this.dataSource = dataSource;
        this.unboundedPageSize = unboundedPageSize;
        this.metrics = metrics;
        this.state = ListState.initial(initialFilters);
        this.states.tryEmitNext(state);
    }

    @NonNull
    public ListViewType view() {
        return view;
    }

    /**
     * Applies an event and, if it calls for one, starts a fetch.
     *
     * @return the state after the event (and after any fetch that completed synchronously)
     * @throws IllegalArgumentException if the event names a filter this view does not have
     */
    @NonNull
    public synchronized ListState<T> dispatch(@NonNull ListEvent event) {
        if (closed) {
            log.debug("Ignoring {} for closed {} list", event.getClass().getSimpleName(), view.noun());
            return state;
        }

        ListState<T> previous = state;
        ListState<T> next = ListStateReducer.reduce(previous, event);
        if (next == previous) {
            return state;
        }

        state = next;
        states.tryEmitNext(next);

        if (event instanceof ListEvent.FetchFailed && next.lastError() != null) {
            notifications.tryEmitNext(ListNotification.error(next.lastError()));
        }
        if (next.requestSequence() != previous.requestSequence()) {
            issue(next);
        }
        return state;
    }

    @NonNull
    public synchronized ListState<T> current() {
        return state;
    }

    /**
     * Snapshots of every state change, starting with the current one.
     */
    @NonNull
    public Flux<ListState<T>> states() {
        return states.asFlux();
    }

    @NonNull
    public Flux<ListNotification> notifications() {
        return notifications.asFlux();
    }

    public synchronized boolean isClosed() {
        return closed;
    }

    /**
     * Unmounts the view: cancels the in-flight fetch and completes both streams.
     * Idempotent.
     */
    public synchronized void close() {
        if (closed) {
            return;
        }
        closed = true;
        if (inFlight != null) {
            inFlight.dispose();
            inFlight = null;
        }
        states.tryEmitComplete();
        notifications.tryEmitComplete();
        log.debug("Closed {} list at request sequence {}", view.noun(), state.requestSequence());
    }

    private void issue(ListState<T> issued) {
        if (inFlight != null) {
            inFlight.dispose();
        }

        long sequence = issued.requestSequence();
        ListQuery query = ListQuery.from(issued.filters(), unboundedPageSize);
        long startedAt = System.nanoTime();

        log.debug("Fetching {} seq={} page={} pageSize={} search='{}' filters={}",
                view.noun(), sequence, query.page(), query.pageSize(),
                StringSanitizer.forLog(query.search()), query.filters());

        Disposable subscription = Mono.defer(() -> dataSource.fetch(query))
                .subscribe(
                        result -> onOutcome(sequence, startedAt, ListViewMetrics.OUTCOME_SUCCESS,
                                new ListEvent.FetchSucceeded(sequence, result)),
                        error -> onFailure(sequence, startedAt, error));

        // A synchronous source may already have moved the state on to a newer request.
        if (state.requestSequence() == sequence) {
            inFlight = subscription;
        }
    }

    private synchronized void onFailure(long sequence, long startedAt, Throwable error) {
        if (!closed && sequence == state.requestSequence()) {
            log.warn("Failed to fetch {} seq={}: {}", view.noun(), sequence, error.toString());
        }
        String message = ErrorMessages.userMessage(error, ErrorMessages.loadFailed(view));
        onOutcome(sequence, startedAt, ListViewMetrics.OUTCOME_FAILURE, new ListEvent.FetchFailed(sequence, message));
    }

    private synchronized void onOutcome(long sequence, long startedAt, String outcome, ListEvent event) {
        if (closed) {
            return;
        }
        Duration elapsed = Duration.ofNanos(System.nanoTime() - startedAt);
        if (sequence != state.requestSequence()) {
            metrics.recordFetch(view, ListViewMetrics.OUTCOME_STALE, elapsed);
            log.debug("Discarding stale {} response seq={} (latest={})", view.noun(), sequence, state.requestSequence());
            return;
        }
        metrics.recordFetch(view, outcome, elapsed);
        dispatch(event);
    }
}
