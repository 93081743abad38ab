package com.example.hrportal.observability.metrics;

import com.example.hrportal.listview.ListViewType;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Tags;
import io.micrometer.core.instrument.Timer;
import org.springframework.lang.NonNull;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.concurrent.TimeUnit;

/**
 * Metrics for list-view fetches and sessions. Tags are limited to the view
 * name and a fixed outcome set.
 */
@Component
public class ListViewMetrics {

    public static final String OUTCOME_SUCCESS = "success";
    public static final String OUTCOME_FAILURE = "failure";
    public static final String OUTCOME_STALE = "stale";

    private final MeterRegistry registry;
    private final Counter sessionOpened;
    private final Counter sessionClosed;

    public ListViewMetrics(@NonNull MeterRegistry registry) {
        this.registry = registry;

        this.sessionOpened = Counter.builder("list_view.session")
                .tag("event", "opened")
                .description("List view sessions opened")
                .register(registry);

        this.sessionClosed = Counter.builder("list_view.session")
                .tag("event", "closed")
                .description("List view sessions closed or evicted")
                .register(registry);
    }

    public void recordFetch(@NonNull ListViewType view, @NonNull String outcome, @NonNull Duration duration) {
        registry.counter("list_view.fetch", Tags.of("view", tagOf(view), "outcome", outcome))
                .increment();
        Timer.builder("list_view.fetch.duration")
                .tag("view", tagOf(view))
                .tag("outcome", outcome)
                .publishPercentiles(0.5, 0.95, 0.99)
                .register(registry)
                .record(duration.toNanos(), TimeUnit.NANOSECONDS);
    }

    public void recordSessionOpened() {
        sessionOpened.increment();
    }

    public void recordSessionClosed() {
        sessionClosed.increment();
    }

    private String tagOf(ListViewType view) {
        return view.noun();
    }
}
