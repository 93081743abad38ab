package com.example.hrportal.listview.session;

import com.example.hrportal.listview.FetchCoordinator;
import com.example.hrportal.listview.ListEvent;
import com.example.hrportal.listview.ListNotification;
import com.example.hrportal.listview.ListState;
import com.example.hrportal.listview.ListViewType;
import org.springframework.lang.NonNull;
import reactor.core.publisher.Flux;

import java.time.Instant;

/**
 * One open list view in one browser tab.
 */
public class ListViewSession {

    private final String id;
    private final FetchCoordinator<?> coordinator;
    private final Instant openedAt;

    public ListViewSession(@NonNull String id, @NonNull FetchCoordinator<?> coordinator, @NonNull Instant openedAt) {
        this.id = id;
        this.coordinator = coordinator;
        this.openedAt = openedAt;
    }

    @NonNull
    public String id() {
        return id;
    }

    @NonNull
    public ListViewType view() {
        return coordinator.view();
    }

    @NonNull
    public Instant openedAt() {
        return openedAt;
    }

    @NonNull
    public ListState<?> dispatch(@NonNull ListEvent event) {
        return coordinator.dispatch(event);
    }

    @NonNull
    public ListState<?> current() {
        return coordinator.current();
    }

    @NonNull
    public Flux<? extends ListState<?>> states() {
        return coordinator.states();
    }

    @NonNull
    public Flux<ListNotification> notifications() {
        return coordinator.notifications();
    }

    public boolean isClosed() {
        return coordinator.isClosed();
    }

    void close() {
        coordinator.close();
    }
}
