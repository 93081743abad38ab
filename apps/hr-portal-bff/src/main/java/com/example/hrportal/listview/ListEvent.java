package com.example.hrportal.listview;

import org.springframework.lang.NonNull;

/**
 * Everything that can move a list view from one state to the next. User
 * input and fetch outcomes go through the same reducer.
 */
public sealed interface ListEvent {

    /** The view was opened. */
    record Mounted() implements ListEvent {
    }

    record SearchChanged(@NonNull String search) implements ListEvent {
    }

    record FilterChanged(@NonNull FilterKey key, @NonNull FilterSelection selection) implements ListEvent {
    }

    record PageChanged(int page) implements ListEvent {
    }

    record PageSizeChanged(@NonNull PageSize pageSize) implements ListEvent {
    }

    /** Re-issue the current query, e.g. after a failed fetch or an edit. */
    record Refreshed() implements ListEvent {
    }

    record FetchSucceeded(long sequence, @NonNull PagedResult<?> result) implements ListEvent {
    }

    record FetchFailed(long sequence, @NonNull String message) implements ListEvent {
    }
}
