package com.example.hrportal.listview;

import org.springframework.lang.NonNull;
import org.springframework.lang.Nullable;

/**
 * Filter inputs plus the last good view model, and the sequence number of
 * the latest request issued for them.
 */
public record ListState<T>(
        @NonNull FilterState filters,
        @NonNull ListViewModel<T> viewModel,
        long requestSequence,
        @NonNull LoadStatus status,
        @Nullable String lastError
) {
    @NonNull
    public static <T> ListState<T> initial(@NonNull FilterState filters) {
        return new ListState<>(filters, ListViewModel.empty(filters), 0, LoadStatus.IDLE, null);
    }

    @NonNull
    public ListViewType view() {
        return filters.view();
    }

    public boolean isLoading() {
        return status == LoadStatus.LOADING;
    }
}
