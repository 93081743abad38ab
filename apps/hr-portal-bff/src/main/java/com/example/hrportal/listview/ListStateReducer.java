package com.example.hrportal.listview;

import org.springframework.lang.NonNull;

/**
 * Pure transition function for a list view.
 *
 * <p>Changing search, a categorical filter or the page size resets the page
 * to 1 and issues a new request. Changing only the page keeps every other
 * input, and clicking the page whose fetch just failed retries it. Every
 * issued request gets the next sequence number, and fetch outcomes carrying
 * an older sequence are dropped, so the latest request always wins
 * regardless of response order.</p>
 *
 * <p>Returns the same instance when an event changes nothing, which callers
 * use to skip redundant fetches.</p>
 */
public final class ListStateReducer {

    private ListStateReducer() {}

    @NonNull
    public static <T> ListState<T> reduce(@NonNull ListState<T> state, @NonNull ListEvent event) {
        FilterState filters = state.filters();

        if (event instanceof ListEvent.Mounted) {
            return issue(state, filters.withPage(1));
        }
        if (event instanceof ListEvent.SearchChanged changed) {
            String search = changed.search().trim();
            if (filters.search().equals(search)) {
                return state;
            }
            return issue(state, filters.withSearch(search).withPage(1));
        }
        if (event instanceof ListEvent.FilterChanged changed) {
            if (filters.selection(changed.key()).equals(changed.selection())
                    && filters.view().accepts(changed.key())) {
                return state;
            }
            return issue(state, filters.withFilter(changed.key(), changed.selection()).withPage(1));
        }
        if (event instanceof ListEvent.PageSizeChanged changed) {
            if (filters.pageSize().equals(changed.pageSize())) {
                return state;
            }
            return issue(state, filters.withPageSize(changed.pageSize()).withPage(1));
        }
        if (event instanceof ListEvent.PageChanged changed) {
            return changePage(state, changed.page());
        }
        if (event instanceof ListEvent.Refreshed) {
            return issue(state, filters);
        }
        if (event instanceof ListEvent.FetchSucceeded succeeded) {
            return applyResult(state, succeeded);
        }
        if (event instanceof ListEvent.FetchFailed failed) {
            if (failed.sequence() != state.requestSequence()) {
                return state;
            }
            return new ListState<>(filters, state.viewModel(), state.requestSequence(),
                    LoadStatus.FAILED, failed.message());
        }
        throw new IllegalArgumentException("Unsupported list event: " + event);
    }

    private static <T> ListState<T> changePage(ListState<T> state, int page) {
        FilterState filters = state.filters();
        if (page < 1 || page > state.viewModel().totalPages()) {
            return state;
        }
        // Rows on screen still belong to viewModel().page() after a failure.
        boolean retry = state.status() == LoadStatus.FAILED && page != state.viewModel().page();
        if (page == filters.page() && !retry) {
            return state;
        }
        return issue(state, filters.withPage(page));
    }

    @SuppressWarnings("unchecked")
    private static <T> ListState<T> applyResult(ListState<T> state, ListEvent.FetchSucceeded succeeded) {
        if (succeeded.sequence() != state.requestSequence()) {
            return state;
        }
        FilterState filters = state.filters();
        ListViewModel<T> model = ListViewModel.of((PagedResult<T>) succeeded.result(), filters);

        // Rows vanished under us: go back to the first page instead of showing a dangling one.
        if (filters.page() > Math.max(1, model.totalPages())) {
            return issue(state, filters.withPage(1));
        }
        return new ListState<>(filters, model, state.requestSequence(), LoadStatus.READY, null);
    }

    private static <T> ListState<T> issue(ListState<T> state, FilterState filters) {
        return new ListState<>(filters, state.viewModel(), state.requestSequence() + 1,
                LoadStatus.LOADING, state.lastError());
    }
}
