package com.example.hrportal.listview;

import org.springframework.lang.NonNull;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;

/**
 * User-controlled inputs of one list view: free-text search, categorical
 * filters, current page and page size.
 *
 * <p>Immutable. Each setter returns a new state and touches only its own
 * field; resetting the page on filter changes is the reducer's job. The
 * search text is stored trimmed, the form it is sent in.</p>
 */
public record FilterState(
        @NonNull ListViewType view,
        @NonNull String search,
        @NonNull Map<FilterKey, FilterSelection> filters,
        int page,
        @NonNull PageSize pageSize
) {
    public FilterState {
        if (page < 1) {
            throw new IllegalArgumentException("Page must be 1 or greater: " + page);
        }
        search = search == null ? "" : search.trim();
        EnumMap<FilterKey, FilterSelection> copy = new EnumMap<>(FilterKey.class);
        if (filters != null) {
            filters.forEach((key, selection) -> {
                if (!view.accepts(key)) {
                    throw new IllegalArgumentException(
                            "Filter " + key.queryParam() + " is not supported by " + view.noun());
                }
                copy.put(key, selection == null ? FilterSelection.unset() : selection);
            });
        }
        for (FilterKey key : view.filterKeys()) {
            copy.putIfAbsent(key, FilterSelection.unset());
        }
        filters = Collections.unmodifiableMap(copy);
    }

    @NonNull
    public static FilterState initial(@NonNull ListViewType view, @NonNull PageSize pageSize) {
        return new FilterState(view, "", Map.of(), 1, pageSize);
    }

    @NonNull
    public FilterSelection selection(@NonNull FilterKey key) {
        return filters.getOrDefault(key, FilterSelection.unset());
    }

    @NonNull
    public FilterState withSearch(@NonNull String newSearch) {
        return new FilterState(view, newSearch, filters, page, pageSize);
    }

    @NonNull
    public FilterState withFilter(@NonNull FilterKey key, @NonNull FilterSelection selection) {
        if (!view.accepts(key)) {
            throw new IllegalArgumentException("Filter " + key.queryParam() + " is not supported by " + view.noun());
        }
        EnumMap<FilterKey, FilterSelection> updated = new EnumMap<>(filters);
        updated.put(key, selection);
        return new FilterState(view, search, updated, page, pageSize);
    }

    @NonNull
    public FilterState withPage(int newPage) {
        return new FilterState(view, search, filters, newPage, pageSize);
    }

    @NonNull
    public FilterState withPageSize(@NonNull PageSize newPageSize) {
        return new FilterState(view, search, filters, page, newPageSize);
    }
}
