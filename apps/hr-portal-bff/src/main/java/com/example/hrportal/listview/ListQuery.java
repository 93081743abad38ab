package com.example.hrportal.listview;

import org.springframework.lang.NonNull;
import org.springframework.util.LinkedMultiValueMap;
import org.springframework.util.MultiValueMap;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Request descriptor sent to a paginated list endpoint. Unset filters and
 * an empty search are omitted entirely so the server applies no constraint.
 */
public record ListQuery(
        @NonNull ListViewType view,
        @NonNull String search,
        @NonNull Map<FilterKey, String> filters,
        int page,
        int pageSize
) {
    public static final String SEARCH_PARAM = "search";
    public static final String PAGE_PARAM = "page";
    public static final String PAGE_SIZE_PARAM = "page_size";

    public ListQuery {
        filters = Collections.unmodifiableMap(new LinkedHashMap<>(filters));
    }

    /**
     * Builds the query for a filter state.
     *
     * @param unboundedPageSize finite row count sent when the state asks for
     *                          an unbounded page
     */
    @NonNull
    public static ListQuery from(@NonNull FilterState state, int unboundedPageSize) {
        Map<FilterKey, String> selected = new LinkedHashMap<>();
        state.filters().forEach((key, selection) -> {
            if (selection.isSet()) {
                selected.put(key, selection.value());
            }
        });
        int rows = state.pageSize().isUnbounded() ? unboundedPageSize : state.pageSize().rows();
        return new ListQuery(state.view(), state.search().trim(), selected, state.page(), rows);
    }

    @NonNull
    public MultiValueMap<String, String> toQueryParams() {
        MultiValueMap<String, String> params = new LinkedMultiValueMap<>();
        if (!search.isEmpty()) {
            params.add(SEARCH_PARAM, search);
        }
        filters.forEach((key, value) -> params.add(key.queryParam(), value));
        params.add(PAGE_PARAM, String.valueOf(page));
        params.add(PAGE_SIZE_PARAM, String.valueOf(pageSize));
        return params;
    }
}
