package com.example.hrportal.listview.web;

import com.example.hrportal.listview.FilterState;
import com.example.hrportal.listview.ListState;
import com.example.hrportal.listview.ListViewModel;
import com.example.hrportal.listview.LoadStatus;
import com.fasterxml.jackson.annotation.JsonInclude;
import org.springframework.lang.NonNull;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * What the browser renders for a list view: the inputs as they stand, the
 * rows of the last successful fetch, and the pagination footer.
 *
 * <p>{@code filters} lists every filter the view has; unset ones map to null.
 * {@code page} is the page being requested, {@code shownPage} the page the
 * rows belong to; they differ while a fetch is loading.</p>
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ListViewSnapshot(
        String sessionId,
        String view,
        LoadStatus status,
        String error,
        String search,
        Map<String, String> filters,
        int page,
        int pageSize,
        int shownPage,
        long total,
        int totalPages,
        long firstRow,
        long lastRow,
        List<Integer> pageLinks,
        String summary,
        List<?> items
) {
    @NonNull
    public static ListViewSnapshot of(@NonNull String sessionId, @NonNull ListState<?> state) {
        FilterState filters = state.filters();
        ListViewModel<?> model = state.viewModel();

        Map<String, String> selected = new LinkedHashMap<>();
        filters.filters().forEach((key, selection) -> selected.put(key.queryParam(), selection.value()));

        return new ListViewSnapshot(
                sessionId,
                state.view().noun(),
                state.status(),
                state.lastError(),
                filters.search(),
                selected,
                filters.page(),
                filters.pageSize().rows(),
                model.page(),
                model.total(),
                model.totalPages(),
                model.firstRow(),
                model.lastRow(),
                model.pageLinks(),
                model.summary(state.view().noun()),
                model.items());
    }
}
