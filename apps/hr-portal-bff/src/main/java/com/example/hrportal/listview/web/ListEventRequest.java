package com.example.hrportal.listview.web;

import com.example.hrportal.listview.FilterKey;
import com.example.hrportal.listview.FilterSelection;
import com.example.hrportal.listview.ListEvent;
import com.example.hrportal.listview.PageSize;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;
import org.springframework.lang.NonNull;
import org.springframework.lang.Nullable;

import java.util.function.IntFunction;

/**
 * User input sent by the browser for an open list view.
 *
 * <pre>{@code
 * {"type": "SEARCH", "value": "engineer"}
 * {"type": "FILTER", "key": "department_id", "value": "3"}
 * {"type": "FILTER", "key": "status", "value": "all"}
 * {"type": "PAGE", "value": "2"}
 * {"type": "PAGE_SIZE", "value": "25"}
 * {"type": "REFRESH"}
 * }</pre>
 */
public record ListEventRequest(
        @NotNull(message = "Event type is required") EventType type,
        @Nullable @Size(max = 64) String key,
        @Nullable @Size(max = 200) String value
) {
    public enum EventType {
        SEARCH,
        FILTER,
        PAGE,
        PAGE_SIZE,
        REFRESH
    }

    /**
     * @param pageSizeResolver validates a requested page size
     * @throws IllegalArgumentException when the request is incomplete or malformed
     */
    @NonNull
    public ListEvent toEvent(@NonNull IntFunction<PageSize> pageSizeResolver) {
        return switch (type) {
            case SEARCH -> new ListEvent.SearchChanged(value == null ? "" : value);
            case FILTER -> {
                if (key == null || key.isBlank()) {
                    throw new IllegalArgumentException("Filter events need a key");
                }
                yield new ListEvent.FilterChanged(FilterKey.fromName(key.trim()), FilterSelection.fromWidget(value));
            }
            case PAGE -> new ListEvent.PageChanged(parseInt("page"));
            case PAGE_SIZE -> new ListEvent.PageSizeChanged(pageSizeResolver.apply(parseInt("page size")));
            case REFRESH -> new ListEvent.Refreshed();
        };
    }

    private int parseInt(String what) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("Missing " + what);
        }
        try {
            return Integer.parseInt(value.trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Invalid " + what + ": " + value, e);
        }
    }
}
