package com.example.hrportal.listview;

import org.springframework.lang.NonNull;
import org.springframework.lang.Nullable;

import java.util.List;

/**
 * One page as returned by a list endpoint. {@code totalPages} is null when
 * the server leaves it out.
 */
public record PagedResult<T>(
        long total,
        int page,
        int pageSize,
        @Nullable Integer totalPages,
        @NonNull List<T> items
) {
    public PagedResult {
        if (total < 0) {
            throw new IllegalArgumentException("Total must not be negative: " + total);
        }
        items = items == null ? List.of() : List.copyOf(items);
    }
}
