package com.example.hrportal.listview;

import org.springframework.lang.NonNull;
import org.springframework.lang.Nullable;

import java.util.List;
import java.util.stream.IntStream;

/**
 * Render-ready result of the most recent successful fetch. Replaced
 * wholesale on every success and never patched.
 */
public record ListViewModel<T>(
        @NonNull List<T> items,
        long total,
        int page,
        @NonNull PageSize pageSize,
        int totalPages
) {
    public ListViewModel {
        items = List.copyOf(items);
    }

    @NonNull
    public static <T> ListViewModel<T> empty(@NonNull FilterState filters) {
        return new ListViewModel<>(List.of(), 0, filters.page(), filters.pageSize(), 0);
    }

    /**
     * Builds the model for a server page. The server's {@code total_pages} is
     * trusted when present; an unbounded page size always yields one page.
     */
    @NonNull
    public static <T> ListViewModel<T> of(@NonNull PagedResult<T> result, @NonNull FilterState filters) {
        return new ListViewModel<>(
                result.items(),
                result.total(),
                filters.page(),
                filters.pageSize(),
                resolveTotalPages(result.totalPages(), result.total(), filters.pageSize()));
    }

    static int resolveTotalPages(@Nullable Integer reported, long total, @NonNull PageSize pageSize) {
        if (pageSize.isUnbounded()) {
            return 1;
        }
        if (reported != null && reported >= 0) {
            return reported;
        }
        return pageSize.pagesFor(total);
    }

    public boolean isEmpty() {
        return items.isEmpty();
    }

    /**
     * 1-based number of the first row on this page, or 0 when nothing is shown.
     */
    public long firstRow() {
        if (items.isEmpty()) {
            return 0;
        }
        if (pageSize.isUnbounded()) {
            return 1;
        }
        return (long) (page - 1) * pageSize.rows() + 1;
    }

    public long lastRow() {
        if (items.isEmpty()) {
            return 0;
        }
        if (pageSize.isUnbounded()) {
            return Math.min(items.size(), total);
        }
        return Math.min((long) page * pageSize.rows(), total);
    }

    @NonNull
    public List<Integer> pageLinks() {
        return IntStream.rangeClosed(1, totalPages).boxed().toList();
    }

    public boolean hasPreviousPage() {
        return page > 1;
    }

    public boolean hasNextPage() {
        return page < totalPages;
    }

    @NonNull
    public String summary(@NonNull String noun) {
        return "Showing " + firstRow() + " to " + lastRow() + " of " + total + " " + noun;
    }
}
