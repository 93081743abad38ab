package com.example.hrportal.listview;

import com.fasterxml.jackson.annotation.JsonValue;
import org.springframework.lang.NonNull;

/**
 * Rows per page. Zero is the "unbounded" variant some screens use to mean
 * "show everything".
 */
public record PageSize(int rows) {

    public static final PageSize UNBOUNDED = new PageSize(0);

    public PageSize {
        if (rows < 0) {
            throw new IllegalArgumentException("Page size must not be negative: " + rows);
        }
    }

    @NonNull
    public static PageSize of(int rows) {
        return rows == 0 ? UNBOUNDED : new PageSize(rows);
    }

    public boolean isUnbounded() {
        return rows == 0;
    }

    /**
     * Total pages for {@code total} matching rows.
     */
    public int pagesFor(long total) {
        if (isUnbounded()) {
            return 1;
        }
        return (int) ((total + rows - 1) / rows);
    }

    @JsonValue
    public int rows() {
        return rows;
    }
}
