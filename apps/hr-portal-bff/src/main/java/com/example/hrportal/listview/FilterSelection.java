package com.example.hrportal.listview;

import org.springframework.lang.NonNull;
import org.springframework.lang.Nullable;

/**
 * Value chosen for a single categorical filter, or explicitly nothing.
 *
 * <p>Select widgets cannot express "no selection", so they send an empty
 * string or {@code "all"}. {@link #fromWidget(String)} folds those into
 * {@link #unset()} at the boundary.</p>
 */
public record FilterSelection(@Nullable String value) {

    public static final String ALL_SENTINEL = "all";

    private static final FilterSelection UNSET = new FilterSelection(null);

    public FilterSelection {
        if (value != null && value.isBlank()) {
            throw new IllegalArgumentException("Filter value must not be blank; use FilterSelection.unset()");
        }
    }

    @NonNull
    public static FilterSelection unset() {
        return UNSET;
    }

    @NonNull
    public static FilterSelection of(@NonNull String value) {
        return new FilterSelection(value.trim());
    }

    @NonNull
    public static FilterSelection fromWidget(@Nullable String raw) {
        if (raw == null || raw.isBlank() || ALL_SENTINEL.equalsIgnoreCase(raw.trim())) {
            return UNSET;
        }
        return of(raw);
    }

    public boolean isSet() {
        return value != null;
    }
}
