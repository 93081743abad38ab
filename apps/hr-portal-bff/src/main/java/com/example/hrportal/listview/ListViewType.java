package com.example.hrportal.listview;

import org.springframework.lang.NonNull;

import java.util.Arrays;
import java.util.Collections;
import java.util.EnumSet;
import java.util.Set;

/**
 * Closed configuration of each paginated list the portal shows: where it is
 * fetched from, which response field holds the rows, and which filters it
 * accepts.
 */
public enum ListViewType {

    JOBS("/jobs", "jobs", "jobs",
            EnumSet.of(FilterKey.DEPARTMENT_ID, FilterKey.LOCATION, FilterKey.EMPLOYMENT_TYPE, FilterKey.IS_ACTIVE)),

    APPLICATIONS("/applications/", "applications", "applications",
            EnumSet.of(FilterKey.JOB_ID, FilterKey.STATUS, FilterKey.SOURCE)),

    EMPLOYEES("/employees", "employees", "employees",
            EnumSet.of(FilterKey.DEPARTMENT_ID, FilterKey.TEAM_ID, FilterKey.ROLE, FilterKey.IS_ACTIVE));

    private final String path;
    private final String itemsField;
    private final String noun;
    private final Set<FilterKey> filterKeys;

    ListViewType(String path, String itemsField, String noun, EnumSet<FilterKey> filterKeys) {
        this.path = path;
        this.itemsField = itemsField;
        this.noun = noun;
        this.filterKeys = Collections.unmodifiableSet(filterKeys);
    }

    @NonNull
    public String path() {
        return path;
    }

    @NonNull
    public String itemsField() {
        return itemsField;
    }

    @NonNull
    public String noun() {
        return noun;
    }

    @NonNull
    public Set<FilterKey> filterKeys() {
        return filterKeys;
    }

    public boolean accepts(@NonNull FilterKey key) {
        return filterKeys.contains(key);
    }

    /**
     * Resolves a view from a URL segment such as {@code jobs}.
     *
     * @throws IllegalArgumentException if the segment names no view
     */
    @NonNull
    public static ListViewType fromPathSegment(@NonNull String segment) {
        return Arrays.stream(values())
                .filter(type -> type.name().equalsIgnoreCase(segment) || type.noun.equalsIgnoreCase(segment))
                .findFirst()
                .orElseThrow(() -> new IllegalArgumentException("Unknown list view: " + segment));
    }
}
