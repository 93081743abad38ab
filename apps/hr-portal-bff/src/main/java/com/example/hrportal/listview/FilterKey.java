package com.example.hrportal.listview;

import org.springframework.lang.NonNull;

import java.util.Arrays;

/**
 * Categorical filters recognised by the HR list endpoints, with the query
 * parameter each one is sent as.
 */
public enum FilterKey {

    DEPARTMENT_ID("department_id"),
    LOCATION("location"),
    EMPLOYMENT_TYPE("employment_type"),
    IS_ACTIVE("is_active"),
    JOB_ID("job_id"),
    STATUS("status"),
    SOURCE("source"),
    TEAM_ID("team_id"),
    ROLE("role");

    private final String queryParam;

    FilterKey(String queryParam) {
        this.queryParam = queryParam;
    }

    @NonNull
    public String queryParam() {
        return queryParam;
    }

    /**
     * Resolves a key from either its enum name or its query parameter name.
     *
     * @throws IllegalArgumentException if nothing matches
     */
    @NonNull
    public static FilterKey fromName(@NonNull String name) {
        return Arrays.stream(values())
                .filter(key -> key.name().equalsIgnoreCase(name) || key.queryParam.equalsIgnoreCase(name))
                .findFirst()
                .orElseThrow(() -> new IllegalArgumentException("Unknown filter key: " + name));
    }
}
