package com.example.hrportal.client.hr;

import org.springframework.lang.NonNull;
import org.springframework.lang.Nullable;

import java.util.Arrays;
import java.util.Optional;

public enum ApplicationStatus {

    PENDING("pending"),
    REVIEWED("reviewed"),
    SHORTLISTED("shortlisted"),
    REJECTED("rejected"),
    HIRED("hired");

    private final String code;

    ApplicationStatus(String code) {
        this.code = code;
    }

    @NonNull
    public String code() {
        return code;
    }

    @NonNull
    public static Optional<ApplicationStatus> fromCode(@Nullable String code) {
        return Arrays.stream(values())
                .filter(status -> status.code.equalsIgnoreCase(code))
                .findFirst();
    }

    /**
     * Terminal statuses take no further screening.
     */
    public boolean isFinal() {
        return this == REJECTED || this == HIRED;
    }
}
