package com.example.hrportal.client.hr;

import org.springframework.lang.NonNull;
import org.springframework.lang.Nullable;

import java.util.Arrays;
import java.util.Optional;

public enum EmploymentType {

    FULL_TIME("full-time", "Full-time"),
    PART_TIME("part-time", "Part-time"),
    CONTRACT("contract", "Contract"),
    INTERNSHIP("internship", "Internship");

    private final String code;
    private final String label;

    EmploymentType(String code, String label) {
        this.code = code;
        this.label = label;
    }

    @NonNull
    public String code() {
        return code;
    }

    @NonNull
    public String label() {
        return label;
    }

    @NonNull
    public static Optional<EmploymentType> fromCode(@Nullable String code) {
        return Arrays.stream(values())
                .filter(type -> type.code.equalsIgnoreCase(code))
                .findFirst();
    }

    /**
     * Display label for a wire code; unknown codes are shown as they are.
     */
    @NonNull
    public static String labelFor(@Nullable String code) {
        return fromCode(code)
                .map(EmploymentType::label)
                .orElse(code == null ? "" : code);
    }
}
