package com.example.hrportal.listview;

import org.springframework.lang.NonNull;

import java.time.Instant;

/**
 * Toast shown to the user when a list fetch fails.
 */
public record ListNotification(
        @NonNull Level level,
        @NonNull String title,
        @NonNull String message,
        @NonNull Instant timestamp
) {
    public enum Level {
        ERROR
    }

    @NonNull
    public static ListNotification error(@NonNull String message) {
        return new ListNotification(Level.ERROR, "Error", message, Instant.now());
    }
}
