package com.example.hrportal.common.util;

import org.springframework.lang.NonNull;
import org.springframework.lang.Nullable;

import java.util.regex.Pattern;

/**
 * Helpers for values that come from requests or the HR API and end up in
 * log lines.
 */
public final class StringSanitizer {

    private static final Pattern SESSION_ID_PATTERN = Pattern.compile(
            "^[0-9a-fA-F]{8}-[0-9a-fA-F]{4}-[0-9a-fA-F]{4}-[0-9a-fA-F]{4}-[0-9a-fA-F]{12}$");
    private static final Pattern CONTROL_CHARS = Pattern.compile("\\p{Cntrl}");
    private static final int DEFAULT_LOG_MAX_LENGTH = 64;
    private static final String ELLIPSIS = "...";

    private StringSanitizer() {}

    @NonNull
    public static String forLog(@Nullable String value) {
        return forLog(value, DEFAULT_LOG_MAX_LENGTH);
    }

    /**
     * Drops control characters (no forged log lines) and cuts the value to
     * {@code maxLength}, marking the cut with an ellipsis.
     */
    @NonNull
    public static String forLog(@Nullable String value, int maxLength) {
        if (value == null) {
            return "null";
        }
        String printable = CONTROL_CHARS.matcher(value).replaceAll("");
        if (printable.length() <= maxLength) {
            return printable;
        }
        return printable.substring(0, maxLength) + ELLIPSIS;
    }

    /**
     * List view session IDs are random UUIDs; anything else is rejected before
     * touching the session cache.
     */
    public static boolean isValidSessionId(@Nullable String sessionId) {
        return sessionId != null && SESSION_ID_PATTERN.matcher(sessionId).matches();
    }
}
