package com.example.hrportal.listview;

import com.example.hrportal.client.HrApiException;
import org.springframework.lang.NonNull;
import org.springframework.lang.Nullable;

/**
 * Turns fetch failures into text fit for a toast.
 */
public final class ErrorMessages {

    private ErrorMessages() {}

    /**
     * Uses the message the server put in its error payload when there is one,
     * otherwise the fallback. Transport and parsing errors always get the
     * fallback since their messages are not meant for end users.
     */
    @NonNull
    public static String userMessage(@Nullable Throwable error, @NonNull String fallback) {
        if (error instanceof HrApiException apiError) {
            String serverMessage = apiError.getServerMessage();
            if (serverMessage != null && !serverMessage.isBlank()) {
                return serverMessage;
            }
        }
        return fallback;
    }

    @NonNull
    public static String loadFailed(@NonNull ListViewType view) {
        return "Failed to load " + view.noun();
    }
}
