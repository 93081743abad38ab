package com.example.hrportal.client;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.lang.NonNull;
import org.springframework.lang.Nullable;

/**
 * Reads the human-readable message out of an HR API error body.
 *
 * <p>Looks at {@code detail}, then {@code message}, then
 * {@code error.message}. FastAPI validation errors put a list under
 * {@code detail}; the first entry's {@code msg} is used for those.</p>
 */
@Slf4j
public final class ErrorPayloads {

    private ErrorPayloads() {}

    @Nullable
    public static String extractMessage(@NonNull ObjectMapper objectMapper, @Nullable String body) {
        if (body == null || body.isBlank()) {
            return null;
        }
        JsonNode root;
        try {
            root = objectMapper.readTree(body);
        } catch (JsonProcessingException e) {
            log.debug("Error body is not JSON, ignoring it for the user message");
            return null;
        }
        if (root == null || !root.isObject()) {
            return null;
        }

        JsonNode detail = root.path("detail");
        if (detail.isTextual() && !detail.asText().isBlank()) {
            return detail.asText();
        }
        if (detail.isArray() && detail.size() > 0 && detail.get(0).path("msg").isTextual()) {
            return detail.get(0).path("msg").asText();
        }

        JsonNode message = root.path("message");
        if (message.isTextual() && !message.asText().isBlank()) {
            return message.asText();
        }

        JsonNode nested = root.path("error").path("message");
        if (nested.isTextual() && !nested.asText().isBlank()) {
            return nested.asText();
        }
        return null;
    }
}
