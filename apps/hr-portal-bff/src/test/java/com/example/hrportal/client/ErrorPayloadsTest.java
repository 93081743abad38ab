package com.example.hrportal.client;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("ErrorPayloads")
class ErrorPayloadsTest {

    private final ObjectMapper objectMapper = new ObjectMapper();

    @Test
    @DisplayName("Reads a plain detail string")
    void detailString() {
        assertThat(ErrorPayloads.extractMessage(objectMapper, "{\"detail\":\"Job not found\"}"))
                .isEqualTo("Job not found");
    }

    @Test
    @DisplayName("Reads the first validation error message")
    void detailList() {
        String body = "{\"detail\":[{\"loc\":[\"query\",\"page\"],\"msg\":\"ensure this value is greater than 0\"}]}";

        assertThat(ErrorPayloads.extractMessage(objectMapper, body))
                .isEqualTo("ensure this value is greater than 0");
    }

    @Test
    @DisplayName("Falls back to message, then error.message")
    void fallbacks() {
        assertThat(ErrorPayloads.extractMessage(objectMapper, "{\"message\":\"Try later\"}"))
                .isEqualTo("Try later");
        assertThat(ErrorPayloads.extractMessage(objectMapper, "{\"error\":{\"message\":\"Quota exceeded\"}}"))
                .isEqualTo("Quota exceeded");
    }

    @Test
    @DisplayName("Returns null for bodies without a message")
    void noMessage() {
        assertThat(ErrorPayloads.extractMessage(objectMapper, null)).isNull();
        assertThat(ErrorPayloads.extractMessage(objectMapper, "<html>Bad Gateway</html>")).isNull();
        assertThat(ErrorPayloads.extractMessage(objectMapper, "[1,2]")).isNull();
        assertThat(ErrorPayloads.extractMessage(objectMapper, "{\"detail\":\"  \"}")).isNull();
    }
}
