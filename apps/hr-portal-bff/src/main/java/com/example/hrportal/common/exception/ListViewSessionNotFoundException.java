package com.example.hrportal.common.exception;

public class ListViewSessionNotFoundException extends RuntimeException {

    private final String sessionId;

    public ListViewSessionNotFoundException(String sessionId) {
        super("List view session not found: " + sessionId);
        this.sessionId = sessionId;
    }

    public String getSessionId() {
        return sessionId;
    }
}
