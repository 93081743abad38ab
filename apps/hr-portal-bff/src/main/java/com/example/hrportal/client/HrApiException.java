package com.example.hrportal.client;

import org.springframework.http.HttpStatusCode;

/**
 * Failure talking to the HR backend: a non-2xx answer, a response that does
 * not have the expected shape, or a transport error.
 */
public class HrApiException extends RuntimeException {

    private final String endpoint;
    private final HttpStatusCode statusCode;
    private final String responseBody;
    private final String serverMessage;

    public HrApiException(String endpoint, HttpStatusCode statusCode, String message,
                          String responseBody, String serverMessage) {
        super(message);
        this.endpoint = endpoint;
        this.statusCode = statusCode;
        this.responseBody = responseBody;
        this.serverMessage = serverMessage;
    }

    public HrApiException(String endpoint, String message, Throwable cause) {
        super(message, cause);
        this.endpoint = endpoint;
        this.statusCode = null;
        this.responseBody = null;
        this.serverMessage = null;
    }

    public String getEndpoint() {
        return endpoint;
    }

    public HttpStatusCode getStatusCode() {
        return statusCode;
    }

    public String getResponseBody() {
        return responseBody;
    }

    /**
     * Human-readable message taken from the server's error payload, if it had one.
     */
    public String getServerMessage() {
        return serverMessage;
    }

    @Override
    public String toString() {
        return "HrApiException{" +
                "endpoint='" + endpoint + '\'' +
                ", statusCode=" + statusCode +
                ", message='" + getMessage() + '\'' +
                '}';
    }
}
