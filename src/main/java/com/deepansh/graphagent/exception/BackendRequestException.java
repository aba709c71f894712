package com.deepansh.graphagent.exception;

/**
 * Structural failure from a model backend (bad request, invalid credentials).
 * Not retried against the same backend, but still counts as a backend failure.
 */
public class BackendRequestException extends AgentException {

    private final int statusCode;

    public BackendRequestException(String message, int statusCode) {
        super(message);
        this.statusCode = statusCode;
    }

    public BackendRequestException(String message, Throwable cause) {
        super(message, cause);
        this.statusCode = 0;
    }

    public int getStatusCode() {
        return statusCode;
    }
}
