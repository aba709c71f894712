package com.deepansh.graphagent.exception;

/**
 * Rate limit, timeout or upstream 5xx from a model backend.
 * The dispatcher retries these against the same backend.
 */
public class TransientBackendException extends AgentException {

    public TransientBackendException(String message) {
        super(message);
    }

    public TransientBackendException(String message, Throwable cause) {
        super(message, cause);
    }
}
