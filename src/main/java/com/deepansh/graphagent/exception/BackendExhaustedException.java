package com.deepansh.graphagent.exception;

/**
 * Raised inside the dispatcher when one backend has used up its attempts.
 * Triggers rotation to the next backend; never leaves the dispatcher.
 */
public class BackendExhaustedException extends AgentException {

    private final String backendName;

    public BackendExhaustedException(String backendName, Throwable cause) {
        super("Backend '" + backendName + "' exhausted: " + cause.getMessage(), cause);
        this.backendName = backendName;
    }

    public String getBackendName() {
        return backendName;
    }
}
