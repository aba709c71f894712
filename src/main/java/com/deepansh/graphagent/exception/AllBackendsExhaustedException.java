package com.deepansh.graphagent.exception;

import java.util.List;

/**
 * Every configured model backend failed within a single call.
 * Surfaced to clients as service unavailable.
 */
public class AllBackendsExhaustedException extends AgentException {

    private final List<String> attemptedBackends;

    public AllBackendsExhaustedException(List<String> attemptedBackends, Throwable lastFailure) {
        super("All model backends exhausted " + attemptedBackends, lastFailure);
        this.attemptedBackends = List.copyOf(attemptedBackends);
    }

    public List<String> getAttemptedBackends() {
        return attemptedBackends;
    }
}
