package com.deepansh.graphagent.exception;

/**
 * Conversation state could not be durably persisted (store failure, pool exhaustion
 * or a concurrent write to the same step). Aborts the turn.
 */
public class CheckpointWriteException extends AgentException {

    private final String threadId;

    public CheckpointWriteException(String threadId, String message, Throwable cause) {
        super(message, cause);
        this.threadId = threadId;
    }

    public String getThreadId() {
        return threadId;
    }
}
