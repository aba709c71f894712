package com.deepansh.graphagent.exception;

/**
 * Long-term memory could not be read or written. Never fatal to a turn.
 */
public class MemoryUnavailableException extends AgentException {

    public MemoryUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}
