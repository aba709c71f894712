package com.deepansh.graphagent.exception;

/**
 * A tool failed. The tool node turns this into a tool-result message instead of failing the turn.
 */
public class ToolExecutionException extends AgentException {

    public ToolExecutionException(String message) {
        super(message);
    }

    public ToolExecutionException(String message, Throwable cause) {
        super(message, cause);
    }
}
