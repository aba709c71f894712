package com.deepansh.graphagent.tool;

import java.util.Map;

/**
 * Contract every tool must implement.
 *
 * The {@link #getInputSchema()} return value is serialized as JSON Schema
 * and sent to the model so it knows how to invoke the tool.
 */
public interface AgentTool {

    /** Unique snake_case name the model uses to invoke this tool */
    String getName();

    /** Primary signal the model uses to decide when to call this tool. */
    String getDescription();

    /** JSON Schema (as a Map) describing the tool's input parameters. */
    Map<String, Object> getInputSchema();

    /**
     * Execute the tool and return the observation fed back to the model.
     *
     * @throws com.deepansh.graphagent.exception.ToolExecutionException when the tool cannot produce a result
     */
    String execute(Map<String, Object> arguments);
}
