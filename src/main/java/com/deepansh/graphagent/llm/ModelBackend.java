package com.deepansh.graphagent.llm;

import com.deepansh.graphagent.tool.ToolDefinition;

import java.util.List;

/**
 * One entry of the backend registry: its configuration, its position in the
 * priority order, the client that talks to it and its token counter.
 */
public record ModelBackend(String name,
                           LlmProperties.Backend params,
                           int priority,
                           LlmClient client,
                           TokenCounter tokenCounter) {

    public BoundModel bind(List<ToolDefinition> tools) {
        return new BoundModel(this, tools);
    }
}
