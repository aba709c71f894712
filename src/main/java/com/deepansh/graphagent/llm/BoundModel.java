package com.deepansh.graphagent.llm;

import com.deepansh.graphagent.model.LlmResponse;
import com.deepansh.graphagent.model.Message;
import com.deepansh.graphagent.tool.ToolDefinition;

import java.util.List;

/**
 * A backend together with the tool set bound to it. Every call through this
 * view carries the same tools, so rebinding after a rotation is a new instance.
 */
public record BoundModel(ModelBackend backend, List<ToolDefinition> tools) {

    public BoundModel {
        tools = List.copyOf(tools);
    }

    public LlmResponse chat(List<Message> messages) {
        return backend.client().chat(messages, tools);
    }

    public String backendName() {
        return backend.name();
    }
}
