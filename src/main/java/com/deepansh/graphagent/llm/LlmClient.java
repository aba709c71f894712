package com.deepansh.graphagent.llm;

import com.deepansh.graphagent.model.LlmResponse;
import com.deepansh.graphagent.model.Message;
import com.deepansh.graphagent.tool.ToolDefinition;

import java.util.List;

public interface LlmClient {

    /**
     * Send the conversation window and the bound tool schemas to one model backend.
     *
     * @param messages  system prompt followed by the trimmed history
     * @param tools     tool definitions the model may invoke; empty for plain completions
     * @return the assistant reply, possibly carrying tool calls
     * @throws com.deepansh.graphagent.exception.TransientBackendException on rate limits, timeouts and 5xx
     * @throws com.deepansh.graphagent.exception.BackendRequestException on bad requests and auth failures
     */
    LlmResponse chat(List<Message> messages, List<ToolDefinition> tools);
}
