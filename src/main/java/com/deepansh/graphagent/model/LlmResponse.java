package com.deepansh.graphagent.model;

import lombok.Builder;
import lombok.Data;

import java.util.ArrayList;
import java.util.List;

@Data
@Builder
public class LlmResponse {

    /** Assistant text; may be null when the model only requests tools */
    private String content;

    /** Tool invocations requested by the model, in the order it produced them */
    @Builder.Default
    private List<ToolCall> toolCalls = new ArrayList<>();

    @Builder.Default
    private int promptTokens = 0;

    @Builder.Default
    private int completionTokens = 0;

    public boolean isToolCallRequired() {
        return toolCalls != null && !toolCalls.isEmpty();
    }

    public Message toMessage() {
        return Message.builder()
                .role(Message.Role.assistant)
                .content(content)
                .toolCalls(isToolCallRequired() ? List.copyOf(toolCalls) : null)
                .build();
    }
}
