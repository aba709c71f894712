package com.deepansh.graphagent.tool;

import lombok.Builder;
import lombok.Value;

import java.util.Map;

/**
 * Immutable snapshot of a tool's schema as bound to a model backend.
 */
@Value
@Builder
public class ToolDefinition {

    String name;
    String description;
    Map<String, Object> inputSchema;

    public static ToolDefinition from(AgentTool tool) {
        return ToolDefinition.builder()
                .name(tool.getName())
                .description(tool.getDescription())
                .inputSchema(tool.getInputSchema())
                .build();
    }

    /**
     * OpenAI-compatible tool format:
     * { "type": "function", "function": { "name", "description", "parameters" } }
     */
    public Map<String, Object> toOpenAiSchema() {
        return Map.of(
                "type", "function",
                "function", Map.of(
                        "name", name,
                        "description", description,
                        "parameters", inputSchema
                )
        );
    }
}
