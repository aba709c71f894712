package com.deepansh.graphagent.tool;

import com.deepansh.graphagent.exception.ToolExecutionException;
import com.deepansh.graphagent.model.Message;
import com.deepansh.graphagent.model.ToolCall;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Static, name-keyed registry of every {@link AgentTool} bean, built once at startup.
 *
 * Invocation never throws: unknown tools and tool failures become tool-result
 * messages starting with {@code ERROR:} so the model can react on its next turn.
 */
@Component
@Slf4j
public class ToolRegistry {

    private final Map<String, AgentTool> tools;

    public ToolRegistry(List<AgentTool> toolBeans) {
        Map<String, AgentTool> byName = new LinkedHashMap<>();
        toolBeans.forEach(tool -> {
            AgentTool previous = byName.putIfAbsent(tool.getName(), tool);
            if (previous != null) {
                throw new IllegalStateException("Duplicate tool name: " + tool.getName());
            }
            log.info("Registered tool: [{}]", tool.getName());
        });
        this.tools = Collections.unmodifiableMap(byName);
        log.info("Total tools registered: {}", tools.size());
    }

    public List<ToolDefinition> getAllDefinitions() {
        return tools.values().stream()
                .map(ToolDefinition::from)
                .toList();
    }

    /**
     * Runs one requested call and returns the tool-result message carrying its call id.
     */
    public Message invoke(ToolCall toolCall) {
        AgentTool tool = tools.get(toolCall.getToolName());

        if (tool == null) {
            String msg = String.format("ERROR: Unknown tool '%s'. Available tools: %s",
                    toolCall.getToolName(), tools.keySet());
            log.warn(msg);
            return Message.toolResult(toolCall, msg);
        }

        log.info("Executing tool: [{}] [callId={}]", toolCall.getToolName(), toolCall.getId());

        try {
            Map<String, Object> args = toolCall.getArguments() != null ? toolCall.getArguments() : Map.of();
            String result = tool.execute(args);
            log.debug("Tool [{}] returned: {}", toolCall.getToolName(), result);
            return Message.toolResult(toolCall, result != null ? result : "");
        } catch (ToolExecutionException e) {
            log.warn("Tool [{}] failed [callId={}]: {}", toolCall.getToolName(), toolCall.getId(), e.getMessage());
            return Message.toolResult(toolCall, "ERROR: " + e.getMessage());
        } catch (Exception e) {
            log.error("Tool [{}] failed [callId={}]", toolCall.getToolName(), toolCall.getId(), e);
            return Message.toolResult(toolCall, "ERROR: Tool execution failed — " + e.getMessage());
        }
    }

    public boolean hasTool(String name) {
        return tools.containsKey(name);
    }

    public int toolCount() {
        return tools.size();
    }
}
