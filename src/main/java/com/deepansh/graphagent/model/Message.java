package com.deepansh.graphagent.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class Message {

    public enum Role {
        system, user, assistant, tool
    }

    private Role role;
    private String content;

    /** Present when role = tool: links back to the assistant's tool call id */
    private String toolCallId;

    /** Present when role = tool: the name of the tool that produced this result */
    private String name;

    /**
     * Present when role = assistant and the model requested tool calls.
     * Echoed back verbatim on the next model call so results can be correlated.
     */
    private List<ToolCall> toolCalls;

    public static Message user(String content) {
        return Message.builder().role(Role.user).content(content).build();
    }

    public static Message assistant(String content) {
        return Message.builder().role(Role.assistant).content(content).build();
    }

    public static Message system(String content) {
        return Message.builder().role(Role.system).content(content).build();
    }

    public static Message toolResult(ToolCall call, String content) {
        return Message.builder()
                .role(Role.tool)
                .toolCallId(call.getId())
                .name(call.getToolName())
                .content(content)
                .build();
    }

    @JsonIgnore
    public boolean hasToolCalls() {
        return toolCalls != null && !toolCalls.isEmpty();
    }

    /** True for the user/assistant messages with text that make up the visible transcript. */
    @JsonIgnore
    public boolean isTranscriptEntry() {
        return (role == Role.user || role == Role.assistant)
                && content != null && !content.isBlank();
    }
}
