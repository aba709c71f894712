package com.deepansh.graphagent.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.Map;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ToolCall {

    /** ID assigned by the model backend; echoed back in the tool result message */
    private String id;

    private String toolName;

    private Map<String, Object> arguments;
}
