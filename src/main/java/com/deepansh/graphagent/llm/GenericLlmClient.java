package com.deepansh.graphagent.llm;

import com.deepansh.graphagent.exception.BackendRequestException;
import com.deepansh.graphagent.exception.TransientBackendException;
import com.deepansh.graphagent.model.LlmResponse;
import com.deepansh.graphagent.model.Message;
import com.deepansh.graphagent.model.ToolCall;
import com.deepansh.graphagent.tool.ToolDefinition;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.ParameterizedTypeReference;
import org.springframework.http.HttpStatusCode;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestClient;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * OpenAI-compatible chat completions client, one instance per configured backend.
 *
 * Error classification:
 *
 * | Error                     | Exception                   | Dispatcher action            |
 * |---------------------------|-----------------------------|------------------------------|
 * | 429 rate limit, 408       | TransientBackendException   | retry same backend           |
 * | 5xx server error          | TransientBackendException   | retry same backend           |
 * | network error / timeout   | TransientBackendException   | retry same backend           |
 * | 401/403 credentials       | BackendRequestException     | rotate without retrying      |
 * | other 4xx                 | BackendRequestException     | rotate without retrying      |
 */
@Slf4j
public class GenericLlmClient implements LlmClient {

    private final LlmProperties.Backend props;
    private final ObjectMapper objectMapper;
    private final RestClient restClient;

    public GenericLlmClient(LlmProperties.Backend props,
                            ObjectMapper objectMapper,
                            RestClient.Builder restClientBuilder) {
        this.props = props;
        this.objectMapper = objectMapper;
        this.restClient = restClientBuilder
                .baseUrl(props.getBaseUrl())
                .defaultHeader("Authorization", "Bearer " + props.getApiKey())
                .defaultHeader("Content-Type", "application/json")
                .build();
    }

    @Override
    public LlmResponse chat(List<Message> messages, List<ToolDefinition> tools) {
        Map<String, Object> requestBody = buildRequestBody(messages, tools);

        log.debug("Sending {} messages and {} tools to {} [model={}]",
                messages.size(), tools.size(), props.getName(), props.getModel());

        try {
            Map<String, Object> response = restClient.post()
                    .uri("/chat/completions")
                    .body(requestBody)
                    .retrieve()
                    .onStatus(HttpStatusCode::is4xxClientError, (req, res) -> {
                        String body = new String(res.getBody().readAllBytes(), StandardCharsets.UTF_8);
                        log.error("{} 4xx [{}]: {}", props.getName(), res.getStatusCode(), body);
                        handle4xxError(body, res.getStatusCode().value());
                    })
                    .onStatus(HttpStatusCode::is5xxServerError, (req, res) -> {
                        String body = new String(res.getBody().readAllBytes(), StandardCharsets.UTF_8);
                        log.error("{} 5xx [{}]: {}", props.getName(), res.getStatusCode(), body);
                        throw new TransientBackendException(
                                props.getName() + " server error [" + res.getStatusCode() + "]: " + body);
                    })
                    .body(new ParameterizedTypeReference<>() {});

            if (response == null) {
                throw new TransientBackendException(props.getName() + " returned an empty body");
            }
            return parseResponse(response);

        } catch (ResourceAccessException e) {
            throw new TransientBackendException(props.getName() + " unreachable: " + e.getMessage(), e);
        }
    }

    private void handle4xxError(String body, int statusCode) {
        if (statusCode == 429) {
            throw new TransientBackendException(props.getName() + " rate limit exceeded");
        }
        if (statusCode == 408) {
            throw new TransientBackendException(props.getName() + " request timed out");
        }
        if (statusCode == 401 || statusCode == 403) {
            throw new BackendRequestException(
                    props.getName() + " rejected the API key [" + statusCode + "]", statusCode);
        }
        throw new BackendRequestException(
                props.getName() + " client error [" + statusCode + "]: " + body, statusCode);
    }

    private Map<String, Object> buildRequestBody(List<Message> messages, List<ToolDefinition> tools) {
        List<Map<String, Object>> formattedMessages = messages.stream()
                .map(this::formatMessage)
                .toList();

        Map<String, Object> body = new HashMap<>();
        body.put("model", props.getModel());
        body.put("max_tokens", props.getMaxTokens());
        if (props.getTemperature() != null) {
            body.put("temperature", props.getTemperature());
        }
        if (props.getReasoningEffort() != null && !props.getReasoningEffort().isBlank()) {
            body.put("reasoning_effort", props.getReasoningEffort());
        }
        body.put("messages", formattedMessages);

        if (!tools.isEmpty()) {
            body.put("tools", tools.stream().map(ToolDefinition::toOpenAiSchema).toList());
            body.put("tool_choice", "auto");
        }

        return body;
    }

    private Map<String, Object> formatMessage(Message msg) {
        Map<String, Object> m = new HashMap<>();
        m.put("role", msg.getRole().name());

        if (msg.getRole() == Message.Role.tool) {
            m.put("tool_call_id", msg.getToolCallId());
            m.put("content", msg.getContent() != null ? msg.getContent() : "");
        } else if (msg.getRole() == Message.Role.assistant && msg.hasToolCalls()) {
            // null content is valid for an assistant message that only carries tool calls
            m.put("content", msg.getContent());
            m.put("tool_calls", msg.getToolCalls().stream().map(this::formatToolCall).toList());
        } else {
            m.put("content", msg.getContent() != null ? msg.getContent() : "");
        }
        return m;
    }

    private Map<String, Object> formatToolCall(ToolCall tc) {
        Map<String, Object> fn = new HashMap<>();
        fn.put("name", tc.getToolName());
        try {
            fn.put("arguments", objectMapper.writeValueAsString(
                    tc.getArguments() != null ? tc.getArguments() : Map.of()));
        } catch (JsonProcessingException e) {
            fn.put("arguments", "{}");
        }

        Map<String, Object> tcMap = new HashMap<>();
        tcMap.put("id", tc.getId());
        tcMap.put("type", "function");
        tcMap.put("function", fn);
        return tcMap;
    }

    @SuppressWarnings("unchecked")
    private LlmResponse parseResponse(Map<String, Object> response) {
        List<Map<String, Object>> choices = (List<Map<String, Object>>) response.get("choices");
        if (choices == null || choices.isEmpty()) {
            throw new TransientBackendException(props.getName() + " returned no choices in response");
        }

        int promptTokens = 0, completionTokens = 0;
        Map<String, Object> usage = (Map<String, Object>) response.get("usage");
        if (usage != null) {
            promptTokens     = ((Number) usage.getOrDefault("prompt_tokens", 0)).intValue();
            completionTokens = ((Number) usage.getOrDefault("completion_tokens", 0)).intValue();
            log.debug("Token usage — prompt={} completion={}", promptTokens, completionTokens);
        }

        Map<String, Object> message = (Map<String, Object>) choices.get(0).get("message");
        if (message == null) {
            throw new TransientBackendException(props.getName() + " returned a choice without a message");
        }

        List<ToolCall> toolCalls = new ArrayList<>();
        List<Map<String, Object>> rawCalls = (List<Map<String, Object>>) message.get("tool_calls");
        if (rawCalls != null) {
            for (Map<String, Object> raw : rawCalls) {
                toolCalls.add(parseToolCall(raw));
            }
        }

        return LlmResponse.builder()
                .content((String) message.get("content"))
                .toolCalls(toolCalls)
                .promptTokens(promptTokens)
                .completionTokens(completionTokens)
                .build();
    }

    @SuppressWarnings("unchecked")
    private ToolCall parseToolCall(Map<String, Object> raw) {
        Map<String, Object> function = (Map<String, Object>) raw.get("function");
        String rawArgs = (String) function.get("arguments");

        Map<String, Object> args;
        try {
            args = rawArgs == null || rawArgs.isBlank()
                    ? Map.of()
                    : objectMapper.readValue(rawArgs, new TypeReference<Map<String, Object>>() {});
        } catch (JsonProcessingException e) {
            throw new BackendRequestException(
                    props.getName() + " produced unparseable tool arguments: " + rawArgs, e);
        }

        return ToolCall.builder()
                .id((String) raw.get("id"))
                .toolName((String) function.get("name"))
                .arguments(args)
                .build();
    }
}
