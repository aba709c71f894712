package com.deepansh.graphagent.tool.impl;

import com.deepansh.graphagent.config.ToolProperties;
import com.deepansh.graphagent.exception.ToolExecutionException;
import com.deepansh.graphagent.tool.AgentTool;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.ParameterizedTypeReference;
import org.springframework.stereotype.Component;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientException;

import java.util.List;
import java.util.Map;

/**
 * Queries the external knowledge base through its OpenAI-compatible chat endpoint:
 * POST {base-url}/chats_openai/{chat-id}/chat/completions, non-streaming.
 *
 * An unconfigured connection or a missing query comes back as text the model can read.
 * A failed request throws {@link ToolExecutionException}; the registry turns it into an
 * {@code ERROR:} tool result.
 */
@Component
@Slf4j
public class KnowledgeBaseTool implements AgentTool {

    private final ToolProperties.KnowledgeBase props;
    private final RestClient restClient;

    public KnowledgeBaseTool(ToolProperties toolProperties, RestClient.Builder outboundRestClientBuilder) {
        this.props = toolProperties.getKnowledgeBase();
        this.restClient = outboundRestClientBuilder.clone()
                .baseUrl(stripTrailingSlash(props.getBaseUrl()))
                .defaultHeader("Content-Type", "application/json")
                .build();
    }

    @Override
    public String getName() {
        return "query_knowledge_base";
    }

    @Override
    public String getDescription() {
        return """
                Searches the knowledge base for information related to the query.
                Use this whenever you need factual information, documentation or domain
                knowledge that might be stored in the internal knowledge base.
                """;
    }

    @Override
    public Map<String, Object> getInputSchema() {
        return Map.of(
                "type", "object",
                "properties", Map.of(
                        "query", Map.of(
                                "type", "string",
                                "description", "The search query to look up in the knowledge base"
                        )
                ),
                "required", List.of("query")
        );
    }

    @Override
    public String execute(Map<String, Object> arguments) {
        if (!props.isConfigured()) {
            log.warn("Knowledge base not configured [apiKeySet={}, chatIdSet={}]",
                    props.getApiKey() != null && !props.getApiKey().isBlank(),
                    props.getChatId() != null && !props.getChatId().isBlank());
            return "Knowledge base is not configured. Please provide an API key and chat id.";
        }

        Object rawQuery = arguments.get("query");
        if (rawQuery == null || rawQuery.toString().isBlank()) {
            return "ERROR: 'query' is required for query_knowledge_base";
        }
        String query = rawQuery.toString();

        log.info("Knowledge base query: '{}'", query);

        try {
            Map<String, Object> response = restClient.post()
                    .uri("/chats_openai/{chatId}/chat/completions", props.getChatId())
                    .header("Authorization", "Bearer " + props.getApiKey())
                    .body(Map.of(
                            "model", "ragflow",
                            "messages", List.of(Map.of("role", "user", "content", query)),
                            "stream", false))
                    .retrieve()
                    .body(new ParameterizedTypeReference<>() {});

            return extractContent(response);
        } catch (RestClientException e) {
            throw new ToolExecutionException("Knowledge base request failed: " + e.getMessage(), e);
        }
    }

    @SuppressWarnings("unchecked")
    private String extractContent(Map<String, Object> response) {
        List<Map<String, Object>> choices = response == null ? null : (List<Map<String, Object>>) response.get("choices");
        if (choices == null || choices.isEmpty()) {
            return "No response from the knowledge base.";
        }
        Map<String, Object> message = (Map<String, Object>) choices.get(0).get("message");
        Object content = message == null ? null : message.get("content");
        return content == null ? "" : content.toString();
    }

    private static String stripTrailingSlash(String url) {
        return url.endsWith("/") ? url.substring(0, url.length() - 1) : url;
    }
}
