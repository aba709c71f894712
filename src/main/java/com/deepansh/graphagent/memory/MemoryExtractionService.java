package com.deepansh.graphagent.memory;

import com.deepansh.graphagent.llm.LlmClient;
import com.deepansh.graphagent.model.LlmResponse;
import com.deepansh.graphagent.model.Message;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.github.resilience4j.circuitbreaker.CallNotPermittedException;
import io.github.resilience4j.circuitbreaker.CircuitBreaker;
import io.github.resilience4j.circuitbreaker.CircuitBreakerRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.util.List;

/**
 * Extracts durable facts about the user from a finished conversation with one
 * auxiliary model call.
 *
 * The call goes to the memory backend's client directly, behind its own
 * "memoryExtraction" circuit breaker: extraction failures never touch the
 * dispatcher's cursor or the main conversation's availability.
 */
@Service
@Slf4j
public class MemoryExtractionService {

    private static final String SYSTEM_PROMPT =
            "You are a memory extraction assistant. Output only valid JSON arrays. Nothing else.";

    private final LlmClient llmClient;
    private final ObjectMapper objectMapper;
    private final CircuitBreaker circuitBreaker;

    public MemoryExtractionService(@Qualifier("memoryLlmClient") LlmClient llmClient,
                                   ObjectMapper objectMapper,
                                   CircuitBreakerRegistry circuitBreakerRegistry) {
        this.llmClient = llmClient;
        this.objectMapper = objectMapper;
        this.circuitBreaker = circuitBreakerRegistry.circuitBreaker("memoryExtraction");
    }

    /**
     * @return the extracted facts, empty when there is nothing worth remembering
     *         or the model did not answer with a JSON array of strings
     */
    public List<String> extractFacts(List<Message> messages) {
        String conversationText = buildConversationText(messages);
        if (conversationText.isBlank()) {
            return List.of();
        }

        String extractionPrompt = """
                Analyze the following conversation and extract facts worth remembering about the user.

                Extract ONLY facts that would be useful in future conversations:
                - Personal/professional facts (role, company, projects, skills)
                - Stated preferences and interests
                - Ongoing tasks or goals they mentioned

                DO NOT extract temporary requests, generic questions or system messages.

                Respond with ONLY a JSON array of short statements. No explanation, no markdown. Example:
                ["Works as a Java backend developer", "Loves hiking"]

                If nothing is worth remembering, respond with exactly: []

                Conversation:
                """ + conversationText;

        LlmResponse response;
        try {
            response = circuitBreaker.executeSupplier(() -> llmClient.chat(
                    List.of(Message.system(SYSTEM_PROMPT), Message.user(extractionPrompt)), List.of()));
        } catch (CallNotPermittedException e) {
            log.warn("Memory extraction circuit breaker open — skipping extraction");
            return List.of();
        }

        return parseFacts(response.getContent());
    }

    List<String> parseFacts(String raw) {
        if (raw == null || raw.isBlank()) {
            return List.of();
        }

        String cleaned = raw.strip()
                .replaceAll("(?s)^```json\\s*", "")
                .replaceAll("(?s)^```\\s*", "")
                .replaceAll("(?s)```\\s*$", "")
                .strip();

        if (!cleaned.startsWith("[")) {
            log.warn("Extraction response is not a JSON array — skipping. First 100 chars: '{}'",
                    cleaned.substring(0, Math.min(100, cleaned.length())));
            return List.of();
        }

        try {
            List<String> facts = objectMapper.readValue(cleaned, new TypeReference<List<String>>() {});
            return facts.stream()
                    .filter(f -> f != null && !f.isBlank())
                    .map(String::strip)
                    .distinct()
                    .toList();
        } catch (JsonProcessingException e) {
            log.warn("Failed to parse extraction JSON — skipping. Error: {}", e.getMessage());
            return List.of();
        }
    }

    private String buildConversationText(List<Message> messages) {
        StringBuilder sb = new StringBuilder();
        messages.forEach(m -> {
            if (!m.isTranscriptEntry()) return;
            String role = m.getRole() == Message.Role.user ? "User" : "Assistant";
            sb.append(role).append(": ").append(m.getContent()).append("\n");
        });
        return sb.toString();
    }
}
