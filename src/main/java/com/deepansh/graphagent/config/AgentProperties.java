package com.deepansh.graphagent.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

/**
 * Agent behaviour: prompt, memory budgets, checkpoint store sizing and the
 * background memory worker pool. Bound from the "agent" prefix.
 */
@ConfigurationProperties(prefix = "agent")
@Data
public class AgentProperties {

    private String systemPrompt = """
            You are a helpful assistant. Answer clearly and concisely.
            Use the available tools when they help you give a better answer.
            If a tool returns an ERROR, do not call it again with the same arguments; \
            answer from your own knowledge or explain the limitation.
            """;

    private ShortTerm shortTerm = new ShortTerm();
    private LongTerm longTerm = new LongTerm();
    private Checkpoint checkpoint = new Checkpoint();
    private MemoryWorker memoryWorker = new MemoryWorker();

    @Data
    public static class ShortTerm {
        /** Token budget for the window sent to the model, system prompt included */
        private int maxTokens = 8000;
    }

    @Data
    public static class LongTerm {
        private int topK = 5;
        private double similarityThreshold = 0.75;
        private String embeddingBaseUrl = "https://api.openai.com/v1";
        private String embeddingApiKey = "";
        private String embeddingModel = "text-embedding-3-small";
        private Duration embeddingCacheTtl = Duration.ofDays(7);
        private String noMemoryPlaceholder = "No relevant memory found.";
    }

    @Data
    public static class Checkpoint {
        /** Upper bound on concurrent store operations across all in-flight turns */
        private int poolSize = 20;
        /** How long a step waits for a pooled connection before failing */
        private Duration poolWaitTimeout = Duration.ofSeconds(5);
        private int lockStripes = 64;
    }

    @Data
    public static class MemoryWorker {
        private int coreSize = 2;
        private int maxSize = 5;
        private int queueCapacity = 100;
        private int shutdownWaitSeconds = 30;
    }
}
