package com.deepansh.graphagent.llm;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * Model backend registry configuration. List order is priority order.
 *
 * <pre>
 * llm:
 *   default-backend: gpt-5-mini
 *   backends:
 *     - name: gpt-5-mini
 *       model: gpt-5-mini
 *       reasoning-effort: low
 *   retry:
 *     max-attempts: 3
 *     initial-backoff: 2s
 * </pre>
 */
@ConfigurationProperties(prefix = "llm")
@Data
public class LlmProperties {

    /** Backend the dispatcher cursor starts on; the first backend when blank */
    private String defaultBackend;

    /** Backend used for memory fact extraction; the default backend when blank */
    private String memoryBackend;

    private List<Backend> backends = new ArrayList<>();

    private Retry retry = new Retry();

    @Data
    public static class Backend {
        private String name;
        private String baseUrl = "https://api.openai.com/v1";
        private String apiKey = "";
        private String model;
        private int maxTokens = 2000;
        private Double temperature;
        /** minimal | low | medium | high; omitted from requests when null */
        private String reasoningEffort;
        /** Approximation used by this backend's token counter */
        private double charsPerToken = 4.0;
    }

    @Data
    public static class Retry {
        /** Attempts per backend per call, first attempt included */
        private int maxAttempts = 3;
        private Duration initialBackoff = Duration.ofSeconds(2);
        private double multiplier = 2.0;
        private Duration maxBackoff = Duration.ofSeconds(8);
    }
}
