package com.deepansh.graphagent.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Strongly-typed configuration for all tools.
 * Bound from application.yml under the "tools" prefix.
 */
@ConfigurationProperties(prefix = "tools")
@Data
public class ToolProperties {

    private KnowledgeBase knowledgeBase = new KnowledgeBase();

    @Data
    public static class KnowledgeBase {
        private String baseUrl = "http://localhost:9380/api/v1";
        private String apiKey = "";
        /** Chat assistant whose datasets back the knowledge base */
        private String chatId = "";

        public boolean isConfigured() {
            return apiKey != null && !apiKey.isBlank() && chatId != null && !chatId.isBlank();
        }
    }
}
