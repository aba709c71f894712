package com.deepansh.graphagent.llm;

import com.deepansh.graphagent.resilience.ModelDispatcher;
import com.deepansh.graphagent.tool.ToolRegistry;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.client.RestClient;

import java.util.ArrayList;
import java.util.List;

/**
 * Builds the model backend registry from {@code llm.backends}, in declaration order.
 */
@Configuration
@Slf4j
public class LlmClientConfig {

    @Bean
    public ModelBackendRegistry modelBackendRegistry(LlmProperties properties,
                                                     ObjectMapper objectMapper,
                                                     RestClient.Builder outboundRestClientBuilder) {
        List<ModelBackend> backends = new ArrayList<>();
        List<LlmProperties.Backend> configured = properties.getBackends();

        for (int i = 0; i < configured.size(); i++) {
            LlmProperties.Backend params = configured.get(i);
            LlmClient client = new GenericLlmClient(params, objectMapper, outboundRestClientBuilder.clone());
            backends.add(new ModelBackend(params.getName(), params, i, client,
                    new ApproximateTokenCounter(params.getCharsPerToken())));
        }

        ModelBackendRegistry registry = new ModelBackendRegistry(backends, properties.getDefaultBackend());

        log.info("================================================================");
        log.info("  Model backends (priority order): {}", backends.stream().map(ModelBackend::name).toList());
        log.info("  Starting backend                : {}", registry.current().name());
        log.info("  Attempts per backend            : {}", properties.getRetry().getMaxAttempts());
        backends.forEach(b -> logKey(b.name(), b.params().getApiKey()));
        log.info("================================================================");

        return registry;
    }

    /**
     * The dispatcher is constructed, then bound to every registered tool before first use.
     */
    @Bean
    public ModelDispatcher modelDispatcher(ModelBackendRegistry registry,
                                           LlmProperties properties,
                                           ToolRegistry toolRegistry) {
        ModelDispatcher dispatcher = new ModelDispatcher(registry, properties.getRetry());
        dispatcher.bindTools(toolRegistry.getAllDefinitions());
        return dispatcher;
    }

    /**
     * Client for memory fact extraction. Talks to its backend directly, outside
     * the dispatcher, so extraction failures never rotate the shared cursor.
     */
    @Bean
    @Qualifier("memoryLlmClient")
    public LlmClient memoryLlmClient(LlmProperties properties, ModelBackendRegistry registry) {
        String name = properties.getMemoryBackend();
        ModelBackend backend = name == null || name.isBlank()
                ? registry.get(registry.currentIndex())
                : registry.byName(name);
        log.info("  Memory extraction backend       : {}", backend.name());
        return backend.client();
    }

    private void logKey(String backend, String key) {
        if (key == null || key.isBlank()) {
            log.error("  [{}] API key not set", backend);
        } else {
            log.info("  [{}] key: {}...{}", backend, key.substring(0, Math.min(8, key.length())),
                    key.length() > 8 ? key.substring(key.length() - 4) : "");
        }
    }
}
