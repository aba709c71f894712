package com.deepansh.graphagent.memory;

import com.deepansh.graphagent.config.AgentProperties;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.ParameterizedTypeReference;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.stereotype.Service;
import org.springframework.util.DigestUtils;
import org.springframework.web.client.RestClient;

import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Map;

/**
 * Text embeddings from an OpenAI-compatible /embeddings endpoint.
 *
 * Embeddings for the same text are deterministic, so results are cached in
 * Redis under embed:{model}:{md5(text)}. A cache outage only costs an extra API call.
 */
@Service
@Slf4j
public class EmbeddingService {

    private static final String CACHE_PREFIX = "embed:";

    private final RestClient restClient;
    private final StringRedisTemplate redisTemplate;
    private final ObjectMapper objectMapper;
    private final AgentProperties.LongTerm props;

    public EmbeddingService(AgentProperties properties,
                            RestClient.Builder outboundRestClientBuilder,
                            StringRedisTemplate redisTemplate,
                            ObjectMapper objectMapper) {
        this.props = properties.getLongTerm();
        this.redisTemplate = redisTemplate;
        this.objectMapper = objectMapper;
        this.restClient = outboundRestClientBuilder.clone()
                .baseUrl(props.getEmbeddingBaseUrl())
                .defaultHeader("Authorization", "Bearer " + props.getEmbeddingApiKey())
                .defaultHeader("Content-Type", "application/json")
                .build();
    }

    public float[] embed(String text) {
        String cacheKey = CACHE_PREFIX + props.getEmbeddingModel() + ":" + hashText(text);

        float[] cached = readCache(cacheKey);
        if (cached != null) {
            log.debug("Embedding cache hit for text length={}", text.length());
            return cached;
        }

        float[] embedding = fetchEmbedding(text);

        try {
            redisTemplate.opsForValue().set(
                    cacheKey, objectMapper.writeValueAsString(embedding), props.getEmbeddingCacheTtl());
        } catch (Exception e) {
            log.warn("Failed to cache embedding: {}", e.getMessage());
        }

        return embedding;
    }

    public static String hashText(String text) {
        return DigestUtils.md5DigestAsHex(text.getBytes(StandardCharsets.UTF_8));
    }

    private float[] readCache(String cacheKey) {
        try {
            String cached = redisTemplate.opsForValue().get(cacheKey);
            return cached != null ? objectMapper.readValue(cached, float[].class) : null;
        } catch (Exception e) {
            log.warn("Embedding cache unavailable, fetching directly: {}", e.getMessage());
            return null;
        }
    }

    @SuppressWarnings("unchecked")
    private float[] fetchEmbedding(String text) {
        log.debug("Fetching embedding for text length={}", text.length());

        Map<String, Object> response = restClient.post()
                .uri("/embeddings")
                .body(Map.of("model", props.getEmbeddingModel(), "input", text))
                .retrieve()
                .body(new ParameterizedTypeReference<>() {});

        List<Map<String, Object>> data = (List<Map<String, Object>>) response.get("data");
        List<Number> rawEmbedding = (List<Number>) data.get(0).get("embedding");

        float[] result = new float[rawEmbedding.size()];
        for (int i = 0; i < rawEmbedding.size(); i++) {
            result[i] = rawEmbedding.get(i).floatValue();
        }
        return result;
    }
}
