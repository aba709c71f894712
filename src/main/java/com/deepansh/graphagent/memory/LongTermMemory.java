package com.deepansh.graphagent.memory;

import com.deepansh.graphagent.config.AgentProperties;
import com.deepansh.graphagent.exception.MemoryUnavailableException;
import com.deepansh.graphagent.model.Message;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.core.task.TaskExecutor;
import org.springframework.core.task.TaskRejectedException;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.stereotype.Component;

import java.util.Comparator;
import java.util.List;

/**
 * Cross-session facts about a user, backed by MongoDB with in-process cosine ranking.
 *
 * search: top-K facts above the similarity threshold for a query.
 * add:    extract facts from a conversation and insert the new ones.
 *
 * Updates after a turn go through {@link #addInBackground}: a bounded worker pool,
 * at most once, best effort. Failures and rejections are logged and dropped.
 */
@Component
@Slf4j
public class LongTermMemory {

    private final MemoryFactRepository repository;
    private final EmbeddingService embeddingService;
    private final MemoryExtractionService extractionService;
    private final TaskExecutor memoryTaskExecutor;
    private final AgentProperties.LongTerm props;

    public LongTermMemory(MemoryFactRepository repository,
                          EmbeddingService embeddingService,
                          MemoryExtractionService extractionService,
                          @Qualifier("memoryTaskExecutor") TaskExecutor memoryTaskExecutor,
                          AgentProperties properties) {
        this.repository = repository;
        this.embeddingService = embeddingService;
        this.extractionService = extractionService;
        this.memoryTaskExecutor = memoryTaskExecutor;
        this.props = properties.getLongTerm();
    }

    /**
     * @throws MemoryUnavailableException when the store or the embedding endpoint fails
     */
    public List<String> search(String userId, String query) {
        try {
            List<MemoryFact> candidates = repository.findEmbeddedByUserId(userId);
            if (candidates.isEmpty()) {
                return List.of();
            }

            float[] queryEmbedding = embeddingService.embed(query);

            List<String> results = candidates.stream()
                    .map(f -> new ScoredFact(f, cosineSimilarity(queryEmbedding, f.getEmbedding())))
                    .filter(sf -> sf.score() >= props.getSimilarityThreshold())
                    .sorted(Comparator.comparingDouble(ScoredFact::score).reversed())
                    .limit(props.getTopK())
                    .map(sf -> sf.fact().getContent())
                    .toList();

            log.debug("Memory search for user={} returned {} of {} facts", userId, results.size(), candidates.size());
            return results;
        } catch (Exception e) {
            throw new MemoryUnavailableException("Long-term memory search failed for user " + userId, e);
        }
    }

    public void add(List<Message> messages, String userId) {
        List<String> facts = extractionService.extractFacts(messages);
        if (facts.isEmpty()) {
            log.debug("No memorable facts found for user={}", userId);
            return;
        }

        long stored = facts.stream().filter(fact -> store(userId, fact)).count();
        log.info("Long-term memory updated for user={}: {} new of {} extracted facts",
                userId, stored, facts.size());
    }

    public void addInBackground(List<Message> messages, String userId) {
        List<Message> snapshot = List.copyOf(messages);
        try {
            memoryTaskExecutor.execute(() -> {
                try {
                    add(snapshot, userId);
                } catch (Exception e) {
                    log.error("Background memory update failed for user={}: {}", userId, e.getMessage(), e);
                }
            });
        } catch (TaskRejectedException e) {
            log.error("Memory update queue full, dropping update for user={}", userId);
        }
    }

    /**
     * Inserts one fact unless the user already has one with the same content.
     *
     * @return true when a new fact was written
     */
    public boolean store(String userId, String content) {
        String hash = EmbeddingService.hashText(content);
        if (repository.existsByUserIdAndContentHash(userId, hash)) {
            return false;
        }

        MemoryFact fact = MemoryFact.builder()
                .userId(userId)
                .content(content)
                .contentHash(hash)
                .embedding(toDoubleList(embeddingService.embed(content)))
                .build();

        try {
            repository.insert(fact);
            log.debug("Stored memory fact for user={}", userId);
            return true;
        } catch (DuplicateKeyException e) {
            // concurrent insert of the same fact won the race
            return false;
        }
    }

    public String formatForPrompt(List<String> facts) {
        if (facts.isEmpty()) {
            return props.getNoMemoryPlaceholder();
        }
        StringBuilder sb = new StringBuilder();
        facts.forEach(f -> sb.append("* ").append(f).append("\n"));
        return sb.toString().stripTrailing();
    }

    private double cosineSimilarity(float[] a, List<Double> b) {
        if (b == null || a.length != b.size()) return 0.0;
        double dot = 0, normA = 0, normB = 0;
        for (int i = 0; i < a.length; i++) {
            double bi = b.get(i);
            dot   += a[i] * bi;
            normA += a[i] * a[i];
            normB += bi * bi;
        }
        return (normA == 0 || normB == 0) ? 0.0 : dot / (Math.sqrt(normA) * Math.sqrt(normB));
    }

    private List<Double> toDoubleList(float[] arr) {
        Double[] result = new Double[arr.length];
        for (int i = 0; i < arr.length; i++) result[i] = (double) arr[i];
        return List.of(result);
    }

    private record ScoredFact(MemoryFact fact, double score) {}
}
