package com.deepansh.graphagent.memory;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.springframework.data.annotation.CreatedDate;
import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.index.CompoundIndex;
import org.springframework.data.mongodb.core.index.Indexed;
import org.springframework.data.mongodb.core.mapping.Document;

import java.time.Instant;
import java.util.List;

/**
 * A durable fact about a user, written once and never updated.
 *
 * Collection: memory_facts
 *
 * The unique (userId, contentHash) index makes writes idempotent per fact content:
 * a second insert of the same fact for the same user is rejected by the store.
 */
@Document(collection = "memory_facts")
@CompoundIndex(name = "uq_user_content", def = "{'userId': 1, 'contentHash': 1}", unique = true)
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class MemoryFact {

    @Id
    private String id;

    @Indexed
    private String userId;

    private String content;

    private String contentHash;

    /** Embedding of {@link #content}; compared by cosine similarity at search time. */
    private List<Double> embedding;

    @CreatedDate
    private Instant createdAt;
}
