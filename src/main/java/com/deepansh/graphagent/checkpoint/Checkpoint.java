package com.deepansh.graphagent.checkpoint;

import com.deepansh.graphagent.graph.ConversationState;
import com.deepansh.graphagent.graph.GraphNode;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.springframework.data.annotation.CreatedDate;
import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.index.CompoundIndex;
import org.springframework.data.mongodb.core.mapping.Document;

import java.time.Instant;

/**
 * One entry of a thread's append-only checkpoint log.
 *
 * The unique (threadId, step) index turns two concurrent writers for the same
 * step into a duplicate key error instead of a silent overwrite.
 */
@Document(collection = "agent_checkpoints")
@CompoundIndex(name = "uq_thread_step", def = "{'threadId': 1, 'step': 1}", unique = true)
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Checkpoint {

    @Id
    private String id;

    private String threadId;

    /** 1-based, strictly increasing per thread */
    private long step;

    private ConversationState state;

    /** Node scheduled after this step; anything but TERMINAL means the turn was cut short */
    private GraphNode nextNode;

    @CreatedDate
    private Instant createdAt;

    public boolean isPending() {
        return nextNode != null && nextNode != GraphNode.TERMINAL;
    }
}
