package com.deepansh.graphagent.checkpoint;

import com.deepansh.graphagent.graph.ConversationState;
import com.deepansh.graphagent.graph.GraphNode;

import java.util.Optional;

/**
 * Durable, append-only log of conversation snapshots keyed by thread id.
 *
 * Implementations never drop a write silently: a failed append throws
 * {@link com.deepansh.graphagent.exception.CheckpointWriteException}.
 * Callers serialise appends per thread (see {@link ThreadLocks}).
 */
public interface CheckpointStore {

    Optional<Checkpoint> getLatest(String threadId);

    /**
     * Appends a snapshot after the latest one, creating the thread's log if absent.
     *
     * @return the step number written
     */
    long append(String threadId, ConversationState state, GraphNode nextNode);
}
