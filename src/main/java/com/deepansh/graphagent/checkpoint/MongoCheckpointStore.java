package com.deepansh.graphagent.checkpoint;

import com.deepansh.graphagent.exception.CheckpointWriteException;
import com.deepansh.graphagent.graph.ConversationState;
import com.deepansh.graphagent.graph.GraphNode;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.stereotype.Component;

import java.util.Optional;

@Component
@RequiredArgsConstructor
@Slf4j
public class MongoCheckpointStore implements CheckpointStore {

    private final CheckpointRepository repository;

    @Override
    public Optional<Checkpoint> getLatest(String threadId) {
        try {
            return repository.findFirstByThreadIdOrderByStepDesc(threadId);
        } catch (DataAccessException e) {
            throw new CheckpointWriteException(threadId, "Could not load latest checkpoint", e);
        }
    }

    @Override
    public long append(String threadId, ConversationState state, GraphNode nextNode) {
        try {
            long step = repository.findFirstByThreadIdOrderByStepDesc(threadId)
                    .map(c -> c.getStep() + 1)
                    .orElse(1L);

            repository.insert(Checkpoint.builder()
                    .threadId(threadId)
                    .step(step)
                    .state(state)
                    .nextNode(nextNode)
                    .build());

            log.info("Checkpoint appended [threadId={}, step={}, messages={}, next={}]",
                    threadId, step, state.size(), nextNode);
            return step;

        } catch (DuplicateKeyException e) {
            throw new CheckpointWriteException(threadId, "Concurrent checkpoint write detected", e);
        } catch (DataAccessException e) {
            throw new CheckpointWriteException(threadId, "Checkpoint write failed", e);
        }
    }
}
