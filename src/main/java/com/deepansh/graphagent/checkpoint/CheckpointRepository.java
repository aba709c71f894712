package com.deepansh.graphagent.checkpoint;

import org.springframework.data.mongodb.repository.MongoRepository;
import org.springframework.stereotype.Repository;

import java.util.Optional;

@Repository
public interface CheckpointRepository extends MongoRepository<Checkpoint, String> {

    Optional<Checkpoint> findFirstByThreadIdOrderByStepDesc(String threadId);

    long countByThreadId(String threadId);
}
