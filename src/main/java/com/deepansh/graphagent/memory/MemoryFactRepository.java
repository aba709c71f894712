package com.deepansh.graphagent.memory;

import org.springframework.data.mongodb.repository.MongoRepository;
import org.springframework.data.mongodb.repository.Query;
import org.springframework.stereotype.Repository;

import java.util.List;

@Repository
public interface MemoryFactRepository extends MongoRepository<MemoryFact, String> {

    @Query("{ 'userId': ?0, 'embedding': { $exists: true, $ne: null } }")
    List<MemoryFact> findEmbeddedByUserId(String userId);

    boolean existsByUserIdAndContentHash(String userId, String contentHash);

    long countByUserId(String userId);
}
