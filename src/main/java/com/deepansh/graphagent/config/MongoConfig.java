package com.deepansh.graphagent.config;

import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.mongo.MongoClientSettingsBuilderCustomizer;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.data.mongodb.config.EnableMongoAuditing;
import org.springframework.data.mongodb.repository.config.EnableMongoRepositories;

import java.util.concurrent.TimeUnit;

/**
 * MongoDB holds checkpoints and long-term memory facts.
 *
 * The driver's connection pool is the shared resource every graph step goes
 * through: its size bounds concurrent store operations, and a step that cannot
 * get a connection within the wait timeout fails instead of hanging.
 */
@Configuration
@EnableMongoAuditing
@EnableMongoRepositories(basePackages = {
    "com.deepansh.graphagent.checkpoint",
    "com.deepansh.graphagent.memory"
})
@Slf4j
public class MongoConfig {

    @Bean
    public MongoClientSettingsBuilderCustomizer checkpointPoolCustomizer(AgentProperties properties) {
        AgentProperties.Checkpoint checkpoint = properties.getCheckpoint();
        log.info("Mongo connection pool [maxSize={}, maxWait={}]",
                checkpoint.getPoolSize(), checkpoint.getPoolWaitTimeout());
        return builder -> builder.applyToConnectionPoolSettings(pool -> pool
                .maxSize(checkpoint.getPoolSize())
                .maxWaitTime(checkpoint.getPoolWaitTimeout().toMillis(), TimeUnit.MILLISECONDS));
    }
}
