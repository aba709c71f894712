package com.deepansh.graphagent.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.util.concurrent.ThreadPoolExecutor;

/**
 * Dedicated pools for work that runs outside the request thread.
 *
 * memoryTaskExecutor: long-term memory updates. Bounded queue, drained on shutdown;
 * when the queue is full the task is rejected and the caller drops it.
 *
 * streamTaskExecutor: runs streamed turns while the request thread returns the emitter.
 */
@Configuration
public class AsyncConfig {

    @Bean(name = "memoryTaskExecutor")
    public ThreadPoolTaskExecutor memoryTaskExecutor(AgentProperties properties) {
        AgentProperties.MemoryWorker worker = properties.getMemoryWorker();
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(worker.getCoreSize());
        executor.setMaxPoolSize(worker.getMaxSize());
        executor.setQueueCapacity(worker.getQueueCapacity());
        executor.setThreadNamePrefix("memory-async-");
        executor.setRejectedExecutionHandler(new ThreadPoolExecutor.AbortPolicy());
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationSeconds(worker.getShutdownWaitSeconds());
        executor.initialize();
        return executor;
    }

    @Bean(name = "streamTaskExecutor")
    public ThreadPoolTaskExecutor streamTaskExecutor() {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(4);
        executor.setMaxPoolSize(16);
        executor.setQueueCapacity(100);
        executor.setThreadNamePrefix("stream-");
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationSeconds(60);
        executor.initialize();
        return executor;
    }
}
