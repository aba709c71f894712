package com.deepansh.graphagent.checkpoint;

import com.deepansh.graphagent.config.AgentProperties;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;

/**
 * Serialises turns per thread id so checkpoint appends for one thread never interleave.
 *
 * Locks are striped: unrelated threads may share a stripe and wait on each other,
 * two turns on the same thread always do.
 */
@Component
public class ThreadLocks {

    private final ReentrantLock[] stripes;

    @Autowired
    public ThreadLocks(AgentProperties properties) {
        this(properties.getCheckpoint().getLockStripes());
    }

    public ThreadLocks(int stripeCount) {
        if (stripeCount < 1) {
            throw new IllegalArgumentException("lock-stripes must be at least 1");
        }
        this.stripes = new ReentrantLock[stripeCount];
        for (int i = 0; i < stripeCount; i++) {
            stripes[i] = new ReentrantLock(true);
        }
    }

    public <T> T withLock(String threadId, Supplier<T> work) {
        ReentrantLock lock = stripeFor(threadId);
        lock.lock();
        try {
            return work.get();
        } finally {
            lock.unlock();
        }
    }

    ReentrantLock stripeFor(String threadId) {
        return stripes[Math.floorMod(threadId.hashCode(), stripes.length)];
    }
}
