package com.deepansh.graphagent.checkpoint;

import com.deepansh.graphagent.config.AgentProperties;
import org.junit.jupiter.api.Test;
import org.springframework.context.annotation.AnnotationConfigApplicationContext;

import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ThreadLocksTest {

    @Test
    void withLock_sameThreadId_runsTurnsOneAtATime() throws Exception {
        ThreadLocks locks = new ThreadLocks(8);
        AtomicInteger active = new AtomicInteger();
        AtomicInteger maxActive = new AtomicInteger();
        CountDownLatch start = new CountDownLatch(1);
        ExecutorService pool = Executors.newFixedThreadPool(4);

        try {
            Future<?>[] futures = new Future<?>[4];
            for (int i = 0; i < futures.length; i++) {
                futures[i] = pool.submit(() -> {
                    start.await();
                    return locks.withLock("t1", () -> {
                        maxActive.accumulateAndGet(active.incrementAndGet(), Math::max);
                        sleep(20);
                        return active.decrementAndGet();
                    });
                });
            }
            start.countDown();
            for (Future<?> f : futures) {
                f.get(5, TimeUnit.SECONDS);
            }
        } finally {
            pool.shutdownNow();
        }

        assertThat(maxActive.get()).isEqualTo(1);
    }

    @Test
    void withLock_releasesLockWhenWorkThrows() {
        ThreadLocks locks = new ThreadLocks(1);

        assertThatThrownBy(() -> locks.withLock("t1", () -> {
            throw new IllegalStateException("boom");
        })).isInstanceOf(IllegalStateException.class);

        assertThat(locks.stripeFor("t1").isLocked()).isFalse();
        assertThat(locks.withLock("t2", () -> "ok")).isEqualTo("ok");
    }

    @Test
    void springContext_buildsBeanFromAgentProperties() {
        try (AnnotationConfigApplicationContext context = new AnnotationConfigApplicationContext()) {
            AgentProperties properties = new AgentProperties();
            properties.getCheckpoint().setLockStripes(4);
            context.registerBean(AgentProperties.class, () -> properties);
            context.register(ThreadLocks.class);
            context.refresh();

            ThreadLocks locks = context.getBean(ThreadLocks.class);

            assertThat(locks.withLock("t1", () -> "ok")).isEqualTo("ok");
            assertThat(locks.stripeFor("t1")).isSameAs(locks.stripeFor("t1"));
        }
    }

    @Test
    void constructor_rejectsZeroStripes() {
        assertThatThrownBy(() -> new ThreadLocks(0)).isInstanceOf(IllegalArgumentException.class);
    }

    private static void sleep(long millis) {
        try {
            Thread.sleep(millis);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }
}
