package com.security.anomaly.engine;

import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class KeyedLocksTest {

    @Test
    void withLocks_nullKeysAreSkipped() {
        KeyedLocks locks = new KeyedLocks();

        assertThat(locks.withLocks(() -> "done", null, "user:alice", null)).isEqualTo("done");
    }

    @Test
    void withLocks_opposingKeyOrder_doesNotDeadlock() throws Exception {
        KeyedLocks locks = new KeyedLocks();
        ExecutorService pool = Executors.newFixedThreadPool(4);
        CountDownLatch start = new CountDownLatch(1);
        int[] counter = {0};
        List<Future<?>> futures = new ArrayList<>();
        try {
            for (int t = 0; t < 4; t++) {
                boolean reversed = t % 2 == 0;
                futures.add(pool.submit(() -> {
                    start.await();
                    for (int i = 0; i < 1000; i++) {
                        if (reversed) {
                            locks.withLocks(() -> counter[0]++, "ip:10.0.0.1", "user:alice");
                        } else {
                            locks.withLocks(() -> counter[0]++, "user:alice", "ip:10.0.0.1");
                        }
                    }
                    return null;
                }));
            }
            start.countDown();
            for (Future<?> future : futures) {
                future.get(10, TimeUnit.SECONDS);
            }
        } finally {
            pool.shutdownNow();
        }

        assertThat(counter[0]).isEqualTo(4000);
    }

    @Test
    void withLocks_heldKey_doesNotBlockOtherKeys() throws Exception {
        KeyedLocks locks = new KeyedLocks();
        ExecutorService pool = Executors.newFixedThreadPool(2);
        CountDownLatch aliceHeld = new CountDownLatch(1);
        CountDownLatch releaseAlice = new CountDownLatch(1);
        try {
            Future<?> holder = pool.submit(() -> locks.withLocks(() -> {
                aliceHeld.countDown();
                try {
                    releaseAlice.await(5, TimeUnit.SECONDS);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                }
                return null;
            }, "user:alice"));
            assertThat(aliceHeld.await(5, TimeUnit.SECONDS)).isTrue();

            // every other key gets through while alice is held
            List<Future<String>> others = new ArrayList<>();
            for (int i = 0; i < 500; i++) {
                String key = "user:other-" + i;
                others.add(pool.submit(() -> locks.withLocks(() -> key, key)));
            }
            for (Future<String> other : others) {
                assertThat(other.get(5, TimeUnit.SECONDS)).startsWith("user:other-");
            }

            releaseAlice.countDown();
            holder.get(5, TimeUnit.SECONDS);
        } finally {
            pool.shutdownNow();
        }
    }

    @Test
    void withLocks_releasedKeys_areForgotten() {
        KeyedLocks locks = new KeyedLocks();

        locks.withLocks(() -> null, "user:alice", "ip:10.0.0.1", "endpoint:/login");

        assertThat(locks.activeKeys()).isZero();
    }

    @Test
    void withLocks_sameThreadReentry_isAllowed() {
        KeyedLocks locks = new KeyedLocks();

        String result = locks.withLocks(() -> locks.withLocks(() -> "inner", "user:alice"), "user:alice");

        assertThat(result).isEqualTo("inner");
        assertThat(locks.activeKeys()).isZero();
    }

    @Test
    void withLocks_actionThrows_releasesEverything() {
        KeyedLocks locks = new KeyedLocks();

        assertThatThrownBy(() -> locks.withLocks(() -> {
            throw new IllegalStateException("boom");
        }, "user:alice", "ip:10.0.0.1")).isInstanceOf(IllegalStateException.class);

        assertThat(locks.activeKeys()).isZero();
    }
}
