// SPDX-License-Identifier: MIT OR Apache-2.0
package io.kami.client;

import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotSame;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

import org.junit.jupiter.api.Test;

class KamiSessionTest {

    private final KamiConfig config = KamiConfig.builder().build();

    @Test
    void poolIsCreatedLazilyAndReused() {
        try (KamiSession session = new KamiSession(config)) {
            assertFalse(session.isOpen());

            final KamiSession.Pool first = session.acquire();

            assertTrue(session.isOpen());
            assertSame(first, session.acquire());
        }
    }

    @Test
    void closeIsIdempotent() {
        final KamiSession session = new KamiSession(config);
        final KamiSession.Pool pool = session.acquire();

        session.close();
        session.close();

        assertFalse(session.isOpen());
        assertFalse(pool.isUsable());
    }

    @Test
    void acquireAfterCloseRecreatesPool() {
        try (KamiSession session = new KamiSession(config)) {
            final KamiSession.Pool first = session.acquire();
            session.close();

            final KamiSession.Pool second = session.acquire();

            assertNotSame(first, second);
            assertTrue(second.isUsable());
        }
    }

    @Test
    void concurrentAcquireSharesOnePool() throws Exception {
        final int threads = 16;
        final Set<KamiSession.Pool> seen = ConcurrentHashMap.newKeySet();
        final CountDownLatch start = new CountDownLatch(1);
        final ExecutorService callers = Executors.newFixedThreadPool(threads);
        try (KamiSession session = new KamiSession(config)) {
            for (int i = 0; i < threads; i++) {
                callers.submit(() -> {
                    start.await();
                    seen.add(session.acquire());
                    return null;
                });
            }
            start.countDown();
            callers.shutdown();
            assertTrue(callers.awaitTermination(10, TimeUnit.SECONDS));

            assertTrue(seen.size() == 1, "pools seen: " + seen.size());
        } finally {
            callers.shutdownNow();
        }
    }
}
