// SPDX-License-Identifier: MIT OR Apache-2.0
package io.kami.client.internal;

import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Factory for the executor that runs HTTP client callbacks.
 */
public final class KamiExecutors {

    /**
     * Counter for unique I/O thread names.
     */
    private static final AtomicInteger IO_THREAD_ID = new AtomicInteger(0);

    private KamiExecutors() {
        // Utility class
    }

    /**
     * Creates an executor for I/O-bound callbacks.
     *
     * <p>
     * Threads are created on demand, reused while busy, and reclaimed after a
     * minute of idleness. They are daemons named {@code kami-io-N} so an
     * unclosed client never keeps the JVM alive.
     *
     * @return a cached thread pool of daemon threads
     */
    public static ExecutorService newIoBoundExecutor() {
        return Executors.newCachedThreadPool(r -> {
            // Mask off sign bit to ensure non-negative thread IDs even after integer overflow
            final int id = IO_THREAD_ID.getAndIncrement() & 0x7FFFFFFF;
            final Thread t = new Thread(r, "kami-io-" + id);
            t.setDaemon(true);
            return t;
        });
    }
}
