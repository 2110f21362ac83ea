// SPDX-License-Identifier: MIT OR Apache-2.0
package io.kami.client.internal;

import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;

import org.junit.jupiter.api.Test;

class KamiExecutorsTest {

    @Test
    void runsOnNamedDaemonThreads() throws Exception {
        final ExecutorService executor = KamiExecutors.newIoBoundExecutor();
        try {
            final CompletableFuture<Thread> thread = CompletableFuture.supplyAsync(Thread::currentThread, executor);
            final Thread worker = thread.get();

            assertTrue(worker.isDaemon());
            assertTrue(worker.getName().startsWith("kami-io-"), worker.getName());
        } finally {
            executor.shutdown();
        }
    }
}
