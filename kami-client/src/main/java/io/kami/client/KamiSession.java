// SPDX-License-Identifier: MIT OR Apache-2.0
package io.kami.client;

import java.net.http.HttpClient;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReference;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import io.kami.client.internal.ConnectionGate;
import io.kami.client.internal.KamiExecutors;

/**
 * Pooled connection context shared by every request of one client.
 *
 * <p>
 * The underlying {@link HttpClient} keeps connections alive between requests
 * and evicts idle ones on its own. The session adds a {@link ConnectionGate}
 * that bounds in-flight requests (256 in total, 10 per host by default).
 *
 * <p><strong>Lifecycle:</strong>
 * <ul>
 * <li>The pool is created lazily by the first {@link #acquire()}.</li>
 * <li>Later calls reuse it.</li>
 * <li>After {@link #close()}, or if the pool was invalidated, the next
 * {@link #acquire()} transparently creates a fresh one.</li>
 * </ul>
 *
 * <p>
 * <strong>Thread Safety:</strong> the current pool is held in an
 * {@link AtomicReference} and replaced with compare-and-exchange, so
 * concurrent callers agree on one pool. Requests already in flight keep the
 * pool they started with. {@link #close()} is idempotent, never throws, and
 * is safe under concurrent teardown: only the caller that detaches a pool
 * shuts it down.
 *
 * @since 0.1.0
 */
public final class KamiSession implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(KamiSession.class);

    private final KamiConfig config;
    private final AtomicReference<Pool> current = new AtomicReference<>();

    public KamiSession(final KamiConfig config) {
        this.config = config;
    }

    /**
     * Returns a live pool, creating one if none exists or the current one was closed.
     *
     * @return the pool to send the next request through
     */
    Pool acquire() {
        // Loop handles another thread closing the pool between the checks
        while (true) {
            final Pool pool = current.get();
            if (pool != null && pool.isUsable()) {
                return pool;
            }
            final Pool fresh = new Pool(config);
            final Pool witness = current.compareAndExchange(pool, fresh);
            if (witness == pool) {
                if (pool != null) {
                    log.debug("Replacing invalidated Kami connection pool");
                    pool.shutdown();
                }
                return fresh;
            }
            // Another thread won the race, discard ours
            fresh.shutdown();
            if (witness != null && witness.isUsable()) {
                return witness;
            }
        }
    }

    /**
     * Returns whether a live pool currently exists.
     */
    public boolean isOpen() {
        final Pool pool = current.get();
        return pool != null && pool.isUsable();
    }

    /**
     * Releases the pooled connections. Safe to call when no pool exists, when
     * already closed, and from several threads at once.
     */
    @Override
    public void close() {
        final Pool pool = current.getAndSet(null);
        if (pool != null) {
            pool.shutdown();
        }
    }

    /**
     * One generation of pooled resources.
     */
    static final class Pool {
        private final HttpClient http;
        private final ExecutorService executor;
        private final ConnectionGate gate;
        private final AtomicBoolean closed = new AtomicBoolean(false);

        private Pool(final KamiConfig config) {
            this.executor = KamiExecutors.newIoBoundExecutor();
            this.http = HttpClient.newBuilder()
                    .executor(executor)
                    .connectTimeout(config.connectTimeout())
                    .version(HttpClient.Version.HTTP_1_1)
                    .build();
            this.gate = new ConnectionGate(config.maxConnections(), config.maxConnectionsPerHost());
        }

        HttpClient http() {
            return http;
        }

        ConnectionGate gate() {
            return gate;
        }

        boolean isUsable() {
            return !closed.get() && !executor.isShutdown();
        }

        void shutdown() {
            if (!closed.compareAndSet(false, true)) {
                return;
            }
            try {
                // In-flight exchanges finish; the client falls back to its own pool for late callbacks.
                executor.shutdown();
            } catch (RuntimeException e) {
                log.warn("Error shutting down Kami connection pool", e);
            }
        }
    }
}
