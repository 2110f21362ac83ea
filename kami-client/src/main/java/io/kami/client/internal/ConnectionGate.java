// SPDX-License-Identifier: MIT OR Apache-2.0
package io.kami.client.internal;

import java.util.Locale;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

/**
 * Bounds the number of in-flight requests, in total and per destination host.
 *
 * <p>
 * A request first takes a global permit, then a permit for its host, and
 * gives both back through {@link Permit#release()} once the exchange is over.
 * Every caller takes the permits in the same order, so two limits cannot
 * deadlock each other.
 */
public final class ConnectionGate {

    private final AsyncPermits total;
    private final int perHostLimit;
    private final ConcurrentMap<String, AsyncPermits> perHost = new ConcurrentHashMap<>();

    public ConnectionGate(final int totalLimit, final int perHostLimit) {
        this.total = new AsyncPermits(totalLimit);
        if (perHostLimit < 1) {
            throw new IllegalArgumentException("perHostLimit must be >= 1, got: " + perHostLimit);
        }
        this.perHostLimit = perHostLimit;
    }

    /**
     * Waits, without blocking, for a connection slot to {@code host}.
     *
     * @param host destination host
     * @return a future completing with the acquired permit
     */
    public CompletableFuture<Permit> acquire(final String host) {
        final AsyncPermits hostPermits = perHost.computeIfAbsent(
                host.toLowerCase(Locale.ROOT), ignored -> new AsyncPermits(perHostLimit));
        return total.acquire()
                .thenCompose(ignored -> hostPermits.acquire())
                .thenApply(ignored -> new Permit(hostPermits));
    }

    AsyncPermits total() {
        return total;
    }

    /**
     * A held connection slot. Releasing twice is a no-op.
     */
    public final class Permit {
        private final AsyncPermits hostPermits;
        private boolean released;

        private Permit(final AsyncPermits hostPermits) {
            this.hostPermits = hostPermits;
        }

        public void release() {
            synchronized (this) {
                if (released) {
                    return;
                }
                released = true;
            }
            hostPermits.release();
            total.release();
        }
    }
}
