// SPDX-License-Identifier: MIT OR Apache-2.0
package io.kami.client.internal;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.concurrent.CompletableFuture;

/**
 * Counting semaphore whose acquire never blocks a thread.
 *
 * <p>
 * {@link #acquire()} returns an already-completed future while permits are
 * available. Past the limit it returns a pending future that completes, in
 * FIFO order, when {@link #release()} hands a permit over. Callers queue
 * instead of failing.
 *
 * <p><strong>Thread Safety:</strong> all state is guarded by {@code this};
 * waiter futures are completed outside the lock.
 */
public final class AsyncPermits {

    private final int limit;
    private final Deque<CompletableFuture<Void>> waiters = new ArrayDeque<>();
    private int available;

    public AsyncPermits(final int limit) {
        if (limit < 1) {
            throw new IllegalArgumentException("limit must be >= 1, got: " + limit);
        }
        this.limit = limit;
        this.available = limit;
    }

    public CompletableFuture<Void> acquire() {
        synchronized (this) {
            if (available > 0) {
                available--;
                return CompletableFuture.completedFuture(null);
            }
            final CompletableFuture<Void> waiter = new CompletableFuture<>();
            waiters.addLast(waiter);
            return waiter;
        }
    }

    public void release() {
        CompletableFuture<Void> next;
        synchronized (this) {
            next = waiters.pollFirst();
            // A cancelled waiter gave up its place; the permit goes to the next one.
            while (next != null && next.isDone()) {
                next = waiters.pollFirst();
            }
            if (next == null) {
                if (available >= limit) {
                    throw new IllegalStateException("release without matching acquire");
                }
                available++;
                return;
            }
        }
        next.complete(null);
    }

    public synchronized int available() {
        return available;
    }

    public synchronized int queued() {
        return waiters.size();
    }
}
