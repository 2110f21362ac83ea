// SPDX-License-Identifier: MIT OR Apache-2.0
package io.kami.client.internal;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.concurrent.CompletableFuture;

import org.junit.jupiter.api.Test;

class AsyncPermitsTest {

    @Test
    void grantsUpToLimitThenQueues() {
        final AsyncPermits permits = new AsyncPermits(2);

        assertTrue(permits.acquire().isDone());
        assertTrue(permits.acquire().isDone());
        final CompletableFuture<Void> third = permits.acquire();

        assertFalse(third.isDone());
        assertEquals(0, permits.available());
        assertEquals(1, permits.queued());
    }

    @Test
    void releaseHandsPermitToWaitersInOrder() {
        final AsyncPermits permits = new AsyncPermits(1);
        permits.acquire();
        final CompletableFuture<Void> first = permits.acquire();
        final CompletableFuture<Void> second = permits.acquire();

        permits.release();

        assertTrue(first.isDone());
        assertFalse(second.isDone());

        permits.release();
        assertTrue(second.isDone());

        permits.release();
        assertEquals(1, permits.available());
    }

    @Test
    void cancelledWaiterIsSkipped() {
        final AsyncPermits permits = new AsyncPermits(1);
        permits.acquire();
        final CompletableFuture<Void> cancelled = permits.acquire();
        final CompletableFuture<Void> next = permits.acquire();
        cancelled.cancel(false);

        permits.release();

        assertTrue(next.isDone());
        assertFalse(next.isCompletedExceptionally());
    }

    @Test
    void releaseWithoutAcquireFails() {
        final AsyncPermits permits = new AsyncPermits(1);

        assertThrows(IllegalStateException.class, permits::release);
    }

    @Test
    void rejectsNonPositiveLimit() {
        assertThrows(IllegalArgumentException.class, () -> new AsyncPermits(0));
    }
}
