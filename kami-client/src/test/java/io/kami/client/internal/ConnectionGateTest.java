// SPDX-License-Identifier: MIT OR Apache-2.0
package io.kami.client.internal;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.concurrent.CompletableFuture;

import org.junit.jupiter.api.Test;

class ConnectionGateTest {

    @Test
    void perHostLimitQueuesCallers() {
        final ConnectionGate gate = new ConnectionGate(256, 2);

        final ConnectionGate.Permit a = gate.acquire("localhost").join();
        gate.acquire("LOCALHOST").join();
        final CompletableFuture<ConnectionGate.Permit> waiting = gate.acquire("localhost");

        assertFalse(waiting.isDone());
        assertTrue(gate.acquire("other-host").isDone());

        a.release();
        assertTrue(waiting.isDone());
    }

    @Test
    void totalLimitSpansHosts() {
        final ConnectionGate gate = new ConnectionGate(2, 10);

        final ConnectionGate.Permit a = gate.acquire("a").join();
        gate.acquire("b").join();
        final CompletableFuture<ConnectionGate.Permit> waiting = gate.acquire("c");

        assertFalse(waiting.isDone());
        a.release();
        assertTrue(waiting.isDone());
    }

    @Test
    void releaseIsIdempotent() {
        final ConnectionGate gate = new ConnectionGate(1, 1);
        final ConnectionGate.Permit permit = gate.acquire("localhost").join();

        permit.release();
        permit.release();

        assertEquals(1, gate.total().available());
    }
}
