// SPDX-License-Identifier: MIT OR Apache-2.0
package io.kami.client;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import org.junit.jupiter.api.Test;

class EncryptedCommitTest {

    @Test
    void completeOnlyWithBytesAndRound() {
        assertTrue(new EncryptedCommit(new byte[] {1}, 5L).isComplete());
        assertFalse(new EncryptedCommit(null, 5L).isComplete());
        assertFalse(new EncryptedCommit(new byte[0], 5L).isComplete());
        assertFalse(new EncryptedCommit(new byte[] {1}, 0L).isComplete());
    }

    @Test
    void copiesBytesAndComparesByContent() {
        final byte[] bytes = {1, 2};
        final EncryptedCommit commit = new EncryptedCommit(bytes, 5L);
        bytes[0] = 9;

        assertEquals(1, commit.commit()[0]);
        assertEquals(new EncryptedCommit(new byte[] {1, 2}, 5L), commit);
        assertEquals(new EncryptedCommit(new byte[] {1, 2}, 5L).hashCode(), commit.hashCode());
    }
}
