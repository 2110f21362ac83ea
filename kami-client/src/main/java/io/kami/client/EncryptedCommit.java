// SPDX-License-Identifier: MIT OR Apache-2.0
package io.kami.client;

import java.util.Arrays;

import org.jspecify.annotations.Nullable;

/**
 * Output of the time-lock encryption: the sealed weights and the round at
 * which they become decryptable.
 *
 * @param commit      encrypted commit bytes, or {@code null} if none was produced
 * @param revealRound target reveal round, {@code 0} if none was produced
 * @since 0.1.0
 */
public record EncryptedCommit(byte @Nullable [] commit, long revealRound) {

    public EncryptedCommit {
        commit = commit == null ? null : commit.clone();
    }

    /**
     * Returns a copy of the commit bytes.
     */
    @Override
    public byte @Nullable [] commit() {
        return commit == null ? null : commit.clone();
    }

    /**
     * Returns whether both a non-empty commit and a non-zero reveal round were produced.
     */
    public boolean isComplete() {
        return commit != null && commit.length > 0 && revealRound != 0;
    }

    @Override
    public boolean equals(final Object o) {
        return o instanceof EncryptedCommit other
                && revealRound == other.revealRound
                && Arrays.equals(commit, other.commit);
    }

    @Override
    public int hashCode() {
        return 31 * Arrays.hashCode(commit) + Long.hashCode(revealRound);
    }

    @Override
    public String toString() {
        return "EncryptedCommit{commitBytes=" + (commit == null ? 0 : commit.length)
                + ", revealRound=" + revealRound + "}";
    }
}
