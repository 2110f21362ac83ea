// SPDX-License-Identifier: MIT OR Apache-2.0
package io.kami.client;

import java.util.List;
import java.util.Objects;

/**
 * Inputs of the time-lock encryption that seals a weight commit.
 *
 * @param uids         destination uids
 * @param weights      weights, one per uid
 * @param versionKey   weights version key
 * @param tempo        subnet tempo in blocks
 * @param currentBlock block height the commit is bound to
 * @param netuid       target subnet
 * @param revealPeriod subnet reveal period, in epochs
 * @since 0.1.0
 */
public record TimelockRequest(
        List<Integer> uids,
        List<Integer> weights,
        long versionKey,
        int tempo,
        long currentBlock,
        int netuid,
        int revealPeriod) {

    public TimelockRequest {
        uids = List.copyOf(Objects.requireNonNull(uids, "uids"));
        weights = List.copyOf(Objects.requireNonNull(weights, "weights"));
    }
}
