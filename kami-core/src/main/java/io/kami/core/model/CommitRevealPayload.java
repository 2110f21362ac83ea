// SPDX-License-Identifier: MIT OR Apache-2.0
package io.kami.core.model;

/**
 * Encrypted weight commit for a commit-reveal subnet.
 *
 * @param netuid      target subnet
 * @param commit      time-lock encrypted weights, lowercase hex without prefix
 * @param revealRound round at which the commit becomes decryptable
 */
public record CommitRevealPayload(int netuid, String commit, long revealRound) {
}
