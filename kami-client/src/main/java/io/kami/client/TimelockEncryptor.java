// SPDX-License-Identifier: MIT OR Apache-2.0
package io.kami.client;

/**
 * Time-lock encryption primitive used by commit-reveal weight submission.
 *
 * <p>
 * Implementations encrypt the weights so they can only be decrypted once the
 * returned reveal round is reached. The client treats the primitive as
 * side-effect free; it is supplied by the caller through
 * {@link KamiClient.Builder#timelockEncryptor(TimelockEncryptor)}.
 *
 * @since 0.1.0
 */
@FunctionalInterface
public interface TimelockEncryptor {

    /**
     * Seals a set of weights.
     *
     * @param request the weights and the subnet timing they are bound to
     * @return the encrypted commit and its reveal round
     */
    EncryptedCommit encrypt(TimelockRequest request);
}
