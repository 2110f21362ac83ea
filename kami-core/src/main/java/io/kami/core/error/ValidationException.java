// SPDX-License-Identifier: MIT OR Apache-2.0
package io.kami.core.error;

/**
 * Thrown when caller-supplied input fails a precondition, or when a derived
 * value (such as an encrypted weight commit) comes back empty.
 *
 * @since 0.1.0
 */
public final class ValidationException extends KamiException {

    public ValidationException(final String message) {
        super(message);
    }

    public ValidationException(final String message, final Throwable cause) {
        super(message, cause);
    }

    /**
     * Signature passed to a verification call lacks the {@code 0x} prefix.
     */
    public static ValidationException signatureNotHex(final String signature) {
        return new ValidationException(
                "Expected signature to be a 0x-prefixed hex string, got: " + signature);
    }

    /**
     * Time-lock encryption produced no commit or no reveal round.
     */
    public static ValidationException emptyCommit(final int netuid) {
        return new ValidationException(
                "Failed to generate commit for reveal on netuid %d. Ensure that tempo and reveal period are set correctly."
                        .formatted(netuid));
    }
}
