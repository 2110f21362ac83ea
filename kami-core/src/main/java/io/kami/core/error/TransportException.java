// SPDX-License-Identifier: MIT OR Apache-2.0
package io.kami.core.error;

/**
 * Thrown when the chain service cannot be reached: connection refused,
 * timeout, DNS or TLS failure.
 *
 * <p>Transport failures are retried by the client's retry policy.
 *
 * @since 0.1.0
 */
public final class TransportException extends KamiException {

    private final String url;

    public TransportException(final String url, final Throwable cause) {
        super("Error connecting to Kami API at " + url + ": " + describe(cause), cause);
        this.url = url;
    }

    public String url() {
        return url;
    }

    private static String describe(final Throwable cause) {
        if (cause == null) {
            return "unknown cause";
        }
        final String message = cause.getMessage();
        return message == null || message.isBlank() ? cause.getClass().getSimpleName() : message;
    }
}
