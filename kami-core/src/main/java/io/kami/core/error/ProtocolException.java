// SPDX-License-Identifier: MIT OR Apache-2.0
package io.kami.core.error;

import org.jspecify.annotations.Nullable;

/**
 * Thrown when a response body does not have the expected shape.
 *
 * <p>A malformed body will not fix itself by resending the request, so
 * protocol failures are never retried.
 *
 * @since 0.1.0
 */
public final class ProtocolException extends KamiException {

    private final @Nullable String body;

    public ProtocolException(final String message, final @Nullable String body, final Throwable cause) {
        super(message, cause);
        this.body = body;
    }

    public ProtocolException(final String message) {
        super(message);
        this.body = null;
    }

    /**
     * Returns the raw response body that failed to parse, if it was captured.
     *
     * @return the body, or {@code null}
     */
    public @Nullable String body() {
        return body;
    }
}
