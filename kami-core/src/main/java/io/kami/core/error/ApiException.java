// SPDX-License-Identifier: MIT OR Apache-2.0
package io.kami.core.error;

import org.jspecify.annotations.Nullable;

/**
 * Thrown when the chain service answers successfully at the transport level
 * but the response envelope carries an application error or an out-of-range
 * status code.
 *
 * <p>
 * Embedded failures are frequently transient (for example, the service is
 * still indexing a block), so the retry policy treats this exception as
 * retryable.
 *
 * @since 0.1.0
 */
public final class ApiException extends KamiException {

    private final String errorMessage;
    private final @Nullable String errorType;

    public ApiException(final String errorMessage, final @Nullable String errorType) {
        super(format(errorMessage, errorType));
        this.errorMessage = errorMessage;
        this.errorType = errorType;
    }

    public ApiException(final String errorMessage) {
        this(errorMessage, null);
    }

    /**
     * Returns the error message reported by the service.
     *
     * @return the message without the type prefix
     */
    public String errorMessage() {
        return errorMessage;
    }

    /**
     * Returns the error type tag when the service reported a structured error.
     *
     * @return the type tag, or {@code null}
     */
    public @Nullable String errorType() {
        return errorType;
    }

    private static String format(final String errorMessage, final @Nullable String errorType) {
        if (errorType == null || errorType.isEmpty()) {
            return "Kami API error: " + errorMessage;
        }
        return "Kami API error (type: " + errorType + "): " + errorMessage;
    }
}
