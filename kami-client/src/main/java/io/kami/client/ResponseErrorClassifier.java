// SPDX-License-Identifier: MIT OR Apache-2.0
package io.kami.client;

import io.kami.core.error.ApiException;

/**
 * Converts "200 OK with an embedded failure" into a first-class error.
 *
 * <p>
 * Runs after a response was transported and parsed:
 * <ol>
 * <li>an {@code error} member that is present and truthy raises
 * {@link ApiException} with its message and, for structured errors, its
 * type;</li>
 * <li>otherwise a {@code statusCode} outside {@code [200, 299]} raises
 * {@code ApiException("HTTP error: {statusCode}")}, followed by the
 * envelope's message when it has one;</li>
 * <li>otherwise the envelope is returned unchanged.</li>
 * </ol>
 *
 * <p>
 * The raised exception is retryable: embedded failures are often transient,
 * such as the service still indexing the requested block.
 *
 * @since 0.1.0
 */
public final class ResponseErrorClassifier {

    private ResponseErrorClassifier() {
    }

    /**
     * Checks an envelope for embedded failures.
     *
     * @param envelope the parsed response
     * @return the same envelope when it carries no failure
     * @throws ApiException if the envelope reports an error or a bad status
     */
    public static ResponseEnvelope classify(final ResponseEnvelope envelope) {
        final ErrorField error = envelope.error();
        if (error.isPresent()) {
            throw new ApiException(error.message(), error.type());
        }
        final Integer status = envelope.statusCode();
        if (status != null && (status < 200 || status > 299)) {
            final String message = envelope.message();
            throw new ApiException(message == null || message.isEmpty()
                    ? "HTTP error: " + status
                    : "HTTP error: " + status + ": " + message);
        }
        return envelope;
    }
}
