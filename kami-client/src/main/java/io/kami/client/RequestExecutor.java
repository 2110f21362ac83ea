// SPDX-License-Identifier: MIT OR Apache-2.0
package io.kami.client;

import java.util.concurrent.CompletableFuture;

/**
 * Performs a single request against the chain service.
 *
 * <p>
 * Implementations produce a parsed {@link ResponseEnvelope} or fail the
 * returned future with:
 * <ul>
 * <li>{@link io.kami.core.error.TransportException} when the service could
 * not be reached (retryable);</li>
 * <li>{@link io.kami.core.error.ProtocolException} when the body is not an
 * envelope (not retried);</li>
 * <li>any other exception unchanged.</li>
 * </ul>
 * Implementations do not retry and do not inspect the envelope's
 * {@code error}; both are the job of {@link KamiRetry} and
 * {@link ResponseErrorClassifier}.
 *
 * <p><strong>Thread Safety:</strong> implementations must be thread-safe.
 *
 * @see HttpRequestExecutor
 */
public interface RequestExecutor extends AutoCloseable {

    /**
     * Sends a request.
     *
     * @param request the request
     * @return a future completing with the parsed envelope
     */
    CompletableFuture<ResponseEnvelope> execute(EndpointRequest request);

    /**
     * Releases pooled resources. Safe to call more than once.
     */
    @Override
    default void close() {
        // Default no-op for executors that hold no resources
    }
}
