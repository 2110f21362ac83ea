// SPDX-License-Identifier: MIT OR Apache-2.0
package io.kami.core.error;

/**
 * Base runtime exception for all Kami client failures.
 *
 * <p>
 * This sealed class forms the root of the client's exception hierarchy, so
 * every Kami failure can be caught with a single catch clause while the
 * concrete subtypes tell callers whether a failure is worth retrying.
 *
 * <p>
 * <strong>Exception Hierarchy:</strong>
 * <pre>
 * KamiException
 * ├── {@link TransportException} - connection, timeout, DNS or TLS failure (retryable)
 * ├── {@link ProtocolException} - body did not parse as the expected shape (not retried)
 * ├── {@link ApiException} - embedded application error or bad status (retryable)
 * ├── {@link ConfigurationException} - invalid or missing configuration
 * └── {@link ValidationException} - caller input failed a precondition
 * </pre>
 *
 * <p>
 * <strong>Usage:</strong>
 *
 * <pre>{@code
 * try {
 *     client.setWeights(payload);
 * } catch (ApiException e) {
 *     // The chain service answered with an error
 * } catch (TransportException e) {
 *     // The chain service could not be reached
 * } catch (KamiException e) {
 *     // Any other Kami failure
 * }
 * }</pre>
 *
 * @since 0.1.0
 */
public sealed class KamiException extends RuntimeException
        permits TransportException,
        ProtocolException,
        ApiException,
        ConfigurationException,
        ValidationException {

    public KamiException(final String message) {
        super(message);
    }

    public KamiException(final String message, final Throwable cause) {
        super(message, cause);
    }
}
