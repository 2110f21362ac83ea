// SPDX-License-Identifier: MIT OR Apache-2.0
package io.kami.client;

import java.time.Duration;
import java.util.Objects;

/**
 * Configuration for request retry with exponential backoff.
 *
 * <p>This record holds the retry ceiling and the backoff schedule:
 * <ul>
 *   <li>{@code maxAttempts} - total attempts including the first (default: 10)</li>
 *   <li>{@code multiplier} - growth factor between waits (default: 1.5)</li>
 *   <li>{@code minWait} - first and smallest wait (default: 1s)</li>
 *   <li>{@code maxWait} - cap on any single wait (default: 10s)</li>
 * </ul>
 *
 * <p><strong>Backoff Formula:</strong>
 * <pre>
 *   wait(attempt) = min(maxWait, max(minWait, minWait * multiplier^(attempt-1)))
 * </pre>
 * where {@code attempt} is the number of the attempt that just failed,
 * starting at 1. With the defaults the waits are 1s, 1.5s, 2.25s, 3.375s,
 * ... capped at 10s, so the worst case for one call is about
 * {@code maxAttempts * maxWait}.
 *
 * <p><strong>Example:</strong>
 * <pre>{@code
 * KamiRetryConfig quick = KamiRetryConfig.builder()
 *     .maxAttempts(3)
 *     .minWait(Duration.ofMillis(100))
 *     .maxWait(Duration.ofSeconds(1))
 *     .build();
 * }</pre>
 *
 * @param maxAttempts total number of attempts (must be &gt;= 1)
 * @param multiplier  backoff growth factor (must be &gt;= 1.0)
 * @param minWait     smallest wait (must be positive)
 * @param maxWait     largest wait (must be &gt;= minWait)
 * @see KamiRetry
 * @since 0.1.0
 */
public record KamiRetryConfig(
        int maxAttempts,
        double multiplier,
        Duration minWait,
        Duration maxWait) {

    /** Default attempt ceiling: 10. */
    public static final int DEFAULT_MAX_ATTEMPTS = 10;

    /** Default backoff multiplier: 1.5. */
    public static final double DEFAULT_MULTIPLIER = 1.5;

    /** Default minimum wait: 1s. */
    public static final Duration DEFAULT_MIN_WAIT = Duration.ofSeconds(1);

    /** Default maximum wait: 10s. */
    public static final Duration DEFAULT_MAX_WAIT = Duration.ofSeconds(10);

    /**
     * Canonical constructor with validation.
     *
     * @throws IllegalArgumentException if any parameter is invalid
     */
    public KamiRetryConfig {
        Objects.requireNonNull(minWait, "minWait");
        Objects.requireNonNull(maxWait, "maxWait");
        if (maxAttempts < 1) {
            throw new IllegalArgumentException("maxAttempts must be >= 1, got: " + maxAttempts);
        }
        if (multiplier < 1.0 || Double.isNaN(multiplier)) {
            throw new IllegalArgumentException("multiplier must be >= 1.0, got: " + multiplier);
        }
        if (minWait.isNegative() || minWait.isZero()) {
            throw new IllegalArgumentException("minWait must be positive, got: " + minWait);
        }
        if (maxWait.compareTo(minWait) < 0) {
            throw new IllegalArgumentException(
                    "maxWait must be >= minWait, got: " + maxWait + " < " + minWait);
        }
    }

    /**
     * Returns the default configuration.
     *
     * @return 10 attempts, multiplier 1.5, waits between 1s and 10s
     */
    public static KamiRetryConfig defaults() {
        return new KamiRetryConfig(DEFAULT_MAX_ATTEMPTS, DEFAULT_MULTIPLIER, DEFAULT_MIN_WAIT, DEFAULT_MAX_WAIT);
    }

    /**
     * Creates a new builder initialized with default values.
     *
     * @return a new builder
     */
    public static Builder builder() {
        return new Builder();
    }

    /**
     * Computes the wait after the given failed attempt.
     *
     * @param attempt number of the attempt that failed, starting at 1
     * @return the wait before the next attempt
     * @throws IllegalArgumentException if {@code attempt < 1}
     */
    public Duration backoff(final int attempt) {
        if (attempt < 1) {
            throw new IllegalArgumentException("attempt must be >= 1, got: " + attempt);
        }
        final double minNanos = minWait.toNanos();
        final double grown = minNanos * Math.pow(multiplier, attempt - 1);
        final double bounded = Math.min(maxWait.toNanos(), Math.max(minNanos, grown));
        return Duration.ofNanos(Math.round(bounded));
    }

    /**
     * Builder for {@link KamiRetryConfig}. All values start at their defaults.
     */
    public static final class Builder {
        private int maxAttempts = DEFAULT_MAX_ATTEMPTS;
        private double multiplier = DEFAULT_MULTIPLIER;
        private Duration minWait = DEFAULT_MIN_WAIT;
        private Duration maxWait = DEFAULT_MAX_WAIT;

        private Builder() {}

        public Builder maxAttempts(final int maxAttempts) {
            this.maxAttempts = maxAttempts;
            return this;
        }

        public Builder multiplier(final double multiplier) {
            this.multiplier = multiplier;
            return this;
        }

        public Builder minWait(final Duration minWait) {
            this.minWait = minWait;
            return this;
        }

        public Builder maxWait(final Duration maxWait) {
            this.maxWait = maxWait;
            return this;
        }

        /**
         * Builds the configuration.
         *
         * @return new immutable {@link KamiRetryConfig}
         * @throws IllegalArgumentException if any parameter is invalid
         */
        public KamiRetryConfig build() {
            return new KamiRetryConfig(maxAttempts, multiplier, minWait, maxWait);
        }
    }
}
