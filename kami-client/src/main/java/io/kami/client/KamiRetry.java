// SPDX-License-Identifier: MIT OR Apache-2.0
package io.kami.client;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.function.Predicate;
import java.util.function.Supplier;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import io.kami.core.DebugLogger;
import io.kami.core.LogFormatter;
import io.kami.core.error.ApiException;
import io.kami.core.error.TransportException;

/**
 * Retry policy for chain service calls with exponential backoff.
 *
 * <p>
 * A policy is built from a {@link KamiRetryConfig} (attempt ceiling and
 * backoff schedule) and a predicate deciding which failures are worth
 * another attempt. The default predicate retries:
 * <ul>
 * <li>✅ {@link TransportException} - connection refused, timeout, DNS, TLS</li>
 * <li>✅ {@link ApiException} - embedded errors and bad status codes, often
 * transient while the service is indexing</li>
 * <li>❌ everything else, notably {@code ProtocolException},
 * {@code ConfigurationException} and {@code ValidationException}</li>
 * </ul>
 *
 * <p>
 * <strong>Backoff:</strong> after failed attempt {@code n} the policy waits
 * {@link KamiRetryConfig#backoff(int)}, logging a WARN line first. The wait is
 * a delayed future, so a call that is backing off holds no thread.
 *
 * <p>
 * <strong>Exhaustion:</strong> when the last attempt fails, that failure is
 * surfaced unchanged, with the earlier failures attached as suppressed
 * exceptions in attempt order, and an ERROR line is logged. Non-retryable
 * failures are surfaced (and logged) on the attempt that raised them.
 *
 * <pre>{@code
 * KamiRetry retry = new KamiRetry(KamiRetryConfig.defaults());
 * CompletableFuture<ResponseEnvelope> envelope = retry.run("chain/latest-block",
 *         () -> executor.execute(request).thenApply(ResponseErrorClassifier::classify));
 * }</pre>
 *
 * @since 0.1.0
 */
public final class KamiRetry {

    private static final Logger log = LoggerFactory.getLogger(KamiRetry.class);

    /**
     * Schedules the pause between attempts.
     */
    @FunctionalInterface
    interface DelayScheduler {
        CompletableFuture<Void> delay(Duration wait);
    }

    private static final DelayScheduler DEFAULT_SCHEDULER = wait -> CompletableFuture.runAsync(
            () -> { },
            CompletableFuture.delayedExecutor(wait.toNanos(), TimeUnit.NANOSECONDS));

    private final KamiRetryConfig config;
    private final Predicate<Throwable> retryable;
    private final DelayScheduler scheduler;

    public KamiRetry(final KamiRetryConfig config) {
        this(config, KamiRetry::isRetryable);
    }

    public KamiRetry(final KamiRetryConfig config, final Predicate<Throwable> retryable) {
        this(config, retryable, DEFAULT_SCHEDULER);
    }

    KamiRetry(final KamiRetryConfig config, final Predicate<Throwable> retryable, final DelayScheduler scheduler) {
        this.config = Objects.requireNonNull(config, "config");
        this.retryable = Objects.requireNonNull(retryable, "retryable");
        this.scheduler = Objects.requireNonNull(scheduler, "scheduler");
    }

    /**
     * Default retry predicate: transport and API failures.
     *
     * @param error the failure of an attempt
     * @return whether another attempt may succeed
     */
    public static boolean isRetryable(final Throwable error) {
        return error instanceof TransportException || error instanceof ApiException;
    }

    public KamiRetryConfig config() {
        return config;
    }

    /**
     * Runs {@code action} until it succeeds, fails with a non-retryable
     * error, or the attempt ceiling is reached.
     *
     * @param <T>       the result type
     * @param operation name used in log lines, typically the endpoint path
     * @param action    starts one attempt; invoked once per attempt
     * @return a future completing with the first successful result or the final failure
     */
    public <T> CompletableFuture<T> run(final String operation, final Supplier<CompletableFuture<T>> action) {
        Objects.requireNonNull(action, "action");
        final CompletableFuture<T> result = new CompletableFuture<>();
        attempt(operation, action, 1, new ArrayList<>(), result);
        return result;
    }

    private <T> void attempt(
            final String operation,
            final Supplier<CompletableFuture<T>> action,
            final int attempt,
            final List<Throwable> failures,
            final CompletableFuture<T> result) {
        CompletableFuture<T> stage;
        try {
            stage = Objects.requireNonNull(action.get(), "action returned null");
        } catch (RuntimeException e) {
            stage = CompletableFuture.failedFuture(e);
        }

        stage.whenComplete((value, error) -> {
            if (error == null) {
                result.complete(value);
                return;
            }
            final Throwable cause = unwrap(error);
            if (!retryable.test(cause)) {
                log.error("{} failed with non-retryable error on attempt {}: {}", operation, attempt, cause.toString());
                result.completeExceptionally(cause);
                return;
            }
            if (attempt >= config.maxAttempts()) {
                attachEarlierFailures(cause, failures);
                log.error("{} failed after {} attempts: {}", operation, attempt, cause.toString());
                result.completeExceptionally(cause);
                return;
            }
            failures.add(cause);

            final Duration wait = config.backoff(attempt);
            log.warn("{} attempt {}/{} failed ({}), retrying in {}ms",
                    operation, attempt, config.maxAttempts(), cause.getMessage(), wait.toMillis());
            DebugLogger.log(LogFormatter.formatRetry(attempt, config.maxAttempts(), wait.toMillis(),
                    String.valueOf(cause.getMessage())));

            scheduler.delay(wait).whenComplete((ignored, delayError) -> {
                if (delayError != null) {
                    cause.addSuppressed(unwrap(delayError));
                    result.completeExceptionally(cause);
                    return;
                }
                attempt(operation, action, attempt + 1, failures, result);
            });
        });
    }

    private static void attachEarlierFailures(final Throwable last, final List<Throwable> failures) {
        for (final Throwable earlier : failures) {
            if (earlier != last) {
                last.addSuppressed(earlier);
            }
        }
    }

    static Throwable unwrap(final Throwable error) {
        Throwable current = error;
        while ((current instanceof CompletionException || current instanceof ExecutionException)
                && current.getCause() != null) {
            current = current.getCause();
        }
        return current;
    }
}
