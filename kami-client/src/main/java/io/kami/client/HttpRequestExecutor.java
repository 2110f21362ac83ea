// SPDX-License-Identifier: MIT OR Apache-2.0
package io.kami.client;

import static io.kami.client.internal.Json.MAPPER;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;

import io.kami.client.internal.ConnectionGate;
import io.kami.core.DebugLogger;
import io.kami.core.LogFormatter;
import io.kami.core.error.ProtocolException;
import io.kami.core.error.TransportException;

/**
 * {@link RequestExecutor} over HTTP/1.1 with JSON bodies.
 *
 * <p>
 * Every request carries {@code Content-Type: application/json} and
 * {@code Accept: application/json} and is sent through the client's
 * {@link KamiSession}, waiting for a connection slot when the configured
 * limits are reached. The exchange itself is asynchronous: no thread is held
 * while the service is answering.
 *
 * @since 0.1.0
 */
public final class HttpRequestExecutor implements RequestExecutor {

    private final KamiConfig config;
    private final KamiSession session;
    private final String baseUrl;

    public HttpRequestExecutor(final KamiConfig config) {
        this.config = Objects.requireNonNull(config, "config");
        this.session = new KamiSession(config);
        this.baseUrl = config.baseUrl();
    }

    @Override
    public CompletableFuture<ResponseEnvelope> execute(final EndpointRequest request) {
        final String method = request.method().name();
        final String body = request.method() == EndpointRequest.Method.POST ? serialize(request) : null;
        final URI uri = URI.create(baseUrl + "/" + request.pathWithQuery());
        final HttpRequest httpRequest = buildRequest(uri, request.method(), body);

        final KamiSession.Pool pool = session.acquire();
        DebugLogger.log(LogFormatter.formatRequest(method, request.path(), body));

        return pool.gate().acquire(uri.getHost()).thenCompose(permit -> {
            final long start = System.nanoTime();
            return send(pool, permit, httpRequest).handle((response, error) -> {
                final long durationMicros = (System.nanoTime() - start) / 1_000L;
                if (error != null) {
                    final Throwable cause = unwrap(error);
                    DebugLogger.log(LogFormatter.formatRequestError(
                            method, request.path(), String.valueOf(cause.getMessage()), durationMicros));
                    if (cause instanceof IOException) {
                        throw new TransportException(uri.toString(), cause);
                    }
                    throw cause instanceof RuntimeException re ? re : new CompletionException(cause);
                }
                DebugLogger.log(LogFormatter.formatResponse(
                        method, request.path(), response.statusCode(), durationMicros));
                return parseResponse(request, response);
            });
        });
    }

    private CompletableFuture<HttpResponse<String>> send(
            final KamiSession.Pool pool, final ConnectionGate.Permit permit, final HttpRequest httpRequest) {
        final CompletableFuture<HttpResponse<String>> exchange;
        try {
            exchange = pool.http().sendAsync(httpRequest, HttpResponse.BodyHandlers.ofString());
        } catch (RuntimeException e) {
            permit.release();
            throw e;
        }
        return exchange.whenComplete((response, error) -> permit.release());
    }

    private HttpRequest buildRequest(final URI uri, final EndpointRequest.Method method, final String body) {
        final HttpRequest.Builder builder = HttpRequest.newBuilder(uri)
                .header("Content-Type", "application/json")
                .header("Accept", "application/json")
                .timeout(config.requestTimeout());
        if (method == EndpointRequest.Method.POST) {
            builder.POST(HttpRequest.BodyPublishers.ofString(body));
        } else {
            builder.GET();
        }
        return builder.build();
    }

    private String serialize(final EndpointRequest request) {
        if (request.body() == null) {
            return "{}";
        }
        try {
            return MAPPER.writeValueAsString(request.body());
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Unable to serialize request body for " + request.path(), e);
        }
    }

    private ResponseEnvelope parseResponse(final EndpointRequest request, final HttpResponse<String> response) {
        final String body = response.body();
        final JsonNode root;
        try {
            root = MAPPER.readTree(body == null ? "" : body);
        } catch (JsonProcessingException e) {
            throw new ProtocolException(
                    "Error decoding JSON response from %s (HTTP %d)".formatted(request.path(), response.statusCode()),
                    body,
                    e);
        }
        if (root == null || !root.isObject()) {
            throw new ProtocolException(
                    "Expected a JSON object from %s (HTTP %d), got: %s"
                            .formatted(request.path(), response.statusCode(), root == null ? "empty body" : root.getNodeType()),
                    body,
                    null);
        }
        return ResponseEnvelope.fromJson(root, response.statusCode());
    }

    private static Throwable unwrap(final Throwable error) {
        Throwable current = error;
        while (current instanceof CompletionException && current.getCause() != null) {
            current = current.getCause();
        }
        return current;
    }

    /**
     * Returns the session this executor sends through.
     */
    KamiSession session() {
        return session;
    }

    @Override
    public void close() {
        session.close();
    }
}
