// SPDX-License-Identifier: MIT OR Apache-2.0
package io.kami.client;

import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.StringJoiner;

import org.jspecify.annotations.Nullable;

/**
 * One call against a chain service endpoint.
 *
 * <p>
 * GET requests carry query parameters; entries whose value is {@code null}
 * are dropped so optional parameters are omitted rather than sent empty.
 * POST requests carry a body that is serialized as JSON.
 *
 * @param method HTTP method
 * @param path   endpoint path relative to the base address, without leading slash
 * @param query  query parameters in insertion order (GET only)
 * @param body   request body (POST only), or {@code null}
 * @since 0.1.0
 */
public record EndpointRequest(
        Method method,
        String path,
        Map<String, String> query,
        @Nullable Object body) {

    /** HTTP methods used by the chain service. */
    public enum Method {
        GET,
        POST
    }

    public EndpointRequest {
        Objects.requireNonNull(method, "method");
        Objects.requireNonNull(path, "path");
        query = query == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(query));
    }

    /**
     * Creates a GET request without query parameters.
     */
    public static EndpointRequest get(final String path) {
        return new EndpointRequest(Method.GET, path, Map.of(), null);
    }

    /**
     * Creates a GET request; null-valued parameters are omitted.
     *
     * @param path  endpoint path
     * @param query parameters, values converted with {@link String#valueOf(Object)}
     * @return the request
     */
    public static EndpointRequest get(final String path, final Map<String, ?> query) {
        final Map<String, String> params = new LinkedHashMap<>();
        if (query != null) {
            query.forEach((key, value) -> {
                if (value != null) {
                    params.put(key, String.valueOf(value));
                }
            });
        }
        return new EndpointRequest(Method.GET, path, params, null);
    }

    /**
     * Creates a POST request.
     *
     * @param path endpoint path
     * @param body body serialized as JSON, or {@code null} for an empty body
     * @return the request
     */
    public static EndpointRequest post(final String path, final @Nullable Object body) {
        return new EndpointRequest(Method.POST, path, Map.of(), body);
    }

    /**
     * Returns the path followed by the URL-encoded query string, if any.
     *
     * @return e.g. {@code chain/check-hotkey?netuid=1&hotkey=5F...}
     */
    public String pathWithQuery() {
        if (query.isEmpty()) {
            return path;
        }
        final StringJoiner joiner = new StringJoiner("&", path + "?", "");
        query.forEach((key, value) -> joiner.add(
                URLEncoder.encode(key, StandardCharsets.UTF_8) + "=" + URLEncoder.encode(value, StandardCharsets.UTF_8)));
        return joiner.toString();
    }
}
