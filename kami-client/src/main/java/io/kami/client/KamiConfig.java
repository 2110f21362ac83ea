// SPDX-License-Identifier: MIT OR Apache-2.0
package io.kami.client;

import java.time.Duration;
import java.util.Objects;
import java.util.function.Function;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import io.kami.core.error.ConfigurationException;

/**
 * Connection settings for a {@link KamiClient}.
 *
 * <p>
 * The base address is {@code http://{host}:{port}}. Hosts and ports can be
 * given explicitly through {@link #builder()} or resolved from the
 * {@code KAMI_HOST} and {@code KAMI_PORT} environment variables through
 * {@link #fromEnvironment()}; each resolution is logged so the address a
 * client talks to is always visible.
 *
 * @param host                  chain service host (default {@code localhost})
 * @param port                  chain service port (default 3000)
 * @param connectTimeout        TCP connect timeout (default 10s)
 * @param requestTimeout        per-request timeout (default 30s)
 * @param maxConnections        in-flight request limit across all hosts (default 256)
 * @param maxConnectionsPerHost in-flight request limit per host (default 10)
 * @param retry                 retry policy settings
 * @since 0.1.0
 */
public record KamiConfig(
        String host,
        int port,
        Duration connectTimeout,
        Duration requestTimeout,
        int maxConnections,
        int maxConnectionsPerHost,
        KamiRetryConfig retry) {

    private static final Logger log = LoggerFactory.getLogger(KamiConfig.class);

    public static final String HOST_ENV = "KAMI_HOST";
    public static final String PORT_ENV = "KAMI_PORT";
    public static final String DEFAULT_HOST = "localhost";
    public static final String DEFAULT_PORT = "3000";
    public static final int DEFAULT_MAX_CONNECTIONS = 256;
    public static final int DEFAULT_MAX_CONNECTIONS_PER_HOST = 10;

    private static final Duration DEFAULT_CONNECT = Duration.ofSeconds(10);
    private static final Duration DEFAULT_REQUEST = Duration.ofSeconds(30);

    public KamiConfig {
        if (host == null || host.isEmpty()) {
            throw new ConfigurationException("Could not resolve Kami host");
        }
        if (port < 1 || port > 65535) {
            throw new ConfigurationException("Could not resolve Kami port: " + port);
        }
        if (maxConnections < 1 || maxConnectionsPerHost < 1) {
            throw new ConfigurationException(
                    "Connection limits must be >= 1, got total=%d perHost=%d"
                            .formatted(maxConnections, maxConnectionsPerHost));
        }
        connectTimeout = connectTimeout == null ? DEFAULT_CONNECT : connectTimeout;
        requestTimeout = requestTimeout == null ? DEFAULT_REQUEST : requestTimeout;
        retry = retry == null ? KamiRetryConfig.defaults() : retry;
    }

    /**
     * Returns {@code http://{host}:{port}}.
     *
     * @return the base address, without trailing slash
     */
    public String baseUrl() {
        return "http://" + host + ":" + port;
    }

    /**
     * Resolves host and port from the process environment.
     *
     * @return the resolved configuration with default timeouts, limits and retry
     * @throws ConfigurationException if the port is not a number
     */
    public static KamiConfig fromEnvironment() {
        return fromEnvironment(System::getenv);
    }

    /**
     * Resolves host and port through the given variable lookup.
     *
     * @param env variable lookup, returning {@code null} for unset variables; an empty value counts as unset
     * @return the resolved configuration
     * @throws ConfigurationException if the port is not a number
     */
    public static KamiConfig fromEnvironment(final Function<String, String> env) {
        Objects.requireNonNull(env, "env");
        return builder()
                .host(resolve(env, HOST_ENV, DEFAULT_HOST))
                .port(parsePort(resolve(env, PORT_ENV, DEFAULT_PORT)))
                .build();
    }

    static String resolve(final Function<String, String> env, final String name, final String defaultValue) {
        final String value = env.apply(name);
        if (value != null && !value.isEmpty()) {
            log.info("{}={}", name, value);
            return value;
        }
        log.info("{} env var not specified, defaulting to {}={}", name, name, defaultValue);
        return defaultValue;
    }

    private static int parsePort(final String value) {
        try {
            return Integer.parseInt(value.trim());
        } catch (NumberFormatException e) {
            throw new ConfigurationException("Could not resolve Kami port: " + value);
        }
    }

    /**
     * Creates a builder initialized with defaults ({@code localhost:3000}).
     *
     * @return a new builder
     */
    public static Builder builder() {
        return new Builder();
    }

    /**
     * Builder for {@link KamiConfig}.
     */
    public static final class Builder {
        private String host = DEFAULT_HOST;
        private int port = Integer.parseInt(DEFAULT_PORT);
        private Duration connectTimeout = DEFAULT_CONNECT;
        private Duration requestTimeout = DEFAULT_REQUEST;
        private int maxConnections = DEFAULT_MAX_CONNECTIONS;
        private int maxConnectionsPerHost = DEFAULT_MAX_CONNECTIONS_PER_HOST;
        private KamiRetryConfig retry = KamiRetryConfig.defaults();

        private Builder() {}

        public Builder host(final String host) {
            this.host = host;
            return this;
        }

        public Builder port(final int port) {
            this.port = port;
            return this;
        }

        public Builder connectTimeout(final Duration connectTimeout) {
            if (connectTimeout != null) {
                this.connectTimeout = connectTimeout;
            }
            return this;
        }

        public Builder requestTimeout(final Duration requestTimeout) {
            if (requestTimeout != null) {
                this.requestTimeout = requestTimeout;
            }
            return this;
        }

        public Builder maxConnections(final int maxConnections) {
            this.maxConnections = maxConnections;
            return this;
        }

        public Builder maxConnectionsPerHost(final int maxConnectionsPerHost) {
            this.maxConnectionsPerHost = maxConnectionsPerHost;
            return this;
        }

        public Builder retry(final KamiRetryConfig retry) {
            this.retry = Objects.requireNonNull(retry, "retry");
            return this;
        }

        /**
         * @throws ConfigurationException if the host is empty or the port out of range
         */
        public KamiConfig build() {
            return new KamiConfig(host, port, connectTimeout, requestTimeout,
                    maxConnections, maxConnectionsPerHost, retry);
        }
    }
}
