// SPDX-License-Identifier: MIT OR Apache-2.0
package io.kami.client;

import static io.kami.client.internal.Json.MAPPER;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.function.Supplier;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import io.kami.core.error.ProtocolException;
import io.kami.core.error.ValidationException;
import io.kami.core.model.AxonInfo;
import io.kami.core.model.KeyringPair;
import io.kami.core.model.ServeAxonPayload;
import io.kami.core.model.SetWeightsPayload;
import io.kami.core.model.SubnetHyperparameters;
import io.kami.core.model.SubnetMetagraph;
import io.kami.core.util.Quantities;

/**
 * Typed client for the Kami chain service.
 *
 * <p>
 * Every operation exists in two forms: {@code xxxAsync(...)} returns a
 * {@link CompletableFuture} that fails with a {@link io.kami.core.error.KamiException},
 * and {@code xxx(...)} waits for the result and rethrows that exception
 * unwrapped. Requests are retried by the client's {@link KamiRetry} policy
 * and error envelopes are turned into exceptions by
 * {@link ResponseErrorClassifier} before any data is read.
 *
 * <p><strong>Usage:</strong>
 * <pre>{@code
 * try (KamiClient kami = KamiClient.builder()
 *         .config(KamiConfig.fromEnvironment())
 *         .timelockEncryptor(myEncryptor)
 *         .build()) {
 *     long block = kami.getCurrentBlock();
 *     SubnetMetagraph graph = kami.getMetagraph(1);
 * }
 * }</pre>
 *
 * <p><strong>Thread Safety:</strong> instances are thread-safe and are meant
 * to be shared.
 *
 * @since 0.1.0
 */
public final class KamiClient implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(KamiClient.class);

    static final String SUBNET_METAGRAPH = "chain/subnet-metagraph/";
    static final String SUBNET_HYPERPARAMETERS = "chain/subnet-hyperparameters/";
    static final String LATEST_BLOCK = "chain/latest-block";
    static final String CHECK_HOTKEY = "chain/check-hotkey";
    static final String SERVE_AXON = "chain/serve-axon";
    static final String SIGN_MESSAGE = "substrate/sign-message/sign";
    static final String VERIFY_MESSAGE = "substrate/sign-message/verify";
    static final String KEYRING_PAIR_INFO = "substrate/keyring-pair-info";

    private final RequestExecutor executor;
    private final KamiRetry retry;
    private final WeightSubmission weights;

    KamiClient(final RequestExecutor executor, final KamiRetry retry, final @Nullable TimelockEncryptor encryptor) {
        this.executor = Objects.requireNonNull(executor, "executor");
        this.retry = Objects.requireNonNull(retry, "retry");
        this.weights = new WeightSubmission(this, encryptor);
    }

    /**
     * Creates a client configured from {@code KAMI_HOST} and {@code KAMI_PORT},
     * without a time-lock encryptor.
     *
     * @return the client
     */
    public static KamiClient create() {
        return builder().config(KamiConfig.fromEnvironment()).build();
    }

    public static Builder builder() {
        return new Builder();
    }

    // ---------------------------------------------------------------- chain

    /**
     * Fetches the full state snapshot of a subnet.
     *
     * @param netuid subnet id
     * @return the metagraph, with every axon attributed to its uid's keys
     */
    public CompletableFuture<SubnetMetagraph> getMetagraphAsync(final int netuid) {
        return get(SUBNET_METAGRAPH + netuid)
                .thenApply(envelope -> convert(envelope.data(), SubnetMetagraph.class, "subnet metagraph"));
    }

    public SubnetMetagraph getMetagraph(final int netuid) {
        return await(() -> getMetagraphAsync(netuid));
    }

    /**
     * Lists the hotkeys registered on a subnet, indexed by uid.
     */
    public CompletableFuture<List<String>> getHotkeysAsync(final int netuid) {
        return getMetagraphAsync(netuid).thenApply(SubnetMetagraph::hotkeys);
    }

    public List<String> getHotkeys(final int netuid) {
        return await(() -> getHotkeysAsync(netuid));
    }

    /**
     * Lists the axons served on a subnet, indexed by uid.
     *
     * @param netuid subnet id
     * @return the axons, or an empty list when none are served
     */
    public CompletableFuture<List<AxonInfo>> getAxonsAsync(final int netuid) {
        return getMetagraphAsync(netuid).thenApply(graph -> {
            if (graph.axons().isEmpty()) {
                log.warn("No axons found for subnet {}", netuid);
            }
            return graph.axons();
        });
    }

    public List<AxonInfo> getAxons(final int netuid) {
        return await(() -> getAxonsAsync(netuid));
    }

    /**
     * Fetches the latest block number.
     *
     * <p>
     * The service may report the number as a JSON number, a decimal string or
     * a {@code 0x}-prefixed hex string.
     */
    public CompletableFuture<Long> getCurrentBlockAsync() {
        return get(LATEST_BLOCK).thenApply(envelope -> {
            final JsonNode blockNumber = envelope.data().path("blockNumber");
            try {
                return Quantities.fromJson(blockNumber).longValueExact();
            } catch (IllegalArgumentException | ArithmeticException e) {
                final ProtocolException failure =
                        new ProtocolException("Invalid latest block response", envelope.data().toString(), e);
                log.error("Failed to read latest block: {}", e.getMessage());
                throw failure;
            }
        });
    }

    public long getCurrentBlock() {
        return await(this::getCurrentBlockAsync);
    }

    public CompletableFuture<SubnetHyperparameters> getSubnetHyperparametersAsync(final int netuid) {
        return get(SUBNET_HYPERPARAMETERS + netuid)
                .thenApply(envelope -> convert(envelope.data(), SubnetHyperparameters.class, "subnet hyperparameters"));
    }

    public SubnetHyperparameters getSubnetHyperparameters(final int netuid) {
        return await(() -> getSubnetHyperparametersAsync(netuid));
    }

    /**
     * Checks whether a hotkey is registered on a subnet.
     *
     * @param netuid subnet id
     * @param hotkey hotkey address
     * @param block  block to check at, or {@code null} for the latest
     * @return {@code true} if registered; {@code false} when the service does not say
     */
    public CompletableFuture<Boolean> isHotkeyRegisteredAsync(
            final int netuid, final String hotkey, final @Nullable Long block) {
        final Map<String, Object> query = new LinkedHashMap<>();
        query.put("netuid", netuid);
        query.put("hotkey", hotkey);
        if (block != null) {
            query.put("block", block);
        }
        return get(CHECK_HOTKEY, query)
                .thenApply(envelope -> envelope.data().path("isHotkeyValid").asBoolean(false));
    }

    public boolean isHotkeyRegistered(final int netuid, final String hotkey, final @Nullable Long block) {
        return await(() -> isHotkeyRegisteredAsync(netuid, hotkey, block));
    }

    public boolean isHotkeyRegistered(final int netuid, final String hotkey) {
        return isHotkeyRegistered(netuid, hotkey, null);
    }

    /**
     * Announces an axon endpoint.
     *
     * @return the service's envelope
     */
    public CompletableFuture<ResponseEnvelope> serveAxonAsync(final ServeAxonPayload payload) {
        Objects.requireNonNull(payload, "payload");
        return postAsync(SERVE_AXON, payload);
    }

    public ResponseEnvelope serveAxon(final ServeAxonPayload payload) {
        return await(() -> serveAxonAsync(payload));
    }

    /**
     * Submits validator weights, directly or through commit-reveal depending
     * on the subnet's hyperparameters.
     *
     * @param payload the weights
     * @return the envelope of the submission endpoint that was called
     * @throws io.kami.core.error.ConfigurationException (through the future) if the subnet
     *         enables commit-reveal but is not provisioned for it, or no encryptor is configured
     * @throws ValidationException (through the future) if the encryptor returns an empty commit
     */
    public CompletableFuture<ResponseEnvelope> setWeightsAsync(final SetWeightsPayload payload) {
        Objects.requireNonNull(payload, "payload");
        return weights.submit(payload);
    }

    public ResponseEnvelope setWeights(final SetWeightsPayload payload) {
        return await(() -> setWeightsAsync(payload));
    }

    // ------------------------------------------------------------ substrate

    /**
     * Signs a message with the service's hotkey.
     *
     * @param message the message
     * @return the hex signature, or empty when the service returned none
     */
    public CompletableFuture<Optional<String>> signMessageAsync(final String message) {
        return postAsync(SIGN_MESSAGE, Map.of("message", message)).thenApply(envelope -> {
            final JsonNode signature = envelope.data().path("signature");
            if (!signature.isTextual() || signature.textValue().isEmpty()) {
                log.error("Sign message response carried no signature");
                return Optional.<String>empty();
            }
            return Optional.of(signature.textValue());
        });
    }

    public Optional<String> signMessage(final String message) {
        return await(() -> signMessageAsync(message));
    }

    /**
     * Verifies a signature produced by {@code hotkey}.
     *
     * @param hotkey    signee address
     * @param message   signed message
     * @param signature {@code 0x}-prefixed hex signature
     * @return whether the signature is valid
     * @throws ValidationException (through the future) if {@code signature} does not
     *         start with a lowercase {@code 0x}; no request is sent in that case
     */
    public CompletableFuture<Boolean> verifyAsync(final String hotkey, final String message, final String signature) {
        if (signature == null || !signature.startsWith("0x")) {
            return CompletableFuture.failedFuture(ValidationException.signatureNotHex(String.valueOf(signature)));
        }
        final Map<String, String> body = new LinkedHashMap<>();
        body.put("message", message);
        body.put("signature", signature);
        body.put("signeeAddress", hotkey);
        return postAsync(VERIFY_MESSAGE, body).thenApply(envelope -> {
            if (envelope.hasNoData()) {
                log.error("Verify response for {} carried no data", hotkey);
                return false;
            }
            return envelope.data().path("valid").asBoolean(false);
        });
    }

    public boolean verify(final String hotkey, final String message, final String signature) {
        return await(() -> verifyAsync(hotkey, message, signature));
    }

    /**
     * Fetches the signing identity the service is configured with.
     */
    public CompletableFuture<KeyringPair> getKeyringPairAsync() {
        return get(KEYRING_PAIR_INFO)
                .thenApply(envelope -> convert(envelope.data(), KeyringPair.class, "keyring pair"));
    }

    public KeyringPair getKeyringPair() {
        return await(this::getKeyringPairAsync);
    }

    @Override
    public void close() {
        executor.close();
    }

    // ------------------------------------------------------------ internals

    private CompletableFuture<ResponseEnvelope> get(final String path) {
        return send(EndpointRequest.get(path));
    }

    private CompletableFuture<ResponseEnvelope> get(final String path, final Map<String, ?> query) {
        return send(EndpointRequest.get(path, query));
    }

    CompletableFuture<ResponseEnvelope> postAsync(final String path, final Object body) {
        return send(EndpointRequest.post(path, body));
    }

    private CompletableFuture<ResponseEnvelope> send(final EndpointRequest request) {
        return retry.run(request.path(),
                () -> executor.execute(request).thenApply(ResponseErrorClassifier::classify));
    }

    private static <T> T convert(final JsonNode data, final Class<T> type, final String what) {
        try {
            return MAPPER.treeToValue(data, type);
        } catch (JsonProcessingException | IllegalArgumentException e) {
            log.error("Failed to parse {} response: {}", what, e.getMessage());
            throw new ProtocolException("Invalid " + what + " response", data.toString(), e);
        }
    }

    private static <T> T await(final Supplier<CompletableFuture<T>> call) {
        try {
            return call.get().get();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("Interrupted while waiting for the chain service", e);
        } catch (ExecutionException e) {
            final Throwable cause = KamiRetry.unwrap(e);
            if (cause instanceof RuntimeException runtime) {
                throw runtime;
            }
            if (cause instanceof Error error) {
                throw error;
            }
            throw new IllegalStateException(cause);
        }
    }

    /**
     * Builder for {@link KamiClient}.
     */
    public static final class Builder {
        private KamiConfig config;
        private @Nullable TimelockEncryptor timelockEncryptor;
        private @Nullable RequestExecutor executor;
        private @Nullable KamiRetry retry;

        private Builder() {}

        /**
         * Sets the connection and retry settings. Defaults to
         * {@link KamiConfig#fromEnvironment()}.
         */
        public Builder config(final KamiConfig config) {
            this.config = Objects.requireNonNull(config, "config");
            return this;
        }

        /**
         * Sets the encryptor used by commit-reveal weight submission.
         */
        public Builder timelockEncryptor(final TimelockEncryptor timelockEncryptor) {
            this.timelockEncryptor = timelockEncryptor;
            return this;
        }

        /**
         * Replaces the HTTP transport, e.g. with an instrumented executor.
         */
        public Builder executor(final RequestExecutor executor) {
            this.executor = executor;
            return this;
        }

        /**
         * Replaces the retry policy built from the config.
         */
        public Builder retry(final KamiRetry retry) {
            this.retry = retry;
            return this;
        }

        public KamiClient build() {
            final KamiConfig resolved = config != null ? config : KamiConfig.fromEnvironment();
            final RequestExecutor transport = executor != null ? executor : new HttpRequestExecutor(resolved);
            final KamiRetry policy = retry != null ? retry : new KamiRetry(resolved.retry());
            return new KamiClient(transport, policy, timelockEncryptor);
        }
    }
}
