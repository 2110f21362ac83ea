// SPDX-License-Identifier: MIT OR Apache-2.0
package io.kami.client;

import java.util.concurrent.CompletableFuture;

import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import io.kami.core.error.ConfigurationException;
import io.kami.core.error.ValidationException;
import io.kami.core.model.CommitRevealPayload;
import io.kami.core.model.SetWeightsPayload;
import io.kami.core.model.SubnetHyperparameters;
import io.kami.core.util.Hex;

/**
 * Decides how validator weights reach the chain and drives the submission.
 *
 * <p>
 * The subnet's hyperparameters select one of two mutually exclusive paths:
 * <ol>
 * <li><strong>Direct</strong> ({@code commitRevealWeightsEnabled == false}):
 * the weights are posted as-is to {@code chain/set-weights}.</li>
 * <li><strong>Commit-reveal</strong> ({@code commitRevealWeightsEnabled == true}):
 * <ol type="a">
 * <li>tempo and reveal period must both be non-zero, otherwise the subnet is
 * not provisioned for commit-reveal;</li>
 * <li>the current block is fetched, since the commit is bound to a height;</li>
 * <li>the weights are sealed by the {@link TimelockEncryptor};</li>
 * <li>an empty commit or a zero reveal round is rejected;</li>
 * <li>the hex-encoded commit is posted to {@code chain/set-commit-reveal-weights}.</li>
 * </ol>
 * </li>
 * </ol>
 * A commit-reveal subnet never receives plaintext weights: every failure on
 * that path fails the submission instead of falling back to the direct path.
 */
final class WeightSubmission {

    private static final Logger log = LoggerFactory.getLogger(WeightSubmission.class);

    static final String SET_WEIGHTS = "chain/set-weights";
    static final String SET_COMMIT_REVEAL_WEIGHTS = "chain/set-commit-reveal-weights";

    private final KamiClient client;
    private final @Nullable TimelockEncryptor encryptor;

    WeightSubmission(final KamiClient client, final @Nullable TimelockEncryptor encryptor) {
        this.client = client;
        this.encryptor = encryptor;
    }

    CompletableFuture<ResponseEnvelope> submit(final SetWeightsPayload payload) {
        return client.getSubnetHyperparametersAsync(payload.netuid()).thenCompose(params -> {
            if (!params.commitRevealWeightsEnabled()) {
                log.debug("Setting weights directly on netuid {}", payload.netuid());
                return client.postAsync(SET_WEIGHTS, payload);
            }
            return commitReveal(payload, params);
        });
    }

    private CompletableFuture<ResponseEnvelope> commitReveal(
            final SetWeightsPayload payload, final SubnetHyperparameters params) {
        final int tempo = params.tempo();
        final int revealPeriod = params.commitRevealPeriod();
        if (tempo == 0 || revealPeriod == 0) {
            throw new ConfigurationException(
                    "Tempo and reveal period must be greater than 0 for commit reveal weights, got tempo=%d revealPeriod=%d"
                            .formatted(tempo, revealPeriod));
        }
        if (encryptor == null) {
            throw new ConfigurationException(
                    "Commit reveal weights are enabled on netuid %d but no TimelockEncryptor is configured"
                            .formatted(payload.netuid()));
        }
        log.info("Commit reveal weights enabled: tempo: {}, reveal_period: {}", tempo, revealPeriod);

        return client.getCurrentBlockAsync().thenCompose(currentBlock -> {
            final EncryptedCommit sealed = encryptor.encrypt(new TimelockRequest(
                    payload.dests(),
                    payload.weights(),
                    payload.versionKey(),
                    tempo,
                    currentBlock,
                    payload.netuid(),
                    revealPeriod));
            if (sealed == null || !sealed.isComplete()) {
                throw ValidationException.emptyCommit(payload.netuid());
            }
            log.info("Weight commit sealed at block {} for reveal round {}", currentBlock, sealed.revealRound());

            final CommitRevealPayload commit = new CommitRevealPayload(
                    payload.netuid(), Hex.encodeNoPrefix(sealed.commit()), sealed.revealRound());
            return client.postAsync(SET_COMMIT_REVEAL_WEIGHTS, commit);
        });
    }
}
