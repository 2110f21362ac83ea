// SPDX-License-Identifier: MIT OR Apache-2.0
package io.kami.core.model;

import java.math.BigInteger;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import org.jspecify.annotations.Nullable;

import io.kami.core.util.HexQuantityDeserializer;

/**
 * Configuration parameters for a subnet's behavior and constraints: consensus
 * settings, registration limits, economic parameters and the commit-reveal
 * switches that decide how validators submit weights.
 *
 * <p>
 * {@code difficulty}, {@code minDifficulty}, {@code maxDifficulty},
 * {@code adjustmentAlpha} and {@code weightsRateLimit} may be reported as
 * {@code 0x}-prefixed hex strings; they are normalized to {@link BigInteger}
 * so {@code "0x1a"} and {@code 26} read identically.
 *
 * <p>
 * {@code tempo}, {@code commitRevealPeriod} and
 * {@code commitRevealWeightsEnabled} select the weight submission path and
 * must be present in the response; a body without them is rejected.
 *
 * @since 0.1.0
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record SubnetHyperparameters(
        long rho,
        long kappa,
        long immunityPeriod,
        long minAllowedWeights,
        long maxWeightsLimit,
        @JsonProperty(required = true) int tempo,
        @JsonDeserialize(using = HexQuantityDeserializer.class) @Nullable BigInteger minDifficulty,
        @JsonDeserialize(using = HexQuantityDeserializer.class) @Nullable BigInteger maxDifficulty,
        @JsonDeserialize(using = HexQuantityDeserializer.class) @Nullable BigInteger difficulty,
        long weightsVersion,
        @JsonDeserialize(using = HexQuantityDeserializer.class) @Nullable BigInteger weightsRateLimit,
        long adjustmentInterval,
        long activityCutoff,
        boolean registrationAllowed,
        long targetRegsPerInterval,
        long minBurn,
        long maxBurn,
        long bondsMovingAvg,
        long maxRegsPerBlock,
        long servingRateLimit,
        long maxValidators,
        @JsonDeserialize(using = HexQuantityDeserializer.class) @Nullable BigInteger adjustmentAlpha,
        @JsonProperty(required = true) int commitRevealPeriod,
        @JsonProperty(required = true) boolean commitRevealWeightsEnabled,
        long alphaHigh,
        long alphaLow,
        boolean liquidAlphaEnabled) {
}
