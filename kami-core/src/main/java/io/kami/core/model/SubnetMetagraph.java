// SPDX-License-Identifier: MIT OR Apache-2.0
package io.kami.core.model;

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import org.jspecify.annotations.Nullable;

import io.kami.core.util.HexQuantityDeserializer;

/**
 * Complete state snapshot of a subnet: its settings, economic figures and
 * every registered participant.
 *
 * <p>
 * Participant data is stored as parallel sequences indexed by uid. Index
 * {@code i} of {@link #hotkeys()}, {@link #coldkeys()}, {@link #axons()},
 * {@link #totalStake()} and the other per-uid lists describes the same
 * participant, and every such list has exactly {@link #numUids()} entries.
 * A snapshot that breaks this rule is rejected at construction, and
 * {@code netuid}, {@code numUids} and every per-uid list must be present in
 * the response.
 *
 * <p>
 * Axons are reported by the chain service without their owning keys.
 * Construction attributes each axon to the hotkey and coldkey at the same
 * index, so {@code axons().get(i).hotkey().equals(hotkeys().get(i))} holds
 * for every uid.
 *
 * <p>
 * The per-hotkey dividend lists are keyed by hotkey rather than by uid and
 * are not length-checked.
 *
 * @since 0.1.0
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record SubnetMetagraph(
        @JsonProperty(required = true) int netuid,
        String name,
        String symbol,
        @Nullable SubnetIdentity identity,
        long networkRegisteredAt,
        String ownerHotkey,
        String ownerColdkey,
        long block,
        int tempo,
        long lastStep,
        long blocksSinceLastStep,
        long subnetEmission,
        double alphaIn,
        double alphaOut,
        double taoIn,
        double alphaOutEmission,
        double alphaInEmission,
        double taoInEmission,
        double pendingAlphaEmission,
        double pendingRootEmission,
        double subnetVolume,
        @Nullable MovingPrice movingPrice,
        long rho,
        long kappa,
        long weightsVersion,
        @JsonDeserialize(using = HexQuantityDeserializer.class) @Nullable BigInteger weightsRateLimit,
        long activityCutoff,
        long maxValidators,
        @JsonProperty(required = true) int numUids,
        int maxUids,
        long burn,
        @JsonDeserialize(using = HexQuantityDeserializer.class) @Nullable BigInteger difficulty,
        boolean registrationAllowed,
        boolean powRegistrationAllowed,
        long immunityPeriod,
        @JsonDeserialize(using = HexQuantityDeserializer.class) @Nullable BigInteger minDifficulty,
        @JsonDeserialize(using = HexQuantityDeserializer.class) @Nullable BigInteger maxDifficulty,
        long minBurn,
        long maxBurn,
        @JsonDeserialize(using = HexQuantityDeserializer.class) @Nullable BigInteger adjustmentAlpha,
        long adjustmentInterval,
        long targetRegsPerInterval,
        long maxRegsPerBlock,
        long servingRateLimit,
        boolean commitRevealWeightsEnabled,
        int commitRevealPeriod,
        boolean liquidAlphaEnabled,
        long alphaHigh,
        long alphaLow,
        long bondsMovingAvg,
        @JsonProperty(required = true) List<String> hotkeys,
        @JsonProperty(required = true) List<String> coldkeys,
        @JsonProperty(required = true) List<@Nullable IdentitiesInfo> identities,
        @JsonProperty(required = true) List<AxonInfo> axons,
        @JsonProperty(required = true) List<Boolean> active,
        @JsonProperty(required = true) List<Boolean> validatorPermit,
        @JsonProperty(required = true) List<Long> pruningScore,
        @JsonProperty(required = true) List<Long> lastUpdate,
        @JsonProperty(required = true) List<Double> emission,
        @JsonProperty(required = true) List<Double> dividends,
        @JsonProperty(required = true) List<Double> incentives,
        @JsonProperty(required = true) List<Double> consensus,
        @JsonProperty(required = true) List<Double> trust,
        @JsonProperty(required = true) List<Double> rank,
        @JsonProperty(required = true) List<Long> blockAtRegistration,
        @JsonProperty(required = true) List<Double> alphaStake,
        @JsonProperty(required = true) List<Double> taoStake,
        @JsonProperty(required = true) List<Double> totalStake,
        List<HotkeyDividend> taoDividendsPerHotkey,
        List<HotkeyDividend> alphaDividendsPerHotkey) {

    public SubnetMetagraph {
        if (numUids < 0) {
            throw new IllegalArgumentException("numUids must be >= 0, got: " + numUids);
        }
        hotkeys = perUid("hotkeys", hotkeys, numUids);
        coldkeys = perUid("coldkeys", coldkeys, numUids);
        axons = attribute(perUid("axons", axons, numUids), hotkeys, coldkeys);
        active = perUid("active", active, numUids);
        validatorPermit = perUid("validatorPermit", validatorPermit, numUids);
        pruningScore = perUid("pruningScore", pruningScore, numUids);
        lastUpdate = perUid("lastUpdate", lastUpdate, numUids);
        emission = perUid("emission", emission, numUids);
        dividends = perUid("dividends", dividends, numUids);
        incentives = perUid("incentives", incentives, numUids);
        consensus = perUid("consensus", consensus, numUids);
        trust = perUid("trust", trust, numUids);
        rank = perUid("rank", rank, numUids);
        blockAtRegistration = perUid("blockAtRegistration", blockAtRegistration, numUids);
        alphaStake = perUid("alphaStake", alphaStake, numUids);
        taoStake = perUid("taoStake", taoStake, numUids);
        totalStake = perUid("totalStake", totalStake, numUids);

        // Identities may hold nulls for uids that never published one.
        checkLength("identities", required("identities", identities).size(), numUids);
        identities = Collections.unmodifiableList(new ArrayList<>(identities));

        taoDividendsPerHotkey = taoDividendsPerHotkey == null ? List.of() : List.copyOf(taoDividendsPerHotkey);
        alphaDividendsPerHotkey = alphaDividendsPerHotkey == null ? List.of() : List.copyOf(alphaDividendsPerHotkey);
    }

    private static <T> List<T> perUid(final String field, final List<T> values, final int numUids) {
        checkLength(field, required(field, values).size(), numUids);
        return List.copyOf(values);
    }

    private static <T> List<T> required(final String field, final List<T> values) {
        if (values == null) {
            throw new IllegalArgumentException(field + " is missing");
        }
        return values;
    }

    private static void checkLength(final String field, final int actual, final int numUids) {
        if (actual != numUids) {
            throw new IllegalArgumentException(
                    "%s has %d entries but numUids is %d".formatted(field, actual, numUids));
        }
    }

    private static List<AxonInfo> attribute(
            final List<AxonInfo> axons, final List<String> hotkeys, final List<String> coldkeys) {
        final List<AxonInfo> attributed = new ArrayList<>(axons.size());
        for (int uid = 0; uid < axons.size(); uid++) {
            attributed.add(axons.get(uid).withOwner(hotkeys.get(uid), coldkeys.get(uid)));
        }
        return List.copyOf(attributed);
    }
}
