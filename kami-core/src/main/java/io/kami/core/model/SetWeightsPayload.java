// SPDX-License-Identifier: MIT OR Apache-2.0
package io.kami.core.model;

import java.util.List;
import java.util.Objects;

import com.fasterxml.jackson.annotation.JsonProperty;

import io.kami.core.error.ValidationException;

/**
 * Validator weights for a subnet: {@code weights[i]} is assigned to uid
 * {@code dests[i]}.
 *
 * @param netuid     target subnet
 * @param dests      destination uids
 * @param weights    normalized weights, one per destination
 * @param versionKey weights version expected by the subnet
 */
public record SetWeightsPayload(
        int netuid,
        List<Integer> dests,
        List<Integer> weights,
        @JsonProperty("version_key") long versionKey) {

    public SetWeightsPayload {
        Objects.requireNonNull(dests, "dests");
        Objects.requireNonNull(weights, "weights");
        if (dests.size() != weights.size()) {
            throw new ValidationException(
                    "dests and weights must have the same length, got %d and %d"
                            .formatted(dests.size(), weights.size()));
        }
        dests = List.copyOf(dests);
        weights = List.copyOf(weights);
    }
}
