// SPDX-License-Identifier: MIT OR Apache-2.0
package io.kami.core.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

/**
 * Public profile a miner or validator publishes for its uid.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record IdentitiesInfo(
        String name,
        String url,
        String githubRepo,
        String image,
        String discord,
        String description,
        String additional) {
}
