// SPDX-License-Identifier: MIT OR Apache-2.0
package io.kami.core.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

/**
 * Descriptive metadata a subnet owner publishes for the subnet.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record SubnetIdentity(
        String subnetName,
        String githubRepo,
        String subnetContact,
        String subnetUrl,
        String discord,
        String description,
        String additional) {
}
