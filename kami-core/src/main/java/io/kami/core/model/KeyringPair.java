// SPDX-License-Identifier: MIT OR Apache-2.0
package io.kami.core.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

/**
 * Signing identity the chain service is configured with.
 *
 * @param hotkey  operational key address
 * @param coldkey custodial key address
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record KeyringPair(String hotkey, String coldkey) {
}
