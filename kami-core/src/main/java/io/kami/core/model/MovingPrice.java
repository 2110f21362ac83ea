// SPDX-License-Identifier: MIT OR Apache-2.0
package io.kami.core.model;

import java.math.BigInteger;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

/**
 * Moving average price in fixed-point bits.
 *
 * @param bits the raw fixed-point value
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record MovingPrice(BigInteger bits) {
}
