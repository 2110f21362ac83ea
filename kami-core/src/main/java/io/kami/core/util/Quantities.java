// SPDX-License-Identifier: MIT OR Apache-2.0
package io.kami.core.util;

import java.math.BigInteger;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * Normalizes integer quantities that the chain service reports either as JSON
 * numbers or as strings.
 *
 * <p>
 * Some subnet fields (difficulty, adjustment alpha, the weights rate limit on
 * the root subnet) are serialized as {@code 0x}-prefixed hex strings when they
 * exceed the JavaScript safe-integer range, and as plain numbers otherwise.
 * Both forms decode to the same value here:
 *
 * <pre>{@code
 * Quantities.parse("0x1a");  // 26
 * Quantities.parse("26");    // 26
 * }</pre>
 *
 * @since 0.1.0
 */
public final class Quantities {

    private Quantities() {
        // Utility class
    }

    /**
     * Parses a hex ({@code 0x...}) or decimal string.
     *
     * @param text the quantity text
     * @return the decoded value
     * @throws IllegalArgumentException if the text is empty or not a number
     */
    public static BigInteger parse(final String text) {
        if (text == null) {
            throw new IllegalArgumentException("quantity cannot be null");
        }
        final String trimmed = text.trim();
        if (Hex.hasPrefix(trimmed)) {
            final String digits = Hex.cleanPrefix(trimmed);
            if (digits.isEmpty()) {
                return BigInteger.ZERO;
            }
            return new BigInteger(digits, 16);
        }
        if (trimmed.isEmpty()) {
            throw new IllegalArgumentException("quantity cannot be empty");
        }
        return new BigInteger(trimmed);
    }

    /**
     * Reads a JSON node holding either an integral number or a quantity string.
     *
     * @param node the node to read
     * @return the decoded value
     * @throws IllegalArgumentException if the node is neither an integer nor a quantity string
     */
    public static BigInteger fromJson(final JsonNode node) {
        if (node == null || node.isNull() || node.isMissingNode()) {
            throw new IllegalArgumentException("quantity is missing");
        }
        if (node.isIntegralNumber()) {
            return node.bigIntegerValue();
        }
        if (node.isTextual()) {
            return parse(node.textValue());
        }
        throw new IllegalArgumentException("expected integer or quantity string, got: " + node);
    }
}
