// SPDX-License-Identifier: MIT OR Apache-2.0
package io.kami.core.model;

import java.util.List;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import com.fasterxml.jackson.databind.JsonNode;

/**
 * One {@code [hotkey, amount]} pair of a metagraph's per-hotkey dividend list.
 *
 * <p>The chain service serializes these as two-element JSON arrays.
 *
 * @param hotkey the hotkey that earned the dividend
 * @param amount the dividend amount
 */
public record HotkeyDividend(String hotkey, double amount) {

    @JsonCreator(mode = JsonCreator.Mode.DELEGATING)
    public static HotkeyDividend fromJson(final JsonNode node) {
        if (node == null || !node.isArray() || node.size() != 2) {
            throw new IllegalArgumentException("expected [hotkey, amount] pair, got: " + node);
        }
        return new HotkeyDividend(node.get(0).asText(), node.get(1).asDouble());
    }

    @JsonValue
    public List<Object> toJson() {
        return List.of(hotkey, amount);
    }
}
