// SPDX-License-Identifier: MIT OR Apache-2.0
package io.kami.core.util;

import java.io.IOException;
import java.math.BigInteger;

import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.databind.DeserializationContext;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.deser.std.StdDeserializer;

/**
 * Jackson deserializer for record components that may arrive as an integer
 * or as a hex/decimal string.
 *
 * <pre>{@code
 * @JsonDeserialize(using = HexQuantityDeserializer.class) BigInteger difficulty
 * }</pre>
 *
 * @see Quantities
 */
public final class HexQuantityDeserializer extends StdDeserializer<BigInteger> {

    private static final long serialVersionUID = 1L;

    public HexQuantityDeserializer() {
        super(BigInteger.class);
    }

    @Override
    public BigInteger deserialize(final JsonParser parser, final DeserializationContext ctxt) throws IOException {
        final JsonNode node = parser.readValueAsTree();
        try {
            return Quantities.fromJson(node);
        } catch (IllegalArgumentException e) {
            return (BigInteger) ctxt.handleWeirdStringValue(
                    BigInteger.class, String.valueOf(node), e.getMessage());
        }
    }
}
